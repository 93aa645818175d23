package natter.core.service.auth;

import java.security.SecureRandom;
import java.util.Base64;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Generate cryptographically secure session tokens.
 *
 * <p>Tokens are 32 bytes (256 bits) of random data encoded as URL-safe Base64,
 * so they can travel in a WebSocket query string without escaping.
 */
@ApplicationScoped
public class SessionTokenGenerator {

    private static final int TOKEN_BYTES = 32;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    /**
     * Generate a new session token.
     *
     * @return a URL-safe Base64 encoded token (43 characters)
     */
    public String generate() {
        byte[] bytes = new byte[TOKEN_BYTES];
        SECURE_RANDOM.nextBytes(bytes);
        return ENCODER.encodeToString(bytes);
    }

    /**
     * Shorten a token for log output.
     *
     * @param token session token
     * @return the first characters of the token followed by an ellipsis
     */
    public static String abbreviate(String token) {
        if (token == null) {
            return "<none>";
        }
        return token.length() <= 6 ? "***" : token.substring(0, 6) + "...";
    }
}
