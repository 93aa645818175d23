package natter.core.util;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.spec.InvalidKeySpecException;
import java.util.Base64;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;

/**
 * Salted PBKDF2 password hashing.
 *
 * <p>Hashes are encoded as {@code pbkdf2$<iterations>$<salt>$<hash>} with URL-safe
 * Base64 salt and hash, so the iteration count can be raised without invalidating
 * stored hashes.
 */
public final class PasswordHasher {

    private static final String ALGORITHM = "PBKDF2WithHmacSHA256";
    private static final String SCHEME = "pbkdf2";
    private static final int ITERATIONS = 210_000;
    private static final int SALT_BYTES = 16;
    private static final int KEY_BITS = 256;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private PasswordHasher() {}

    /**
     * Hash a password with a fresh random salt.
     *
     * @param password plaintext password
     * @return encoded hash
     */
    public static String hash(String password) {
        final var salt = new byte[SALT_BYTES];
        SECURE_RANDOM.nextBytes(salt);
        final var derived = derive(password, salt, ITERATIONS);
        return SCHEME + "$" + ITERATIONS + "$" + ENCODER.encodeToString(salt) + "$" + ENCODER.encodeToString(derived);
    }

    /**
     * Check a password against an encoded hash in constant time.
     *
     * @param password plaintext password
     * @param encoded  hash produced by {@link #hash(String)}
     * @return true if the password matches; false for a mismatch or a malformed hash
     */
    public static boolean matches(String password, String encoded) {
        if (password == null || encoded == null) {
            return false;
        }
        final var parts = encoded.split("\\$");
        if (parts.length != 4 || !SCHEME.equals(parts[0])) {
            return false;
        }
        try {
            final var iterations = Integer.parseInt(parts[1]);
            final var salt = DECODER.decode(parts[2]);
            final var expected = DECODER.decode(parts[3]);
            return MessageDigest.isEqual(expected, derive(password, salt, iterations));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static byte[] derive(String password, byte[] salt, int iterations) {
        final var spec = new PBEKeySpec(password.toCharArray(), salt, iterations, KEY_BITS);
        try {
            return SecretKeyFactory.getInstance(ALGORITHM).generateSecret(spec).getEncoded();
        } catch (NoSuchAlgorithmException | InvalidKeySpecException e) {
            throw new AssertionError(ALGORITHM + " must be available on every JDK", e);
        } finally {
            spec.clearPassword();
        }
    }
}
