package natter.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SessionTokenGenerator")
class SessionTokenGeneratorTest {

    private final SessionTokenGenerator generator = new SessionTokenGenerator();

    @Test
    @DisplayName("Should generate URL-safe 256-bit tokens")
    void shouldGenerateUrlSafeTokens() {
        var token = generator.generate();

        assertEquals(43, token.length());
        assertTrue(token.matches("[A-Za-z0-9_-]+"), token);
    }

    @Test
    @DisplayName("Should not repeat tokens")
    void shouldNotRepeatTokens() {
        var tokens = new HashSet<String>();
        for (int i = 0; i < 1000; i++) {
            tokens.add(generator.generate());
        }

        assertEquals(1000, tokens.size());
    }

    @Test
    @DisplayName("Should abbreviate tokens for logging")
    void shouldAbbreviateTokens() {
        var token = generator.generate();

        var abbreviated = SessionTokenGenerator.abbreviate(token);

        assertFalse(abbreviated.contains(token));
        assertTrue(abbreviated.startsWith(token.substring(0, 6)));
        assertEquals("***", SessionTokenGenerator.abbreviate("short"));
        assertEquals("<none>", SessionTokenGenerator.abbreviate(null));
    }
}
