package natter.core.port.in;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import natter.core.model.auth.SessionGrant;
import natter.core.model.auth.UserAccount;

/**
 * Inbound port for account registration and session login/logout.
 */
public interface AccountManagement {

    /**
     * Register a new account.
     *
     * @param email       login email
     * @param password    plaintext password
     * @param displayName optional display name shown in chat
     * @return the created account
     */
    Uni<UserAccount> register(String email, String password, Optional<String> displayName);

    /**
     * Verify credentials and issue a session token.
     *
     * @param email    login email
     * @param password plaintext password
     * @return the issued session
     * @throws InvalidCredentialsException (as a failed Uni) on unknown email or wrong password
     */
    Uni<SessionGrant> login(String email, String password);

    /**
     * Invalidate a session token and close the chat connections using it.
     *
     * @param token session token
     * @return Uni completing when the token is gone
     */
    Uni<Void> logout(String token);

    /**
     * Thrown when registering an email that already has an account.
     */
    class AccountExistsException extends RuntimeException {
        public AccountExistsException(String email) {
            super("An account already exists for " + email);
        }
    }

    /**
     * Thrown when login credentials do not match an account.
     */
    class InvalidCredentialsException extends RuntimeException {
        public InvalidCredentialsException() {
            super("Invalid credentials");
        }
    }

    /**
     * Thrown when no unique session token could be stored.
     */
    class SessionCreationException extends RuntimeException {
        public SessionCreationException(String message) {
            super(message);
        }
    }
}
