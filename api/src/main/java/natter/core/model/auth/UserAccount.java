package natter.core.model.auth;

import java.time.Instant;

/**
 * An account held by the identity provider.
 *
 * @param uid          stable user identifier, used as the chat user ID
 * @param email        login email, stored lower-cased
 * @param passwordHash salted password hash, see {@link natter.core.util.PasswordHasher}
 * @param createdAt    account creation timestamp
 */
public record UserAccount(String uid, String email, String passwordHash, Instant createdAt) {}
