package natter.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import natter.core.model.auth.UserAccount;

/**
 * Outbound port for the account directory.
 */
public interface IdentityProvider {

    /**
     * Create an account.
     *
     * @param email    login email
     * @param password plaintext password; only a salted hash is stored
     * @return the created account
     * @throws natter.core.port.in.AccountManagement.AccountExistsException (as a failed Uni)
     *         if the email is already registered
     */
    Uni<UserAccount> createAccount(String email, String password);

    /**
     * Find an account by email, ignoring case.
     *
     * @param email login email
     * @return the account, or empty if none is registered
     */
    Uni<Optional<UserAccount>> lookupByEmail(String email);
}
