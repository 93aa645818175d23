package natter.spi;

import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;

import natter.core.port.out.IdentityProvider;
import natter.core.port.out.SessionStore;

/**
 * SPI for chat storage backends.
 *
 * <p>A provider supplies both the session store (token to user, user to display
 * name) and the account directory, so the two always live in the same backend.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>redis (priority: 100) - Redis-based storage</li>
 *   <li>memory (priority: 0) - In-memory storage (development only)</li>
 * </ul>
 *
 * <p>Provider selection order:
 * <ol>
 *   <li>Configured provider (natter.session.storage.provider)</li>
 *   <li>Highest priority available provider</li>
 *   <li>Memory fallback (always available)</li>
 * </ol>
 */
public interface ChatStorageProvider {

    /**
     * Return the provider name for configuration selection.
     *
     * @return Provider name (e.g., "redis", "memory")
     */
    String name();

    /**
     * Return the provider priority for automatic selection.
     *
     * @return Priority value (higher = more preferred)
     */
    int priority();

    /**
     * Check if this provider is available and ready to use.
     *
     * @return true if the provider can be used
     */
    boolean isAvailable();

    SessionStore createSessionStore();

    IdentityProvider createIdentityProvider();

    /**
     * Report the health of this storage backend for the readiness endpoint.
     *
     * @return Health check response, or empty if not supported
     */
    Optional<HealthCheckResponse> healthCheck();
}
