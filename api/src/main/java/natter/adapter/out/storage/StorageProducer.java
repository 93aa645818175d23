package natter.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import natter.core.port.out.IdentityProvider;
import natter.core.port.out.SessionStore;
import natter.core.service.storage.StorageProviderRegistry;

/**
 * CDI producer for the session store and identity provider.
 *
 * <p>Delegates to the {@link StorageProviderRegistry}, which selects the storage
 * provider based on configuration and availability.
 *
 * @see natter.spi.ChatStorageProvider
 */
@ApplicationScoped
public class StorageProducer {

    private final StorageProviderRegistry registry;

    @Inject
    public StorageProducer(StorageProviderRegistry registry) {
        this.registry = registry;
    }

    @Produces
    @ApplicationScoped
    public SessionStore sessionStore() {
        return registry.getSessionStore();
    }

    @Produces
    @ApplicationScoped
    public IdentityProvider identityProvider() {
        return registry.getIdentityProvider();
    }
}
