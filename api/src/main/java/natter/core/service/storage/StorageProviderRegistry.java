package natter.core.service.storage;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import natter.core.config.SessionConfig;
import natter.core.port.out.IdentityProvider;
import natter.core.port.out.SessionStore;
import natter.spi.ChatStorageProvider;
import natter.spi.StorageProviderException;

/**
 * Registry for chat storage providers.
 *
 * <p>Discovers available providers via CDI and selects the appropriate one
 * based on configuration and availability.
 *
 * <p>Selection order:
 * <ol>
 *   <li>Configured provider (natter.session.storage.provider)</li>
 *   <li>Highest priority available provider</li>
 *   <li>Memory fallback (always available)</li>
 * </ol>
 */
@ApplicationScoped
public class StorageProviderRegistry {

    private static final Logger LOG = Logger.getLogger(StorageProviderRegistry.class);

    private final Instance<ChatStorageProvider> providers;
    private final SessionConfig config;

    private ChatStorageProvider selectedProvider;
    private SessionStore sessionStore;
    private IdentityProvider identityProvider;

    @Inject
    public StorageProviderRegistry(Instance<ChatStorageProvider> providers, SessionConfig config) {
        this.providers = providers;
        this.config = config;
    }

    /**
     * Select the provider during startup, on a worker thread, so availability
     * checks never run on the event loop.
     */
    void onStart(@Observes StartupEvent event) {
        getSelectedProvider();
        LOG.infof("Chat storage provider initialized: %s", selectedProvider.name());
    }

    public synchronized SessionStore getSessionStore() {
        if (sessionStore == null) {
            sessionStore = getSelectedProvider().createSessionStore();
        }
        return sessionStore;
    }

    public synchronized IdentityProvider getIdentityProvider() {
        if (identityProvider == null) {
            identityProvider = getSelectedProvider().createIdentityProvider();
        }
        return identityProvider;
    }

    public synchronized ChatStorageProvider getSelectedProvider() {
        if (selectedProvider == null) {
            selectedProvider = selectProvider();
        }
        return selectedProvider;
    }

    private ChatStorageProvider selectProvider() {
        String configuredProvider = config.storage().provider();
        List<ChatStorageProvider> availableProviders = providers.stream()
                .filter(ChatStorageProvider::isAvailable)
                .sorted(Comparator.comparingInt(ChatStorageProvider::priority).reversed())
                .toList();

        LOG.debugf(
                "Available chat storage providers: %s",
                availableProviders.stream().map(ChatStorageProvider::name).toList());

        Optional<ChatStorageProvider> configured = availableProviders.stream()
                .filter(p -> p.name().equals(configuredProvider))
                .findFirst();

        if (configured.isPresent()) {
            LOG.infof("Using configured chat storage provider: %s", configuredProvider);
            return configured.get();
        }

        if (!configuredProvider.equals("memory")) {
            LOG.warnf("Configured chat storage provider '%s' is not available, falling back", configuredProvider);
        }

        if (!availableProviders.isEmpty()) {
            ChatStorageProvider provider = availableProviders.get(0);
            LOG.infof("Using chat storage provider: %s (priority: %d)", provider.name(), provider.priority());
            return provider;
        }

        throw new StorageProviderException("No chat storage providers available");
    }
}
