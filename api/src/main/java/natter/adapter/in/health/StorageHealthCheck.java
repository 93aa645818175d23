package natter.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import natter.core.service.storage.StorageProviderRegistry;

/**
 * Readiness check for the selected chat storage backend.
 *
 * <p>Reports the provider's own health response; providers that do not supply one
 * are reported UP with their name.
 */
@Readiness
@ApplicationScoped
public class StorageHealthCheck implements HealthCheck {

    private final StorageProviderRegistry registry;

    @Inject
    public StorageHealthCheck(StorageProviderRegistry registry) {
        this.registry = registry;
    }

    @Override
    public HealthCheckResponse call() {
        var provider = registry.getSelectedProvider();
        return provider.healthCheck()
                .orElseGet(() -> HealthCheckResponse.named("chat-storage")
                        .up()
                        .withData("provider", provider.name())
                        .build());
    }
}
