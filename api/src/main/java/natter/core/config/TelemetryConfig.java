package natter.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for telemetry.
 *
 * <p>Configuration prefix: {@code natter.telemetry}
 */
@ConfigMapping(prefix = "natter.telemetry")
public interface TelemetryConfig {

    MetricsConfig metrics();

    interface MetricsConfig {

        @WithDefault("true")
        boolean enabled();
    }
}
