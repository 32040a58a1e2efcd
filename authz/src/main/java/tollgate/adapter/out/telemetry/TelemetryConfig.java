package tollgate.adapter.out.telemetry;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for authorization telemetry.
 *
 * <p>Example configuration:
 * <pre>{@code
 * tollgate.telemetry.enabled=true
 * tollgate.telemetry.metrics.enabled=true
 * }</pre>
 */
@ConfigMapping(prefix = "tollgate.telemetry")
public interface TelemetryConfig {

    /**
     * Master toggle for all telemetry features.
     * When disabled, all sub-features are also disabled regardless of their individual settings.
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Metrics configuration for Micrometer metrics collection.
     */
    MetricsConfig metrics();

    /**
     * Metrics configuration.
     */
    interface MetricsConfig {
        /**
         * Enable metrics collection with Micrometer.
         * Requires tollgate.telemetry.enabled=true to take effect.
         */
        @WithDefault("true")
        boolean enabled();
    }
}
