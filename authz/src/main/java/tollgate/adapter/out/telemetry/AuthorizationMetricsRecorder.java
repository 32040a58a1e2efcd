package tollgate.adapter.out.telemetry;

import java.util.concurrent.TimeUnit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import tollgate.core.port.out.AuthorizationMetrics;

/**
 * Micrometer metrics for authorization decisions and IAM authority calls.
 *
 * <p>Records metrics for:
 * <ul>
 *   <li>{@code tollgate.authorization.decisions} - Decisions by permission, outcome and reason</li>
 *   <li>{@code tollgate.iam.remote.calls} - Calls to the IAM authority by operation and status</li>
 *   <li>{@code tollgate.iam.remote.duration} - IAM authority latency by operation</li>
 * </ul>
 */
@ApplicationScoped
public class AuthorizationMetricsRecorder implements AuthorizationMetrics {

    static final String DECISIONS = "tollgate.authorization.decisions";
    static final String REMOTE_CALLS = "tollgate.iam.remote.calls";
    static final String REMOTE_DURATION = "tollgate.iam.remote.duration";

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public AuthorizationMetricsRecorder(MeterRegistry registry, TelemetryConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.enabled() && config.metrics().enabled();
    }

    /**
     * Check if metrics recording is enabled.
     *
     * @return true if metrics are enabled
     */
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordSuccess(String permission) {
        if (!enabled) {
            return;
        }

        Counter.builder(DECISIONS)
                .description("Permission authorization decisions")
                .tag("permission", nullSafe(permission))
                .tag("outcome", "allowed")
                .tag("reason", "none")
                .register(registry)
                .increment();
    }

    @Override
    public void recordFailure(String permission, String reason) {
        if (!enabled) {
            return;
        }

        Counter.builder(DECISIONS)
                .description("Permission authorization decisions")
                .tag("permission", nullSafe(permission))
                .tag("outcome", "denied")
                .tag("reason", nullSafe(reason))
                .register(registry)
                .increment();
    }

    /**
     * Record a call to the IAM authority.
     *
     * @param operation  the endpoint called (e.g., {@code check-permission})
     * @param statusCode the HTTP status code returned, 0 if none
     * @param durationMs duration in milliseconds
     */
    public void recordRemoteCall(String operation, int statusCode, long durationMs) {
        if (!enabled) {
            return;
        }

        Counter.builder(REMOTE_CALLS)
                .description("IAM authority calls")
                .tag("operation", nullSafe(operation))
                .tag("status_class", statusClass(statusCode))
                .register(registry)
                .increment();

        Timer.builder(REMOTE_DURATION)
                .description("IAM authority latency")
                .tag("operation", nullSafe(operation))
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    private String statusClass(int statusCode) {
        return switch (statusCode / 100) {
            case 1 -> "1xx";
            case 2 -> "2xx";
            case 3 -> "3xx";
            case 4 -> "4xx";
            case 5 -> "5xx";
            default -> "error";
        };
    }

    private String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
