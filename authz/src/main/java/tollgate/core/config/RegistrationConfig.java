package tollgate.core.config;

import java.time.Duration;
import java.util.List;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for background catalog registration.
 *
 * <p>Configuration prefix: {@code tollgate.registration}
 *
 * <h2>Example Configuration</h2>
 * <pre>
 * tollgate.registration.initial-delay=PT2S
 * tollgate.registration.max-attempts=10
 * tollgate.registration.retry-delays=PT1S,PT2S,PT5S,PT10S,PT30S,PT1M,PT2M
 * </pre>
 */
@ConfigMapping(prefix = "tollgate.registration")
public interface RegistrationConfig {

    /**
     * Enable catalog registration on startup.
     *
     * @return true if enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Delay before the first attempt, so the service can bind its listener first.
     *
     * @return initial delay (default: 2 seconds)
     */
    @WithDefault("PT2S")
    Duration initialDelay();

    /**
     * Maximum number of publish attempts.
     *
     * @return max attempts (default: 10)
     */
    @WithDefault("10")
    int maxAttempts();

    /**
     * Delays between attempts. The last delay is reused once the list is exhausted.
     *
     * @return retry delays (default: 1s, 2s, 5s, 10s, 30s, 1m, 2m)
     */
    @WithDefault("PT1S,PT2S,PT5S,PT10S,PT30S,PT1M,PT2M")
    List<Duration> retryDelays();

    /**
     * Upper bound for a single publish attempt.
     *
     * @return attempt timeout (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration attemptTimeout();
}
