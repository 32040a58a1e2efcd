package tollgate.core.service.registration;

import java.time.Duration;
import java.util.List;

/**
 * Delays between registration attempts.
 *
 * <p>The delay after the n-th failed attempt is the n-th entry; once the entries
 * are used up the last one is repeated.
 *
 * @param delays the delays, at least one
 */
public record RetrySchedule(List<Duration> delays) {

    private static final RetrySchedule DEFAULT = new RetrySchedule(List.of(
            Duration.ofSeconds(1),
            Duration.ofSeconds(2),
            Duration.ofSeconds(5),
            Duration.ofSeconds(10),
            Duration.ofSeconds(30),
            Duration.ofMinutes(1),
            Duration.ofMinutes(2)));

    public RetrySchedule {
        if (delays == null || delays.isEmpty()) {
            throw new IllegalArgumentException("Retry schedule needs at least one delay");
        }
        for (var delay : delays) {
            if (delay == null || delay.isNegative()) {
                throw new IllegalArgumentException("Retry delays must be zero or positive: " + delays);
            }
        }
        delays = List.copyOf(delays);
    }

    public static RetrySchedule defaults() {
        return DEFAULT;
    }

    /**
     * Delay to wait after a failed attempt.
     *
     * @param failedAttempt the 1-based number of the attempt that failed
     * @return the delay before the next attempt
     */
    public Duration delayAfter(int failedAttempt) {
        var index = Math.max(0, failedAttempt - 1);
        return delays.get(Math.min(index, delays.size() - 1));
    }
}
