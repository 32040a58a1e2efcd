package tollgate.core.service.registration;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

/**
 * Publishes the service catalog in the background, retrying until it succeeds,
 * the attempts are used up, or the runner is cancelled.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Wait the initial delay</li>
 *   <li>Attempt to publish; on success mark registered and stop</li>
 *   <li>On failure wait the scheduled delay and try again</li>
 *   <li>After the last attempt fails mark partially registered and stop</li>
 * </ol>
 *
 * <p>Cancellation is observed at every wait and abandons an in-flight attempt.
 * Failures never propagate out of {@link #run()}.
 */
public class BackgroundRegistrationRunner implements Runnable {

    private static final Logger LOG = Logger.getLogger(BackgroundRegistrationRunner.class);

    /**
     * Waits for a delay or until the runner is cancelled.
     */
    @FunctionalInterface
    public interface Waiter {

        /**
         * Wait for the given delay.
         *
         * @param delay  how long to wait
         * @param cancel latch released on cancellation
         * @return true if cancelled while waiting
         */
        boolean await(Duration delay, CountDownLatch cancel) throws InterruptedException;

        static Waiter blocking() {
            return (delay, cancel) -> cancel.await(delay.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private final String serviceName;
    private final Supplier<Uni<Void>> publisher;
    private final RegistrationStatusTracker tracker;
    private final RetrySchedule schedule;
    private final Duration initialDelay;
    private final int maxAttempts;
    private final Duration attemptTimeout;
    private final Waiter waiter;

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final AtomicReference<CompletableFuture<Void>> inFlight = new AtomicReference<>();

    public BackgroundRegistrationRunner(
            String serviceName,
            Supplier<Uni<Void>> publisher,
            RegistrationStatusTracker tracker,
            RetrySchedule schedule,
            Duration initialDelay,
            int maxAttempts,
            Duration attemptTimeout) {
        this(serviceName, publisher, tracker, schedule, initialDelay, maxAttempts, attemptTimeout, Waiter.blocking());
    }

    public BackgroundRegistrationRunner(
            String serviceName,
            Supplier<Uni<Void>> publisher,
            RegistrationStatusTracker tracker,
            RetrySchedule schedule,
            Duration initialDelay,
            int maxAttempts,
            Duration attemptTimeout,
            Waiter waiter) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.serviceName = serviceName;
        this.publisher = publisher;
        this.tracker = tracker;
        this.schedule = schedule;
        this.initialDelay = initialDelay;
        this.maxAttempts = maxAttempts;
        this.attemptTimeout = attemptTimeout;
        this.waiter = waiter;
    }

    @Override
    public void run() {
        try {
            if (pause(initialDelay)) {
                LOG.debugf("IAM registration for %s cancelled before the first attempt", serviceName);
                return;
            }

            for (int attempt = 1; attempt <= maxAttempts && !isCancelled(); attempt++) {
                LOG.infof("Attempting IAM registration for %s (attempt %d/%d)", serviceName, attempt, maxAttempts);
                tracker.markAttempting();

                Throwable failure = attemptPublish();
                if (failure == null) {
                    tracker.markRegistered();
                    LOG.infof("IAM registration for %s succeeded", serviceName);
                    return;
                }
                if (isCancelled()) {
                    break;
                }

                if (attempt == maxAttempts) {
                    tracker.markPartiallyRegistered(failure);
                    LOG.errorf(
                            failure,
                            "IAM registration for %s failed after %d attempts. "
                                    + "The service continues with token permission claims only",
                            serviceName,
                            maxAttempts);
                    return;
                }

                tracker.markRetrying(failure);
                var delay = schedule.delayAfter(attempt);
                LOG.warnf(
                        "IAM registration attempt %d for %s failed: %s. Retrying in %s",
                        attempt, serviceName, failure.getMessage(), delay);
                if (pause(delay)) {
                    break;
                }
            }
            LOG.debugf("IAM registration for %s cancelled", serviceName);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debugf("IAM registration for %s interrupted", serviceName);
        }
    }

    /**
     * Stop the runner. Safe to call more than once and from any thread.
     */
    public void cancel() {
        cancelled.countDown();
        var attempt = inFlight.get();
        if (attempt != null) {
            attempt.cancel(true);
        }
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    private boolean pause(Duration delay) throws InterruptedException {
        if (isCancelled()) {
            return true;
        }
        if (delay.isZero() || delay.isNegative()) {
            return false;
        }
        return waiter.await(delay, cancelled) || isCancelled();
    }

    /**
     * @return null on success, the failure otherwise
     */
    private Throwable attemptPublish() throws InterruptedException {
        CompletableFuture<Void> future;
        try {
            future = publisher.get().subscribeAsCompletionStage();
        } catch (RuntimeException e) {
            return e;
        }

        inFlight.set(future);
        try {
            if (isCancelled()) {
                future.cancel(true);
            }
            future.get(attemptTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return null;
        } catch (CancellationException e) {
            return e;
        } catch (ExecutionException e) {
            return e.getCause() != null ? e.getCause() : e;
        } catch (TimeoutException e) {
            future.cancel(true);
            return new TimeoutException("IAM registration attempt timed out after " + attemptTimeout);
        } finally {
            inFlight.set(null);
        }
    }
}
