package tollgate.core.service.registration;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

import jakarta.enterprise.context.ApplicationScoped;

import tollgate.core.model.registration.RegistrationState;
import tollgate.core.model.registration.RegistrationStatus;

/**
 * Holds the current catalog registration status.
 *
 * <p>Written by the background registration thread, read by health checks.
 * Once {@link RegistrationStatus#REGISTERED} is reached the state no longer changes.
 */
@ApplicationScoped
public class RegistrationStatusTracker {

    private final AtomicReference<RegistrationState> state = new AtomicReference<>(RegistrationState.initial());

    public RegistrationState state() {
        return state.get();
    }

    public RegistrationStatus status() {
        return state.get().status();
    }

    public Optional<Throwable> lastError() {
        return state.get().lastError();
    }

    public boolean isRegistered() {
        return status() == RegistrationStatus.REGISTERED;
    }

    /**
     * An attempt is starting. The last error, if any, is kept.
     */
    public void markAttempting() {
        transition(current -> new RegistrationState(RegistrationStatus.ATTEMPTING, current.lastError()));
    }

    /**
     * An attempt failed and another one will follow.
     */
    public void markRetrying(Throwable error) {
        transition(current -> new RegistrationState(RegistrationStatus.ATTEMPTING, Optional.ofNullable(error)));
    }

    public void markRegistered() {
        transition(current -> new RegistrationState(RegistrationStatus.REGISTERED, Optional.empty()));
    }

    /**
     * All attempts were used up. The service keeps running with its local claims.
     */
    public void markPartiallyRegistered(Throwable error) {
        transition(current ->
                new RegistrationState(RegistrationStatus.PARTIALLY_REGISTERED, Optional.ofNullable(error)));
    }

    public void markFailed(Throwable error) {
        transition(current -> new RegistrationState(RegistrationStatus.FAILED, Optional.ofNullable(error)));
    }

    private void transition(UnaryOperator<RegistrationState> next) {
        state.updateAndGet(current ->
                current.status() == RegistrationStatus.REGISTERED ? current : next.apply(current));
    }
}
