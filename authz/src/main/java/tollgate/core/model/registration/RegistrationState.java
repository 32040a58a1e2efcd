package tollgate.core.model.registration;

import java.util.Optional;

/**
 * Immutable snapshot of the registration status and the last error seen.
 *
 * <p>Status and error are published together so that readers never observe a
 * status paired with the error of a different transition.
 *
 * @param status    the current registration status
 * @param lastError the last failure, if any
 */
public record RegistrationState(RegistrationStatus status, Optional<Throwable> lastError) {

    private static final RegistrationState INITIAL = new RegistrationState(RegistrationStatus.PENDING, Optional.empty());

    public RegistrationState {
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        if (lastError == null) {
            lastError = Optional.empty();
        }
    }

    public static RegistrationState initial() {
        return INITIAL;
    }
}
