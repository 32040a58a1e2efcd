package tollgate.core.model.registration;

/**
 * Lifecycle of the IAM catalog registration for this process.
 */
public enum RegistrationStatus {
    /** Registration has not started yet. */
    PENDING,
    /** A publish attempt is in progress or scheduled for retry. */
    ATTEMPTING,
    /** The catalog was accepted; no further attempts are made. */
    REGISTERED,
    /** Every attempt failed; the service keeps running with local permission knowledge only. */
    PARTIALLY_REGISTERED,
    /** Registration stopped on an unrecoverable error. */
    FAILED;

    /**
     * Whether this status means the registration loop is over.
     */
    public boolean isTerminal() {
        return this == REGISTERED || this == PARTIALLY_REGISTERED || this == FAILED;
    }
}
