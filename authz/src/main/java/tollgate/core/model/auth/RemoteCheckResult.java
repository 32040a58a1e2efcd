package tollgate.core.model.auth;

/**
 * Result of a live permission check against the IAM authority.
 *
 * <p>Keeps remote failures visible to the caller as a value, so the fail-open
 * or fail-closed policy is an explicit branch rather than exception handling.
 */
public sealed interface RemoteCheckResult {

    /**
     * The authority answered.
     *
     * @param allowed whether the permission is granted
     */
    record Answered(boolean allowed) implements RemoteCheckResult {

        private static final Answered GRANTED = new Answered(true);
        private static final Answered REFUSED = new Answered(false);

        public static Answered of(boolean allowed) {
            return allowed ? GRANTED : REFUSED;
        }
    }

    /**
     * The authority could not be reached or returned an error.
     *
     * @param reason short description (e.g., {@code status 503}, {@code timeout})
     * @param cause  the underlying failure, may be null
     */
    record Unavailable(String reason, Throwable cause) implements RemoteCheckResult {

        public Unavailable {
            if (reason == null || reason.isBlank()) {
                reason = cause != null ? cause.getClass().getSimpleName() : "unknown";
            }
        }
    }

    /**
     * Whether the authority granted the permission. Failures count as not granted.
     */
    default boolean granted() {
        return this instanceof Answered answered && answered.allowed();
    }
}
