package tollgate.core.model.auth;

/**
 * Outcome of an authorization check for a protected operation.
 *
 * <p>This is a sealed interface with three possible outcomes:
 * <ul>
 *   <li>{@link Allowed} - the caller may perform the operation</li>
 *   <li>{@link Denied} - the caller may not; final for the operation</li>
 *   <li>{@link ServiceUnavailable} - the IAM authority could not be consulted and
 *       fail-open is disabled</li>
 * </ul>
 */
public sealed interface AuthorizationDecision {

    String REASON_UNAUTHENTICATED = "unauthenticated";
    String REASON_MISSING_PRINCIPAL = "missing principal id";
    String REASON_INSUFFICIENT_PERMISSIONS = "insufficient permissions";
    String REASON_REMOTE_UNAVAILABLE = "authorization service unavailable";

    /**
     * Whether the operation may proceed.
     */
    boolean isAllowed();

    /**
     * The caller may perform the operation.
     *
     * @param source where the grant came from
     */
    record Allowed(Source source) implements AuthorizationDecision {

        @Override
        public boolean isAllowed() {
            return true;
        }
    }

    /**
     * The caller may not perform the operation.
     *
     * @param reason    short reason for metrics and logs, never shown to the caller
     * @param challenge true when the caller should be asked to authenticate
     */
    record Denied(String reason, boolean challenge) implements AuthorizationDecision {

        public Denied {
            if (reason == null || reason.isBlank()) {
                reason = REASON_INSUFFICIENT_PERMISSIONS;
            }
        }

        public static Denied unauthenticated(String reason) {
            return new Denied(reason, true);
        }

        public static Denied forbidden(String reason) {
            return new Denied(reason, false);
        }

        @Override
        public boolean isAllowed() {
            return false;
        }
    }

    /**
     * The permission could not be determined.
     *
     * @param reason short description of the remote failure
     */
    record ServiceUnavailable(String reason) implements AuthorizationDecision {

        @Override
        public boolean isAllowed() {
            return false;
        }
    }

    /**
     * Where an {@link Allowed} decision came from.
     */
    enum Source {
        /** Authorization is switched off. */
        DISABLED,
        /** A claim carried by the caller's identity. */
        LOCAL_CLAIM,
        /** A live check against the IAM authority. */
        REMOTE_CHECK,
        /** The IAM authority failed and fail-open is enabled. */
        FAIL_OPEN
    }
}
