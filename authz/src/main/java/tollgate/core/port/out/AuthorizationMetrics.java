package tollgate.core.port.out;

/**
 * Port interface for recording authorization outcomes.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface AuthorizationMetrics {

    /**
     * Record a successful authorization check.
     *
     * @param permission the permission that was checked
     */
    void recordSuccess(String permission);

    /**
     * Record a failed authorization check.
     *
     * @param permission the permission that was checked
     * @param reason     the reason for failure
     */
    void recordFailure(String permission, String reason);
}
