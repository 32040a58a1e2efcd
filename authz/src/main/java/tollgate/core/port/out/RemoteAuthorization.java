package tollgate.core.port.out;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.auth.PermissionCheckRequest;
import tollgate.core.model.auth.PermissionResolution;
import tollgate.core.model.auth.RemoteCheckResult;

/**
 * Port interface for live permission checks against the central IAM authority.
 *
 * <p>None of the returned {@link Uni}s fail. Transport errors, timeouts and non-2xx
 * responses are folded into the result: an empty permission set, {@code false}, or a
 * {@link RemoteCheckResult.Unavailable}. Whether a failure should be treated as a grant
 * is decided by the caller, not here.
 */
public interface RemoteAuthorization {

    /**
     * Fetch the globally granted permissions of a principal.
     *
     * @param principalId the principal to resolve
     * @return the granted permission ids, empty on failure
     */
    Uni<Set<String>> getUserPermissions(String principalId);

    /**
     * Fetch the full resolution (permissions, roles, cache metadata) of a principal.
     *
     * @param principalId the principal to resolve
     * @return the resolution, {@link PermissionResolution#empty(String)} on failure
     */
    Uni<PermissionResolution> resolvePermissions(String principalId);

    /**
     * Check a single permission and report remote failures as a value.
     *
     * @param principalId  the principal (user or service account)
     * @param permissionId the permission to check
     * @param resourcePath optional resource path for a scoped check
     * @return the answer, or {@link RemoteCheckResult.Unavailable} on failure
     */
    Uni<RemoteCheckResult> evaluatePermission(String principalId, String permissionId, Optional<String> resourcePath);

    /**
     * Check a single permission, optionally scoped to a resource path.
     *
     * @param principalId  the principal (user or service account)
     * @param permissionId the permission to check
     * @param resourcePath optional resource path for a scoped check
     * @return true if granted, false if refused or on failure
     */
    default Uni<Boolean> checkPermission(String principalId, String permissionId, Optional<String> resourcePath) {
        return evaluatePermission(principalId, permissionId, resourcePath).map(RemoteCheckResult::granted);
    }

    /**
     * Check several permissions concurrently.
     *
     * <p>Every requested permission id is present in the result. Failed checks map to
     * {@code false}.
     *
     * @param principalId the principal
     * @param requests    the checks to perform
     * @return map of permission id to result
     */
    Uni<Map<String, Boolean>> checkPermissionsBulk(String principalId, List<PermissionCheckRequest> requests);
}
