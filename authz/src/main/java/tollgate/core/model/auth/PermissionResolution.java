package tollgate.core.model.auth;

import java.time.Instant;
import java.util.Set;

/**
 * Globally granted permissions and roles of a principal, as resolved by the IAM authority.
 *
 * @param principalId the principal the permissions belong to
 * @param permissions permission ids granted to the principal
 * @param roles       role ids assigned to the principal
 * @param cacheUntil  when the authority's cached answer expires, may be null
 * @param fromCache   whether the authority answered from its cache
 */
public record PermissionResolution(
        String principalId, Set<String> permissions, Set<String> roles, Instant cacheUntil, boolean fromCache) {

    public PermissionResolution {
        permissions = permissions != null ? Set.copyOf(permissions) : Set.of();
        roles = roles != null ? Set.copyOf(roles) : Set.of();
    }

    public static PermissionResolution empty(String principalId) {
        return new PermissionResolution(principalId, Set.of(), Set.of(), null, false);
    }
}
