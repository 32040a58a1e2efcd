package tollgate.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.registration.PermissionRegistration;
import tollgate.core.model.registration.RoleRegistration;

/**
 * Port interface for publishing a service's permission and role catalog to the IAM authority.
 *
 * <p>Registration is additive: the authority adds new entries and leaves existing
 * ones untouched. Nothing here removes entries.
 *
 * <p>The returned {@link Uni}s fail when the authority is unreachable or answers
 * with a non-2xx status.
 */
public interface CatalogRegistry {

    /**
     * Register permissions owned by a service.
     *
     * @param serviceName the registering service
     * @param permissions the permissions to register
     * @return completion, or failure if not accepted
     */
    Uni<Void> registerPermissions(String serviceName, List<PermissionRegistration> permissions);

    /**
     * Register predefined roles of a service.
     *
     * @param serviceName the registering service
     * @param roles       the roles to register
     * @return completion, or failure if not accepted
     */
    Uni<Void> registerRoles(String serviceName, List<RoleRegistration> roles);
}
