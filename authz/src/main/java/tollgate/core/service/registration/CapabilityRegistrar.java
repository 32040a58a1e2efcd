package tollgate.core.service.registration;

import java.util.ArrayList;
import java.util.List;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tollgate.core.model.registration.PermissionRegistration;
import tollgate.core.port.out.CatalogRegistry;
import tollgate.spi.ServiceCatalog;

/**
 * Validates a {@link ServiceCatalog} and publishes it to the IAM authority.
 *
 * <p>Permissions are published before roles so that roles can reference them.
 * Empty lists are not sent.
 */
public class CapabilityRegistrar {

    private static final Logger LOG = Logger.getLogger(CapabilityRegistrar.class);

    private static final int PERMISSION_SEGMENTS = 3;

    private final ServiceCatalog catalog;
    private final CatalogRegistry registry;

    public CapabilityRegistrar(ServiceCatalog catalog, CatalogRegistry registry) {
        this.catalog = catalog;
        this.registry = registry;
    }

    public String serviceName() {
        return catalog.serviceName();
    }

    /**
     * Validate every permission id of the catalog.
     *
     * @throws CatalogValidationException if any id is malformed
     */
    public void validate() {
        validate(catalog.permissions());
    }

    /**
     * Validate a list of permission registrations.
     *
     * @param permissions the registrations to check
     * @throws CatalogValidationException listing every malformed id
     */
    public static void validate(List<PermissionRegistration> permissions) {
        if (permissions == null) {
            throw new CatalogValidationException("Permission list cannot be null");
        }
        var invalid = new ArrayList<String>();
        for (var permission : permissions) {
            if (!isValidPermissionId(permission.permissionId())) {
                invalid.add(permission.permissionId());
            }
        }
        if (!invalid.isEmpty()) {
            throw new CatalogValidationException(invalid);
        }
    }

    /**
     * Whether the id has exactly three non-empty, dot-separated segments.
     */
    public static boolean isValidPermissionId(String permissionId) {
        if (permissionId == null || permissionId.isBlank()) {
            return false;
        }
        var segments = permissionId.split("\\.", -1);
        if (segments.length != PERMISSION_SEGMENTS) {
            return false;
        }
        for (var segment : segments) {
            if (segment.isBlank()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Send the permissions, then the roles, to the IAM authority.
     *
     * @return completion, or the failure of the first rejected call
     */
    public Uni<Void> publish() {
        var serviceName = catalog.serviceName();
        var permissions = List.copyOf(catalog.permissions());
        var roles = List.copyOf(catalog.roles());

        Uni<Void> permissionsPublished = permissions.isEmpty()
                ? Uni.createFrom().voidItem()
                : Uni.createFrom().deferred(() -> registry.registerPermissions(serviceName, permissions));

        return permissionsPublished
                .invoke(() -> LOG.debugf("Registered %d permissions for %s", permissions.size(), serviceName))
                .chain(() -> roles.isEmpty()
                        ? Uni.createFrom().voidItem()
                        : registry.registerRoles(serviceName, roles))
                .invoke(() -> LOG.debugf("Registered %d roles for %s", roles.size(), serviceName));
    }

    /**
     * Validate, then publish.
     *
     * @return completion of the publish
     * @throws CatalogValidationException synchronously, before any remote call
     */
    public Uni<Void> register() {
        validate();
        return publish();
    }
}
