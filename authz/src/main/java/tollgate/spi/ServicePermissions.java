package tollgate.spi;

import java.util.List;
import java.util.Map;

import tollgate.core.model.registration.PermissionRegistration;

/**
 * Flat list of the permission ids a service defines.
 *
 * <p>Services usually keep their permission ids as string constants for use in
 * {@code @RequirePermission}; this interface exposes them as a list so a
 * {@link ServiceCatalog} can be derived from the same constants.
 */
public interface ServicePermissions {

    /**
     * All permission ids defined by the service.
     *
     * @return permission ids
     */
    List<String> all();

    /**
     * Descriptions for the permission ids, keyed by id. Missing entries get an empty description.
     *
     * @return descriptions by permission id
     */
    default Map<String, String> descriptions() {
        return Map.of();
    }

    /**
     * Converts the permission ids to registrations.
     *
     * @return one registration per permission id
     */
    default List<PermissionRegistration> toRegistrations() {
        var descriptions = descriptions();
        return all().stream()
                .map(id -> new PermissionRegistration(id, descriptions.getOrDefault(id, "")))
                .toList();
    }
}
