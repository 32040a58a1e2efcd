package tollgate.core.model.auth;

import java.util.Optional;

/**
 * A single permission check, optionally scoped to a resource path.
 *
 * @param permissionId the permission to check (e.g., {@code order.orders.read})
 * @param resourcePath hierarchical resource path (e.g., {@code customers/123/orders/456}),
 *                     empty for a global check
 */
public record PermissionCheckRequest(String permissionId, Optional<String> resourcePath) {

    public PermissionCheckRequest {
        if (permissionId == null || permissionId.isBlank()) {
            throw new IllegalArgumentException("Permission ID cannot be null or blank");
        }
        if (resourcePath == null) {
            resourcePath = Optional.empty();
        }
    }

    public static PermissionCheckRequest global(String permissionId) {
        return new PermissionCheckRequest(permissionId, Optional.empty());
    }

    public static PermissionCheckRequest scoped(String permissionId, String resourcePath) {
        return new PermissionCheckRequest(permissionId, Optional.ofNullable(resourcePath));
    }
}
