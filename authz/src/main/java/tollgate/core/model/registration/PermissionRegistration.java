package tollgate.core.model.registration;

/**
 * A permission a service declares to the IAM authority.
 *
 * <p>Permission ids follow the {@code service.resource.action} format
 * (e.g., {@code accounting.journal-entries.create}). The format is checked
 * when the catalog is validated at startup, not here, so that a malformed
 * catalog is reported as a whole.
 *
 * @param permissionId unique permission identifier
 * @param description  human-readable description of what the permission allows
 */
public record PermissionRegistration(String permissionId, String description) {

    public PermissionRegistration {
        if (permissionId == null) {
            throw new IllegalArgumentException("Permission ID cannot be null");
        }
        if (description == null) {
            description = "";
        }
    }
}
