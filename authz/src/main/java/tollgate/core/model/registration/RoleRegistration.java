package tollgate.core.model.registration;

import java.util.List;

/**
 * A predefined role a service declares to the IAM authority.
 *
 * <p>Roles may reference permissions owned by other services. Referential
 * integrity is owned by the IAM authority and is not checked locally.
 *
 * @param roleId        unique role identifier (e.g., {@code roles.accounting.admin})
 * @param description   human-readable description of what the role provides
 * @param permissionIds permission ids granted by this role, in declaration order
 * @param custom        whether this is a custom role (predefined roles are not)
 */
public record RoleRegistration(String roleId, String description, List<String> permissionIds, boolean custom) {

    public RoleRegistration {
        if (roleId == null || roleId.isBlank()) {
            throw new IllegalArgumentException("Role ID cannot be null or blank");
        }
        if (description == null) {
            description = "";
        }
        permissionIds = permissionIds != null ? List.copyOf(permissionIds) : List.of();
    }

    /**
     * Creates a predefined (non-custom) role.
     */
    public RoleRegistration(String roleId, String description, List<String> permissionIds) {
        this(roleId, description, permissionIds, false);
    }
}
