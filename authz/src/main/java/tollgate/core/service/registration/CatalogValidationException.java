package tollgate.core.service.registration;

import java.util.List;

/**
 * Thrown when a service catalog contains malformed permission ids.
 *
 * <p>Raised during startup, before anything is sent to the IAM authority.
 */
public class CatalogValidationException extends RuntimeException {

    private final List<String> invalidPermissionIds;

    public CatalogValidationException(String message) {
        super(message);
        this.invalidPermissionIds = List.of();
    }

    public CatalogValidationException(List<String> invalidPermissionIds) {
        super("Invalid permission ids " + invalidPermissionIds
                + ": permission ids must have exactly three non-empty segments (service.resource.action)");
        this.invalidPermissionIds = List.copyOf(invalidPermissionIds);
    }

    public List<String> invalidPermissionIds() {
        return invalidPermissionIds;
    }
}
