package tollgate.core.model.auth;

import java.util.Optional;

/**
 * Authorization requirement attached to a protected operation.
 *
 * <p>Built once per protected operation when it is first resolved and shared by
 * every request to that operation. Instances are immutable.
 *
 * @param permission           required permission (e.g., {@code invoice.invoices.create})
 * @param resourcePathTemplate optional resource path with {@code {param}} placeholders
 *                             (e.g., {@code customers/{customerId}/orders/{orderId}})
 * @param requireLiveCheck     always consult the IAM authority when the local check fails
 * @param preValidateModel     request body should be validated before the permission check
 * @param critical             successful access emits an audit record
 * @param auditPurpose         server-side purpose recorded with critical audit records
 */
public record PermissionRequirement(
        String permission,
        Optional<String> resourcePathTemplate,
        boolean requireLiveCheck,
        boolean preValidateModel,
        boolean critical,
        Optional<String> auditPurpose) {

    public PermissionRequirement {
        if (permission == null || permission.isBlank()) {
            throw new IllegalArgumentException("Permission cannot be null or blank");
        }
        resourcePathTemplate = resourcePathTemplate != null
                ? resourcePathTemplate.filter(t -> !t.isBlank())
                : Optional.empty();
        auditPurpose = auditPurpose != null ? auditPurpose.filter(p -> !p.isBlank()) : Optional.empty();
    }

    /**
     * Creates a plain requirement: local claims only, not critical.
     */
    public static PermissionRequirement of(String permission) {
        return builder(permission).build();
    }

    public static Builder builder(String permission) {
        return new Builder(permission);
    }

    /**
     * Builder for {@link PermissionRequirement}.
     */
    public static final class Builder {
        private final String permission;
        private String resourcePathTemplate;
        private boolean requireLiveCheck;
        private boolean preValidateModel;
        private boolean critical;
        private String auditPurpose;

        private Builder(String permission) {
            this.permission = permission;
        }

        public Builder resourcePathTemplate(String resourcePathTemplate) {
            this.resourcePathTemplate = resourcePathTemplate;
            return this;
        }

        public Builder requireLiveCheck(boolean requireLiveCheck) {
            this.requireLiveCheck = requireLiveCheck;
            return this;
        }

        public Builder preValidateModel(boolean preValidateModel) {
            this.preValidateModel = preValidateModel;
            return this;
        }

        public Builder critical(boolean critical) {
            this.critical = critical;
            return this;
        }

        public Builder auditPurpose(String auditPurpose) {
            this.auditPurpose = auditPurpose;
            return this;
        }

        public PermissionRequirement build() {
            return new PermissionRequirement(
                    permission,
                    Optional.ofNullable(resourcePathTemplate),
                    requireLiveCheck,
                    preValidateModel,
                    critical,
                    Optional.ofNullable(auditPurpose));
        }
    }
}
