package tollgate.core.service.auth;

import java.util.Optional;

import tollgate.core.model.auth.PermissionRequirement;

/**
 * Encodes permission requirements as policy names and parses them back.
 *
 * <p>Format: {@code Permission:{permission}[:validate_model][:critical][:purpose_{text}]}
 *
 * <p>The purpose text is restricted to {@code [A-Za-z0-9._-]}; spaces become
 * underscores and every other character is dropped. Resource path templates and the
 * live-check flag are not part of the name.
 */
public final class PermissionPolicyNames {

    static final String VALIDATE_MODEL = "validate_model";
    static final String CRITICAL = "critical";
    static final String PURPOSE_PREFIX = "purpose_";

    private PermissionPolicyNames() {}

    /**
     * Build the policy name for a requirement.
     *
     * @param permission       the required permission, with or without prefix
     * @param preValidateModel whether the model is validated before the check
     * @param critical         whether the operation is critical
     * @param auditPurpose     audit purpose, may be null
     * @return the policy name
     */
    public static String encode(String permission, boolean preValidateModel, boolean critical, String auditPurpose) {
        if (permission == null || permission.isBlank()) {
            throw new IllegalArgumentException("Permission cannot be null or blank");
        }

        final var name = new StringBuilder(PermissionMatcher.PERMISSION_PREFIX)
                .append(PermissionMatcher.stripPrefix(permission));

        if (preValidateModel) {
            name.append(':').append(VALIDATE_MODEL);
        }
        if (critical) {
            name.append(':').append(CRITICAL);
        }
        if (auditPurpose != null && !auditPurpose.isBlank()) {
            final var sanitized = sanitize(auditPurpose);
            if (!sanitized.isEmpty()) {
                name.append(':').append(PURPOSE_PREFIX).append(sanitized);
            }
        }
        return name.toString();
    }

    /**
     * Build the policy name for an existing requirement.
     */
    public static String encode(PermissionRequirement requirement) {
        return encode(
                requirement.permission(),
                requirement.preValidateModel(),
                requirement.critical(),
                requirement.auditPurpose().orElse(null));
    }

    /**
     * Parse a policy name.
     *
     * @param policyName the policy name
     * @return the requirement, or empty if the name is not a permission policy
     */
    public static Optional<PermissionRequirement> parse(String policyName) {
        if (!PermissionMatcher.hasPrefix(policyName)) {
            return Optional.empty();
        }

        final var parts = PermissionMatcher.stripPrefix(policyName).split(":");
        final var permission = parts[0];
        if (permission.isBlank()) {
            return Optional.empty();
        }

        final var builder = PermissionRequirement.builder(permission);
        for (int i = 1; i < parts.length; i++) {
            final var part = parts[i];
            if (part.equalsIgnoreCase(VALIDATE_MODEL)) {
                builder.preValidateModel(true);
            } else if (part.equalsIgnoreCase(CRITICAL)) {
                builder.critical(true);
            } else if (part.regionMatches(true, 0, PURPOSE_PREFIX, 0, PURPOSE_PREFIX.length())) {
                builder.auditPurpose(part.substring(PURPOSE_PREFIX.length()));
            }
        }
        return Optional.of(builder.build());
    }

    /**
     * Restrict text to characters that are safe inside a policy name.
     *
     * @param value the raw text
     * @return the sanitized text, empty if nothing remains
     */
    public static String sanitize(String value) {
        if (value == null || value.isBlank()) {
            return "";
        }

        final var result = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            final char ch = value.charAt(i);
            if ((ch >= 'a' && ch <= 'z')
                    || (ch >= 'A' && ch <= 'Z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '.'
                    || ch == '_'
                    || ch == '-') {
                result.append(ch);
            } else if (ch == ' ') {
                result.append('_');
            }
        }
        return result.toString();
    }
}
