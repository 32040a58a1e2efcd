package tollgate.core.service.auth;

import java.util.Collection;

/**
 * Matches required permissions against held permission claims.
 *
 * <p>Permissions are dot-separated segments ({@code service.resource.action}).
 * Comparison is case-insensitive and ignores an optional {@code Permission:} prefix
 * on either side.
 *
 * <p>Matching rules for a claim:
 * <ol>
 *   <li>{@code *} matches every permission</li>
 *   <li>A claim ending in {@code .*} matches every permission that shares its
 *       preceding segments, at any depth ({@code invoice.*} matches
 *       {@code invoice.invoices.create})</li>
 *   <li>A wildcard in any other position never matches, so {@code *.delete}
 *       does not grant {@code invoices.create} and {@code invoices.*.read}
 *       grants nothing</li>
 *   <li>Otherwise every segment must match and the segment counts must be equal</li>
 * </ol>
 *
 * <p>Runs on every authorized request: no allocation, no exceptions.
 */
public final class PermissionMatcher {

    /** Scheme prefix that may precede a permission id. */
    public static final String PERMISSION_PREFIX = "Permission:";

    /** Claim that grants every permission. */
    public static final String WILDCARD = "*";

    private static final char SEPARATOR = '.';

    private PermissionMatcher() {}

    /**
     * Checks whether any held claim satisfies the required permission.
     *
     * @param required   the required permission
     * @param heldClaims permission claims held by the caller
     * @return true if at least one claim matches
     */
    public static boolean match(String required, Collection<String> heldClaims) {
        if (isBlank(required) || heldClaims == null || heldClaims.isEmpty()) {
            return false;
        }
        for (var claim : heldClaims) {
            if (isMatch(required, claim)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks whether a single claim satisfies the required permission.
     *
     * @param required the required permission
     * @param claim    the held claim
     * @return true if the claim grants the required permission
     */
    public static boolean isMatch(String required, String claim) {
        if (isBlank(required) || isBlank(claim)) {
            return false;
        }

        final int requiredStart = prefixLength(required);
        final int claimStart = prefixLength(claim);
        final int requiredLength = required.length() - requiredStart;
        final int claimLength = claim.length() - claimStart;

        if (requiredLength == 0 || claimLength == 0) {
            return false;
        }

        if (requiredLength == claimLength && required.regionMatches(true, requiredStart, claim, claimStart, claimLength)) {
            return true;
        }

        if (claimLength == 1 && claim.charAt(claimStart) == '*') {
            return true;
        }

        int r = requiredStart;
        int c = claimStart;
        while (true) {
            final int claimEnd = segmentEnd(claim, c);
            final boolean lastClaimSegment = claimEnd == claim.length();
            final int segmentLength = claimEnd - c;

            if (segmentLength == 1 && claim.charAt(c) == '*') {
                // Only a trailing wildcard grants anything
                return lastClaimSegment;
            }

            if (r > required.length()) {
                // Claim is more specific than the requirement
                return false;
            }

            final int requiredEnd = segmentEnd(required, r);
            if (requiredEnd - r != segmentLength || !claim.regionMatches(true, c, required, r, segmentLength)) {
                return false;
            }

            r = requiredEnd + 1;
            c = claimEnd + 1;

            if (lastClaimSegment) {
                return r > required.length();
            }
        }
    }

    /**
     * Removes the {@code Permission:} prefix, if present.
     *
     * @param permission a permission, possibly prefixed
     * @return the bare permission id, or null if the input was null
     */
    public static String stripPrefix(String permission) {
        if (permission == null) {
            return null;
        }
        return permission.substring(prefixLength(permission));
    }

    /**
     * Whether the permission carries the {@code Permission:} prefix (case-insensitive).
     */
    public static boolean hasPrefix(String permission) {
        return permission != null && prefixLength(permission) > 0;
    }

    private static int prefixLength(String value) {
        return value.regionMatches(true, 0, PERMISSION_PREFIX, 0, PERMISSION_PREFIX.length())
                ? PERMISSION_PREFIX.length()
                : 0;
    }

    private static int segmentEnd(String value, int from) {
        final int end = value.indexOf(SEPARATOR, from);
        return end < 0 ? value.length() : end;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
