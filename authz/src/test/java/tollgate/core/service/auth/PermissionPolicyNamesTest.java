package tollgate.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tollgate.core.model.auth.PermissionRequirement;

@DisplayName("PermissionPolicyNames")
class PermissionPolicyNamesTest {

    @Nested
    @DisplayName("encode")
    class Encode {

        @Test
        @DisplayName("should prefix a plain permission")
        void shouldPrefixPlainPermission() {
            assertEquals(
                    "Permission:invoice.invoices.create",
                    PermissionPolicyNames.encode("invoice.invoices.create", false, false, null));
        }

        @Test
        @DisplayName("should not double the prefix")
        void shouldNotDoublePrefix() {
            assertEquals(
                    "Permission:invoice.invoices.create",
                    PermissionPolicyNames.encode("permission:invoice.invoices.create", false, false, null));
        }

        @Test
        @DisplayName("should append flags in order")
        void shouldAppendFlags() {
            assertEquals(
                    "Permission:orders.orders.refund:validate_model:critical:purpose_Customer_refund",
                    PermissionPolicyNames.encode("orders.orders.refund", true, true, "Customer refund"));
        }

        @Test
        @DisplayName("should omit purpose that sanitizes to nothing")
        void shouldOmitEmptyPurpose() {
            assertEquals(
                    "Permission:a.b.c:critical", PermissionPolicyNames.encode("a.b.c", false, true, "!!!"));
        }

        @Test
        @DisplayName("should reject blank permission")
        void shouldRejectBlankPermission() {
            assertThrows(IllegalArgumentException.class, () -> PermissionPolicyNames.encode(" ", false, false, null));
        }
    }

    @Nested
    @DisplayName("parse")
    class Parse {

        @Test
        @DisplayName("should parse flags and purpose")
        void shouldParseFlags() {
            var requirement = PermissionPolicyNames.parse(
                            "Permission:orders.orders.refund:validate_model:critical:purpose_Customer_refund")
                    .orElseThrow();

            assertEquals("orders.orders.refund", requirement.permission());
            assertTrue(requirement.preValidateModel());
            assertTrue(requirement.critical());
            assertEquals(Optional.of("Customer_refund"), requirement.auditPurpose());
            assertFalse(requirement.requireLiveCheck());
            assertTrue(requirement.resourcePathTemplate().isEmpty());
        }

        @Test
        @DisplayName("should return empty for non-permission policies")
        void shouldIgnoreOtherPolicies() {
            assertTrue(PermissionPolicyNames.parse("AdminOnly").isEmpty());
            assertTrue(PermissionPolicyNames.parse(null).isEmpty());
            assertTrue(PermissionPolicyNames.parse("Permission:").isEmpty());
        }

        @Test
        @DisplayName("should read back an encoded requirement")
        void shouldReadBackEncodedRequirement() {
            var original = PermissionRequirement.builder("invoice.invoices.void")
                    .critical(true)
                    .auditPurpose("month-end.close")
                    .build();

            var parsed = PermissionPolicyNames.parse(PermissionPolicyNames.encode(original)).orElseThrow();

            assertEquals(original, parsed);
        }
    }

    @Test
    @DisplayName("sanitize should keep safe characters and replace spaces")
    void sanitizeShouldKeepSafeCharacters() {
        assertEquals("Fraud_review-2024.Q1_x", PermissionPolicyNames.sanitize("Fraud review-2024.Q1_x"));
        assertEquals("abc", PermissionPolicyNames.sanitize("a:b/c?"));
        assertEquals("", PermissionPolicyNames.sanitize(null));
    }
}
