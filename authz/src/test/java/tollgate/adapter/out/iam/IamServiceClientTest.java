package tollgate.adapter.out.iam;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.absent;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.vertx.mutiny.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import tollgate.adapter.out.telemetry.AuthorizationMetricsRecorder;
import tollgate.core.config.IamClientConfig;
import tollgate.core.model.auth.PermissionCheckRequest;
import tollgate.core.model.auth.RemoteCheckResult;
import tollgate.core.model.registration.PermissionRegistration;
import tollgate.core.model.registration.RoleRegistration;

/**
 * Unit tests for IamServiceClient.
 */
@DisplayName("IamServiceClient")
@ExtendWith(MockitoExtension.class)
class IamServiceClientTest {

    private static final String PRINCIPAL = "user-42";

    @Mock
    private IamClientConfig config;

    @Mock
    private AuthorizationMetricsRecorder metrics;

    private WireMockServer wireMockServer;
    private Vertx vertx;
    private IamServiceClient client;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();

        lenient().when(config.baseUrl()).thenReturn(wireMockServer.baseUrl());
        lenient().when(config.basePath()).thenReturn("/iam/v1");
        lenient().when(config.timeout()).thenReturn(Duration.ofSeconds(5));
        lenient().when(config.checkTimeout()).thenReturn(Duration.ofSeconds(5));
        lenient().when(config.serviceName()).thenReturn("invoice");
        lenient().when(config.serviceAccountToken()).thenReturn(Optional.of("svc-token"));

        client = new IamServiceClient(vertx, config, metrics);
    }

    @AfterEach
    void tearDown() {
        if (wireMockServer != null) {
            wireMockServer.stop();
        }
        if (vertx != null) {
            vertx.close().await().indefinitely();
        }
    }

    private void stubCheck(String permissionId, int status, String body) {
        wireMockServer.stubFor(post(urlEqualTo("/iam/v1/auth/check-permission"))
                .withRequestBody(matchingJsonPath("$.permissionId", equalTo(permissionId)))
                .willReturn(aResponse()
                        .withStatus(status)
                        .withHeader("Content-Type", "application/json")
                        .withBody(body)));
    }

    @Nested
    @DisplayName("Permission checks")
    class PermissionChecks {

        @Test
        @DisplayName("should send principal, permission and resource path")
        void shouldSendCheckRequest() {
            stubCheck("orders.orders.read", 200, "{\"allowed\": true, \"fromCache\": false, \"latencyMs\": 3}");

            var result = client.evaluatePermission(
                            PRINCIPAL, "orders.orders.read", Optional.of("customers/123/orders/456"))
                    .await()
                    .indefinitely();

            assertEquals(RemoteCheckResult.Answered.of(true), result);
            wireMockServer.verify(postRequestedFor(urlEqualTo("/iam/v1/auth/check-permission"))
                    .withHeader("X-Service-Name", equalTo("invoice"))
                    .withHeader("Authorization", equalTo("Bearer svc-token"))
                    .withRequestBody(equalToJson("{\"principalId\": \"user-42\", \"permissionId\": "
                            + "\"orders.orders.read\", \"resourcePath\": \"customers/123/orders/456\"}")));
        }

        @Test
        @DisplayName("should report a check slower than the check timeout as unavailable")
        void shouldTimeOutSlowCheck() {
            when(config.checkTimeout()).thenReturn(Duration.ofMillis(200));
            wireMockServer.stubFor(post(urlEqualTo("/iam/v1/auth/check-permission"))
                    .willReturn(aResponse()
                            .withStatus(200)
                            .withHeader("Content-Type", "application/json")
                            .withBody("{\"allowed\": true}")
                            .withFixedDelay(2000)));

            var started = System.nanoTime();
            var result = client.evaluatePermission(PRINCIPAL, "orders.orders.read", Optional.empty())
                    .await()
                    .atMost(Duration.ofSeconds(5));

            assertInstanceOf(RemoteCheckResult.Unavailable.class, result);
            assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofMillis(1500)) < 0);
        }

        @Test
        @DisplayName("should accept PascalCase response fields")
        void shouldAcceptPascalCase() {
            stubCheck("orders.orders.read", 200, "{\"Allowed\": true}");

            assertTrue(client.checkPermission(PRINCIPAL, "orders.orders.read", Optional.empty())
                    .await()
                    .indefinitely());
        }

        @Test
        @DisplayName("should answer false when refused")
        void shouldAnswerFalse() {
            stubCheck("orders.orders.delete", 200, "{\"allowed\": false}");

            var result = client.evaluatePermission(PRINCIPAL, "orders.orders.delete", Optional.empty())
                    .await()
                    .indefinitely();

            assertEquals(RemoteCheckResult.Answered.of(false), result);
        }

        @Test
        @DisplayName("should report non-2xx as unavailable")
        void shouldReportErrorStatusAsUnavailable() {
            stubCheck("orders.orders.read", 503, "{}");

            var result = client.evaluatePermission(PRINCIPAL, "orders.orders.read", Optional.empty())
                    .await()
                    .indefinitely();

            var unavailable = assertInstanceOf(RemoteCheckResult.Unavailable.class, result);
            assertEquals("status 503", unavailable.reason());
            assertFalse(client.checkPermission(PRINCIPAL, "orders.orders.read", Optional.empty())
                    .await()
                    .indefinitely());
        }

        @Test
        @DisplayName("should report connection failure as unavailable")
        void shouldReportConnectionFailure() {
            wireMockServer.stop();

            var result = client.evaluatePermission(PRINCIPAL, "orders.orders.read", Optional.empty())
                    .await()
                    .indefinitely();

            assertInstanceOf(RemoteCheckResult.Unavailable.class, result);
        }

        @Test
        @DisplayName("should omit the bearer token when not configured")
        void shouldOmitTokenWhenAbsent() {
            lenient().when(config.serviceAccountToken()).thenReturn(Optional.empty());
            stubCheck("orders.orders.read", 200, "{\"allowed\": true}");

            client.checkPermission(PRINCIPAL, "orders.orders.read", Optional.empty())
                    .await()
                    .indefinitely();

            wireMockServer.verify(postRequestedFor(urlEqualTo("/iam/v1/auth/check-permission"))
                    .withHeader("Authorization", absent()));
        }

        @Test
        @DisplayName("should record remote call metrics")
        void shouldRecordMetrics() {
            stubCheck("orders.orders.read", 200, "{\"allowed\": true}");

            client.checkPermission(PRINCIPAL, "orders.orders.read", Optional.empty())
                    .await()
                    .indefinitely();

            verify(metrics).recordRemoteCall(eq("check-permission"), eq(200), anyLong());
        }
    }

    @Nested
    @DisplayName("Bulk checks")
    class BulkChecks {

        @Test
        @DisplayName("should return an empty map for no requests")
        void shouldReturnEmptyMap() {
            var result = client.checkPermissionsBulk(PRINCIPAL, List.of()).await().indefinitely();

            assertEquals(Map.of(), result);
            assertEquals(0, wireMockServer.getAllServeEvents().size());
        }

        @Test
        @DisplayName("should map every requested permission")
        void shouldMapEveryPermission() {
            stubCheck("orders.orders.read", 200, "{\"allowed\": true}");
            stubCheck("orders.orders.delete", 200, "{\"allowed\": false}");
            stubCheck("orders.orders.refund", 500, "{}");

            var result = client.checkPermissionsBulk(
                            PRINCIPAL,
                            List.of(
                                    PermissionCheckRequest.global("orders.orders.read"),
                                    PermissionCheckRequest.scoped("orders.orders.delete", "customers/1"),
                                    PermissionCheckRequest.global("orders.orders.refund")))
                    .await()
                    .indefinitely();

            assertEquals(
                    Map.of("orders.orders.read", true, "orders.orders.delete", false, "orders.orders.refund", false),
                    result);
        }

        @Test
        @DisplayName("should map every permission to false when the authority is down")
        void shouldDenyAllWhenDown() {
            wireMockServer.stop();

            var result = client.checkPermissionsBulk(
                            PRINCIPAL,
                            List.of(
                                    PermissionCheckRequest.global("orders.orders.read"),
                                    PermissionCheckRequest.global("orders.orders.delete")))
                    .await()
                    .indefinitely();

            assertEquals(Map.of("orders.orders.read", false, "orders.orders.delete", false), result);
        }
    }

    @Nested
    @DisplayName("Permission resolution")
    class Resolution {

        @Test
        @DisplayName("should parse the resolution")
        void shouldParseResolution() {
            wireMockServer.stubFor(post(urlEqualTo("/iam/v1/auth/resolve-permissions"))
                    .withRequestBody(equalToJson("{\"principalId\": \"user-42\"}"))
                    .willReturn(aResponse()
                            .withStatus(200)
                            .withHeader("Content-Type", "application/json")
                            .withBody("{\"principalId\": \"user-42\", \"permissions\": [\"invoice.*\"],"
                                    + " \"roles\": [\"roles.invoice.clerk\"],"
                                    + " \"cacheUntil\": \"2026-01-01T00:00:00Z\", \"fromCache\": true}")));

            var resolution = client.resolvePermissions(PRINCIPAL).await().indefinitely();

            assertEquals("user-42", resolution.principalId());
            assertEquals(Set.of("invoice.*"), resolution.permissions());
            assertEquals(Set.of("roles.invoice.clerk"), resolution.roles());
            assertEquals(Instant.parse("2026-01-01T00:00:00Z"), resolution.cacheUntil());
            assertTrue(resolution.fromCache());
        }

        @Test
        @DisplayName("should return no permissions on failure")
        void shouldReturnEmptyOnFailure() {
            wireMockServer.stubFor(post(urlEqualTo("/iam/v1/auth/resolve-permissions"))
                    .willReturn(aResponse().withStatus(500)));

            var permissions = client.getUserPermissions(PRINCIPAL).await().indefinitely();

            assertEquals(Set.of(), permissions);
        }
    }

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("should send the permission catalog")
        void shouldSendPermissions() {
            wireMockServer.stubFor(post(urlEqualTo("/iam/v1/permissions/register"))
                    .willReturn(aResponse().withStatus(201)));

            client.registerPermissions(
                            "invoice", List.of(new PermissionRegistration("invoice.invoices.create", "Create")))
                    .await()
                    .indefinitely();

            wireMockServer.verify(postRequestedFor(urlEqualTo("/iam/v1/permissions/register"))
                    .withRequestBody(equalToJson("{\"serviceName\": \"invoice\", \"permissions\": "
                            + "[{\"permissionId\": \"invoice.invoices.create\", \"description\": \"Create\"}]}")));
        }

        @Test
        @DisplayName("should send the role catalog")
        void shouldSendRoles() {
            wireMockServer.stubFor(post(urlEqualTo("/iam/v1/roles/register"))
                    .willReturn(aResponse().withStatus(204)));

            client.registerRoles(
                            "invoice",
                            List.of(new RoleRegistration(
                                    "roles.invoice.clerk", "Clerk", List.of("invoice.invoices.create"))))
                    .await()
                    .indefinitely();

            wireMockServer.verify(postRequestedFor(urlEqualTo("/iam/v1/roles/register"))
                    .withRequestBody(equalToJson("{\"serviceName\": \"invoice\", \"roles\": [{\"roleId\": "
                            + "\"roles.invoice.clerk\", \"description\": \"Clerk\", \"permissionIds\": "
                            + "[\"invoice.invoices.create\"], \"isCustom\": false}]}")));
        }

        @Test
        @DisplayName("should fail on non-2xx status")
        void shouldFailOnErrorStatus() {
            wireMockServer.stubFor(post(urlEqualTo("/iam/v1/permissions/register"))
                    .willReturn(aResponse().withStatus(500)));

            var registration = client.registerPermissions(
                    "invoice", List.of(new PermissionRegistration("invoice.invoices.create", "")));

            var error = assertThrows(
                    IamServiceClient.RemoteAuthorityException.class, () -> registration.await().indefinitely());
            assertEquals(500, error.statusCode());
        }
    }

    @Test
    @DisplayName("should join base URL and path without duplicate slashes")
    void shouldJoinUrl() {
        lenient().when(config.baseUrl()).thenReturn("http://iam-service/");
        lenient().when(config.basePath()).thenReturn("iam/v1/");

        assertEquals("http://iam-service/iam/v1/auth/check-permission", client.url("/auth/check-permission"));
    }
}
