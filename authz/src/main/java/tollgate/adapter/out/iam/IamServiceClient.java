package tollgate.adapter.out.iam;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import tollgate.adapter.out.telemetry.AuthorizationMetricsRecorder;
import tollgate.core.config.IamClientConfig;
import tollgate.core.model.auth.PermissionCheckRequest;
import tollgate.core.model.auth.PermissionResolution;
import tollgate.core.model.auth.RemoteCheckResult;
import tollgate.core.model.registration.PermissionRegistration;
import tollgate.core.model.registration.RoleRegistration;
import tollgate.core.port.out.CatalogRegistry;
import tollgate.core.port.out.RemoteAuthorization;

/**
 * HTTP client for the central IAM authority.
 *
 * <p>Every request is a JSON {@code POST} to {@code {base-url}{base-path}{endpoint}}
 * carrying the {@code X-Service-Name} header and, when configured, the service
 * account token as a bearer credential.
 *
 * <h2>Endpoints</h2>
 * <pre>{@code
 * POST /auth/resolve-permissions  {"principalId": "..."}
 *   -> {"principalId", "permissions": [], "roles": [], "cacheUntil", "fromCache"}
 *
 * POST /auth/check-permission     {"principalId", "permissionId", "resourcePath"}
 *   -> {"principalId", "permissionId", "allowed", "resourcePath", "fromCache", "latencyMs"}
 *
 * POST /permissions/register      {"serviceName", "permissions": [{"permissionId", "description"}]}
 *
 * POST /roles/register            {"serviceName", "roles": [{"roleId", "description",
 *                                  "permissionIds": [], "isCustom"}]}
 * }</pre>
 *
 * <p>Response fields are read case-insensitively on their first letter, so both
 * {@code allowed} and {@code Allowed} are accepted.
 *
 * <p>Reads never fail: errors are logged and folded into empty or negative results.
 * Registration calls fail with {@link RemoteAuthorityException} on any non-2xx status.
 */
@ApplicationScoped
public class IamServiceClient implements RemoteAuthorization, CatalogRegistry {

    private static final Logger LOG = Logger.getLogger(IamServiceClient.class);

    static final String RESOLVE_PERMISSIONS = "/auth/resolve-permissions";
    static final String CHECK_PERMISSION = "/auth/check-permission";
    static final String REGISTER_PERMISSIONS = "/permissions/register";
    static final String REGISTER_ROLES = "/roles/register";

    static final String SERVICE_NAME_HEADER = "X-Service-Name";

    private final WebClient webClient;
    private final IamClientConfig config;
    private final AuthorizationMetricsRecorder metrics;

    @Inject
    public IamServiceClient(Vertx vertx, IamClientConfig config, AuthorizationMetricsRecorder metrics) {
        this(WebClient.create(vertx), config, metrics);
    }

    IamServiceClient(WebClient webClient, IamClientConfig config, AuthorizationMetricsRecorder metrics) {
        this.webClient = webClient;
        this.config = config;
        this.metrics = metrics;
    }

    @Override
    public Uni<Set<String>> getUserPermissions(String principalId) {
        return resolvePermissions(principalId).map(PermissionResolution::permissions);
    }

    @Override
    public Uni<PermissionResolution> resolvePermissions(String principalId) {
        final var body = new JsonObject().put("principalId", principalId);

        return post(RESOLVE_PERMISSIONS, body, config.checkTimeout())
                .map(response -> {
                    requireSuccess(RESOLVE_PERMISSIONS, response);
                    final var resolution = parseResolution(principalId, response.bodyAsJsonObject());
                    LOG.debugf(
                            "Resolved %d permissions for principal %s",
                            resolution.permissions().size(), principalId);
                    return resolution;
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf(error, "Failed to resolve permissions for principal %s", principalId);
                    return PermissionResolution.empty(principalId);
                });
    }

    @Override
    public Uni<RemoteCheckResult> evaluatePermission(
            String principalId, String permissionId, Optional<String> resourcePath) {
        final var body = new JsonObject()
                .put("principalId", principalId)
                .put("permissionId", permissionId)
                .put("resourcePath", resourcePath.orElse(null));

        return post(CHECK_PERMISSION, body, config.checkTimeout())
                .map(response -> {
                    if (!isSuccess(response.statusCode())) {
                        LOG.warnf(
                                "Permission check for %s on %s returned status %d",
                                principalId, permissionId, response.statusCode());
                        return (RemoteCheckResult)
                                new RemoteCheckResult.Unavailable("status " + response.statusCode(), null);
                    }
                    final var json = response.bodyAsJsonObject();
                    final var allowed = json != null && Boolean.TRUE.equals(field(json, "allowed"));
                    LOG.debugf(
                            "Permission check for %s on %s (resource: %s): %s",
                            principalId, permissionId, resourcePath.orElse("-"), allowed);
                    return (RemoteCheckResult) RemoteCheckResult.Answered.of(allowed);
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf(error, "Permission check for %s on %s failed", principalId, permissionId);
                    return new RemoteCheckResult.Unavailable(error.getClass().getSimpleName(), error);
                });
    }

    @Override
    public Uni<Map<String, Boolean>> checkPermissionsBulk(String principalId, List<PermissionCheckRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            return Uni.createFrom().item(Map.of());
        }

        final List<Uni<Map.Entry<String, Boolean>>> checks = requests.stream()
                .map(request -> checkPermission(principalId, request.permissionId(), request.resourcePath())
                        .map(allowed -> Map.entry(request.permissionId(), allowed)))
                .toList();

        return Uni.combine()
                .all()
                .unis(checks)
                .with(results -> {
                    final var byPermission = new LinkedHashMap<String, Boolean>();
                    for (var result : results) {
                        @SuppressWarnings("unchecked")
                        final var entry = (Map.Entry<String, Boolean>) result;
                        byPermission.merge(entry.getKey(), entry.getValue(), Boolean::logicalAnd);
                    }
                    return (Map<String, Boolean>) byPermission;
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf(error, "Bulk permission check for %s failed", principalId);
                    final var denied = new LinkedHashMap<String, Boolean>();
                    requests.forEach(request -> denied.put(request.permissionId(), false));
                    return denied;
                });
    }

    @Override
    public Uni<Void> registerPermissions(String serviceName, List<PermissionRegistration> permissions) {
        final var entries = new JsonArray();
        permissions.forEach(permission -> entries.add(new JsonObject()
                .put("permissionId", permission.permissionId())
                .put("description", permission.description())));

        final var body = new JsonObject().put("serviceName", serviceName).put("permissions", entries);

        return post(REGISTER_PERMISSIONS, body, config.timeout())
                .invoke(response -> requireSuccess(REGISTER_PERMISSIONS, response))
                .invoke(() -> LOG.infof("Registered %d permissions for service %s", permissions.size(), serviceName))
                .replaceWithVoid();
    }

    @Override
    public Uni<Void> registerRoles(String serviceName, List<RoleRegistration> roles) {
        final var entries = new JsonArray();
        roles.forEach(role -> entries.add(new JsonObject()
                .put("roleId", role.roleId())
                .put("description", role.description())
                .put("permissionIds", new JsonArray(role.permissionIds()))
                .put("isCustom", role.custom())));

        final var body = new JsonObject().put("serviceName", serviceName).put("roles", entries);

        return post(REGISTER_ROLES, body, config.timeout())
                .invoke(response -> requireSuccess(REGISTER_ROLES, response))
                .invoke(() -> LOG.infof("Registered %d roles for service %s", roles.size(), serviceName))
                .replaceWithVoid();
    }

    private Uni<HttpResponse<Buffer>> post(String endpoint, JsonObject body, Duration timeout) {
        final var url = url(endpoint);
        final var operation = endpoint.substring(endpoint.lastIndexOf('/') + 1);
        final var startTime = System.currentTimeMillis();

        final var request = webClient
                .postAbs(url)
                .timeout(timeout.toMillis())
                .putHeader("Content-Type", "application/json")
                .putHeader("Accept", "application/json")
                .putHeader(SERVICE_NAME_HEADER, config.serviceName());
        config.serviceAccountToken()
                .filter(token -> !token.isBlank())
                .ifPresent(token -> request.putHeader("Authorization", "Bearer " + token));

        return request.sendJsonObject(body)
                .invoke(response -> metrics.recordRemoteCall(
                        operation, response.statusCode(), System.currentTimeMillis() - startTime))
                .onFailure()
                .invoke(error -> metrics.recordRemoteCall(operation, 0, System.currentTimeMillis() - startTime));
    }

    String url(String endpoint) {
        var base = config.baseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        var path = config.basePath();
        if (path == null || path.isBlank() || path.equals("/")) {
            path = "";
        } else {
            if (!path.startsWith("/")) {
                path = "/" + path;
            }
            if (path.endsWith("/")) {
                path = path.substring(0, path.length() - 1);
            }
        }
        return base + path + endpoint;
    }

    private void requireSuccess(String endpoint, HttpResponse<Buffer> response) {
        if (!isSuccess(response.statusCode())) {
            LOG.warnf(
                    "IAM authority call failed: endpoint=%s, status=%d, body=%s",
                    endpoint, response.statusCode(), response.bodyAsString());
            throw new RemoteAuthorityException(endpoint, response.statusCode());
        }
    }

    private static boolean isSuccess(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }

    private PermissionResolution parseResolution(String principalId, JsonObject json) {
        if (json == null) {
            return PermissionResolution.empty(principalId);
        }
        final var resolvedId = field(json, "principalId");
        return new PermissionResolution(
                resolvedId instanceof String id && !id.isBlank() ? id : principalId,
                extractStringSet(json, "permissions"),
                extractStringSet(json, "roles"),
                parseInstant(field(json, "cacheUntil")),
                Boolean.TRUE.equals(field(json, "fromCache")));
    }

    private Set<String> extractStringSet(JsonObject json, String name) {
        final var value = field(json, name);
        if (!(value instanceof JsonArray array)) {
            return Set.of();
        }

        final var result = new HashSet<String>();
        for (int i = 0; i < array.size(); i++) {
            final var item = array.getValue(i);
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }

    private static Instant parseInstant(Object value) {
        if (!(value instanceof String text) || text.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            LOG.debugf("Ignoring unparseable cacheUntil value: %s", text);
            return null;
        }
    }

    private static Object field(JsonObject json, String camelCaseName) {
        if (json.containsKey(camelCaseName)) {
            return json.getValue(camelCaseName);
        }
        return json.getValue(Character.toUpperCase(camelCaseName.charAt(0)) + camelCaseName.substring(1));
    }

    /**
     * Exception thrown when the IAM authority answers with a non-2xx status.
     */
    public static class RemoteAuthorityException extends RuntimeException {

        private final int statusCode;

        public RemoteAuthorityException(String endpoint, int statusCode) {
            super("IAM authority returned status " + statusCode + " for " + endpoint);
            this.statusCode = statusCode;
        }

        public int statusCode() {
            return statusCode;
        }
    }
}
