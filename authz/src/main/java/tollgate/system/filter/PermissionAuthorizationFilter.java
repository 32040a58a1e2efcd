package tollgate.system.filter;

import java.util.HashMap;
import java.util.Map;

import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ResourceInfo;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.Response;

import io.quarkus.security.identity.CurrentIdentityAssociation;
import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerRequestFilter;

import tollgate.adapter.in.auth.CallerIdentityMapper;
import tollgate.adapter.in.auth.PermissionRequirementResolver;
import tollgate.adapter.in.auth.RequirePermission;
import tollgate.core.model.auth.AuthorizationDecision;
import tollgate.core.service.auth.PermissionAuthorizationService;
import tollgate.core.service.common.ClientIpExtractor;

/**
 * Enforces {@link RequirePermission} on resource methods.
 *
 * <p>Runs after authentication. Requests to unannotated methods pass through untouched.
 *
 * <p>Responses:
 * <ul>
 *   <li>401 with a {@code Bearer} challenge - no authenticated identity or no principal id</li>
 *   <li>403 - the caller lacks the permission</li>
 *   <li>503 - the IAM authority could not be consulted and fail-open is disabled</li>
 * </ul>
 *
 * <p>Uses @ServerRequestFilter with Uni return type so live checks against the IAM
 * authority do not block the Vert.x event loop.
 */
public class PermissionAuthorizationFilter {

    private static final Logger LOG = Logger.getLogger(PermissionAuthorizationFilter.class);

    private final PermissionAuthorizationService authorizationService;
    private final PermissionRequirementResolver requirementResolver;
    private final CallerIdentityMapper identityMapper;
    private final CurrentIdentityAssociation identityAssociation;

    @Inject
    public PermissionAuthorizationFilter(
            PermissionAuthorizationService authorizationService,
            PermissionRequirementResolver requirementResolver,
            CallerIdentityMapper identityMapper,
            CurrentIdentityAssociation identityAssociation) {
        this.authorizationService = authorizationService;
        this.requirementResolver = requirementResolver;
        this.identityMapper = identityMapper;
        this.identityAssociation = identityAssociation;
    }

    /**
     * Check the permission of the matched resource method.
     *
     * @param requestContext the request context
     * @param resourceInfo   the matched resource
     * @param request        the underlying HTTP request
     * @return Uni with null to continue, or Response to abort
     */
    @ServerRequestFilter(priority = Priorities.AUTHORIZATION)
    public Uni<Response> filter(
            ContainerRequestContext requestContext, ResourceInfo resourceInfo, HttpServerRequest request) {
        final var requirement =
                requirementResolver.resolve(resourceInfo.getResourceClass(), resourceInfo.getResourceMethod());
        if (requirement.isEmpty()) {
            return Uni.createFrom().nullItem();
        }

        final var routeParameters =
                firstValues(requestContext.getUriInfo().getPathParameters());
        final var sourceIp = ClientIpExtractor.extract(
                requestContext.getHeaderString(ClientIpExtractor.FORWARDED),
                requestContext.getHeaderString(ClientIpExtractor.X_FORWARDED_FOR),
                request != null && request.remoteAddress() != null
                        ? request.remoteAddress().host()
                        : null);

        return identityAssociation
                .getDeferredIdentity()
                .map(identity -> identityMapper.map(identity, routeParameters, sourceIp))
                .chain(caller -> authorizationService.authorize(requirement.get(), caller))
                .map(decision -> toResponse(decision, requestContext));
    }

    Response toResponse(AuthorizationDecision decision, ContainerRequestContext requestContext) {
        if (decision instanceof AuthorizationDecision.Allowed) {
            return null;
        }

        if (decision instanceof AuthorizationDecision.Denied denied) {
            if (denied.challenge()) {
                LOG.debugf("Authentication required for %s: %s", path(requestContext), denied.reason());
                return Response.status(Response.Status.UNAUTHORIZED)
                        .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
                        .entity(Map.of("error", "Authentication required"))
                        .build();
            }
            LOG.debugf("Permission denied for %s: %s", path(requestContext), denied.reason());
            return Response.status(Response.Status.FORBIDDEN)
                    .entity(Map.of("error", "Insufficient permissions"))
                    .build();
        }

        final var unavailable = (AuthorizationDecision.ServiceUnavailable) decision;
        LOG.debugf("Authorization unavailable for %s: %s", path(requestContext), unavailable.reason());
        return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                .entity(Map.of("error", "Authorization service unavailable"))
                .build();
    }

    private static String path(ContainerRequestContext requestContext) {
        return requestContext.getUriInfo() != null ? requestContext.getUriInfo().getPath() : "";
    }

    private static Map<String, String> firstValues(MultivaluedMap<String, String> parameters) {
        if (parameters == null || parameters.isEmpty()) {
            return Map.of();
        }
        final var values = new HashMap<String, String>();
        parameters.forEach((name, list) -> {
            if (list != null && !list.isEmpty() && list.get(0) != null) {
                values.put(name, list.get(0));
            }
        });
        return values;
    }
}
