package tollgate.system.filter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ResourceInfo;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MultivaluedHashMap;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;

import io.quarkus.security.identity.CurrentIdentityAssociation;
import io.quarkus.security.identity.SecurityIdentity;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import tollgate.adapter.in.auth.CallerIdentityMapper;
import tollgate.adapter.in.auth.PermissionRequirementResolver;
import tollgate.adapter.in.auth.RequirePermission;
import tollgate.core.model.auth.AuthorizationDecision;
import tollgate.core.model.auth.CallerIdentity;
import tollgate.core.model.auth.PermissionRequirement;
import tollgate.core.service.auth.PermissionAuthorizationService;
import tollgate.testing.TestIdentities;

@DisplayName("PermissionAuthorizationFilter")
class PermissionAuthorizationFilterTest {

    static class OrdersResource {

        @RequirePermission(value = "orders.orders.read", resourcePath = "customers/{customerId}")
        public void read() {}

        public void open() {}
    }

    private PermissionAuthorizationService authorizationService;
    private CurrentIdentityAssociation identityAssociation;
    private ContainerRequestContext requestContext;
    private ResourceInfo resourceInfo;
    private UriInfo uriInfo;
    private PermissionAuthorizationFilter filter;

    @BeforeEach
    void setUp() throws NoSuchMethodException {
        authorizationService = mock(PermissionAuthorizationService.class);
        identityAssociation = mock(CurrentIdentityAssociation.class);
        requestContext = mock(ContainerRequestContext.class);
        resourceInfo = mock(ResourceInfo.class);
        uriInfo = mock(UriInfo.class);

        var pathParameters = new MultivaluedHashMap<String, String>();
        pathParameters.add("customerId", "123");
        when(requestContext.getUriInfo()).thenReturn(uriInfo);
        when(uriInfo.getPath()).thenReturn("/customers/123");
        when(uriInfo.getPathParameters()).thenReturn(pathParameters);
        when(requestContext.getHeaderString("X-Forwarded-For")).thenReturn("198.51.100.1");
        doReturn(OrdersResource.class).when(resourceInfo).getResourceClass();
        when(resourceInfo.getResourceMethod()).thenReturn(OrdersResource.class.getMethod("read"));

        SecurityIdentity identity = TestIdentities.token("user-42").build();
        when(identityAssociation.getDeferredIdentity()).thenReturn(Uni.createFrom().item(identity));

        filter = new PermissionAuthorizationFilter(
                authorizationService,
                new PermissionRequirementResolver(),
                new CallerIdentityMapper(),
                identityAssociation);
    }

    private Response filter(AuthorizationDecision decision) {
        when(authorizationService.authorize(any(PermissionRequirement.class), any(CallerIdentity.class)))
                .thenReturn(Uni.createFrom().item(decision));
        return filter.filter(requestContext, resourceInfo, null).await().indefinitely();
    }

    @Test
    @DisplayName("should pass through unprotected methods")
    void shouldPassThroughUnprotected() throws NoSuchMethodException {
        when(resourceInfo.getResourceMethod()).thenReturn(OrdersResource.class.getMethod("open"));

        var response = filter.filter(requestContext, resourceInfo, null).await().indefinitely();

        assertNull(response);
        verifyNoInteractions(authorizationService, identityAssociation);
    }

    @Test
    @DisplayName("should continue when allowed")
    void shouldContinueWhenAllowed() {
        var response = filter(new AuthorizationDecision.Allowed(AuthorizationDecision.Source.LOCAL_CLAIM));

        assertNull(response);
    }

    @Test
    @DisplayName("should pass caller identity and route parameters to the authorization service")
    void shouldPassCallerIdentity() {
        filter(new AuthorizationDecision.Allowed(AuthorizationDecision.Source.LOCAL_CLAIM));

        var requirement = ArgumentCaptor.forClass(PermissionRequirement.class);
        var caller = ArgumentCaptor.forClass(CallerIdentity.class);
        verify(authorizationService).authorize(requirement.capture(), caller.capture());
        assertEquals("orders.orders.read", requirement.getValue().permission());
        assertEquals(Optional.of("user-42"), caller.getValue().principalId());
        assertEquals(Map.of("customerId", "123"), caller.getValue().routeParameters());
        assertEquals(Optional.of("198.51.100.1"), caller.getValue().sourceIp());
        assertEquals(Set.of(), caller.getValue().permissions());
    }

    @Nested
    @DisplayName("Rejections")
    class Rejections {

        @Test
        @DisplayName("should return 401 with bearer challenge")
        void shouldChallenge() {
            var response = filter(AuthorizationDecision.Denied.unauthenticated("unauthenticated"));

            assertEquals(401, response.getStatus());
            assertEquals("Bearer", response.getHeaderString(HttpHeaders.WWW_AUTHENTICATE));
        }

        @Test
        @DisplayName("should return 403 when permission is missing")
        void shouldForbid() {
            var response = filter(AuthorizationDecision.Denied.forbidden("insufficient permissions"));

            assertEquals(403, response.getStatus());
            assertEquals(Map.of("error", "Insufficient permissions"), response.getEntity());
        }

        @Test
        @DisplayName("should return 503 when the IAM authority is unavailable")
        void shouldReturnServiceUnavailable() {
            var response = filter(new AuthorizationDecision.ServiceUnavailable("timeout"));

            assertEquals(503, response.getStatus());
        }
    }
}
