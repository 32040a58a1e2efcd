package tollgate.adapter.in.auth;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.json.JsonNumber;
import jakarta.json.JsonString;
import jakarta.json.JsonValue;

import io.quarkus.security.identity.SecurityIdentity;
import org.eclipse.microprofile.jwt.JsonWebToken;

import tollgate.core.model.auth.CallerIdentity;

/**
 * Maps the Quarkus {@link SecurityIdentity} to a {@link CallerIdentity}.
 *
 * <p>Reads the identity attributes set by the upstream authentication mechanism:
 * <ul>
 *   <li>{@code claims} - the token claims as a {@code Map<String, Object>}</li>
 *   <li>{@code permissions} - permissions already resolved by the identity provider</li>
 * </ul>
 * Without a {@code claims} attribute, claims are read from a {@link JsonWebToken}
 * principal as set by the Quarkus OIDC and SmallRye JWT extensions.
 *
 * <p>Permissions are collected from the {@code permissions} and legacy {@code permission}
 * claims and the {@code permissions} attribute, de-duplicated. The principal id comes from
 * the {@code sub} claim, falling back to the name-identifier claim. Identities without any
 * claims use the principal name.
 */
@ApplicationScoped
public class CallerIdentityMapper {

    public static final String CLAIMS_ATTRIBUTE = "claims";
    public static final String PERMISSIONS_ATTRIBUTE = "permissions";

    static final List<String> PERMISSION_CLAIMS = List.of("permissions", "permission");
    static final List<String> PRINCIPAL_CLAIMS =
            List.of("sub", "http://schemas.xmlsoap.org/ws/2005/05/identity/claims/nameidentifier");
    static final List<String> CLIENT_CLAIMS = List.of("client_id", "azp", "appid");

    /**
     * Map an identity.
     *
     * @param identity        the security identity, may be null
     * @param routeParameters route parameter values of the request
     * @param sourceIp        originating client address
     * @return the caller identity
     */
    public CallerIdentity map(SecurityIdentity identity, Map<String, String> routeParameters, Optional<String> sourceIp) {
        if (identity == null || identity.isAnonymous()) {
            return new CallerIdentity(false, Optional.empty(), Optional.empty(), Set.of(), sourceIp, routeParameters);
        }

        final Optional<Map<String, Object>> tokenClaims = claims(identity);
        final Map<String, Object> claims = tokenClaims.orElse(Map.of());
        final var permissions = new LinkedHashSet<String>();
        for (var claim : PERMISSION_CLAIMS) {
            addValues(permissions, claims.get(claim));
        }
        addValues(permissions, identity.getAttribute(PERMISSIONS_ATTRIBUTE));

        final Optional<String> principalId;
        if (tokenClaims.isEmpty()) {
            principalId = Optional.ofNullable(identity.getPrincipal()).map(principal -> principal.getName());
        } else {
            principalId = firstClaim(claims, PRINCIPAL_CLAIMS);
        }

        return new CallerIdentity(
                true, principalId, firstClaim(claims, CLIENT_CLAIMS), permissions, sourceIp, routeParameters);
    }

    @SuppressWarnings("unchecked")
    private static Optional<Map<String, Object>> claims(SecurityIdentity identity) {
        final Object claims = identity.getAttribute(CLAIMS_ATTRIBUTE);
        if (claims instanceof Map<?, ?> map) {
            return Optional.of((Map<String, Object>) map);
        }
        if (identity.getPrincipal() instanceof JsonWebToken jwt) {
            return Optional.of(tokenClaims(jwt));
        }
        return Optional.empty();
    }

    private static Map<String, Object> tokenClaims(JsonWebToken jwt) {
        final var names = jwt.getClaimNames();
        if (names == null) {
            return Map.of();
        }
        final var claims = new HashMap<String, Object>();
        for (var name : names) {
            final Object value = jwt.getClaim(name);
            if (value != null) {
                claims.put(name, unwrap(value));
            }
        }
        return claims;
    }

    // Raw token claims arrive as JSON-P values
    private static Object unwrap(Object value) {
        if (value instanceof JsonString json) {
            return json.getString();
        }
        if (value instanceof JsonNumber json) {
            return json.toString();
        }
        if (value instanceof Iterable<?> values) {
            final var items = new ArrayList<Object>();
            for (var item : values) {
                if (item != null && item != JsonValue.NULL) {
                    items.add(unwrap(item));
                }
            }
            return items;
        }
        return value;
    }

    private static Optional<String> firstClaim(Map<String, Object> claims, List<String> names) {
        for (var name : names) {
            final var value = claims.get(name);
            if (value != null && !value.toString().isBlank()) {
                return Optional.of(value.toString());
            }
        }
        return Optional.empty();
    }

    private static void addValues(Set<String> target, Object value) {
        if (value == null) {
            return;
        }
        if (value instanceof Iterable<?> values) {
            for (var item : values) {
                addValues(target, item);
            }
        } else if (value instanceof Object[] values) {
            for (var item : values) {
                addValues(target, item);
            }
        } else {
            final var text = value.toString().trim();
            if (!text.isEmpty()) {
                target.add(text);
            }
        }
    }
}
