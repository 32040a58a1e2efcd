package tollgate.core.model.auth;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The authenticated caller of a protected operation, reduced to what authorization needs.
 *
 * <p>Produced per request from the upstream authenticator's identity. Permission
 * claims are already de-duplicated: a token carrying the same permission under both
 * the {@code permissions} and legacy {@code permission} claim types yields one entry.
 *
 * @param authenticated   whether an authenticated identity is present
 * @param principalId     subject of the identity, empty when no subject claim exists
 * @param clientId        client/application id, when present in the claims
 * @param permissions     de-duplicated permission claim values
 * @param sourceIp        originating client address, when known
 * @param routeParameters route parameter values of the current request
 */
public record CallerIdentity(
        boolean authenticated,
        Optional<String> principalId,
        Optional<String> clientId,
        Set<String> permissions,
        Optional<String> sourceIp,
        Map<String, String> routeParameters) {

    public CallerIdentity {
        principalId = principalId != null ? principalId.filter(p -> !p.isBlank()) : Optional.empty();
        clientId = clientId != null ? clientId.filter(c -> !c.isBlank()) : Optional.empty();
        permissions = permissions != null ? Set.copyOf(permissions) : Set.of();
        sourceIp = sourceIp != null ? sourceIp : Optional.empty();
        routeParameters = routeParameters != null ? Map.copyOf(routeParameters) : Map.of();
    }

    /**
     * Identity of a request that carried no authenticated principal.
     */
    public static CallerIdentity anonymous() {
        return new CallerIdentity(false, Optional.empty(), Optional.empty(), Set.of(), Optional.empty(), Map.of());
    }
}
