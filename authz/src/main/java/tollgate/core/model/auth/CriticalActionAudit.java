package tollgate.core.model.auth;

import java.time.Instant;
import java.util.Optional;

/**
 * Audit record emitted when a critical operation is allowed.
 *
 * <p>The purpose comes from the server-side requirement only. A purpose supplied by
 * the client (e.g., in a request header) is never recorded.
 *
 * @param timestamp   when access was granted
 * @param principalId the caller's principal id
 * @param clientId    the caller's client/application id, when present
 * @param sourceIp    originating client address, when known
 * @param permission  the permission that was granted
 * @param purpose     the configured audit purpose, when declared
 */
public record CriticalActionAudit(
        Instant timestamp,
        String principalId,
        Optional<String> clientId,
        Optional<String> sourceIp,
        String permission,
        Optional<String> purpose) {

    public CriticalActionAudit {
        clientId = clientId != null ? clientId : Optional.empty();
        sourceIp = sourceIp != null ? sourceIp : Optional.empty();
        purpose = purpose != null ? purpose : Optional.empty();
    }
}
