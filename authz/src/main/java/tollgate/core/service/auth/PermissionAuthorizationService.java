package tollgate.core.service.auth;

import java.time.Instant;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tollgate.core.config.AuthorizationConfig;
import tollgate.core.model.auth.AuthorizationDecision;
import tollgate.core.model.auth.CallerIdentity;
import tollgate.core.model.auth.CriticalActionAudit;
import tollgate.core.model.auth.PermissionRequirement;
import tollgate.core.model.auth.RemoteCheckResult;
import tollgate.core.port.out.AuthorizationMetrics;
import tollgate.core.port.out.CriticalActionAuditor;
import tollgate.core.port.out.RemoteAuthorization;

/**
 * Decides whether a caller may perform an operation guarded by a {@link PermissionRequirement}.
 *
 * <p>Decision order:
 * <ol>
 *   <li>No authenticated identity: deny with an authentication challenge</li>
 *   <li>No principal id: deny with an authentication challenge</li>
 *   <li>Permission checks disabled: allow</li>
 *   <li>A held permission claim matches: allow</li>
 *   <li>Requirement asks for a live check, or declares a resource path and
 *       resource-scoped checks are enabled: ask the IAM authority</li>
 *   <li>Otherwise deny</li>
 * </ol>
 *
 * <p>When the IAM authority cannot answer, the operation is allowed only if
 * {@code tollgate.authorization.fail-open-on-error} is set; otherwise the decision is
 * {@link AuthorizationDecision.ServiceUnavailable}.
 *
 * <p>Every allowed decision for a critical requirement produces an audit record.
 * The returned {@link Uni} never fails.
 */
@ApplicationScoped
public class PermissionAuthorizationService {

    private static final Logger LOG = Logger.getLogger(PermissionAuthorizationService.class);

    private final AuthorizationConfig config;
    private final Optional<RemoteAuthorization> remoteAuthorization;
    private final AuthorizationMetrics metrics;
    private final CriticalActionAuditor auditor;

    @Inject
    public PermissionAuthorizationService(
            AuthorizationConfig config,
            Instance<RemoteAuthorization> remoteAuthorization,
            AuthorizationMetrics metrics,
            CriticalActionAuditor auditor) {
        this(
                config,
                remoteAuthorization.isResolvable() ? Optional.of(remoteAuthorization.get()) : Optional.empty(),
                metrics,
                auditor);
    }

    public PermissionAuthorizationService(
            AuthorizationConfig config,
            Optional<RemoteAuthorization> remoteAuthorization,
            AuthorizationMetrics metrics,
            CriticalActionAuditor auditor) {
        this.config = config;
        this.remoteAuthorization = remoteAuthorization;
        this.metrics = metrics;
        this.auditor = auditor;
    }

    /**
     * Decide whether the caller satisfies a plain permission requirement.
     *
     * @param permission the required permission
     * @param caller     the caller
     * @return the decision
     */
    public Uni<AuthorizationDecision> authorize(String permission, CallerIdentity caller) {
        return authorize(PermissionRequirement.of(permission), caller);
    }

    /**
     * Decide whether the caller satisfies the requirement.
     *
     * @param requirement the requirement of the operation
     * @param caller      the caller
     * @return the decision, never a failure
     */
    public Uni<AuthorizationDecision> authorize(PermissionRequirement requirement, CallerIdentity caller) {
        final var permission = PermissionMatcher.stripPrefix(requirement.permission());

        if (caller == null || !caller.authenticated()) {
            return Uni.createFrom()
                    .item(deny(
                            permission,
                            AuthorizationDecision.Denied.unauthenticated(
                                    AuthorizationDecision.REASON_UNAUTHENTICATED)));
        }

        if (caller.principalId().isEmpty()) {
            LOG.debugf("Authenticated identity has no principal id, denying %s", permission);
            return Uni.createFrom()
                    .item(deny(
                            permission,
                            AuthorizationDecision.Denied.unauthenticated(
                                    AuthorizationDecision.REASON_MISSING_PRINCIPAL)));
        }
        final var principalId = caller.principalId().get();

        if (!config.enabled()) {
            LOG.debugf("Permission checks disabled, allowing %s for authenticated caller", permission);
            return Uni.createFrom().item(new AuthorizationDecision.Allowed(AuthorizationDecision.Source.DISABLED));
        }

        if (PermissionMatcher.match(permission, caller.permissions())) {
            return Uni.createFrom()
                    .item(allow(requirement, permission, caller, AuthorizationDecision.Source.LOCAL_CLAIM));
        }

        final boolean resourceScoped =
                requirement.resourcePathTemplate().isPresent() && config.resourceScopedEnabled();
        if (!requirement.requireLiveCheck() && !resourceScoped) {
            return Uni.createFrom().item(insufficientPermissions(permission));
        }

        if (remoteAuthorization.isEmpty()) {
            LOG.debugf("Live check required for %s but no IAM client is available", permission);
            return Uni.createFrom().item(insufficientPermissions(permission));
        }

        final var resourcePath = requirement
                .resourcePathTemplate()
                .map(template -> ResourcePathResolver.resolve(template, caller.routeParameters()));
        final var remote = remoteAuthorization.get();

        return Uni.createFrom()
                .deferred(() -> remote.evaluatePermission(principalId, permission, resourcePath))
                .onFailure()
                .recoverWithItem(error -> new RemoteCheckResult.Unavailable(error.getMessage(), error))
                .map(result -> fromRemote(result, requirement, permission, caller, resourcePath));
    }

    private AuthorizationDecision fromRemote(
            RemoteCheckResult result,
            PermissionRequirement requirement,
            String permission,
            CallerIdentity caller,
            Optional<String> resourcePath) {
        if (result instanceof RemoteCheckResult.Answered answered) {
            if (answered.allowed()) {
                return allow(requirement, permission, caller, AuthorizationDecision.Source.REMOTE_CHECK);
            }
            LOG.debugf(
                    "IAM authority refused %s for %s (resource: %s)",
                    permission, caller.principalId().orElse(null), resourcePath.orElse("-"));
            return insufficientPermissions(permission);
        }

        final var unavailable = (RemoteCheckResult.Unavailable) result;
        if (config.failOpenOnError()) {
            LOG.warnf(
                    unavailable.cause(),
                    "IAM authority unavailable (%s), allowing %s because fail-open is enabled",
                    unavailable.reason(),
                    permission);
            return allow(requirement, permission, caller, AuthorizationDecision.Source.FAIL_OPEN);
        }

        LOG.errorf(
                unavailable.cause(),
                "IAM authority unavailable (%s) while checking %s",
                unavailable.reason(),
                permission);
        metrics.recordFailure(permission, AuthorizationDecision.REASON_REMOTE_UNAVAILABLE);
        return new AuthorizationDecision.ServiceUnavailable(unavailable.reason());
    }

    private AuthorizationDecision allow(
            PermissionRequirement requirement,
            String permission,
            CallerIdentity caller,
            AuthorizationDecision.Source source) {
        metrics.recordSuccess(permission);
        if (requirement.critical()) {
            auditor.record(new CriticalActionAudit(
                    Instant.now(),
                    caller.principalId().orElse(null),
                    caller.clientId(),
                    caller.sourceIp(),
                    permission,
                    requirement.auditPurpose()));
        }
        return new AuthorizationDecision.Allowed(source);
    }

    private AuthorizationDecision insufficientPermissions(String permission) {
        return deny(
                permission,
                AuthorizationDecision.Denied.forbidden(AuthorizationDecision.REASON_INSUFFICIENT_PERMISSIONS));
    }

    private AuthorizationDecision deny(String permission, AuthorizationDecision.Denied denied) {
        metrics.recordFailure(permission, denied.reason());
        return denied;
    }
}
