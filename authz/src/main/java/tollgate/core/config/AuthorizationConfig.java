package tollgate.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for permission-based authorization.
 *
 * <p>Configuration prefix: {@code tollgate.authorization}
 *
 * <h2>Example Configuration</h2>
 * <pre>
 * tollgate.authorization.enabled=true
 * tollgate.authorization.resource-scoped-enabled=true
 * tollgate.authorization.fail-open-on-error=false
 * </pre>
 *
 * <h2>Environment Variables</h2>
 * <pre>
 * TOLLGATE_AUTHORIZATION_ENABLED=false
 * TOLLGATE_AUTHORIZATION_FAIL_OPEN_ON_ERROR=true
 * </pre>
 */
@ConfigMapping(prefix = "tollgate.authorization")
public interface AuthorizationConfig {

    /**
     * Master switch for permission checks.
     *
     * <p>When disabled, every authenticated caller with a principal id is allowed
     * without consulting claims or the IAM authority. Unauthenticated callers are
     * still denied.
     *
     * @return true if permission checks are enforced (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Whether resource path templates trigger a live IAM check.
     *
     * <p>When disabled, a requirement's resource path template is ignored and only
     * {@code requireLiveCheck} can cause a remote call.
     *
     * @return true if resource-scoped checks are enabled (default: false)
     */
    @WithDefault("false")
    boolean resourceScopedEnabled();

    /**
     * Behavior when the IAM authority fails during a live check.
     *
     * <p>When true, the operation is allowed. When false (default), the caller receives
     * a service-unavailable response.
     *
     * @return true to allow on remote failure (default: false)
     */
    @WithDefault("false")
    boolean failOpenOnError();
}
