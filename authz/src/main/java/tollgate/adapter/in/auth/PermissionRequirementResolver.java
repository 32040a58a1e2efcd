package tollgate.adapter.in.auth;

import java.lang.reflect.Method;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;

import tollgate.core.model.auth.PermissionRequirement;
import tollgate.core.service.auth.PermissionMatcher;
import tollgate.core.service.auth.PermissionPolicyNames;

/**
 * Resolves the {@link PermissionRequirement} of a resource method from its
 * {@link RequirePermission} annotation.
 *
 * <p>Requirements are built once per method and cached for the lifetime of the application.
 */
@ApplicationScoped
public class PermissionRequirementResolver {

    private final Map<Method, Optional<PermissionRequirement>> requirements = new ConcurrentHashMap<>();

    /**
     * Requirement of a resource method.
     *
     * @param resourceClass  the resource class, may be null
     * @param resourceMethod the resource method, may be null
     * @return the requirement, or empty if the method is not protected
     */
    public Optional<PermissionRequirement> resolve(Class<?> resourceClass, Method resourceMethod) {
        if (resourceMethod == null) {
            return Optional.empty();
        }
        return requirements.computeIfAbsent(resourceMethod, method -> {
            var annotation = method.getAnnotation(RequirePermission.class);
            if (annotation == null) {
                var owner = resourceClass != null ? resourceClass : method.getDeclaringClass();
                annotation = owner.getAnnotation(RequirePermission.class);
            }
            return Optional.ofNullable(annotation).map(PermissionRequirementResolver::toRequirement);
        });
    }

    /**
     * Convert an annotation to a requirement.
     */
    public static PermissionRequirement toRequirement(RequirePermission annotation) {
        return PermissionRequirement.builder(PermissionMatcher.stripPrefix(annotation.value()))
                .resourcePathTemplate(annotation.resourcePath())
                .requireLiveCheck(annotation.requireLiveCheck())
                .preValidateModel(annotation.preValidateModel())
                .critical(annotation.critical())
                .auditPurpose(annotation.auditPurpose())
                .build();
    }

    /**
     * Policy name of an annotation, in the {@code Permission:...} format.
     */
    public static String policyName(RequirePermission annotation) {
        return PermissionPolicyNames.encode(
                annotation.value(), annotation.preValidateModel(), annotation.critical(), annotation.auditPurpose());
    }
}
