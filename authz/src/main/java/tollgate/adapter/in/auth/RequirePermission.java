package tollgate.adapter.in.auth;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the permission a resource method (or every method of a resource class) requires.
 *
 * <p>A method-level annotation replaces a class-level one.
 *
 * <pre>{@code
 * @POST
 * @Path("/customers/{customerId}/orders/{orderId}/refund")
 * @RequirePermission(
 *         value = "orders.orders.refund",
 *         resourcePath = "customers/{customerId}/orders/{orderId}",
 *         critical = true,
 *         auditPurpose = "Customer refund")
 * public Uni<Refund> refund(...) { ... }
 * }</pre>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface RequirePermission {

    /**
     * The required permission, {@code service.resource.action}.
     */
    String value();

    /**
     * Resource path template with {@code {param}} placeholders filled from route parameters.
     * Checked against the IAM authority when resource-scoped checks are enabled.
     */
    String resourcePath() default "";

    /**
     * Ask the IAM authority whenever the caller's claims do not grant the permission.
     */
    boolean requireLiveCheck() default false;

    /**
     * Validate the request body before the permission check.
     */
    boolean preValidateModel() default false;

    /**
     * Emit an audit record every time access is granted.
     */
    boolean critical() default false;

    /**
     * Purpose recorded with the audit record of a critical operation.
     */
    String auditPurpose() default "";
}
