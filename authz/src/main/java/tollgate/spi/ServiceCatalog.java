package tollgate.spi;

import java.util.List;

import tollgate.core.model.registration.PermissionRegistration;
import tollgate.core.model.registration.RoleRegistration;

/**
 * SPI for the permission and role catalog a service publishes to the IAM authority.
 *
 * <p>Each service that wants its permissions registered on startup provides exactly
 * one CDI bean implementing this interface. The catalog is validated synchronously
 * during startup; a malformed permission id fails startup.
 *
 * <h2>Implementation Example</h2>
 * <pre>{@code
 * @ApplicationScoped
 * public class InvoiceCatalog implements ServiceCatalog {
 *
 *     @Override
 *     public String serviceName() {
 *         return "invoice";
 *     }
 *
 *     @Override
 *     public List<PermissionRegistration> permissions() {
 *         return List.of(
 *             new PermissionRegistration("invoice.invoices.create", "Create invoices"),
 *             new PermissionRegistration("invoice.invoices.read", "Read invoices"));
 *     }
 *
 *     @Override
 *     public List<RoleRegistration> roles() {
 *         return List.of(new RoleRegistration(
 *             "roles.invoice.clerk", "Invoice clerk",
 *             List.of("invoice.invoices.create", "invoice.invoices.read")));
 *     }
 * }
 * }</pre>
 */
public interface ServiceCatalog {

    /**
     * Name the catalog is registered under.
     *
     * @return service name
     */
    String serviceName();

    /**
     * Permissions owned by this service.
     *
     * @return the permissions, never null
     */
    List<PermissionRegistration> permissions();

    /**
     * Predefined roles of this service. Roles may reference permissions of other services.
     *
     * @return the roles, never null
     */
    List<RoleRegistration> roles();
}
