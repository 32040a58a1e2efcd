package tollgate.adapter.in.bootstrap;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import tollgate.core.config.RegistrationConfig;
import tollgate.core.port.out.CatalogRegistry;
import tollgate.core.service.registration.BackgroundRegistrationRunner;
import tollgate.core.service.registration.CapabilityRegistrar;
import tollgate.core.service.registration.CatalogValidationException;
import tollgate.core.service.registration.RegistrationStatusTracker;
import tollgate.core.service.registration.RetrySchedule;
import tollgate.spi.ServiceCatalog;

/**
 * Publishes the service catalog to the IAM authority on application startup.
 *
 * <p>The catalog is validated synchronously; publishing then runs on a daemon thread
 * so that startup never waits for the authority.
 *
 * <h2>Failure Behavior</h2>
 * <ul>
 *   <li>Malformed permission id: startup FAILS</li>
 *   <li>More than one {@link ServiceCatalog} bean: startup FAILS</li>
 *   <li>IAM authority unreachable: startup continues, registration is retried in the background</li>
 * </ul>
 */
@ApplicationScoped
public class RegistrationInitializer {

    private static final Logger LOG = Logger.getLogger(RegistrationInitializer.class);

    static final String THREAD_NAME = "tollgate-iam-registration";

    private final Instance<ServiceCatalog> catalogs;
    private final CatalogRegistry registry;
    private final RegistrationStatusTracker tracker;
    private final RegistrationConfig config;

    private ExecutorService executor;
    private BackgroundRegistrationRunner runner;

    @Inject
    public RegistrationInitializer(
            Instance<ServiceCatalog> catalogs,
            CatalogRegistry registry,
            RegistrationStatusTracker tracker,
            RegistrationConfig config) {
        this.catalogs = catalogs;
        this.registry = registry;
        this.tracker = tracker;
        this.config = config;
    }

    void onStart(@Observes StartupEvent event) {
        if (!config.enabled()) {
            LOG.debug("IAM registration is disabled");
            return;
        }
        if (catalogs.isUnsatisfied()) {
            LOG.info("No ServiceCatalog bean found, skipping IAM registration");
            return;
        }
        if (catalogs.isAmbiguous()) {
            throw new CatalogValidationException("Multiple ServiceCatalog beans found, expected exactly one");
        }

        final var registrar = new CapabilityRegistrar(catalogs.get(), registry);
        try {
            registrar.validate();
        } catch (CatalogValidationException e) {
            LOG.errorf("IAM registration FAILED for %s: %s", registrar.serviceName(), e.getMessage());
            tracker.markFailed(e);
            throw e;
        }

        runner = new BackgroundRegistrationRunner(
                registrar.serviceName(),
                registrar::publish,
                tracker,
                new RetrySchedule(config.retryDelays()),
                config.initialDelay(),
                config.maxAttempts(),
                config.attemptTimeout());

        executor = Executors.newSingleThreadExecutor(task -> {
            final var thread = new Thread(task, THREAD_NAME);
            thread.setDaemon(true);
            return thread;
        });
        executor.execute(runner);
        LOG.infof("IAM registration for %s scheduled in %s", registrar.serviceName(), config.initialDelay());
    }

    void onStop(@Observes ShutdownEvent event) {
        if (runner != null) {
            runner.cancel();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    BackgroundRegistrationRunner runner() {
        return runner;
    }
}
