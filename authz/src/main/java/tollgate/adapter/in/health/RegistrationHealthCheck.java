package tollgate.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import tollgate.core.model.registration.RegistrationStatus;
import tollgate.core.service.registration.RegistrationStatusTracker;

/**
 * Health check for catalog registration with the IAM authority.
 *
 * <p>Always reports UP: a service that could not register still authorizes requests
 * from token claims. Any status other than {@code REGISTERED} is reported as degraded
 * through the {@code degraded} data entry.
 */
@Readiness
@ApplicationScoped
public class RegistrationHealthCheck implements HealthCheck {

    static final String NAME = "iam-registration";

    private final RegistrationStatusTracker tracker;

    @Inject
    public RegistrationHealthCheck(RegistrationStatusTracker tracker) {
        this.tracker = tracker;
    }

    @Override
    public HealthCheckResponse call() {
        final var state = tracker.state();
        final HealthCheckResponseBuilder builder = HealthCheckResponse.builder()
                .name(NAME)
                .withData("registration.status", state.status().name())
                .withData("degraded", state.status() != RegistrationStatus.REGISTERED);

        if (state.status() != RegistrationStatus.REGISTERED) {
            builder.withData("message", describe(state.status()));
        }
        state.lastError().ifPresent(error -> builder.withData("lastError", String.valueOf(error.getMessage())));

        return builder.up().build();
    }

    private static String describe(RegistrationStatus status) {
        return switch (status) {
            case PENDING -> "Registration has not started";
            case ATTEMPTING -> "Registration in progress";
            case PARTIALLY_REGISTERED -> "Registration attempts exhausted, using token claims only";
            case FAILED -> "Registration failed, using token claims only";
            case REGISTERED -> "Registered";
        };
    }
}
