package tech.notifyrelay.listener;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness of the relay: DOWN while either the LISTEN subscription or the bus is
 * unavailable. Not a liveness check, the relay recovers on its own.
 */
@ApplicationScoped
@Readiness
public class RelayHealthCheck implements HealthCheck {

    @Inject
    NotifyRelay relay;

    @Override
    public HealthCheckResponse call() {
        NotifyRelay.RelayStatus status = relay.getStatus();

        HealthCheckResponseBuilder builder = HealthCheckResponse.builder()
                .name("NotifyRelay")
                .withData("upstreamOpen", status.upstreamOpen())
                .withData("busHealthy", status.busHealthy())
                .withData("forwarded", status.forwarded())
                .withData("dropped", status.dropped())
                .withData("lastEvent", status.lastEventAt() != null ? status.lastEventAt().toString() : "never");

        if (!status.running()) {
            return builder.down().withData("reason", "Relay not running").build();
        }
        if (!status.upstreamOpen()) {
            return builder.down().withData("reason", "LISTEN subscription not open - reconnecting").build();
        }
        if (!status.busHealthy()) {
            return builder.down().withData("reason", "Bus unavailable - events are being dropped").build();
        }
        return builder.up().build();
    }
}
