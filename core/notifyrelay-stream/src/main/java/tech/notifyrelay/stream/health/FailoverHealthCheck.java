package tech.notifyrelay.stream.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Liveness;
import tech.notifyrelay.notify.model.ChannelSet;
import tech.notifyrelay.stream.failover.FailoverController;
import tech.notifyrelay.stream.manager.ConnectionManager;

/**
 * Liveness of the worker. A bus outage is handled by failover, not by a restart, so this
 * stays UP and only reports where events are coming from.
 */
@ApplicationScoped
@Liveness
public class FailoverHealthCheck implements HealthCheck {

    @Inject
    ConnectionManager connectionManager;

    @Inject
    ChannelSet channels;

    @Override
    public HealthCheckResponse call() {
        FailoverController controller = connectionManager.getFailoverController();
        String lastTransition = connectionManager.getLastTransitionReason();

        HealthCheckResponseBuilder builder = HealthCheckResponse.builder()
                .name("StreamWorker")
                .up()
                .withData("state", controller.getState().name())
                .withData("sourceMode", controller.getSourceMode().name())
                .withData("busMode", controller.isBusMode())
                .withData("busHealthy", connectionManager.isBusHealthy())
                .withData("sessions", connectionManager.getSessionCount())
                .withData("evicted", connectionManager.getEvictedCount())
                .withData("droppedDuringSwitch", controller.getDroppedEvents())
                .withData("lastTransition", lastTransition != null ? lastTransition : "none");
        for (String channel : channels) {
            builder.withData("subscribers." + channel, connectionManager.getSubscriberCount(channel));
        }
        return builder.build();
    }
}
