package com.emergencyalerts.api.websocket;

import com.emergencyalerts.domain.model.Alert;
import com.emergencyalerts.event.AlertEventType;
import com.emergencyalerts.event.AlertStatusChangedEvent;
import com.emergencyalerts.notification.DashboardBroadcaster;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Forwards committed alert changes to the dashboard channel and the alert's own topic.
 *
 * <p>Runs on the eventExecutor so the approval flow never waits on the broker. Every change is
 * sent as {@code AlertStatusChanged}; a delivery is additionally announced as
 * {@code AlertDelivered}.
 */
@Component
public class DashboardUpdatesHandler {

    static final String ALERT_STATUS_CHANGED = "AlertStatusChanged";
    static final String ALERT_DELIVERED = "AlertDelivered";

    private final DashboardBroadcaster dashboardBroadcaster;
    private final Clock clock;

    public DashboardUpdatesHandler(DashboardBroadcaster dashboardBroadcaster, Clock clock) {
        this.dashboardBroadcaster = dashboardBroadcaster;
        this.clock = clock;
    }

    @Async("eventExecutor")
    @EventListener
    public void onAlertStatusChanged(AlertStatusChangedEvent event) {
        Alert alert = event.getAlert();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("alertId", alert.getId());
        payload.put("headline", alert.getHeadline());
        payload.put("severity", alert.getSeverity().name());
        payload.put("eventType", event.getEventType().name());
        payload.put("previousStatus", event.getPreviousStatus() != null ? event.getPreviousStatus().name() : null);
        payload.put("status", alert.getStatus().name());
        payload.put("actorId", event.getActorId());
        payload.put("versionToken", alert.versionToken().value());
        payload.put("updatedAt", alert.getUpdatedAt());

        DashboardMessage message = DashboardMessage.of(ALERT_STATUS_CHANGED, payload, clock.instant());
        dashboardBroadcaster.publish(message);
        dashboardBroadcaster.publishToAlert(alert.getId(), message);

        if (event.getEventType() == AlertEventType.DELIVERED) {
            Map<String, Object> delivered = new LinkedHashMap<>();
            delivered.put("alertId", alert.getId());
            delivered.put("headline", alert.getHeadline());
            delivered.put("deliveredAt", alert.getDeliveredAt());
            dashboardBroadcaster.publish(DashboardMessage.of(ALERT_DELIVERED, delivered, clock.instant()));
        }
    }
}
