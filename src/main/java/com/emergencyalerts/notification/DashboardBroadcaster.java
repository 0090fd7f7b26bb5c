package com.emergencyalerts.notification;

import com.emergencyalerts.api.websocket.DashboardMessage;
import com.emergencyalerts.observability.AlertMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes to the single "dashboard" channel ({@code /topic/dashboard}) over STOMP.
 *
 * <p>Best-effort: a send that fails is logged and counted, never rethrown, so neither the
 * reaction dispatcher nor the approval flow can fail because of an observer. Nothing is
 * retried and no ordering across messages is promised.
 */
@Component
public class DashboardBroadcaster {

    public static final String DASHBOARD_TOPIC = "/topic/dashboard";
    public static final String ALERT_TOPIC_PREFIX = "/topic/alerts/";

    private static final Logger log = LoggerFactory.getLogger(DashboardBroadcaster.class);

    private final SimpMessagingTemplate simpMessagingTemplate;
    private final AlertMetricsService alertMetricsService;

    public DashboardBroadcaster(SimpMessagingTemplate simpMessagingTemplate, AlertMetricsService alertMetricsService) {
        this.simpMessagingTemplate = simpMessagingTemplate;
        this.alertMetricsService = alertMetricsService;
    }

    /** Sends to every dashboard observer. Returns whether the broker accepted the message. */
    public boolean publish(DashboardMessage message) {
        return send(DASHBOARD_TOPIC, message);
    }

    /** Sends to observers following a single alert ({@code /topic/alerts/{alertId}}). */
    public boolean publishToAlert(String alertId, DashboardMessage message) {
        return send(ALERT_TOPIC_PREFIX + alertId, message);
    }

    private boolean send(String destination, DashboardMessage message) {
        try {
            simpMessagingTemplate.convertAndSend(destination, message);
            log.debug("Dashboard message {} sent to {}", message.getEventType(), destination);
            return true;
        } catch (Exception e) {
            alertMetricsService.recordBroadcastFailure();
            log.error("Failed to send dashboard message {} to {}: {}", message.getEventType(), destination, e.getMessage());
            return false;
        }
    }
}
