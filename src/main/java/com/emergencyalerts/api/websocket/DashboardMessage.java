package com.emergencyalerts.api.websocket;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope for every message on the dashboard channel.
 *
 * <p>{@code eventType} tells the dashboard how to read {@code payload}, e.g.
 * {@code AlertStatusChanged}, {@code SLABreachDetected}, {@code CorrelationEventDetected}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardMessage {

    private String eventType;
    private Object payload;
    private Instant timestamp;

    public static DashboardMessage of(String eventType, Object payload, Instant timestamp) {
        return new DashboardMessage(eventType, payload, timestamp);
    }
}
