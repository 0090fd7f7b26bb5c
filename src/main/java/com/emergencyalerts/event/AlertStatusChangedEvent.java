package com.emergencyalerts.event;

import com.emergencyalerts.domain.enums.AlertStatus;
import com.emergencyalerts.domain.model.Alert;
import org.springframework.context.ApplicationEvent;

/**
 * Published after an alert write has been committed: creation or any status transition.
 *
 * <p>Carries the committed snapshot, so listeners never observe a state that was not
 * persisted. The dashboard handler forwards it to observers; the delivery outcome listener
 * is not interested in it.
 */
public class AlertStatusChangedEvent extends ApplicationEvent {

    private final Alert alert;
    private final AlertEventType eventType;
    private final AlertStatus previousStatus;
    private final String actorId;

    public AlertStatusChangedEvent(
            Object source, Alert alert, AlertEventType eventType, AlertStatus previousStatus, String actorId) {
        super(source);
        this.alert = alert;
        this.eventType = eventType;
        this.previousStatus = previousStatus;
        this.actorId = actorId;
    }

    public Alert getAlert() {
        return alert;
    }

    public AlertEventType getEventType() {
        return eventType;
    }

    /** Null for CREATED. */
    public AlertStatus getPreviousStatus() {
        return previousStatus;
    }

    /** User who caused the change; null for system-driven transitions (delivery, expiry). */
    public String getActorId() {
        return actorId;
    }
}
