package com.emergencyalerts.event;

import com.emergencyalerts.domain.enums.AlertStatus;
import com.emergencyalerts.domain.model.Alert;
import com.emergencyalerts.domain.model.DeliveryAttempt;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed wrapper around Spring's {@link ApplicationEventPublisher}.
 *
 * <p>Events are only published for committed writes. Delivery to listeners depends on their
 * annotations: the dashboard handler is {@code @Async}, so publishing never blocks on observers.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Alert ----

    public void publishAlertCreated(Object source, Alert alert) {
        applicationEventPublisher.publishEvent(
                new AlertStatusChangedEvent(source, alert, AlertEventType.CREATED, null, alert.getCreatedBy()));
    }

    public void publishAlertTransition(
            Object source, Alert alert, AlertEventType eventType, AlertStatus previousStatus, String actorId) {
        applicationEventPublisher.publishEvent(
                new AlertStatusChangedEvent(source, alert, eventType, previousStatus, actorId));
    }

    // ---- Delivery ----

    public void publishDeliveryAttemptRecorded(Object source, DeliveryAttempt attempt) {
        applicationEventPublisher.publishEvent(new DeliveryAttemptRecordedEvent(source, attempt));
    }
}
