package com.emergencyalerts.event;

import com.emergencyalerts.domain.model.DeliveryAttempt;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a delivery attempt has been appended to the ledger.
 */
public class DeliveryAttemptRecordedEvent extends ApplicationEvent {

    private final DeliveryAttempt attempt;

    public DeliveryAttemptRecordedEvent(Object source, DeliveryAttempt attempt) {
        super(source);
        this.attempt = attempt;
    }

    public DeliveryAttempt getAttempt() {
        return attempt;
    }
}
