package com.emergencyalerts.delivery;

import com.emergencyalerts.approval.ApprovalCoordinator;
import com.emergencyalerts.domain.model.DeliveryAttempt;
import com.emergencyalerts.event.DeliveryAttemptRecordedEvent;
import com.emergencyalerts.exception.ConcurrentAlertModificationException;
import com.emergencyalerts.exception.InvalidStateTransitionException;
import com.emergencyalerts.exception.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Marks an alert DELIVERED when the first successful attempt is recorded. Later successes find
 * the alert already delivered and are ignored.
 */
@Component
public class DeliveryOutcomeListener {

    private static final Logger log = LoggerFactory.getLogger(DeliveryOutcomeListener.class);

    private final ApprovalCoordinator approvalCoordinator;

    public DeliveryOutcomeListener(ApprovalCoordinator approvalCoordinator) {
        this.approvalCoordinator = approvalCoordinator;
    }

    @Async("eventExecutor")
    @EventListener
    public void onDeliveryAttemptRecorded(DeliveryAttemptRecordedEvent event) {
        DeliveryAttempt attempt = event.getAttempt();
        if (!attempt.isSuccess()) {
            return;
        }
        try {
            approvalCoordinator.markDelivered(attempt.getAlertId());
        } catch (InvalidStateTransitionException e) {
            log.debug("Alert {} not marked delivered: {}", attempt.getAlertId(), e.getMessage());
        } catch (ConcurrentAlertModificationException e) {
            log.warn("Alert {} changed while marking delivered: {}", attempt.getAlertId(), e.getMessage());
        } catch (ResourceNotFoundException e) {
            log.warn("Delivery success recorded for unknown alert {}", attempt.getAlertId());
        }
    }
}
