package com.emergencyalerts.delivery;

import com.emergencyalerts.domain.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Default gateway: records the delivery request in the log and does nothing else.
 */
@Component
@ConditionalOnProperty(name = "emergency-alerts.delivery.mode", havingValue = "log-only", matchIfMissing = true)
public class LogOnlyDeliveryGateway implements DeliveryGateway {

    private static final Logger log = LoggerFactory.getLogger(LogOnlyDeliveryGateway.class);

    @Override
    public void requestDelivery(Alert alert) {
        log.info(
                "[LOG-ONLY] Delivery requested for alert {} ({}, {}, {} areas): {}",
                alert.getId(),
                alert.getSeverity(),
                alert.getChannelType(),
                alert.getAreas().size(),
                alert.getHeadline());
    }

    @Override
    public String getName() {
        return "log-only";
    }
}
