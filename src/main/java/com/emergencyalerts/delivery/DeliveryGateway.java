package com.emergencyalerts.delivery;

import com.emergencyalerts.domain.model.Alert;

/**
 * Hands an approved alert to the delivery transport. The transport owns retries and reports
 * each try back through the delivery-attempt API.
 *
 * <p>Implementations:
 * <ul>
 *   <li>{@link LogOnlyDeliveryGateway} -- logs the request, for environments with no transport</li>
 *   <li>{@link WebhookDeliveryGateway} -- POSTs the alert to the transport's intake URL</li>
 * </ul>
 */
public interface DeliveryGateway {

    /**
     * Requests delivery of {@code alert}.
     *
     * @throws com.emergencyalerts.exception.UpstreamUnavailableException if the transport
     *     cannot be reached or refuses the request
     */
    void requestDelivery(Alert alert);

    String getName();
}
