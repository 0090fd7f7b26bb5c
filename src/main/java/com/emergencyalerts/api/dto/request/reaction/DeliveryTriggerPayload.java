package com.emergencyalerts.api.dto.request.reaction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** An approved alert entered the delivery pipeline. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryTriggerPayload {

    private String alertId;
}
