package com.emergencyalerts.api.dto.response;

import com.emergencyalerts.domain.enums.AlertStatus;
import com.emergencyalerts.domain.enums.ChannelType;
import com.emergencyalerts.domain.enums.Severity;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * REST API response DTO for an alert.
 *
 * <p>{@code status} is the effective status at read time. {@code versionToken} is the opaque
 * precondition to send back in {@code If-Match} on the next write.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertResponse {

    private String id;
    private String headline;
    private String description;
    private Severity severity;
    private ChannelType channelType;
    private String languageCode;
    private List<AreaResponse> areas;
    private Instant expiresAt;
    private AlertStatus status;
    private String createdBy;
    private Instant createdAt;
    private Instant updatedAt;
    private String approverId;
    private String rejectionReason;
    private Instant decidedAt;
    private String cancelledBy;
    private Instant deliveredAt;
    private String versionToken;
}
