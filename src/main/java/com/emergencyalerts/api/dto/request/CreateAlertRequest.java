package com.emergencyalerts.api.dto.request;

import com.emergencyalerts.domain.enums.ChannelType;
import com.emergencyalerts.domain.enums.Severity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for POST /api/alerts. Set {@code submit} to send the alert for approval
 * immediately instead of saving a draft.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateAlertRequest {

    @NotBlank
    @Size(max = 100)
    private String headline;

    @NotBlank
    @Size(max = 1395)
    private String description;

    @NotNull
    private Severity severity;

    @NotNull
    private ChannelType channelType;

    /** BCP 47 tag; defaults to en-GB. */
    @Size(min = 2, max = 10)
    private String languageCode;

    @NotNull
    private Instant expiresAt;

    @NotEmpty
    @Valid
    private List<AreaRequest> areas;

    private boolean submit;
}
