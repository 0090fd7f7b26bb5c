package com.emergencyalerts.domain.model;

import com.emergencyalerts.domain.enums.ChannelType;
import com.emergencyalerts.domain.enums.Severity;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Unvalidated operator input for a new alert. {@code submit} sends it straight to
 * PENDING_APPROVAL instead of leaving it as a draft.
 */
@Value
@Builder
public class AlertDraft {

    String headline;
    String description;
    Severity severity;
    ChannelType channelType;
    String languageCode;
    Instant expiresAt;
    List<AreaDraft> areas;
    boolean submit;
}
