package com.emergencyalerts.domain.model;

import com.emergencyalerts.domain.enums.AlertStatus;
import lombok.Builder;
import lombok.Value;

/**
 * List filter. {@code status} is matched against the effective status, {@code search} against
 * headline, description and id, case-insensitively. Pages are zero-based.
 */
@Value
@Builder
public class AlertQuery {

    AlertStatus status;
    String search;
    int page;
    int pageSize;
}
