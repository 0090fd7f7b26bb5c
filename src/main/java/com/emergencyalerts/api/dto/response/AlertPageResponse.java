package com.emergencyalerts.api.dto.response;

import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** One page of GET /api/alerts. Pages are zero-based. */
@Getter
@Builder
public class AlertPageResponse {

    private final List<AlertResponse> items;
    private final long total;
    private final int page;
    private final int pageSize;
}
