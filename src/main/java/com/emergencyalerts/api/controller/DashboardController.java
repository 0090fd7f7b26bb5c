package com.emergencyalerts.api.controller;

import com.emergencyalerts.api.dto.response.CorrelationEventResponse;
import com.emergencyalerts.api.dto.response.DashboardSummaryResponse;
import com.emergencyalerts.correlation.CorrelationEventStore;
import com.emergencyalerts.domain.enums.PatternType;
import com.emergencyalerts.domain.model.DashboardSummary;
import com.emergencyalerts.mapper.AlertMapper;
import com.emergencyalerts.mapper.CorrelationEventMapper;
import com.emergencyalerts.service.DashboardService;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Dashboard landing data. Live updates are pushed over STOMP on {@code /topic/dashboard}.
 */
@RestController
@RequestMapping("/api/dashboard")
public class DashboardController {

    static final int DEFAULT_CORRELATION_LIMIT = 20;

    private final DashboardService dashboardService;
    private final CorrelationEventStore correlationEventStore;
    private final AlertMapper alertMapper;
    private final CorrelationEventMapper correlationEventMapper;

    public DashboardController(
            DashboardService dashboardService,
            CorrelationEventStore correlationEventStore,
            AlertMapper alertMapper,
            CorrelationEventMapper correlationEventMapper) {
        this.dashboardService = dashboardService;
        this.correlationEventStore = correlationEventStore;
        this.alertMapper = alertMapper;
        this.correlationEventMapper = correlationEventMapper;
    }

    @GetMapping("/summary")
    public ResponseEntity<DashboardSummaryResponse> getSummary() {
        DashboardSummary summary = dashboardService.summary();

        Map<String, Long> statusCounts = new LinkedHashMap<>();
        summary.getStatusCounts().forEach((status, count) -> statusCounts.put(status.name(), count));

        return ResponseEntity.ok(DashboardSummaryResponse.builder()
                .statusCounts(statusCounts)
                .approvalTimeouts(alertMapper.toResponseList(summary.getApprovalTimeouts(), summary.getGeneratedAt()))
                .slaBreaches(alertMapper.toResponseList(summary.getSlaBreaches(), summary.getGeneratedAt()))
                .deliveryStats(summary.getDeliveryStats())
                .recentCorrelations(correlationEventMapper.toResponseList(summary.getRecentCorrelations()))
                .generatedAt(summary.getGeneratedAt())
                .build());
    }

    @GetMapping("/correlations")
    public ResponseEntity<List<CorrelationEventResponse>> getCorrelations(
            @RequestParam(required = false) PatternType patternType,
            @RequestParam(required = false) Integer limit) {
        int resolvedLimit = limit == null ? DEFAULT_CORRELATION_LIMIT : limit;
        return ResponseEntity.ok(correlationEventMapper.toResponseList(
                correlationEventStore.recentByPattern(patternType, resolvedLimit)));
    }
}
