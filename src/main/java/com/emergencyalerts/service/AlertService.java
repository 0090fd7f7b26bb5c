package com.emergencyalerts.service;

import com.emergencyalerts.domain.IdGenerator;
import com.emergencyalerts.domain.enums.AlertStatus;
import com.emergencyalerts.domain.model.Alert;
import com.emergencyalerts.domain.model.AlertDraft;
import com.emergencyalerts.domain.model.AlertPage;
import com.emergencyalerts.domain.model.AlertPolicy;
import com.emergencyalerts.domain.model.AlertQuery;
import com.emergencyalerts.event.EventPublisherHelper;
import com.emergencyalerts.exception.ResourceNotFoundException;
import com.emergencyalerts.exception.ValidationException;
import com.emergencyalerts.repository.AlertStore;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Alert creation and reads. State changes after creation go through
 * {@link com.emergencyalerts.approval.ApprovalCoordinator}.
 */
@Service
public class AlertService {

    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    private final AlertStore alertStore;
    private final EventPublisherHelper eventPublisherHelper;
    private final AlertPolicy alertPolicy;
    private final IdGenerator idGenerator;
    private final Clock clock;

    public AlertService(
            AlertStore alertStore,
            EventPublisherHelper eventPublisherHelper,
            AlertPolicy alertPolicy,
            IdGenerator idGenerator,
            Clock clock) {
        this.alertStore = alertStore;
        this.eventPublisherHelper = eventPublisherHelper;
        this.alertPolicy = alertPolicy;
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    public Alert create(AlertDraft draft, String creatorId) {
        Alert alert = Alert.create(draft, creatorId, alertPolicy, clock.instant(), idGenerator);
        Alert saved = alertStore.insert(alert);
        log.info(
                "Alert {} created by {} as {} ({}, {} areas)",
                saved.getId(),
                creatorId,
                saved.getStatus(),
                saved.getSeverity(),
                saved.getAreas().size());
        eventPublisherHelper.publishAlertCreated(this, saved);
        return saved;
    }

    public Alert get(String alertId) {
        return alertStore.findById(alertId).orElseThrow(() -> new ResourceNotFoundException("Alert", alertId));
    }

    public Optional<Alert> find(String alertId) {
        return alertStore.findById(alertId);
    }

    /**
     * Newest-first page of alerts. A null or non-positive page size falls back to the policy
     * default; sizes above the policy maximum are capped.
     */
    public AlertPage list(AlertStatus status, String search, Integer page, Integer pageSize) {
        int resolvedPage = page == null ? 0 : page;
        if (resolvedPage < 0) {
            throw new ValidationException("page", "Page must not be negative");
        }
        int resolvedSize = pageSize == null || pageSize <= 0 ? alertPolicy.getDefaultPageSize() : pageSize;
        resolvedSize = Math.min(resolvedSize, alertPolicy.getMaxPageSize());

        AlertQuery query = AlertQuery.builder()
                .status(status)
                .search(search)
                .page(resolvedPage)
                .pageSize(resolvedSize)
                .build();
        return alertStore.search(query, clock.instant());
    }

    /** Live alerts with an area in {@code regionCode}. */
    public List<String> liveAlertIdsInRegion(String regionCode) {
        return alertStore.findLiveIdsByRegion(regionCode, clock.instant());
    }
}
