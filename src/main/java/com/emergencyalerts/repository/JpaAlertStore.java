package com.emergencyalerts.repository;

import com.emergencyalerts.domain.enums.AlertStatus;
import com.emergencyalerts.domain.model.Alert;
import com.emergencyalerts.domain.model.AlertPage;
import com.emergencyalerts.domain.model.AlertQuery;
import com.emergencyalerts.entity.AlertEntity;
import com.emergencyalerts.mapper.AlertMapper;
import com.emergencyalerts.repository.jpa.AlertJpaRepository;
import java.time.Instant;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;

/**
 * {@link AlertStore} over Spring Data JPA. The compare-and-swap is a conditional UPDATE on the
 * version column, so atomicity comes from the database row lock for the statement's duration.
 */
@Repository
public class JpaAlertStore implements AlertStore {

    private static final List<AlertStatus> LIVE_STATUSES =
            Arrays.stream(AlertStatus.values()).filter(AlertStatus::expiresWithTime).toList();

    private final AlertJpaRepository alertJpaRepository;
    private final AlertMapper alertMapper;

    public JpaAlertStore(AlertJpaRepository alertJpaRepository, AlertMapper alertMapper) {
        this.alertJpaRepository = alertJpaRepository;
        this.alertMapper = alertMapper;
    }

    @Override
    public Optional<Alert> findById(String id) {
        return alertJpaRepository.findById(id).map(alertMapper::toDomain);
    }

    @Override
    public Alert insert(Alert alert) {
        AlertEntity saved = alertJpaRepository.saveAndFlush(alertMapper.toEntity(alert));
        return alertMapper.toDomain(saved);
    }

    @Override
    public boolean compareAndSet(Alert updated, long expectedVersion) {
        int rows = alertJpaRepository.compareAndSet(
                updated.getId(),
                expectedVersion,
                updated.getVersion(),
                updated.getStatus(),
                updated.getApproverId(),
                updated.getRejectionReason(),
                updated.getDecidedAt(),
                updated.getCancelledBy(),
                updated.getDeliveredAt(),
                updated.getUpdatedAt());
        return rows == 1;
    }

    @Override
    public AlertPage search(AlertQuery query, Instant now) {
        String pattern = query.getSearch() == null || query.getSearch().isBlank()
                ? null
                : "%" + escapeLike(query.getSearch().trim().toLowerCase(Locale.ROOT)) + "%";
        AlertStatus status = query.getStatus();
        boolean liveStatus = status != null && status.expiresWithTime();
        boolean expiredStatus = status == AlertStatus.EXPIRED;

        Page<AlertEntity> page = alertJpaRepository.search(
                pattern,
                status,
                liveStatus,
                expiredStatus,
                LIVE_STATUSES,
                now,
                PageRequest.of(query.getPage(), query.getPageSize()));
        return new AlertPage(
                alertMapper.toDomainList(page.getContent()),
                page.getTotalElements(),
                query.getPage(),
                query.getPageSize());
    }

    @Override
    public List<String> findLiveIdsByRegion(String regionCode, Instant now) {
        return alertJpaRepository.findIdsByRegionCode(regionCode, LIVE_STATUSES, now);
    }

    @Override
    public List<Alert> findExpirable(Instant now, int limit) {
        return alertMapper.toDomainList(alertJpaRepository.findByStatusInAndExpiresAtLessThanEqualOrderByExpiresAtAsc(
                LIVE_STATUSES, now, PageRequest.of(0, limit)));
    }

    @Override
    public List<Alert> findPendingCreatedBefore(Instant createdBefore, Instant now, int limit) {
        return alertMapper.toDomainList(
                alertJpaRepository.findByStatusAndExpiresAtGreaterThanAndCreatedAtLessThanOrderByCreatedAtAsc(
                        AlertStatus.PENDING_APPROVAL, now, createdBefore, PageRequest.of(0, limit)));
    }

    @Override
    public List<Alert> findApprovedDecidedBefore(Instant decidedBefore, Instant now, int limit) {
        return alertMapper.toDomainList(
                alertJpaRepository.findByStatusAndExpiresAtGreaterThanAndDecidedAtLessThanOrderByDecidedAtAsc(
                        AlertStatus.APPROVED, now, decidedBefore, PageRequest.of(0, limit)));
    }

    @Override
    public Map<AlertStatus, Long> countByEffectiveStatus(Instant now) {
        Map<AlertStatus, Long> counts = new EnumMap<>(AlertStatus.class);
        for (AlertStatus status : AlertStatus.values()) {
            if (status.expiresWithTime()) {
                counts.put(status, alertJpaRepository.countByStatusAndExpiresAtGreaterThan(status, now));
            } else if (status != AlertStatus.EXPIRED) {
                counts.put(status, alertJpaRepository.countByStatus(status));
            }
        }
        long expired = alertJpaRepository.countByStatus(AlertStatus.EXPIRED)
                + alertJpaRepository.countByStatusInAndExpiresAtLessThanEqual(LIVE_STATUSES, now);
        counts.put(AlertStatus.EXPIRED, expired);
        return counts;
    }

    /** Escapes the LIKE wildcards so user input matches literally; pairs with {@code ESCAPE '!'}. */
    static String escapeLike(String text) {
        return text.replace("!", "!!").replace("%", "!%").replace("_", "!_");
    }
}
