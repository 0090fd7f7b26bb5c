package com.emergencyalerts.repository;

import com.emergencyalerts.domain.enums.AlertStatus;
import com.emergencyalerts.domain.model.Alert;
import com.emergencyalerts.domain.model.AlertPage;
import com.emergencyalerts.domain.model.AlertQuery;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence port for the alert aggregate.
 *
 * <p>{@link #compareAndSet} is the only way to change a stored alert. Implementations must apply
 * it atomically: when several callers pass the same expected version, at most one returns true.
 */
public interface AlertStore {

    Optional<Alert> findById(String id);

    Alert insert(Alert alert);

    /**
     * Replaces the stored alert with {@code updated} if its version is still
     * {@code expectedVersion}.
     *
     * @return false when another writer got there first
     */
    boolean compareAndSet(Alert updated, long expectedVersion);

    AlertPage search(AlertQuery query, Instant now);

    /** Ids of live (non-terminal, unexpired) alerts with an area in the region. */
    List<String> findLiveIdsByRegion(String regionCode, Instant now);

    /**
     * Non-terminal alerts whose expiry has passed but are not yet marked EXPIRED, earliest
     * expiry first, at most {@code limit} of them.
     */
    List<Alert> findExpirable(Instant now, int limit);

    /** PENDING_APPROVAL alerts created before {@code createdBefore}, oldest first. */
    List<Alert> findPendingCreatedBefore(Instant createdBefore, Instant now, int limit);

    /** APPROVED alerts decided before {@code decidedBefore} and still undelivered, oldest first. */
    List<Alert> findApprovedDecidedBefore(Instant decidedBefore, Instant now, int limit);

    Map<AlertStatus, Long> countByEffectiveStatus(Instant now);
}
