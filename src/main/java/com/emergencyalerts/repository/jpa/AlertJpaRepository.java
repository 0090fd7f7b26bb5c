package com.emergencyalerts.repository.jpa;

import com.emergencyalerts.domain.enums.AlertStatus;
import com.emergencyalerts.entity.AlertEntity;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA repository for the alerts table.
 *
 * <p>Status writes go through {@link #compareAndSet}, a single conditional UPDATE keyed on the
 * version the writer read. The database applies it atomically, so of several writers that read
 * the same version exactly one sees a row count of 1.
 */
@Repository
public interface AlertJpaRepository extends JpaRepository<AlertEntity, String> {

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE AlertEntity a SET a.status = :status, a.approverId = :approverId,"
            + " a.rejectionReason = :rejectionReason, a.decidedAt = :decidedAt, a.cancelledBy = :cancelledBy,"
            + " a.deliveredAt = :deliveredAt, a.updatedAt = :updatedAt, a.version = :newVersion"
            + " WHERE a.id = :id AND a.version = :expectedVersion")
    int compareAndSet(
            @Param("id") String id,
            @Param("expectedVersion") long expectedVersion,
            @Param("newVersion") long newVersion,
            @Param("status") AlertStatus status,
            @Param("approverId") String approverId,
            @Param("rejectionReason") String rejectionReason,
            @Param("decidedAt") Instant decidedAt,
            @Param("cancelledBy") String cancelledBy,
            @Param("deliveredAt") Instant deliveredAt,
            @Param("updatedAt") Instant updatedAt);

    /**
     * Filtered, newest-first listing by effective status. A live status only matches alerts
     * not yet past expiry; EXPIRED also matches live alerts whose expiry has passed.
     * {@code pattern} is a LIKE pattern whose literal wildcards are escaped with {@code !}.
     */
    @Query(
            value = "SELECT a FROM AlertEntity a WHERE"
                    + " (:pattern IS NULL OR LOWER(a.headline) LIKE :pattern ESCAPE '!'"
                    + "   OR LOWER(a.description) LIKE :pattern ESCAPE '!' OR LOWER(a.id) LIKE :pattern ESCAPE '!')"
                    + " AND (:status IS NULL"
                    + "   OR (a.status = :status AND (:liveStatus = false OR a.expiresAt > :now))"
                    + "   OR (:expiredStatus = true AND a.status IN :liveStatuses AND a.expiresAt <= :now))"
                    + " ORDER BY a.createdAt DESC",
            countQuery = "SELECT COUNT(a) FROM AlertEntity a WHERE"
                    + " (:pattern IS NULL OR LOWER(a.headline) LIKE :pattern ESCAPE '!'"
                    + "   OR LOWER(a.description) LIKE :pattern ESCAPE '!' OR LOWER(a.id) LIKE :pattern ESCAPE '!')"
                    + " AND (:status IS NULL"
                    + "   OR (a.status = :status AND (:liveStatus = false OR a.expiresAt > :now))"
                    + "   OR (:expiredStatus = true AND a.status IN :liveStatuses AND a.expiresAt <= :now))")
    Page<AlertEntity> search(
            @Param("pattern") String pattern,
            @Param("status") AlertStatus status,
            @Param("liveStatus") boolean liveStatus,
            @Param("expiredStatus") boolean expiredStatus,
            @Param("liveStatuses") Collection<AlertStatus> liveStatuses,
            @Param("now") Instant now,
            Pageable pageable);

    @Query("SELECT DISTINCT a.id FROM AlertEntity a JOIN a.areas ar WHERE ar.regionCode = :regionCode"
            + " AND a.status IN :statuses AND a.expiresAt > :now")
    List<String> findIdsByRegionCode(
            @Param("regionCode") String regionCode,
            @Param("statuses") Collection<AlertStatus> statuses,
            @Param("now") Instant now);

    List<AlertEntity> findByStatusInAndExpiresAtLessThanEqualOrderByExpiresAtAsc(
            Collection<AlertStatus> statuses, Instant now, Pageable pageable);

    List<AlertEntity> findByStatusAndExpiresAtGreaterThanAndCreatedAtLessThanOrderByCreatedAtAsc(
            AlertStatus status, Instant now, Instant createdBefore, Pageable pageable);

    List<AlertEntity> findByStatusAndExpiresAtGreaterThanAndDecidedAtLessThanOrderByDecidedAtAsc(
            AlertStatus status, Instant now, Instant decidedBefore, Pageable pageable);

    long countByStatus(AlertStatus status);

    long countByStatusAndExpiresAtGreaterThan(AlertStatus status, Instant now);

    long countByStatusInAndExpiresAtLessThanEqual(Collection<AlertStatus> statuses, Instant now);
}
