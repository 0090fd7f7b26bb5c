package com.emergencyalerts.repository.jpa;

import com.emergencyalerts.domain.enums.AttemptOutcome;
import com.emergencyalerts.entity.DeliveryAttemptEntity;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the delivery_attempts table. Read-only apart from inserts.
 */
@Repository
public interface DeliveryAttemptJpaRepository extends JpaRepository<DeliveryAttemptEntity, String> {

    List<DeliveryAttemptEntity> findByAlertIdOrderByAttemptedAtAscAttemptNumberAsc(String alertId);

    List<DeliveryAttemptEntity> findByAlertIdInOrderByAttemptedAtAscAttemptNumberAsc(Collection<String> alertIds);

    @Query("SELECT DISTINCT d.alertId FROM DeliveryAttemptEntity d WHERE d.attemptedAt >= :since")
    List<String> findAlertIdsAttemptedSince(@Param("since") Instant since);

    long countByOutcomeAndAttemptedAtGreaterThanEqual(AttemptOutcome outcome, Instant since);

    boolean existsByAlertIdAndOutcome(String alertId, AttemptOutcome outcome);
}
