package com.emergencyalerts.repository.jpa;

import com.emergencyalerts.domain.enums.PatternType;
import com.emergencyalerts.entity.CorrelationEventEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CorrelationEventJpaRepository extends JpaRepository<CorrelationEventEntity, String> {

    boolean existsByIdempotencyKey(String idempotencyKey);

    Optional<CorrelationEventEntity> findByIdempotencyKey(String idempotencyKey);

    List<CorrelationEventEntity> findAllByOrderByDetectedAtDesc(Pageable pageable);

    List<CorrelationEventEntity> findByPatternTypeOrderByDetectedAtDesc(PatternType patternType, Pageable pageable);
}
