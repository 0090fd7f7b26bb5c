package com.emergencyalerts.correlation;

import com.emergencyalerts.domain.enums.PatternType;
import com.emergencyalerts.domain.model.CorrelationEvent;
import com.emergencyalerts.mapper.CorrelationEventMapper;
import com.emergencyalerts.repository.jpa.CorrelationEventJpaRepository;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * Write-once store of detected patterns, keyed by idempotency key.
 *
 * <p>The unique constraint on the key column is the arbiter: when two deliveries of the same
 * detection race past the existence check, exactly one insert succeeds and the loser sees the
 * constraint violation, which is reported as "already present" rather than an error.
 */
@Service
public class CorrelationEventStore {

    private static final Logger log = LoggerFactory.getLogger(CorrelationEventStore.class);

    static final int MAX_LIMIT = 200;

    private final CorrelationEventJpaRepository correlationEventJpaRepository;
    private final CorrelationEventMapper correlationEventMapper;

    public CorrelationEventStore(
            CorrelationEventJpaRepository correlationEventJpaRepository,
            CorrelationEventMapper correlationEventMapper) {
        this.correlationEventJpaRepository = correlationEventJpaRepository;
        this.correlationEventMapper = correlationEventMapper;
    }

    /**
     * Inserts the event unless one with the same idempotency key exists.
     *
     * @return the stored event, or empty when the key was already taken
     */
    public Optional<CorrelationEvent> insertIfAbsent(CorrelationEvent event) {
        String key = event.getIdempotencyKey();
        if (correlationEventJpaRepository.existsByIdempotencyKey(key)) {
            log.debug("Correlation event {} already recorded", key);
            return Optional.empty();
        }

        try {
            correlationEventJpaRepository.saveAndFlush(correlationEventMapper.toEntity(event));
        } catch (DataIntegrityViolationException e) {
            if (correlationEventJpaRepository.existsByIdempotencyKey(key)) {
                log.debug("Correlation event {} recorded concurrently", key);
                return Optional.empty();
            }
            throw e;
        }

        log.info(
                "Correlation event {} recorded: {} over {} alerts",
                key,
                event.getPatternType(),
                event.getAlertIds().size());
        return Optional.of(event);
    }

    public Optional<CorrelationEvent> findByIdempotencyKey(String idempotencyKey) {
        return correlationEventJpaRepository.findByIdempotencyKey(idempotencyKey)
                .map(correlationEventMapper::toDomain);
    }

    /** Most recently detected events first. */
    public List<CorrelationEvent> recent(int limit) {
        return correlationEventMapper.toDomainList(
                correlationEventJpaRepository.findAllByOrderByDetectedAtDesc(PageRequest.of(0, clamp(limit))));
    }

    public List<CorrelationEvent> recentByPattern(PatternType patternType, int limit) {
        if (patternType == null) {
            return recent(limit);
        }
        return correlationEventMapper.toDomainList(correlationEventJpaRepository.findByPatternTypeOrderByDetectedAtDesc(
                patternType, PageRequest.of(0, clamp(limit))));
    }

    private static int clamp(int limit) {
        return Math.max(1, Math.min(limit, MAX_LIMIT));
    }
}
