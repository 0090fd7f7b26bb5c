package com.emergencyalerts.delivery;

import com.emergencyalerts.domain.IdGenerator;
import com.emergencyalerts.domain.enums.AttemptOutcome;
import com.emergencyalerts.domain.model.ConsecutiveFailureCount;
import com.emergencyalerts.domain.model.DeliveryAttempt;
import com.emergencyalerts.domain.model.DeliveryStats;
import com.emergencyalerts.event.EventPublisherHelper;
import com.emergencyalerts.mapper.DeliveryAttemptMapper;
import com.emergencyalerts.repository.jpa.DeliveryAttemptJpaRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Append-only record of delivery tries.
 *
 * <p>Attempts are inserted once and never updated or deleted. The ledger only records what the
 * transport reports; retry policy lives with the transport. Its read side feeds the external
 * retry-storm and success-rate detections.
 */
@Service
public class DeliveryAttemptLedger {

    private static final Logger log = LoggerFactory.getLogger(DeliveryAttemptLedger.class);

    private final DeliveryAttemptJpaRepository deliveryAttemptJpaRepository;
    private final DeliveryAttemptMapper deliveryAttemptMapper;
    private final EventPublisherHelper eventPublisherHelper;
    private final IdGenerator idGenerator;
    private final Clock clock;

    public DeliveryAttemptLedger(
            DeliveryAttemptJpaRepository deliveryAttemptJpaRepository,
            DeliveryAttemptMapper deliveryAttemptMapper,
            EventPublisherHelper eventPublisherHelper,
            IdGenerator idGenerator,
            Clock clock) {
        this.deliveryAttemptJpaRepository = deliveryAttemptJpaRepository;
        this.deliveryAttemptMapper = deliveryAttemptMapper;
        this.eventPublisherHelper = eventPublisherHelper;
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    /**
     * Appends one attempt stamped with the current time. {@code detail} is the provider
     * operation id for a success and the failure reason for a failure.
     */
    public DeliveryAttempt record(
            String alertId, String recipientId, int attemptNumber, AttemptOutcome outcome, String detail) {
        return record(alertId, recipientId, attemptNumber, outcome, detail, clock.instant());
    }

    public DeliveryAttempt record(
            String alertId,
            String recipientId,
            int attemptNumber,
            AttemptOutcome outcome,
            String detail,
            Instant attemptedAt) {
        DeliveryAttempt attempt = DeliveryAttempt.create(
                alertId, recipientId, attemptNumber, outcome, detail, attemptedAt, idGenerator);
        deliveryAttemptJpaRepository.save(deliveryAttemptMapper.toEntity(attempt));

        if (attempt.isSuccess()) {
            log.info("Delivery attempt {} for alert {} to {} succeeded", attemptNumber, alertId, recipientId);
        } else {
            log.warn(
                    "Delivery attempt {} for alert {} to {} failed: {}",
                    attemptNumber,
                    alertId,
                    recipientId,
                    attempt.getFailureReason());
        }
        eventPublisherHelper.publishDeliveryAttemptRecorded(this, attempt);
        return attempt;
    }

    /** All attempts for an alert, oldest first. */
    public List<DeliveryAttempt> attemptsForAlert(String alertId) {
        return deliveryAttemptMapper.toDomainList(
                deliveryAttemptJpaRepository.findByAlertIdOrderByAttemptedAtAscAttemptNumberAsc(alertId));
    }

    /** Failures recorded for the alert after its most recent success (or ever, if none). */
    public int consecutiveFailures(String alertId) {
        return trailingFailures(alertId, attemptsForAlert(alertId)).getConsecutiveFailures();
    }

    /**
     * Trailing failure runs for every alert with at least one attempt since {@code since},
     * largest run first. Alerts whose latest attempt succeeded are omitted.
     */
    public List<ConsecutiveFailureCount> consecutiveFailuresSince(Instant since) {
        List<String> alertIds = deliveryAttemptJpaRepository.findAlertIdsAttemptedSince(since);
        if (alertIds.isEmpty()) {
            return List.of();
        }

        Map<String, List<DeliveryAttempt>> byAlert = new LinkedHashMap<>();
        for (DeliveryAttempt attempt : deliveryAttemptMapper.toDomainList(
                deliveryAttemptJpaRepository.findByAlertIdInOrderByAttemptedAtAscAttemptNumberAsc(alertIds))) {
            byAlert.computeIfAbsent(attempt.getAlertId(), id -> new ArrayList<>()).add(attempt);
        }

        List<ConsecutiveFailureCount> counts = new ArrayList<>();
        byAlert.forEach((alertId, attempts) -> {
            ConsecutiveFailureCount count = trailingFailures(alertId, attempts);
            if (count.getConsecutiveFailures() > 0) {
                counts.add(count);
            }
        });
        counts.sort(Comparator.comparingInt(ConsecutiveFailureCount::getConsecutiveFailures)
                .reversed()
                .thenComparing(ConsecutiveFailureCount::getAlertId));
        return counts;
    }

    /** Global success and failure counts for attempts made since {@code since}. */
    public DeliveryStats statsSince(Instant since) {
        long successes = deliveryAttemptJpaRepository.countByOutcomeAndAttemptedAtGreaterThanEqual(
                AttemptOutcome.SUCCESS, since);
        long failures = deliveryAttemptJpaRepository.countByOutcomeAndAttemptedAtGreaterThanEqual(
                AttemptOutcome.FAILURE, since);
        return DeliveryStats.of(since, successes, failures);
    }

    private static ConsecutiveFailureCount trailingFailures(String alertId, List<DeliveryAttempt> attempts) {
        int failures = 0;
        String lastReason = null;
        Instant lastAttemptAt = null;
        for (int i = attempts.size() - 1; i >= 0; i--) {
            DeliveryAttempt attempt = attempts.get(i);
            if (lastAttemptAt == null) {
                lastAttemptAt = attempt.getAttemptedAt();
            }
            if (attempt.isSuccess()) {
                break;
            }
            if (lastReason == null) {
                lastReason = attempt.getFailureReason();
            }
            failures++;
        }
        return ConsecutiveFailureCount.builder()
                .alertId(alertId)
                .consecutiveFailures(failures)
                .lastFailureReason(lastReason)
                .lastAttemptAt(lastAttemptAt)
                .build();
    }
}
