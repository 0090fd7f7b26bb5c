package com.emergencyalerts.approval;

import com.emergencyalerts.domain.model.Alert;
import com.emergencyalerts.domain.model.AlertPolicy;
import com.emergencyalerts.exception.BaseException;
import com.emergencyalerts.repository.AlertStore;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically persists EXPIRED for alerts whose expiry has passed. Reads already report such
 * alerts as expired; this makes the stored status catch up and emits the status-change event.
 *
 * <p>Uses the coordinator's compare-and-swap path, so an alert changed concurrently is simply
 * skipped and picked up on the next run if still eligible.
 */
@Component
public class AlertExpirySweeper {

    private static final Logger log = LoggerFactory.getLogger(AlertExpirySweeper.class);

    private final AlertStore alertStore;
    private final ApprovalCoordinator approvalCoordinator;
    private final AlertPolicy alertPolicy;
    private final Clock clock;

    public AlertExpirySweeper(
            AlertStore alertStore, ApprovalCoordinator approvalCoordinator, AlertPolicy alertPolicy, Clock clock) {
        this.alertStore = alertStore;
        this.approvalCoordinator = approvalCoordinator;
        this.alertPolicy = alertPolicy;
        this.clock = clock;
    }

    @Scheduled(
            fixedDelayString = "${emergency-alerts.policy.expiry-sweep-interval-ms:30000}",
            initialDelayString = "${emergency-alerts.policy.expiry-sweep-interval-ms:30000}")
    public void sweep() {
        expireDue();
    }

    /**
     * Expires eligible alerts in batches of at most {@code maxPageSize}, earliest expiry first,
     * and returns how many were written. Stops on a short batch or on a batch in which nothing
     * could be written, so alerts that keep failing do not hold the sweep in a loop.
     */
    public int expireDue() {
        int batchSize = alertPolicy.getMaxPageSize();
        int expired = 0;
        int eligible = 0;
        while (true) {
            List<Alert> batch = alertStore.findExpirable(clock.instant(), batchSize);
            int written = 0;
            for (Alert alert : batch) {
                try {
                    approvalCoordinator.expire(alert.getId());
                    written++;
                } catch (BaseException e) {
                    log.warn("Skipped expiring alert {}: {}", alert.getId(), e.getMessage());
                }
            }
            expired += written;
            eligible += batch.size();
            if (batch.size() < batchSize || written == 0) {
                break;
            }
        }
        if (expired > 0) {
            log.info("Expiry sweep marked {} of {} eligible alerts as expired", expired, eligible);
        }
        return expired;
    }
}
