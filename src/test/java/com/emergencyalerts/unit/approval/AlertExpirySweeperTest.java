package com.emergencyalerts.unit.approval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.emergencyalerts.approval.AlertExpirySweeper;
import com.emergencyalerts.approval.ApprovalCoordinator;
import com.emergencyalerts.delivery.DeliveryGateway;
import com.emergencyalerts.domain.enums.AlertStatus;
import com.emergencyalerts.domain.model.Alert;
import com.emergencyalerts.domain.model.AlertPolicy;
import com.emergencyalerts.event.EventPublisherHelper;
import com.emergencyalerts.exception.InvalidStateTransitionException;
import com.emergencyalerts.observability.AlertMetricsService;
import com.emergencyalerts.repository.AlertStore;
import com.emergencyalerts.support.AlertFixtures;
import com.emergencyalerts.support.InMemoryAlertStore;
import com.emergencyalerts.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AlertExpirySweeperTest {

    private InMemoryAlertStore alertStore;
    private MutableClock clock;
    private ApprovalCoordinator coordinator;
    private AlertExpirySweeper sweeper;

    @BeforeEach
    void setUp() {
        alertStore = new InMemoryAlertStore();
        clock = new MutableClock(AlertFixtures.NOW);
        coordinator = new ApprovalCoordinator(
                alertStore,
                mock(DeliveryGateway.class),
                mock(EventPublisherHelper.class),
                new AlertMetricsService(new SimpleMeterRegistry()),
                AlertPolicy.defaults(),
                clock);
        sweeper = new AlertExpirySweeper(
                alertStore, coordinator, AlertPolicy.defaults().toBuilder().maxPageSize(2).build(), clock);
    }

    @Test
    @DisplayName("Nothing is written before any alert is due")
    void nothingDue() {
        alertStore.insert(AlertFixtures.pending("op-1"));

        assertThat(sweeper.expireDue()).isZero();
    }

    @Test
    @DisplayName("Due non-terminal alerts are persisted as EXPIRED, terminal ones are left alone")
    void expiresDueAlerts() {
        Alert pending = alertStore.insert(AlertFixtures.pending("op-1"));
        Alert rejected = alertStore.insert(AlertFixtures.pending("op-1").toBuilder()
                .id("rejected-1")
                .status(AlertStatus.REJECTED)
                .build());
        clock.advance(Duration.ofHours(2));

        assertThat(sweeper.expireDue()).isEqualTo(1);

        assertThat(alertStore.findById(pending.getId()).orElseThrow().getStatus()).isEqualTo(AlertStatus.EXPIRED);
        assertThat(alertStore.findById(rejected.getId()).orElseThrow().getStatus()).isEqualTo(AlertStatus.REJECTED);
        assertThat(sweeper.expireDue()).isZero();
    }

    @Test
    @DisplayName("More due alerts than one batch are all expired across several batches")
    void expiresAcrossBatches() {
        for (int i = 1; i <= 5; i++) {
            alertStore.insert(AlertFixtures.pending("op-1").toBuilder()
                    .id("due-" + i)
                    .expiresAt(AlertFixtures.NOW.plus(Duration.ofMinutes(i)))
                    .build());
        }
        clock.advance(Duration.ofHours(1));

        assertThat(sweeper.expireDue()).isEqualTo(5);

        assertThat(alertStore.countByEffectiveStatus(clock.instant()).get(AlertStatus.EXPIRED)).isEqualTo(5L);
        assertThat(alertStore.findExpirable(clock.instant(), 10)).isEmpty();
    }

    @Test
    @DisplayName("A full batch in which every expiry fails ends the sweep instead of refetching it")
    void stopsWhenBatchMakesNoProgress() {
        AlertStore stuckStore = mock(AlertStore.class);
        ApprovalCoordinator failingCoordinator = mock(ApprovalCoordinator.class);
        Alert first = AlertFixtures.pending("op-1").toBuilder().id("stuck-1").build();
        Alert second = AlertFixtures.pending("op-1").toBuilder().id("stuck-2").build();
        when(stuckStore.findExpirable(any(), eq(2))).thenReturn(List.of(first, second));
        when(failingCoordinator.expire(anyString()))
                .thenThrow(new InvalidStateTransitionException("stuck", AlertStatus.CANCELLED, AlertStatus.EXPIRED));
        AlertExpirySweeper stuckSweeper = new AlertExpirySweeper(
                stuckStore, failingCoordinator, AlertPolicy.defaults().toBuilder().maxPageSize(2).build(), clock);

        assertThat(stuckSweeper.expireDue()).isZero();

        verify(stuckStore, times(1)).findExpirable(any(), eq(2));
        verify(failingCoordinator, times(2)).expire(anyString());
    }
}
