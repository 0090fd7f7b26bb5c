package com.emergencyalerts.unit.approval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.emergencyalerts.approval.ApprovalCoordinator;
import com.emergencyalerts.approval.CancellationSignal;
import com.emergencyalerts.delivery.DeliveryGateway;
import com.emergencyalerts.domain.enums.AlertStatus;
import com.emergencyalerts.domain.model.Alert;
import com.emergencyalerts.domain.model.AlertDecision;
import com.emergencyalerts.domain.model.AlertPolicy;
import com.emergencyalerts.domain.vo.VersionToken;
import com.emergencyalerts.event.AlertEventType;
import com.emergencyalerts.event.EventPublisherHelper;
import com.emergencyalerts.exception.ConcurrentAlertModificationException;
import com.emergencyalerts.exception.InvalidStateTransitionException;
import com.emergencyalerts.exception.OperationCancelledException;
import com.emergencyalerts.exception.ResourceNotFoundException;
import com.emergencyalerts.exception.UpstreamUnavailableException;
import com.emergencyalerts.observability.AlertMetricsService;
import com.emergencyalerts.repository.AlertStore;
import com.emergencyalerts.support.AlertFixtures;
import com.emergencyalerts.support.InMemoryAlertStore;
import com.emergencyalerts.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for ApprovalCoordinator: precondition checks, the compare-and-swap write path,
 * cancellation before commit and the delivery hand-off after approval.
 */
@ExtendWith(MockitoExtension.class)
class ApprovalCoordinatorTest {

    @Mock
    private DeliveryGateway deliveryGateway;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private InMemoryAlertStore alertStore;
    private SimpleMeterRegistry meterRegistry;
    private MutableClock clock;
    private ApprovalCoordinator approvalCoordinator;
    private Alert pending;

    @BeforeEach
    void setUp() {
        alertStore = new InMemoryAlertStore();
        meterRegistry = new SimpleMeterRegistry();
        clock = new MutableClock(AlertFixtures.NOW.plusSeconds(10));
        approvalCoordinator = new ApprovalCoordinator(
                alertStore,
                deliveryGateway,
                eventPublisherHelper,
                new AlertMetricsService(meterRegistry),
                AlertPolicy.defaults(),
                clock);
        pending = alertStore.insert(AlertFixtures.pending("op-1"));
    }

    private Alert stored() {
        return alertStore.findById(pending.getId()).orElseThrow();
    }

    private double conflicts() {
        return meterRegistry.counter("alerts.approval.conflicts").count();
    }

    @Nested
    @DisplayName("Approve")
    class Approve {

        @Test
        @DisplayName("Approve with a current token commits, publishes and requests delivery")
        void approveCommits() {
            AlertDecision decision = approvalCoordinator.approve(pending.getId(), "ap-1", VersionToken.of(1));

            assertThat(decision.getAlert().getStatus()).isEqualTo(AlertStatus.APPROVED);
            assertThat(decision.isDeliveryRequested()).isTrue();
            assertThat(decision.getVersionToken()).isEqualTo(VersionToken.of(2));
            assertThat(stored().getStatus()).isEqualTo(AlertStatus.APPROVED);
            verify(deliveryGateway).requestDelivery(decision.getAlert());
            verify(eventPublisherHelper)
                    .publishAlertTransition(
                            any(), eq(decision.getAlert()), eq(AlertEventType.APPROVED),
                            eq(AlertStatus.PENDING_APPROVAL), eq("ap-1"));
        }

        @Test
        @DisplayName("Approve without a token applies to the current version")
        void approveWithoutToken() {
            AlertDecision decision = approvalCoordinator.approve(pending.getId(), "ap-1", null);

            assertThat(decision.getAlert().getVersion()).isEqualTo(2L);
        }

        @Test
        @DisplayName("Stale token fails without writing or requesting delivery")
        void staleTokenFails() {
            assertThatThrownBy(() -> approvalCoordinator.approve(pending.getId(), "ap-1", VersionToken.of(5)))
                    .isInstanceOf(ConcurrentAlertModificationException.class)
                    .satisfies(e -> assertThat(((ConcurrentAlertModificationException) e).getDetails())
                            .containsEntry("expectedVersion", "5")
                            .containsEntry("currentVersion", "1"));

            assertThat(stored()).isEqualTo(pending);
            assertThat(conflicts()).isEqualTo(1.0);
            verifyNoInteractions(deliveryGateway, eventPublisherHelper);
        }

        @Test
        @DisplayName("Unreachable transport leaves the approval committed and reports the failure")
        void transportFailureKeepsApproval() {
            doThrow(new UpstreamUnavailableException("delivery-transport", "connection refused"))
                    .when(deliveryGateway)
                    .requestDelivery(any());

            AlertDecision decision = approvalCoordinator.approve(pending.getId(), "ap-1", VersionToken.of(1));

            assertThat(decision.isDeliveryRequested()).isFalse();
            assertThat(decision.getDeliveryFailureReason()).contains("connection refused");
            assertThat(stored().getStatus()).isEqualTo(AlertStatus.APPROVED);
        }

        @Test
        @DisplayName("Cancellation seen before commit aborts with nothing written")
        void cancellationBeforeCommit() {
            CancellationSignal cancelled = () -> true;

            assertThatThrownBy(() -> approvalCoordinator.approve(pending.getId(), "ap-1", null, cancelled))
                    .isInstanceOf(OperationCancelledException.class);

            assertThat(stored().getStatus()).isEqualTo(AlertStatus.PENDING_APPROVAL);
            verifyNoInteractions(deliveryGateway, eventPublisherHelper);
        }

        @Test
        @DisplayName("Approve of an expired alert is refused")
        void approveExpiredFails() {
            clock.advance(Duration.ofHours(3));

            assertThatThrownBy(() -> approvalCoordinator.approve(pending.getId(), "ap-1", null))
                    .isInstanceOf(InvalidStateTransitionException.class);
            assertThat(stored().getStatus()).isEqualTo(AlertStatus.PENDING_APPROVAL);
        }

        @Test
        @DisplayName("Unknown alert id is not found")
        void unknownAlert() {
            assertThatThrownBy(() -> approvalCoordinator.approve("missing", "ap-1", null))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("Losing the compare-and-swap is reported as a concurrent modification")
        void lostSwap() {
            AlertStore racingStore = mock(AlertStore.class);
            when(racingStore.findById(pending.getId())).thenReturn(Optional.of(pending));
            when(racingStore.compareAndSet(any(), anyLong())).thenReturn(false);
            ApprovalCoordinator coordinator = new ApprovalCoordinator(
                    racingStore,
                    deliveryGateway,
                    eventPublisherHelper,
                    new AlertMetricsService(meterRegistry),
                    AlertPolicy.defaults(),
                    clock);

            assertThatThrownBy(() -> coordinator.approve(pending.getId(), "ap-1", VersionToken.of(1)))
                    .isInstanceOf(ConcurrentAlertModificationException.class);
            verify(racingStore).compareAndSet(any(), eq(1L));
            verify(deliveryGateway, never()).requestDelivery(any());
        }
    }

    @Nested
    @DisplayName("Other transitions")
    class OtherTransitions {

        @Test
        @DisplayName("Reject after approval is an invalid transition")
        void rejectAfterApproval() {
            approvalCoordinator.approve(pending.getId(), "ap-1", null);

            assertThatThrownBy(() -> approvalCoordinator.reject(pending.getId(), "ap-2", "Late", null))
                    .isInstanceOf(InvalidStateTransitionException.class);
        }

        @Test
        @DisplayName("Reject stores the reason and never requests delivery")
        void rejectStoresReason() {
            Alert rejected = approvalCoordinator.reject(pending.getId(), "ap-1", "Wrong region", VersionToken.of(1));

            assertThat(rejected.getRejectionReason()).isEqualTo("Wrong region");
            assertThat(stored().getStatus()).isEqualTo(AlertStatus.REJECTED);
            verifyNoInteractions(deliveryGateway);
        }

        @Test
        @DisplayName("Cancel and submit go through the same versioned path")
        void cancelAndSubmit() {
            Alert draft = alertStore.insert(AlertFixtures.draftAlert("op-2").toBuilder().id("draft-1").build());

            Alert submitted = approvalCoordinator.submit(draft.getId(), "op-2", VersionToken.of(1));
            Alert cancelled = approvalCoordinator.cancel(draft.getId(), "op-2", submitted.versionToken());

            assertThat(submitted.getStatus()).isEqualTo(AlertStatus.PENDING_APPROVAL);
            assertThat(cancelled.getStatus()).isEqualTo(AlertStatus.CANCELLED);
            assertThat(cancelled.getVersion()).isEqualTo(3L);
        }

        @Test
        @DisplayName("markDelivered is system-driven and has no actor")
        void markDelivered() {
            approvalCoordinator.approve(pending.getId(), "ap-1", null);

            Alert delivered = approvalCoordinator.markDelivered(pending.getId());

            assertThat(delivered.getStatus()).isEqualTo(AlertStatus.DELIVERED);
            verify(eventPublisherHelper)
                    .publishAlertTransition(
                            any(), eq(delivered), eq(AlertEventType.DELIVERED), eq(AlertStatus.APPROVED), isNull());
        }

        @Test
        @DisplayName("retriggerDelivery requires an approved alert")
        void retriggerDelivery() {
            assertThatThrownBy(() -> approvalCoordinator.retriggerDelivery(pending.getId()))
                    .isInstanceOf(InvalidStateTransitionException.class);

            approvalCoordinator.approve(pending.getId(), "ap-1", null);
            AlertDecision decision = approvalCoordinator.retriggerDelivery(pending.getId());

            assertThat(decision.isDeliveryRequested()).isTrue();
            assertThat(decision.getAlert().getVersion()).isEqualTo(2L);
        }
    }
}
