package com.emergencyalerts.unit.reaction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.emergencyalerts.api.dto.request.reaction.ApproverWorkloadPayload;
import com.emergencyalerts.api.dto.request.reaction.AreaExpansionPayload;
import com.emergencyalerts.api.dto.request.reaction.DeliveryTriggerPayload;
import com.emergencyalerts.api.dto.request.reaction.DuplicateSuppressionPayload;
import com.emergencyalerts.api.dto.request.reaction.ExpiryWarningPayload;
import com.emergencyalerts.api.dto.request.reaction.RateSpikePayload;
import com.emergencyalerts.api.dto.request.reaction.RegionCorrelationPayload;
import com.emergencyalerts.api.dto.request.reaction.SlaBreachPayload;
import com.emergencyalerts.api.websocket.DashboardMessage;
import com.emergencyalerts.correlation.CorrelationEventStore;
import com.emergencyalerts.domain.enums.PatternType;
import com.emergencyalerts.domain.model.Alert;
import com.emergencyalerts.domain.model.CorrelationEvent;
import com.emergencyalerts.domain.model.ReactionSettings;
import com.emergencyalerts.exception.ValidationException;
import com.emergencyalerts.notification.DashboardBroadcaster;
import com.emergencyalerts.observability.AlertMetricsService;
import com.emergencyalerts.reaction.IdempotencyService;
import com.emergencyalerts.reaction.ReactionContext;
import com.emergencyalerts.reaction.ReactionDispatcher;
import com.emergencyalerts.reaction.ReactionKind;
import com.emergencyalerts.reaction.ReactionReceipt;
import com.emergencyalerts.reaction.ReactionTable;
import com.emergencyalerts.repository.AlertStore;
import com.emergencyalerts.support.AlertFixtures;
import com.emergencyalerts.support.InMemoryAlertStore;
import com.emergencyalerts.support.MutableClock;
import com.emergencyalerts.support.SequentialIdGenerator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for ReactionDispatcher: idempotency key derivation, single persist/broadcast per
 * key, alert enrichment with placeholder fallback, cardinality guards and Redis dedup.
 */
@ExtendWith(MockitoExtension.class)
class ReactionDispatcherTest {

    @Mock
    private CorrelationEventStore correlationEventStore;

    @Mock
    private IdempotencyService idempotencyService;

    @Mock
    private DashboardBroadcaster dashboardBroadcaster;

    private InMemoryAlertStore alertStore;
    private SimpleMeterRegistry meterRegistry;
    private MutableClock clock;
    private ReactionDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        alertStore = new InMemoryAlertStore();
        meterRegistry = new SimpleMeterRegistry();
        clock = new MutableClock(AlertFixtures.NOW);
        dispatcher = dispatcherWith(alertStore);
    }

    private ReactionDispatcher dispatcherWith(AlertStore store) {
        return new ReactionDispatcher(
                new ReactionTable(),
                correlationEventStore,
                idempotencyService,
                store,
                dashboardBroadcaster,
                new AlertMetricsService(meterRegistry),
                ReactionSettings.defaults(),
                new SequentialIdGenerator("evt"),
                clock);
    }

    private void storeAcceptsEachKeyOnce() {
        Set<String> keys = ConcurrentHashMap.newKeySet();
        when(correlationEventStore.insertIfAbsent(any())).thenAnswer(invocation -> {
            CorrelationEvent event = invocation.getArgument(0);
            return keys.add(event.getIdempotencyKey()) ? Optional.of(event) : Optional.empty();
        });
    }

    private DashboardMessage publishedMessage() {
        ArgumentCaptor<DashboardMessage> captor = ArgumentCaptor.forClass(DashboardMessage.class);
        verify(dashboardBroadcaster).publish(captor.capture());
        return captor.getValue();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> payloadOf(DashboardMessage message) {
        return (Map<String, Object>) message.getPayload();
    }

    @Nested
    @DisplayName("Persisted reactions")
    class Persisted {

        @Test
        @DisplayName("Redelivered SLA breach in the same window persists and broadcasts once")
        void slaBreachOncePerWindow() {
            storeAcceptsEachKeyOnce();
            SlaBreachPayload payload = SlaBreachPayload.builder()
                    .alertId("alert-1")
                    .headline("Flood")
                    .severity("Severe")
                    .elapsedSeconds(90)
                    .build();

            ReactionReceipt first = dispatcher.dispatch(ReactionKind.SLA_BREACH, payload);
            ReactionReceipt second = dispatcher.dispatch(ReactionKind.SLA_BREACH, payload);

            assertThat(first.isDuplicate()).isFalse();
            assertThat(second.isDuplicate()).isTrue();
            assertThat(first.getIdempotencyKey())
                    .isEqualTo("delivery-sla-breach:alert-1:20240501095830")
                    .isEqualTo(second.getIdempotencyKey());
            verify(correlationEventStore, times(2)).insertIfAbsent(any());
            verify(dashboardBroadcaster, times(1)).publish(any());
            verifyNoInteractions(idempotencyService);
            assertThat(meterRegistry.counter("reactions.duplicates", "kind", "sla_breach").count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Persisted event carries the pattern, alert ids and key in its metadata")
        void persistedEventShape() {
            storeAcceptsEachKeyOnce();

            dispatcher.dispatch(ReactionKind.SLA_BREACH, SlaBreachPayload.builder()
                    .alertId("alert-1")
                    .headline("Flood")
                    .severity("Severe")
                    .elapsedSeconds(61)
                    .build());

            ArgumentCaptor<CorrelationEvent> captor = ArgumentCaptor.forClass(CorrelationEvent.class);
            verify(correlationEventStore).insertIfAbsent(captor.capture());
            CorrelationEvent event = captor.getValue();
            assertThat(event.getId()).isEqualTo("evt-1");
            assertThat(event.getPatternType()).isEqualTo(PatternType.SLA_BREACH);
            assertThat(event.getAlertIds()).containsExactly("alert-1");
            assertThat(event.getDetectedAt()).isEqualTo(AlertFixtures.NOW);
            assertThat(event.getMetadata()).contains(event.getIdempotencyKey());
            assertThat(publishedMessage().getEventType()).isEqualTo("SLABreachDetected");
        }

        @Test
        @DisplayName("Geographic correlation key ignores alert order and repeats")
        void geographicKeyIsOrderInsensitive() {
            storeAcceptsEachKeyOnce();

            ReactionReceipt first = dispatcher.dispatch(ReactionKind.GEOGRAPHIC_CLUSTER, RegionCorrelationPayload.builder()
                    .regionCode("LDN")
                    .alertIds(List.of("a-1", "a-2"))
                    .build());
            clock.advance(Duration.ofMinutes(5));
            ReactionReceipt second = dispatcher.dispatch(ReactionKind.GEOGRAPHIC_CLUSTER, RegionCorrelationPayload.builder()
                    .regionCode("LDN")
                    .alertIds(List.of("a-2", "a-1", "a-2"))
                    .build());

            assertThat(second.getIdempotencyKey()).isEqualTo(first.getIdempotencyKey());
            assertThat(second.isDuplicate()).isTrue();
            verify(dashboardBroadcaster, times(1)).publish(any());
        }

        @Test
        @DisplayName("Geographic correlation needs two distinct alerts")
        void geographicCardinalityGuard() {
            RegionCorrelationPayload payload = RegionCorrelationPayload.builder()
                    .regionCode("LDN")
                    .alertIds(List.of("a-1", "a-1"))
                    .build();

            assertThatThrownBy(() -> dispatcher.dispatch(ReactionKind.GEOGRAPHIC_CLUSTER, payload))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("at least 2 distinct");
            verifyNoInteractions(correlationEventStore, dashboardBroadcaster);
        }

        @Test
        @DisplayName("Duplicate suppression pointing an alert at itself is rejected")
        void duplicateSuppressionCardinalityGuard() {
            DuplicateSuppressionPayload payload = DuplicateSuppressionPayload.builder()
                    .alertId("a-1")
                    .duplicateAlertId("a-1")
                    .headline("Flood")
                    .regionCode("LDN")
                    .build();

            assertThatThrownBy(() -> dispatcher.dispatch(ReactionKind.DUPLICATE_SUPPRESSION, payload))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("at least 2 distinct alerts, got 1");
            verifyNoInteractions(correlationEventStore, dashboardBroadcaster);
        }

        @Test
        @DisplayName("Area expansion with a single alert is rejected")
        void areaExpansionSingleAlertGuard() {
            AreaExpansionPayload payload = AreaExpansionPayload.builder()
                    .alertIds(List.of("a-1"))
                    .regionCodes(List.of("LDN", "KNT"))
                    .headline("Flood")
                    .build();

            assertThatThrownBy(() -> dispatcher.dispatch(ReactionKind.AREA_EXPANSION, payload))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("at least 2 distinct alerts, got 1");
            verifyNoInteractions(correlationEventStore, dashboardBroadcaster);
        }

        @Test
        @DisplayName("Area expansion within one region is rejected")
        void areaExpansionSingleRegionGuard() {
            AreaExpansionPayload payload = AreaExpansionPayload.builder()
                    .alertIds(List.of("a-1", "a-2"))
                    .regionCodes(List.of("LDN", "LDN"))
                    .build();

            assertThatThrownBy(() -> dispatcher.dispatch(ReactionKind.AREA_EXPANSION, payload))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("2 distinct regions");
            verifyNoInteractions(correlationEventStore, dashboardBroadcaster);
        }

        @Test
        @DisplayName("Regional hotspot accepts a single alert but needs a region")
        void hotspotRules() {
            storeAcceptsEachKeyOnce();

            ReactionReceipt receipt = dispatcher.dispatch(ReactionKind.REGIONAL_HOTSPOT, RegionCorrelationPayload.builder()
                    .regionCode("LDN")
                    .alertIds(List.of("a-1"))
                    .build());

            assertThat(receipt.isDuplicate()).isFalse();
            assertThatThrownBy(() -> dispatcher.dispatch(ReactionKind.REGIONAL_HOTSPOT, RegionCorrelationPayload.builder()
                            .alertIds(List.of("a-1"))
                            .build()))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Expiry warning is keyed on the warning window start, not arrival time")
        void expiryWarningKey() {
            storeAcceptsEachKeyOnce();
            Alert alert = alertStore.insert(AlertFixtures.pending("op-1"));
            ExpiryWarningPayload payload = ExpiryWarningPayload.builder()
                    .alertId(alert.getId())
                    .expiresAt(Instant.parse("2024-05-01T10:20:00Z"))
                    .build();

            ReactionReceipt first = dispatcher.dispatch(ReactionKind.EXPIRY_WARNING, payload);
            clock.advance(Duration.ofMinutes(3));
            ReactionReceipt second = dispatcher.dispatch(ReactionKind.EXPIRY_WARNING, payload);

            assertThat(first.getIdempotencyKey()).isEqualTo("expiry-warning:" + alert.getId() + ":20240501100500");
            assertThat(second.isDuplicate()).isTrue();
            Map<String, Object> message = payloadOf(publishedMessage());
            assertThat(message).containsEntry("headline", "Flood warning").containsEntry("minutesRemaining", 20L);
        }
    }

    @Nested
    @DisplayName("Enrichment")
    class Enrichment {

        @Test
        @DisplayName("Missing headline and severity are read from the alert")
        void enrichesFromAlert() {
            storeAcceptsEachKeyOnce();
            Alert alert = alertStore.insert(AlertFixtures.pending("op-1"));

            dispatcher.dispatch(ReactionKind.SLA_BREACH, SlaBreachPayload.builder()
                    .alertId(alert.getId())
                    .elapsedSeconds(75)
                    .build());

            assertThat(payloadOf(publishedMessage()))
                    .containsEntry("headline", "Flood warning")
                    .containsEntry("severity", "SEVERE");
        }

        @Test
        @DisplayName("Unknown alert degrades to placeholders instead of failing")
        void unknownAlertUsesPlaceholders() {
            storeAcceptsEachKeyOnce();

            ReactionReceipt receipt = dispatcher.dispatch(ReactionKind.SLA_BREACH, SlaBreachPayload.builder()
                    .alertId("ghost")
                    .elapsedSeconds(75)
                    .build());

            assertThat(receipt.isDuplicate()).isFalse();
            assertThat(payloadOf(publishedMessage()))
                    .containsEntry("headline", ReactionContext.UNKNOWN_HEADLINE)
                    .containsEntry("severity", ReactionContext.UNKNOWN_SEVERITY);
        }

        @Test
        @DisplayName("Failed alert lookup degrades to placeholders instead of failing")
        void failedLookupUsesPlaceholders() {
            AlertStore brokenStore = mock(AlertStore.class);
            when(brokenStore.findById(anyString())).thenThrow(new IllegalStateException("db down"));
            when(idempotencyService.claim(anyString())).thenReturn(true);

            dispatcherWith(brokenStore).dispatch(ReactionKind.DELIVERY_TRIGGER, DeliveryTriggerPayload.builder()
                    .alertId("alert-1")
                    .build());

            assertThat(payloadOf(publishedMessage()))
                    .containsEntry("headline", ReactionContext.UNKNOWN_HEADLINE)
                    .containsEntry("status", ReactionContext.UNKNOWN_STATUS);
        }

        @Test
        @DisplayName("Provided headline and severity skip the alert lookup")
        void providedValuesSkipLookup() {
            AlertStore watchedStore = mock(AlertStore.class);
            storeAcceptsEachKeyOnce();

            dispatcherWith(watchedStore).dispatch(ReactionKind.SLA_BREACH, SlaBreachPayload.builder()
                    .alertId("alert-1")
                    .headline("Given")
                    .severity("Extreme")
                    .elapsedSeconds(75)
                    .build());

            verifyNoInteractions(watchedStore);
            assertThat(payloadOf(publishedMessage())).containsEntry("headline", "Given");
        }
    }

    @Nested
    @DisplayName("Broadcast-only reactions")
    class BroadcastOnly {

        @Test
        @DisplayName("Delivery trigger is deduplicated through the Redis claim")
        void deliveryTriggerUsesRedis() {
            when(idempotencyService.claim(anyString())).thenReturn(true, false);
            DeliveryTriggerPayload payload = DeliveryTriggerPayload.builder().alertId("alert-1").build();

            ReactionReceipt first = dispatcher.dispatch(ReactionKind.DELIVERY_TRIGGER, payload);
            ReactionReceipt second = dispatcher.dispatch(ReactionKind.DELIVERY_TRIGGER, payload);

            assertThat(first.isDuplicate()).isFalse();
            assertThat(second.isDuplicate()).isTrue();
            assertThat(first.getIdempotencyKey()).isEqualTo("delivery-trigger:alert-1:20240501100000");
            verify(dashboardBroadcaster, times(1)).publish(any());
            verifyNoInteractions(correlationEventStore);
        }

        @Test
        @DisplayName("Rate spikes are never deduplicated and are critical above the threshold")
        void rateSpikeNeverDeduplicated() {
            RateSpikePayload payload = RateSpikePayload.builder()
                    .alertsInWindow(150)
                    .creationRatePerHour(150.456)
                    .build();

            ReactionReceipt first = dispatcher.dispatch(ReactionKind.RATE_SPIKE, payload);
            ReactionReceipt second = dispatcher.dispatch(ReactionKind.RATE_SPIKE, payload);

            assertThat(first.getIdempotencyKey()).isNotEqualTo(second.getIdempotencyKey());
            assertThat(second.isDuplicate()).isFalse();
            verify(dashboardBroadcaster, times(2)).publish(any());
            verifyNoInteractions(idempotencyService, correlationEventStore);
        }

        @Test
        @DisplayName("Rate spike message rounds the rate and grades severity")
        void rateSpikeMessage() {
            dispatcher.dispatch(ReactionKind.RATE_SPIKE, RateSpikePayload.builder()
                    .alertsInWindow(40)
                    .creationRatePerHour(40.126)
                    .build());

            assertThat(payloadOf(publishedMessage()))
                    .containsEntry("creationRatePerHour", 40.13)
                    .containsEntry("severity", "Warning");
        }

        @Test
        @DisplayName("Approver workload is keyed per approver and hour")
        void approverWorkloadHourlyKey() {
            when(idempotencyService.claim(anyString())).thenReturn(true);

            ReactionReceipt receipt = dispatcher.dispatch(ReactionKind.APPROVER_WORKLOAD, ApproverWorkloadPayload.builder()
                    .approverId("ap-1")
                    .decisionsInHour(30)
                    .workloadLevel("High")
                    .build());

            assertThat(receipt.getIdempotencyKey()).isEqualTo("approver-workload:ap-1:2024050110");
        }

        @Test
        @DisplayName("A failed broadcast does not fail the reaction")
        void broadcastFailureIsSwallowed() {
            when(idempotencyService.claim(anyString())).thenReturn(true);
            when(dashboardBroadcaster.publish(any())).thenReturn(false);

            ReactionReceipt receipt = dispatcher.dispatch(ReactionKind.DELIVERY_TRIGGER, DeliveryTriggerPayload.builder()
                    .alertId("alert-1")
                    .build());

            assertThat(receipt.isDuplicate()).isFalse();
        }
    }

    @Nested
    @DisplayName("Payload checks")
    class PayloadChecks {

        @Test
        @DisplayName("Null payload is rejected")
        void nullPayload() {
            assertThatThrownBy(() -> dispatcher.dispatch(ReactionKind.SLA_BREACH, null))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Payload of the wrong type is rejected")
        void wrongPayloadType() {
            assertThatThrownBy(() -> dispatcher.dispatch(
                            ReactionKind.SLA_BREACH, DeliveryTriggerPayload.builder().alertId("a").build()))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Negative counts are rejected before anything is stored")
        void negativeCounts() {
            assertThatThrownBy(() -> dispatcher.dispatch(ReactionKind.SLA_BREACH, SlaBreachPayload.builder()
                            .alertId("alert-1")
                            .elapsedSeconds(-1)
                            .build()))
                    .isInstanceOf(ValidationException.class);
            verify(correlationEventStore, never()).insertIfAbsent(any());
        }

        @Test
        @DisplayName("Every kind resolves from its route and has a payload type")
        void everyKindRouted() {
            for (ReactionKind kind : ReactionKind.values()) {
                assertThat(ReactionKind.fromRoute(kind.getRoute())).contains(kind);
                assertThat(dispatcher.payloadType(kind)).isNotNull();
            }
            assertThat(ReactionKind.fromRoute("nope")).isEmpty();
        }
    }
}
