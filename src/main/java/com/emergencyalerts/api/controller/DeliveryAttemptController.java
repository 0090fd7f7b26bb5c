package com.emergencyalerts.api.controller;

import com.emergencyalerts.api.dto.request.RecordDeliveryAttemptRequest;
import com.emergencyalerts.api.dto.response.DeliveryAttemptResponse;
import com.emergencyalerts.auth.RequiresRole;
import com.emergencyalerts.delivery.DeliveryAttemptLedger;
import com.emergencyalerts.domain.enums.UserRole;
import com.emergencyalerts.domain.model.ConsecutiveFailureCount;
import com.emergencyalerts.domain.model.DeliveryAttempt;
import com.emergencyalerts.domain.model.DeliveryStats;
import com.emergencyalerts.domain.model.Recipient;
import com.emergencyalerts.exception.ValidationException;
import com.emergencyalerts.mapper.DeliveryAttemptMapper;
import com.emergencyalerts.service.AlertService;
import com.emergencyalerts.service.RecipientService;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Delivery attempt ledger endpoints.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/alerts/{alertId}/delivery-attempts -- attempts for one alert, oldest first</li>
 *   <li>POST /api/alerts/{alertId}/delivery-attempts -- the transport reports an attempt</li>
 *   <li>GET /api/delivery/stats -- success/failure counts over a trailing window</li>
 *   <li>GET /api/delivery/retry-counts -- trailing failure runs per alert</li>
 * </ul>
 */
@RestController
public class DeliveryAttemptController {

    static final int DEFAULT_WINDOW_MINUTES = 60;
    static final int MAX_WINDOW_MINUTES = 7 * 24 * 60;

    private final DeliveryAttemptLedger deliveryAttemptLedger;
    private final AlertService alertService;
    private final RecipientService recipientService;
    private final DeliveryAttemptMapper deliveryAttemptMapper;
    private final Clock clock;

    public DeliveryAttemptController(
            DeliveryAttemptLedger deliveryAttemptLedger,
            AlertService alertService,
            RecipientService recipientService,
            DeliveryAttemptMapper deliveryAttemptMapper,
            Clock clock) {
        this.deliveryAttemptLedger = deliveryAttemptLedger;
        this.alertService = alertService;
        this.recipientService = recipientService;
        this.deliveryAttemptMapper = deliveryAttemptMapper;
        this.clock = clock;
    }

    @GetMapping("/api/alerts/{alertId}/delivery-attempts")
    public ResponseEntity<List<DeliveryAttemptResponse>> listAttempts(@PathVariable String alertId) {
        alertService.get(alertId);
        return ResponseEntity.ok(deliveryAttemptMapper.toResponseList(deliveryAttemptLedger.attemptsForAlert(alertId)));
    }

    @PostMapping("/api/alerts/{alertId}/delivery-attempts")
    @RequiresRole(UserRole.ADMIN)
    public ResponseEntity<DeliveryAttemptResponse> recordAttempt(
            @PathVariable String alertId, @Valid @RequestBody RecordDeliveryAttemptRequest request) {
        alertService.get(alertId);
        Recipient recipient = resolveRecipient(request);
        String detail = switch (request.getOutcome()) {
            case SUCCESS -> request.getProviderOperationId();
            case FAILURE -> request.getFailureReason();
        };

        DeliveryAttempt attempt = request.getAttemptedAt() == null
                ? deliveryAttemptLedger.record(
                        alertId, recipient.getId(), request.getAttemptNumber(), request.getOutcome(), detail)
                : deliveryAttemptLedger.record(
                        alertId,
                        recipient.getId(),
                        request.getAttemptNumber(),
                        request.getOutcome(),
                        detail,
                        request.getAttemptedAt());
        return ResponseEntity.status(HttpStatus.CREATED).body(deliveryAttemptMapper.toResponse(attempt));
    }

    @GetMapping("/api/delivery/stats")
    public ResponseEntity<DeliveryStats> stats(@RequestParam(required = false) Integer windowMinutes) {
        return ResponseEntity.ok(deliveryAttemptLedger.statsSince(windowStart(windowMinutes)));
    }

    @GetMapping("/api/delivery/retry-counts")
    public ResponseEntity<List<ConsecutiveFailureCount>> retryCounts(
            @RequestParam(required = false) Integer windowMinutes) {
        return ResponseEntity.ok(deliveryAttemptLedger.consecutiveFailuresSince(windowStart(windowMinutes)));
    }

    private Recipient resolveRecipient(RecordDeliveryAttemptRequest request) {
        if (request.getRecipientId() != null && !request.getRecipientId().isBlank()) {
            return recipientService.get(request.getRecipientId());
        }
        if (request.getRecipientEmail() != null && !request.getRecipientEmail().isBlank()) {
            return recipientService.findOrCreate(request.getRecipientEmail(), request.getDisplayName());
        }
        throw new ValidationException("recipientId", "recipientId or recipientEmail is required");
    }

    private Instant windowStart(Integer windowMinutes) {
        int minutes = windowMinutes == null ? DEFAULT_WINDOW_MINUTES : windowMinutes;
        if (minutes < 1 || minutes > MAX_WINDOW_MINUTES) {
            throw new ValidationException(
                    "windowMinutes", "windowMinutes must be between 1 and " + MAX_WINDOW_MINUTES);
        }
        return clock.instant().minus(Duration.ofMinutes(minutes));
    }
}
