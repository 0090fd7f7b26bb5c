package com.emergencyalerts.api.controller;

import com.emergencyalerts.api.dto.request.reaction.RegionCorrelationPayload;
import com.emergencyalerts.exception.ResourceNotFoundException;
import com.emergencyalerts.exception.ValidationException;
import com.emergencyalerts.reaction.ReactionDispatcher;
import com.emergencyalerts.reaction.ReactionKind;
import com.emergencyalerts.service.AlertService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Webhook entry point for the external change detector: POST /api/reactions/{route}.
 *
 * <p>Authentication is done by {@link com.emergencyalerts.auth.ReactionTokenFilter} before
 * this controller is reached. Every accepted delivery answers 204, duplicates included, so the
 * detector never retries a reaction that was already handled.
 */
@RestController
@RequestMapping("/api/reactions")
public class ReactionController {

    private static final Logger log = LoggerFactory.getLogger(ReactionController.class);

    private final ReactionDispatcher reactionDispatcher;
    private final AlertService alertService;
    private final ObjectMapper objectMapper;

    public ReactionController(
            ReactionDispatcher reactionDispatcher, AlertService alertService, ObjectMapper objectMapper) {
        this.reactionDispatcher = reactionDispatcher;
        this.alertService = alertService;
        this.objectMapper = objectMapper;
    }

    @PostMapping("/{route}")
    public ResponseEntity<Void> react(@PathVariable String route, @RequestBody(required = false) JsonNode body) {
        ReactionKind kind = ReactionKind.fromRoute(route)
                .orElseThrow(() -> new ResourceNotFoundException("Reaction route", route));
        if (body == null || body.isNull()) {
            throw new ValidationException("Reaction payload is required");
        }

        Object payload = readPayload(kind, body);
        if (payload instanceof RegionCorrelationPayload regionPayload) {
            resolveRegionAlerts(regionPayload);
        }

        reactionDispatcher.dispatch(kind, payload);
        return ResponseEntity.noContent().build();
    }

    private Object readPayload(ReactionKind kind, JsonNode body) {
        try {
            return objectMapper.treeToValue(body, reactionDispatcher.payloadType(kind));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("Unreadable {} payload: {}", kind.getRoute(), e.getMessage());
            throw new ValidationException("Malformed " + kind.getRoute() + " payload");
        }
    }

    /** Region-level detections may omit alert ids; use the region's live alerts. */
    private void resolveRegionAlerts(RegionCorrelationPayload payload) {
        if (payload.getAlertIds() != null && !payload.getAlertIds().isEmpty()) {
            return;
        }
        if (payload.getRegionCode() == null || payload.getRegionCode().isBlank()) {
            throw new ValidationException("regionCode", "regionCode or alertIds is required");
        }
        List<String> alertIds = alertService.liveAlertIdsInRegion(payload.getRegionCode());
        log.debug("Resolved {} live alerts for region {}", alertIds.size(), payload.getRegionCode());
        payload.setAlertIds(alertIds);
    }
}
