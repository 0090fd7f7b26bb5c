package com.emergencyalerts.api.controller;

import com.emergencyalerts.api.dto.request.AreaRequest;
import com.emergencyalerts.api.dto.request.CreateAlertRequest;
import com.emergencyalerts.api.dto.response.AlertPageResponse;
import com.emergencyalerts.api.dto.response.AlertResponse;
import com.emergencyalerts.auth.AuthenticatedUser;
import com.emergencyalerts.auth.RequiresRole;
import com.emergencyalerts.domain.enums.AlertStatus;
import com.emergencyalerts.domain.enums.UserRole;
import com.emergencyalerts.domain.model.Alert;
import com.emergencyalerts.domain.model.AlertDraft;
import com.emergencyalerts.domain.model.AlertPage;
import com.emergencyalerts.domain.model.AreaDraft;
import com.emergencyalerts.domain.vo.GeoPoint;
import com.emergencyalerts.exception.InvalidPolygonException;
import com.emergencyalerts.mapper.AlertMapper;
import com.emergencyalerts.service.AlertService;
import jakarta.validation.Valid;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for alert authoring and reads.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/alerts -- create a draft (or submit it straight away)</li>
 *   <li>GET /api/alerts/{alertId} -- one alert with its version token as ETag</li>
 *   <li>GET /api/alerts -- paged list, filterable by effective status and free text</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/alerts")
public class AlertController {

    private final AlertService alertService;
    private final AlertMapper alertMapper;
    private final Clock clock;

    public AlertController(AlertService alertService, AlertMapper alertMapper, Clock clock) {
        this.alertService = alertService;
        this.alertMapper = alertMapper;
        this.clock = clock;
    }

    @PostMapping
    @RequiresRole(UserRole.OPERATOR)
    public ResponseEntity<AlertResponse> createAlert(
            @Valid @RequestBody CreateAlertRequest request,
            @RequestAttribute(AuthenticatedUser.REQUEST_ATTRIBUTE) AuthenticatedUser user) {
        Alert alert = alertService.create(toDraft(request), user.getUserId());
        return ResponseEntity.status(HttpStatus.CREATED)
                .eTag(alert.versionToken().toEntityTag())
                .body(alertMapper.toResponse(alert, clock.instant()));
    }

    @GetMapping("/{alertId}")
    public ResponseEntity<AlertResponse> getAlert(@PathVariable String alertId) {
        Alert alert = alertService.get(alertId);
        return ResponseEntity.ok()
                .eTag(alert.versionToken().toEntityTag())
                .body(alertMapper.toResponse(alert, clock.instant()));
    }

    @GetMapping
    public ResponseEntity<AlertPageResponse> listAlerts(
            @RequestParam(required = false) AlertStatus status,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer pageSize) {
        AlertPage result = alertService.list(status, search, page, pageSize);
        return ResponseEntity.ok(AlertPageResponse.builder()
                .items(alertMapper.toResponseList(result.getItems(), clock.instant()))
                .total(result.getTotal())
                .page(result.getPage())
                .pageSize(result.getPageSize())
                .build());
    }

    private static AlertDraft toDraft(CreateAlertRequest request) {
        List<AreaDraft> areas = new ArrayList<>();
        List<AreaRequest> requested = request.getAreas() == null ? List.of() : request.getAreas();
        for (int i = 0; i < requested.size(); i++) {
            AreaRequest area = requested.get(i);
            areas.add(AreaDraft.builder()
                    .description(area.getDescription())
                    .regionCode(area.getRegionCode())
                    .polygon(toRing(i, area.getPolygon()))
                    .build());
        }
        return AlertDraft.builder()
                .headline(request.getHeadline())
                .description(request.getDescription())
                .severity(request.getSeverity())
                .channelType(request.getChannelType())
                .languageCode(request.getLanguageCode())
                .expiresAt(request.getExpiresAt())
                .areas(areas)
                .submit(request.isSubmit())
                .build();
    }

    private static List<GeoPoint> toRing(int areaIndex, List<List<Double>> pairs) {
        if (pairs == null) {
            throw new InvalidPolygonException(areaIndex, "Polygon is required");
        }
        List<GeoPoint> ring = new ArrayList<>(pairs.size());
        for (List<Double> pair : pairs) {
            if (pair == null || pair.size() != 2 || pair.get(0) == null || pair.get(1) == null) {
                throw new InvalidPolygonException(areaIndex, "Each vertex must be a [longitude, latitude] pair");
            }
            ring.add(GeoPoint.of(pair.get(0), pair.get(1)));
        }
        return ring;
    }
}
