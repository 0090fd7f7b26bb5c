package com.emergencyalerts.api.controller;

import com.emergencyalerts.api.dto.request.RejectAlertRequest;
import com.emergencyalerts.api.dto.response.AlertDecisionResponse;
import com.emergencyalerts.api.dto.response.AlertResponse;
import com.emergencyalerts.approval.ApprovalCoordinator;
import com.emergencyalerts.auth.AuthenticatedUser;
import com.emergencyalerts.auth.RequiresRole;
import com.emergencyalerts.domain.enums.UserRole;
import com.emergencyalerts.domain.model.Alert;
import com.emergencyalerts.domain.model.AlertDecision;
import com.emergencyalerts.domain.vo.VersionToken;
import com.emergencyalerts.mapper.AlertMapper;
import jakarta.validation.Valid;
import java.time.Clock;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lifecycle actions on an alert. Each accepts an optional {@code If-Match} version token; a
 * stale token fails with 409 CONCURRENT_MODIFICATION. Without one the action applies to the
 * current version, and a concurrent writer still loses at the store's compare-and-swap.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/alerts/{alertId}/submission -- DRAFT to PENDING_APPROVAL</li>
 *   <li>POST /api/alerts/{alertId}/approval -- PENDING_APPROVAL to APPROVED, then request delivery</li>
 *   <li>POST /api/alerts/{alertId}/rejection -- PENDING_APPROVAL to REJECTED</li>
 *   <li>POST /api/alerts/{alertId}/cancellation -- any live state to CANCELLED</li>
 *   <li>POST /api/alerts/{alertId}/delivery -- ask the transport again for an APPROVED alert</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/alerts/{alertId}")
public class ApprovalController {

    private final ApprovalCoordinator approvalCoordinator;
    private final AlertMapper alertMapper;
    private final Clock clock;

    public ApprovalController(ApprovalCoordinator approvalCoordinator, AlertMapper alertMapper, Clock clock) {
        this.approvalCoordinator = approvalCoordinator;
        this.alertMapper = alertMapper;
        this.clock = clock;
    }

    @PostMapping("/submission")
    @RequiresRole(UserRole.OPERATOR)
    public ResponseEntity<AlertResponse> submit(
            @PathVariable String alertId,
            @RequestHeader(value = HttpHeaders.IF_MATCH, required = false) String ifMatch,
            @RequestAttribute(AuthenticatedUser.REQUEST_ATTRIBUTE) AuthenticatedUser user) {
        Alert alert = approvalCoordinator.submit(alertId, user.getUserId(), expected(ifMatch));
        return withEtag(alert);
    }

    @PostMapping("/approval")
    @RequiresRole(UserRole.APPROVER)
    public ResponseEntity<AlertDecisionResponse> approve(
            @PathVariable String alertId,
            @RequestHeader(value = HttpHeaders.IF_MATCH, required = false) String ifMatch,
            @RequestAttribute(AuthenticatedUser.REQUEST_ATTRIBUTE) AuthenticatedUser user) {
        AlertDecision decision = approvalCoordinator.approve(alertId, user.getUserId(), expected(ifMatch));
        return decisionResponse(decision);
    }

    @PostMapping("/rejection")
    @RequiresRole(UserRole.APPROVER)
    public ResponseEntity<AlertResponse> reject(
            @PathVariable String alertId,
            @Valid @RequestBody RejectAlertRequest request,
            @RequestHeader(value = HttpHeaders.IF_MATCH, required = false) String ifMatch,
            @RequestAttribute(AuthenticatedUser.REQUEST_ATTRIBUTE) AuthenticatedUser user) {
        Alert alert = approvalCoordinator.reject(alertId, user.getUserId(), request.getReason(), expected(ifMatch));
        return withEtag(alert);
    }

    @PostMapping("/cancellation")
    @RequiresRole({UserRole.OPERATOR, UserRole.APPROVER})
    public ResponseEntity<AlertResponse> cancel(
            @PathVariable String alertId,
            @RequestHeader(value = HttpHeaders.IF_MATCH, required = false) String ifMatch,
            @RequestAttribute(AuthenticatedUser.REQUEST_ATTRIBUTE) AuthenticatedUser user) {
        Alert alert = approvalCoordinator.cancel(alertId, user.getUserId(), expected(ifMatch));
        return withEtag(alert);
    }

    @PostMapping("/delivery")
    @RequiresRole(UserRole.APPROVER)
    public ResponseEntity<AlertDecisionResponse> retriggerDelivery(@PathVariable String alertId) {
        return decisionResponse(approvalCoordinator.retriggerDelivery(alertId));
    }

    private static VersionToken expected(String ifMatch) {
        return VersionToken.fromHeader(ifMatch).orElse(null);
    }

    private ResponseEntity<AlertResponse> withEtag(Alert alert) {
        return ResponseEntity.ok()
                .eTag(alert.versionToken().toEntityTag())
                .body(alertMapper.toResponse(alert, clock.instant()));
    }

    private ResponseEntity<AlertDecisionResponse> decisionResponse(AlertDecision decision) {
        return ResponseEntity.ok()
                .eTag(decision.getVersionToken().toEntityTag())
                .body(AlertDecisionResponse.builder()
                        .alert(alertMapper.toResponse(decision.getAlert(), clock.instant()))
                        .versionToken(decision.getVersionToken().value())
                        .deliveryRequested(decision.isDeliveryRequested())
                        .deliveryFailureReason(decision.getDeliveryFailureReason())
                        .build());
    }
}
