package com.emergencyalerts.unit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.emergencyalerts.api.controller.ApprovalController;
import com.emergencyalerts.approval.ApprovalCoordinator;
import com.emergencyalerts.auth.AuthenticatedUser;
import com.emergencyalerts.config.ApiResponseAdvice;
import com.emergencyalerts.domain.enums.AlertStatus;
import com.emergencyalerts.domain.enums.UserRole;
import com.emergencyalerts.domain.model.Alert;
import com.emergencyalerts.domain.model.AlertDecision;
import com.emergencyalerts.domain.model.AlertPolicy;
import com.emergencyalerts.domain.vo.VersionToken;
import com.emergencyalerts.exception.ConcurrentAlertModificationException;
import com.emergencyalerts.exception.GlobalExceptionHandler;
import com.emergencyalerts.exception.InvalidStateTransitionException;
import com.emergencyalerts.mapper.AlertMapper;
import com.emergencyalerts.support.AlertFixtures;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for lifecycle actions, focused on the If-Match / ETag contract.
 */
@ExtendWith(MockitoExtension.class)
class ApprovalControllerTest {

    private static final AuthenticatedUser APPROVER = new AuthenticatedUser("ap-1", Set.of(UserRole.APPROVER));

    private MockMvc mockMvc;

    @Mock
    private ApprovalCoordinator approvalCoordinator;

    @BeforeEach
    void setUp() {
        ApprovalController controller = new ApprovalController(
                approvalCoordinator,
                Mappers.getMapper(AlertMapper.class),
                Clock.fixed(AlertFixtures.NOW, ZoneOffset.UTC));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
    }

    private static Alert approved() {
        return AlertFixtures.pending("op-1").approve("ap-1", AlertFixtures.NOW.plus(Duration.ofMinutes(1)));
    }

    @Nested
    @DisplayName("POST /approval")
    class Approve {

        @Test
        @DisplayName("Passes the If-Match token through and returns the new ETag")
        void approveWithIfMatch() throws Exception {
            Alert approved = approved();
            when(approvalCoordinator.approve("a-2", "ap-1", VersionToken.of(1)))
                    .thenReturn(AlertDecision.builder().alert(approved).deliveryRequested(true).build());

            mockMvc.perform(post("/api/alerts/a-2/approval")
                            .requestAttr(AuthenticatedUser.REQUEST_ATTRIBUTE, APPROVER)
                            .header("If-Match", "\"1\""))
                    .andExpect(status().isOk())
                    .andExpect(header().string("ETag", "\"2\""))
                    .andExpect(jsonPath("$.data.alert.status").value("APPROVED"))
                    .andExpect(jsonPath("$.data.alert.approverId").value("ap-1"))
                    .andExpect(jsonPath("$.data.versionToken").value("2"))
                    .andExpect(jsonPath("$.data.deliveryRequested").value(true));
        }

        @Test
        @DisplayName("Without If-Match the action applies to the current version")
        void approveWithoutIfMatch() throws Exception {
            when(approvalCoordinator.approve(eq("a-2"), eq("ap-1"), isNull()))
                    .thenReturn(AlertDecision.builder()
                            .alert(approved())
                            .deliveryRequested(false)
                            .deliveryFailureReason("Delivery transport unavailable")
                            .build());

            mockMvc.perform(post("/api/alerts/a-2/approval").requestAttr(AuthenticatedUser.REQUEST_ATTRIBUTE, APPROVER))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.deliveryRequested").value(false))
                    .andExpect(jsonPath("$.data.deliveryFailureReason").value("Delivery transport unavailable"));
        }

        @Test
        @DisplayName("Stale token surfaces as 409 CONCURRENT_MODIFICATION")
        void staleToken() throws Exception {
            when(approvalCoordinator.approve("a-2", "ap-1", VersionToken.of(1)))
                    .thenThrow(new ConcurrentAlertModificationException("a-2", "1", "2"));

            mockMvc.perform(post("/api/alerts/a-2/approval")
                            .requestAttr(AuthenticatedUser.REQUEST_ATTRIBUTE, APPROVER)
                            .header("If-Match", "W/\"1\""))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.error.code").value("CONCURRENT_MODIFICATION"))
                    .andExpect(jsonPath("$.error.details.currentVersion").value("2"));
        }

        @Test
        @DisplayName("Approving a decided alert surfaces as 409 INVALID_STATE_TRANSITION")
        void alreadyDecided() throws Exception {
            when(approvalCoordinator.approve(eq("a-2"), eq("ap-1"), isNull()))
                    .thenThrow(new InvalidStateTransitionException("a-2", AlertStatus.REJECTED, AlertStatus.APPROVED));

            mockMvc.perform(post("/api/alerts/a-2/approval").requestAttr(AuthenticatedUser.REQUEST_ATTRIBUTE, APPROVER))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.error.code").value("INVALID_STATE_TRANSITION"));
        }
    }

    @Nested
    @DisplayName("POST /rejection")
    class Reject {

        @Test
        @DisplayName("Records the reason and returns the rejected alert")
        void reject() throws Exception {
            Alert rejected = AlertFixtures.pending("op-1")
                    .reject("ap-1", "Wrong area", AlertPolicy.defaults(), AlertFixtures.NOW.plusSeconds(30));
            when(approvalCoordinator.reject("a-2", "ap-1", "Wrong area", VersionToken.of(1)))
                    .thenReturn(rejected);

            mockMvc.perform(post("/api/alerts/a-2/rejection")
                            .requestAttr(AuthenticatedUser.REQUEST_ATTRIBUTE, APPROVER)
                            .header("If-Match", "\"1\"")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"reason\":\"Wrong area\"}"))
                    .andExpect(status().isOk())
                    .andExpect(header().string("ETag", "\"2\""))
                    .andExpect(jsonPath("$.data.status").value("REJECTED"))
                    .andExpect(jsonPath("$.data.rejectionReason").value("Wrong area"));
        }

        @Test
        @DisplayName("Blank reason is rejected before reaching the coordinator")
        void blankReason() throws Exception {
            mockMvc.perform(post("/api/alerts/a-2/rejection")
                            .requestAttr(AuthenticatedUser.REQUEST_ATTRIBUTE, APPROVER)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"reason\":\"  \"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));

            verifyNoInteractions(approvalCoordinator);
        }
    }

    @Test
    @DisplayName("POST /submission moves a draft to pending approval")
    void submit() throws Exception {
        Alert submitted = AlertFixtures.draftAlert("op-1").submit("op-1", AlertFixtures.NOW.plusSeconds(5));
        when(approvalCoordinator.submit(eq("a-2"), eq("op-1"), isNull())).thenReturn(submitted);

        mockMvc.perform(post("/api/alerts/a-2/submission")
                        .requestAttr(
                                AuthenticatedUser.REQUEST_ATTRIBUTE,
                                new AuthenticatedUser("op-1", Set.of(UserRole.OPERATOR))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("PENDING_APPROVAL"));
    }

    @Test
    @DisplayName("POST /cancellation records who cancelled")
    void cancel() throws Exception {
        Alert cancelled = approved().cancel("ap-1", AlertFixtures.NOW.plus(Duration.ofMinutes(2)));
        when(approvalCoordinator.cancel(eq("a-2"), eq("ap-1"), any())).thenReturn(cancelled);

        mockMvc.perform(post("/api/alerts/a-2/cancellation")
                        .requestAttr(AuthenticatedUser.REQUEST_ATTRIBUTE, APPROVER)
                        .header("If-Match", "*"))
                .andExpect(status().isOk())
                .andExpect(header().string("ETag", "\"3\""))
                .andExpect(jsonPath("$.data.status").value("CANCELLED"))
                .andExpect(jsonPath("$.data.cancelledBy").value("ap-1"));
    }

    @Test
    @DisplayName("POST /delivery re-requests delivery")
    void retriggerDelivery() throws Exception {
        when(approvalCoordinator.retriggerDelivery("a-2"))
                .thenReturn(AlertDecision.builder().alert(approved()).deliveryRequested(true).build());

        mockMvc.perform(post("/api/alerts/a-2/delivery"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.deliveryRequested").value(true));
    }
}
