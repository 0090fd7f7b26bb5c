package com.emergencyalerts.api.dto.request.reaction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApproverWorkloadPayload {

    private String approverId;

    private int decisionsInHour;

    private int approvedCount;

    private int rejectedCount;

    private String workloadLevel;
}
