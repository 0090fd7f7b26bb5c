package com.emergencyalerts.api.dto.request.reaction;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeverityEscalationPayload {

    private List<String> alertIds;

    private String fromSeverity;

    private String toSeverity;
}
