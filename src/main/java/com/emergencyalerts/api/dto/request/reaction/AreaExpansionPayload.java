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
public class AreaExpansionPayload {

    private List<String> alertIds;

    private List<String> regionCodes;

    private String headline;
}
