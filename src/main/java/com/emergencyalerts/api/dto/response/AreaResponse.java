package com.emergencyalerts.api.dto.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AreaResponse {

    private String id;
    private String description;
    private String regionCode;

    /** Closed ring of [longitude, latitude] pairs. */
    private List<List<Double>> polygon;
}
