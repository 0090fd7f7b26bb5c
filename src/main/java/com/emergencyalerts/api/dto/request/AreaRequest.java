package com.emergencyalerts.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One target area of a new alert. The polygon is a closed ring of [longitude, latitude] pairs;
 * geometry rules are checked by the domain, not here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AreaRequest {

    @NotBlank
    @Size(max = 255)
    private String description;

    @NotNull
    private List<List<Double>> polygon;

    @Size(max = 50)
    private String regionCode;
}
