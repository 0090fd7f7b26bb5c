package com.emergencyalerts.domain.model;

import com.emergencyalerts.domain.vo.GeoPoint;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Unvalidated area input for {@link Alert#create}. */
@Value
@Builder
public class AreaDraft {

    String description;
    List<GeoPoint> polygon;
    String regionCode;
}
