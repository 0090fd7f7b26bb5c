package com.emergencyalerts.mapper;

import com.emergencyalerts.api.dto.response.AlertResponse;
import com.emergencyalerts.api.dto.response.AreaResponse;
import com.emergencyalerts.domain.model.Alert;
import com.emergencyalerts.domain.model.Area;
import com.emergencyalerts.domain.vo.GeoPoint;
import com.emergencyalerts.entity.AlertEntity;
import com.emergencyalerts.entity.AreaEntity;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper for the alert aggregate, its JPA entities and API responses.
 *
 * <p>Area polygons are stored as JSON text in the entity and exposed as [lon, lat] pairs in
 * responses. Responses carry the effective status, which depends on the read time, so callers
 * go through {@link #toResponse(Alert, Instant)}.
 */
@Mapper
public interface AlertMapper {

    // Entity <-> Domain
    Alert toDomain(AlertEntity entity);

    List<Alert> toDomainList(List<AlertEntity> entities);

    AlertEntity toEntity(Alert alert);

    @Mapping(source = "polygon", target = "polygon", qualifiedByName = "ringToJson")
    AreaEntity toEntity(Area area);

    @Mapping(source = "polygon", target = "polygon", qualifiedByName = "jsonToRing")
    Area toDomain(AreaEntity entity);

    // Domain -> Response
    @Mapping(target = "versionToken", expression = "java(alert.versionToken().value())")
    AlertResponse toResponse(Alert alert);

    @Mapping(source = "polygon", target = "polygon", qualifiedByName = "ringToPairs")
    AreaResponse toResponse(Area area);

    default AlertResponse toResponse(Alert alert, Instant now) {
        AlertResponse response = toResponse(alert);
        response.setStatus(alert.effectiveStatus(now));
        return response;
    }

    default List<AlertResponse> toResponseList(List<Alert> alerts, Instant now) {
        List<AlertResponse> responses = new ArrayList<>(alerts.size());
        for (Alert alert : alerts) {
            responses.add(toResponse(alert, now));
        }
        return responses;
    }

    @Named("ringToJson")
    default String ringToJson(List<GeoPoint> ring) {
        return JsonHelper.ringToJson(ring);
    }

    @Named("jsonToRing")
    default List<GeoPoint> jsonToRing(String json) {
        return JsonHelper.ringFromJson(json);
    }

    @Named("ringToPairs")
    default List<List<Double>> ringToPairs(List<GeoPoint> ring) {
        if (ring == null) {
            return List.of();
        }
        List<List<Double>> pairs = new ArrayList<>(ring.size());
        for (GeoPoint point : ring) {
            pairs.add(List.of(point.getLongitude(), point.getLatitude()));
        }
        return pairs;
    }
}
