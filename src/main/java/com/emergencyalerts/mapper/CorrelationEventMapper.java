package com.emergencyalerts.mapper;

import com.emergencyalerts.api.dto.response.CorrelationEventResponse;
import com.emergencyalerts.domain.model.CorrelationEvent;
import com.emergencyalerts.entity.CorrelationEventEntity;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper for correlation events. The alert id set is a JSON array column; metadata
 * stays an opaque string until it reaches the API, where it is expanded into an object.
 */
@Mapper
public interface CorrelationEventMapper {

    @Mapping(source = "alertIds", target = "alertIds", qualifiedByName = "alertIdsToJson")
    CorrelationEventEntity toEntity(CorrelationEvent event);

    @Mapping(source = "alertIds", target = "alertIds", qualifiedByName = "jsonToAlertIds")
    CorrelationEvent toDomain(CorrelationEventEntity entity);

    List<CorrelationEvent> toDomainList(List<CorrelationEventEntity> entities);

    @Mapping(source = "metadata", target = "metadata", qualifiedByName = "metadataToMap")
    CorrelationEventResponse toResponse(CorrelationEvent event);

    List<CorrelationEventResponse> toResponseList(List<CorrelationEvent> events);

    @Named("alertIdsToJson")
    default String alertIdsToJson(List<String> alertIds) {
        return JsonHelper.toJson(alertIds == null ? List.of() : alertIds);
    }

    @Named("jsonToAlertIds")
    default List<String> jsonToAlertIds(String json) {
        return JsonHelper.fromJsonList(json, String.class);
    }

    @Named("metadataToMap")
    default Map<String, Object> metadataToMap(String metadata) {
        return JsonHelper.fromJsonMap(metadata);
    }
}
