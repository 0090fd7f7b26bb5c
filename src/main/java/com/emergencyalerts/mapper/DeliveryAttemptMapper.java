package com.emergencyalerts.mapper;

import com.emergencyalerts.api.dto.response.DeliveryAttemptResponse;
import com.emergencyalerts.domain.model.DeliveryAttempt;
import com.emergencyalerts.entity.DeliveryAttemptEntity;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper between DeliveryAttempt, its entity and response DTO. Straightforward 1:1.
 */
@Mapper
public interface DeliveryAttemptMapper {

    DeliveryAttemptEntity toEntity(DeliveryAttempt attempt);

    DeliveryAttempt toDomain(DeliveryAttemptEntity entity);

    List<DeliveryAttempt> toDomainList(List<DeliveryAttemptEntity> entities);

    DeliveryAttemptResponse toResponse(DeliveryAttempt attempt);

    List<DeliveryAttemptResponse> toResponseList(List<DeliveryAttempt> attempts);
}
