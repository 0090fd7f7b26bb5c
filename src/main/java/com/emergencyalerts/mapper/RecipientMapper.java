package com.emergencyalerts.mapper;

import com.emergencyalerts.domain.model.Recipient;
import com.emergencyalerts.entity.RecipientEntity;
import org.mapstruct.Mapper;

@Mapper
public interface RecipientMapper {

    RecipientEntity toEntity(Recipient recipient);

    Recipient toDomain(RecipientEntity entity);
}
