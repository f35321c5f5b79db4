package com.structurescout.mapper;

import com.structurescout.domain.model.PhaseTransition;
import com.structurescout.entity.PhaseTransitionEntity;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper between PhaseTransition and PhaseTransitionEntity. 1:1 field mapping.
 */
@Mapper
public interface PhaseTransitionMapper {

    PhaseTransitionEntity toEntity(PhaseTransition transition);

    PhaseTransition toDomain(PhaseTransitionEntity entity);

    List<PhaseTransition> toDomainList(List<PhaseTransitionEntity> entities);
}
