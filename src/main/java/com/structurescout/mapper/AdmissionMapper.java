package com.structurescout.mapper;

import com.structurescout.domain.model.Admission;
import com.structurescout.entity.AdmissionEntity;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper between Admission and AdmissionEntity. 1:1 field mapping.
 */
@Mapper
public interface AdmissionMapper {

    AdmissionEntity toEntity(Admission admission);

    Admission toDomain(AdmissionEntity entity);

    List<Admission> toDomainList(List<AdmissionEntity> entities);
}
