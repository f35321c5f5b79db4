package com.structurescout.mapper;

import com.fasterxml.jackson.core.type.TypeReference;
import com.structurescout.domain.model.DecisionRecord;
import com.structurescout.entity.DecisionLogEntity;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between DecisionRecord domain model and DecisionLogEntity.
 *
 * <p>The dataContext field is a Map in the domain model but stored as a JSON string
 * in the entity. This mapper handles the JSON conversion via {@link JsonHelper}.
 */
@Mapper
public interface DecisionLogMapper {

    @Mapping(source = "dataContext", target = "dataContext", qualifiedByName = "mapToJson")
    DecisionLogEntity toEntity(DecisionRecord decisionRecord);

    @Mapping(source = "dataContext", target = "dataContext", qualifiedByName = "jsonToMap")
    DecisionRecord toDomain(DecisionLogEntity entity);

    List<DecisionRecord> toDomainList(List<DecisionLogEntity> entities);

    List<DecisionLogEntity> toEntityList(List<DecisionRecord> records);

    @Named("mapToJson")
    default String mapToJson(Map<String, Object> dataContext) {
        return JsonHelper.toJson(dataContext);
    }

    @Named("jsonToMap")
    default Map<String, Object> jsonToMap(String json) {
        return JsonHelper.fromJson(json, new TypeReference<Map<String, Object>>() {});
    }
}
