package com.structurescout.mapper;

import com.structurescout.domain.model.AccountState;
import com.structurescout.entity.AccountStateEntity;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper between the immutable AccountState snapshot and its entity.
 */
@Mapper
public interface AccountStateMapper {

    AccountStateEntity toEntity(AccountState state);

    AccountState toDomain(AccountStateEntity entity);
}
