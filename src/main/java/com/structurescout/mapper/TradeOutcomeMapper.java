package com.structurescout.mapper;

import com.structurescout.domain.model.TradeOutcome;
import com.structurescout.entity.TradeOutcomeEntity;
import java.time.Instant;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between TradeOutcome and TradeOutcomeEntity.
 * The entity id is the outcome's ledger sequence.
 */
@Mapper
public interface TradeOutcomeMapper {

    @Mapping(target = "id", ignore = true)
    @Mapping(source = "accountId", target = "accountId")
    @Mapping(source = "recordedAt", target = "recordedAt")
    @Mapping(source = "outcome.correlationId", target = "correlationId")
    @Mapping(source = "outcome.pnlFraction", target = "pnlFraction")
    @Mapping(source = "outcome.realizedR", target = "realizedR")
    @Mapping(source = "outcome.closedAt", target = "closedAt")
    TradeOutcomeEntity toEntity(TradeOutcome outcome, String accountId, Instant recordedAt);

    @Mapping(source = "id", target = "sequence")
    TradeOutcome toDomain(TradeOutcomeEntity entity);

    List<TradeOutcome> toDomainList(List<TradeOutcomeEntity> entities);
}
