package com.structurescout.repository.jpa;

import com.structurescout.entity.TradeOutcomeEntity;
import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the trade_outcome log.
 * Rows are read back in id order at startup to rebuild the ledger aggregates.
 */
@Repository
public interface TradeOutcomeJpaRepository extends JpaRepository<TradeOutcomeEntity, Long> {

    List<TradeOutcomeEntity> findByAccountIdOrderByIdAsc(String accountId);

    @Query("SELECT t FROM TradeOutcomeEntity t WHERE t.accountId = :accountId "
            + "AND t.closedAt >= :since ORDER BY t.id ASC")
    List<TradeOutcomeEntity> findClosedSince(@Param("accountId") String accountId, @Param("since") Instant since);

    boolean existsByAccountIdAndCorrelationId(String accountId, String correlationId);

    long countByAccountId(String accountId);
}
