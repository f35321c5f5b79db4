package com.structurescout.repository.jpa;

import com.structurescout.domain.enums.DecisionSource;
import com.structurescout.domain.enums.DecisionType;
import com.structurescout.entity.DecisionLogEntity;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the decision_log table.
 *
 * <p>Supports reviewing engine decisions by correlation id, source, type and session date.
 * Used by the REST API for historical queries and by DecisionArchiveService for batch persistence.
 */
@Repository
public interface DecisionLogJpaRepository extends JpaRepository<DecisionLogEntity, Long> {

    List<DecisionLogEntity> findBySourceIdOrderByTimestampDesc(String sourceId);

    List<DecisionLogEntity> findBySourceOrderByTimestampDesc(DecisionSource source);

    List<DecisionLogEntity> findByDecisionTypeOrderByTimestampDesc(DecisionType decisionType);

    List<DecisionLogEntity> findBySessionDateOrderByTimestampDesc(LocalDate sessionDate);

    @Query("SELECT d FROM DecisionLogEntity d WHERE d.timestamp BETWEEN :from AND :to ORDER BY d.timestamp DESC")
    List<DecisionLogEntity> findByDateRange(@Param("from") LocalDateTime from, @Param("to") LocalDateTime to);

    long countBySessionDate(LocalDate sessionDate);
}
