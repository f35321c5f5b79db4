package com.structurescout.repository.jpa;

import com.structurescout.entity.PhaseTransitionEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the phase_transition audit table.
 */
@Repository
public interface PhaseTransitionJpaRepository extends JpaRepository<PhaseTransitionEntity, Long> {

    List<PhaseTransitionEntity> findByAccountIdOrderByTransitionedAtDesc(String accountId);
}
