package com.structurescout.repository.jpa;

import com.structurescout.domain.enums.AdmissionStatus;
import com.structurescout.entity.AdmissionEntity;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the admission table.
 */
@Repository
public interface AdmissionJpaRepository extends JpaRepository<AdmissionEntity, Long> {

    Optional<AdmissionEntity> findByAccountIdAndCorrelationId(String accountId, String correlationId);

    List<AdmissionEntity> findByAccountIdAndStatus(String accountId, AdmissionStatus status);

    @Query("SELECT a FROM AdmissionEntity a WHERE a.accountId = :accountId AND a.sessionDate >= :from "
            + "ORDER BY a.id ASC")
    List<AdmissionEntity> findSince(@Param("accountId") String accountId, @Param("from") LocalDate from);
}
