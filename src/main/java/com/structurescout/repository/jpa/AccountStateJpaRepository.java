package com.structurescout.repository.jpa;

import com.structurescout.entity.AccountStateEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the account_state table, keyed by account id.
 */
@Repository
public interface AccountStateJpaRepository extends JpaRepository<AccountStateEntity, String> {}
