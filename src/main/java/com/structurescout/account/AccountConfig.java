package com.structurescout.account;

import com.structurescout.domain.enums.OperatingPhase;
import com.structurescout.exception.ConfigurationException;
import jakarta.annotation.PostConstruct;
import java.math.BigDecimal;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Account identity and the values used the first time the account is seen,
 * bound from {@code structurescout.account.*}. After that, account_state is authoritative.
 */
@Data
@Component
@ConfigurationProperties(prefix = "structurescout.account")
public class AccountConfig {

    private String accountId = "default";
    private BigDecimal initialEquity = new BigDecimal("10000.00");
    private OperatingPhase initialPhase = OperatingPhase.OBSERVATION;

    @PostConstruct
    public void validate() {
        if (accountId == null || accountId.isBlank()) {
            throw new ConfigurationException("structurescout.account.account-id", accountId, "must not be blank");
        }
        if (initialEquity == null || initialEquity.signum() <= 0) {
            throw new ConfigurationException("structurescout.account.initial-equity", initialEquity, "must be positive");
        }
        if (initialPhase == null) {
            throw new ConfigurationException("structurescout.account.initial-phase", null, "is required");
        }
    }
}
