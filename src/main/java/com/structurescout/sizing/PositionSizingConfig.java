package com.structurescout.sizing;

import com.structurescout.exception.ConfigurationException;
import jakarta.annotation.PostConstruct;
import java.math.BigDecimal;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for position sizing, bound from {@code structurescout.sizing.*}.
 *
 * <p>Defaults:
 * <ul>
 *   <li>microLiveFixedSize: 2 contracts</li>
 *   <li>riskFraction: 0.01 (risk 1% of equity per trade in FULL_LIVE)</li>
 *   <li>contractRiskPerUnit: 2.00 dollars per index point per contract (micro NAS100)</li>
 *   <li>maxContracts: 10 (hard cap)</li>
 * </ul>
 */
@Data
@Component
@ConfigurationProperties(prefix = "structurescout.sizing")
public class PositionSizingConfig {

    private int microLiveFixedSize = 2;
    private BigDecimal riskFraction = new BigDecimal("0.01");
    private BigDecimal contractRiskPerUnit = new BigDecimal("2.00");
    private int maxContracts = 10;

    @PostConstruct
    public void validate() {
        if (microLiveFixedSize <= 0) {
            throw new ConfigurationException(
                    "structurescout.sizing.micro-live-fixed-size", microLiveFixedSize, "must be positive");
        }
        if (riskFraction == null || riskFraction.signum() <= 0 || riskFraction.compareTo(BigDecimal.ONE) > 0) {
            throw new ConfigurationException("structurescout.sizing.risk-fraction", riskFraction, "must be in (0, 1]");
        }
        if (contractRiskPerUnit == null || contractRiskPerUnit.signum() <= 0) {
            throw new ConfigurationException(
                    "structurescout.sizing.contract-risk-per-unit", contractRiskPerUnit, "must be positive");
        }
        if (maxContracts < microLiveFixedSize) {
            throw new ConfigurationException(
                    "structurescout.sizing.max-contracts", maxContracts, "must be at least micro-live-fixed-size");
        }
    }
}
