package com.structurescout.api.dto.request;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EquityRequest {

    @NotNull(message = "Equity is required")
    @DecimalMin(value = "0.01", message = "Equity must be positive")
    private BigDecimal equity;
}
