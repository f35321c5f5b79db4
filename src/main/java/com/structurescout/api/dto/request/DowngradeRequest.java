package com.structurescout.api.dto.request;

import com.structurescout.domain.enums.OperatingPhase;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for an administrative phase downgrade.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DowngradeRequest {

    @NotNull(message = "Target phase is required")
    private OperatingPhase targetPhase;

    @Size(max = 500, message = "Reason must be 500 characters or less")
    private String reason;
}
