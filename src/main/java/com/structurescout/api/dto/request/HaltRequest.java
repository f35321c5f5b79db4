package com.structurescout.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a manual trading halt. {@code confirm} must be the literal "CONFIRM".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HaltRequest {

    @NotBlank(message = "Halt requires 'confirm': 'CONFIRM'")
    private String confirm;

    @Size(max = 500, message = "Reason must be 500 characters or less")
    private String reason;
}
