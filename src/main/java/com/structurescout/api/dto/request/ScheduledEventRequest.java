package com.structurescout.api.dto.request;

import com.structurescout.domain.enums.EventImpact;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for registering a scheduled economic event. Impact is optional; when absent it is
 * classified from the title.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledEventRequest {

    @NotBlank(message = "Event title is required")
    private String title;

    @NotNull(message = "Event time is required")
    private Instant eventTime;

    private EventImpact impact;
}
