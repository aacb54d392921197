package com.bbthechange.recurring.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Request DTO for replacing a series' schedule. All three values are required.
 */
@Data
@NoArgsConstructor
public class UpdateScheduleRequest {
    private Instant anchor;
    private Duration duration;
    private String rule;
}
