package com.bbthechange.recurring.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request DTO for queueing expansion. A missing {@code until} uses the configured horizon.
 */
@Data
@NoArgsConstructor
public class ExpandRequest {
    private Instant until;
}
