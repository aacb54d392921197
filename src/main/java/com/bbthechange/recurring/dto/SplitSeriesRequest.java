package com.bbthechange.recurring.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

/**
 * Request DTO for "edit this and future": the series continues as a new version from splitDate.
 */
@Data
@NoArgsConstructor
public class SplitSeriesRequest {

    @NotNull(message = "Split date is required")
    private LocalDate splitDate;

    @NotNull(message = "New anchor is required")
    private Instant newAnchor;

    /** Defaults to the current duration. */
    private Duration newDuration;

    /** Merged onto the current template; keys here win. */
    private Map<String, Object> templateDelta;
}
