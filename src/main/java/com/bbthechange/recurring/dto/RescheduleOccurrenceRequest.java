package com.bbthechange.recurring.dto;

import com.bbthechange.recurring.model.TimeRange;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class RescheduleOccurrenceRequest {

    @NotNull(message = "New range is required")
    private TimeRange newRange;
}
