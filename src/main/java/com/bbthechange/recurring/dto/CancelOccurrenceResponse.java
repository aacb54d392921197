package com.bbthechange.recurring.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Result of a cancel. seriesId and occurrenceDate are null when the record was not part of a series.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CancelOccurrenceResponse {
    private boolean ok;
    private String seriesId;
    private LocalDate occurrenceDate;
}
