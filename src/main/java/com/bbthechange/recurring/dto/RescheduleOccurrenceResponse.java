package com.bbthechange.recurring.dto;

import com.bbthechange.recurring.model.TimeRange;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * priorRange is the range the record had before this call. originalRange is the instance's
 * audit snapshot and stays null for records outside a series.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RescheduleOccurrenceResponse {
    private boolean ok;
    private TimeRange priorRange;
    private TimeRange originalRange;
    private TimeRange newRange;
}
