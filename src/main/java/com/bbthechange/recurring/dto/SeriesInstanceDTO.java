package com.bbthechange.recurring.dto;

import com.bbthechange.recurring.model.ExceptionType;
import com.bbthechange.recurring.model.SeriesInstance;
import com.bbthechange.recurring.model.TimeRange;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

@Data
@NoArgsConstructor
public class SeriesInstanceDTO {

    private String instanceId;
    private String seriesId;
    private LocalDate occurrenceDate;
    private String recordType;
    private String recordId;
    private boolean exception;
    private ExceptionType exceptionType;
    private TimeRange originalRange;
    private String exceptionReason;
    private String exceptionBy;
    private Instant exceptionAt;

    public SeriesInstanceDTO(SeriesInstance instance) {
        this.instanceId = instance.getInstanceId();
        this.seriesId = instance.getSeriesId();
        this.occurrenceDate = instance.getOccurrenceDate();
        this.recordType = instance.getRecordType();
        this.recordId = instance.getRecordId();
        this.exception = instance.isExceptionInstance();
        this.exceptionType = instance.getExceptionType();
        this.originalRange = instance.getOriginalTimeRange();
        this.exceptionReason = instance.getExceptionReason();
        this.exceptionBy = instance.getExceptionBy();
        this.exceptionAt = instance.getExceptionAt();
    }
}
