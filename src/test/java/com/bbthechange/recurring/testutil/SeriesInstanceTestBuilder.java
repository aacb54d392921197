package com.bbthechange.recurring.testutil;

import com.bbthechange.recurring.model.ExceptionType;
import com.bbthechange.recurring.model.SeriesInstance;

import java.time.LocalDate;
import java.util.UUID;

public class SeriesInstanceTestBuilder {

    private String seriesId = UUID.randomUUID().toString();
    private LocalDate occurrenceDate = LocalDate.of(2025, 3, 3);
    private String recordType = "booking";
    private String recordId = UUID.randomUUID().toString();
    private ExceptionType exceptionType;

    private SeriesInstanceTestBuilder() {
    }

    public static SeriesInstanceTestBuilder anInstance() {
        return new SeriesInstanceTestBuilder();
    }

    public SeriesInstanceTestBuilder forSeries(String seriesId) {
        this.seriesId = seriesId;
        return this;
    }

    public SeriesInstanceTestBuilder on(LocalDate occurrenceDate) {
        this.occurrenceDate = occurrenceDate;
        return this;
    }

    public SeriesInstanceTestBuilder withRecordId(String recordId) {
        this.recordId = recordId;
        return this;
    }

    public SeriesInstanceTestBuilder withoutRecord() {
        this.recordId = null;
        return this;
    }

    public SeriesInstanceTestBuilder asException(ExceptionType exceptionType) {
        this.exceptionType = exceptionType;
        return this;
    }

    public SeriesInstance build() {
        SeriesInstance instance = new SeriesInstance(seriesId, occurrenceDate, recordType);
        if (recordId != null) {
            instance.linkRecord(recordId);
        }
        if (exceptionType != null) {
            instance.markException(exceptionType, "test", "user-1");
        } else {
            instance.setException(false);
            instance.setExceptionType(ExceptionType.NONE);
        }
        instance.setVersion(1L);
        return instance;
    }
}
