package com.bbthechange.recurring.dto;

import com.bbthechange.recurring.model.Series;
import com.bbthechange.recurring.model.SeriesStatus;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

/**
 * Snapshot of one series version for presentation.
 */
@Data
@NoArgsConstructor
public class SeriesVersionDTO {

    private String seriesId;
    private Integer versionNumber;
    private String rule;
    private Instant anchor;
    private Duration duration;
    private String timezone;
    private SeriesStatus status;
    private LocalDate effectiveFrom;
    private LocalDate effectiveUntil;
    private Map<String, Object> template;

    public SeriesVersionDTO(Series series) {
        this.seriesId = series.getSeriesId();
        this.versionNumber = series.getVersionNumber();
        this.rule = series.getRule();
        this.anchor = series.getAnchor();
        this.duration = series.getDuration();
        this.timezone = series.getTimezone();
        this.status = series.getStatus();
        this.effectiveFrom = series.getEffectiveFrom();
        this.effectiveUntil = series.getEffectiveUntil();
        this.template = series.getTemplate();
    }
}
