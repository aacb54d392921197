package com.bbthechange.recurring.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.UUID;

/**
 * Unit of asynchronous expansion work: materialize a series up to a horizon.
 * A null {@code expandFrom} expands from the series anchor.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExpansionJob {

    public static final String TYPE = "EXPAND_SERIES";

    private String type = TYPE;
    private String jobId;
    private String seriesId;
    private Instant expandFrom;
    private Instant expandUntil;
    private int attempt = 1;

    public ExpansionJob() {
    }

    public ExpansionJob(String jobId, String seriesId, Instant expandFrom, Instant expandUntil) {
        this.jobId = jobId;
        this.seriesId = seriesId;
        this.expandFrom = expandFrom;
        this.expandUntil = expandUntil;
    }

    public static ExpansionJob forSeries(String seriesId, Instant expandUntil) {
        return new ExpansionJob(UUID.randomUUID().toString(), seriesId, null, expandUntil);
    }

    public static ExpansionJob forSeries(String seriesId, Instant expandFrom, Instant expandUntil) {
        return new ExpansionJob(UUID.randomUUID().toString(), seriesId, expandFrom, expandUntil);
    }

    public ExpansionJob nextAttempt() {
        ExpansionJob retry = new ExpansionJob(jobId, seriesId, expandFrom, expandUntil);
        retry.setAttempt(attempt + 1);
        return retry;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public String getSeriesId() {
        return seriesId;
    }

    public void setSeriesId(String seriesId) {
        this.seriesId = seriesId;
    }

    public Instant getExpandFrom() {
        return expandFrom;
    }

    public void setExpandFrom(Instant expandFrom) {
        this.expandFrom = expandFrom;
    }

    public Instant getExpandUntil() {
        return expandUntil;
    }

    public void setExpandUntil(Instant expandUntil) {
        this.expandUntil = expandUntil;
    }

    public int getAttempt() {
        return attempt;
    }

    public void setAttempt(int attempt) {
        this.attempt = attempt;
    }
}
