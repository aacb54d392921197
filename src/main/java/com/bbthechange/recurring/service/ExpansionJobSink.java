package com.bbthechange.recurring.service;

import com.bbthechange.recurring.model.ExpansionJob;

/**
 * Destination for asynchronous expansion work.
 */
public interface ExpansionJobSink {

    /**
     * Hand a job to the worker. Returns once the job is accepted, not when it has run.
     */
    void enqueue(ExpansionJob job);
}
