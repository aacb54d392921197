package com.bbthechange.recurring.service;

import com.bbthechange.recurring.model.ExpansionJob;

/**
 * Materializes the occurrences of a series as concrete records and tracked instances.
 */
public interface ExpansionWorkerService {

    /**
     * Expand one series up to the job's horizon. Dates that are already tracked are left alone,
     * so a job can be repeated safely.
     *
     * @return number of records created
     */
    int process(ExpansionJob job);
}
