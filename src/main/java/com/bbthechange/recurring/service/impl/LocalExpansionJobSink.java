package com.bbthechange.recurring.service.impl;

import com.bbthechange.recurring.config.ExpansionProperties;
import com.bbthechange.recurring.model.ExpansionJob;
import com.bbthechange.recurring.service.ExpansionJobSink;
import com.bbthechange.recurring.service.ExpansionWorkerService;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs expansion jobs on a small in-process thread pool.
 * Active unless expansion.sqs.enabled=true. Jobs are lost on shutdown; the SQS sink is the durable option.
 */
@Service
@ConditionalOnProperty(name = "expansion.sqs.enabled", havingValue = "false", matchIfMissing = true)
public class LocalExpansionJobSink implements ExpansionJobSink {

    private static final Logger logger = LoggerFactory.getLogger(LocalExpansionJobSink.class);

    private final ExpansionWorkerService worker;
    private final ExpansionProperties properties;
    private final MeterRegistry meterRegistry;
    private final ExecutorService executor;

    public LocalExpansionJobSink(ExpansionWorkerService worker, ExpansionProperties properties,
                                 MeterRegistry meterRegistry) {
        this.worker = worker;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.executor = Executors.newFixedThreadPool(Math.max(1, properties.getLocalThreads()));
    }

    @Override
    public void enqueue(ExpansionJob job) {
        try {
            executor.submit(() -> run(job));
            meterRegistry.counter("recurring_expansion_jobs_total", "sink", "local", "status", "queued").increment();
        } catch (RejectedExecutionException e) {
            logger.error("Expansion job {} for series {} rejected, executor is shut down", job.getJobId(), job.getSeriesId());
            meterRegistry.counter("recurring_expansion_jobs_total", "sink", "local", "status", "rejected").increment();
        }
    }

    private void run(ExpansionJob job) {
        try {
            worker.process(job);
        } catch (RuntimeException e) {
            if (job.getAttempt() < properties.getMaxAttempts()) {
                logger.warn("Expansion job {} for series {} failed on attempt {}, re-queueing",
                    job.getJobId(), job.getSeriesId(), job.getAttempt(), e);
                enqueue(job.nextAttempt());
            } else {
                logger.error("Expansion job {} for series {} failed after {} attempts, giving up",
                    job.getJobId(), job.getSeriesId(), job.getAttempt(), e);
                meterRegistry.counter("recurring_expansion_jobs_total", "sink", "local", "status", "failed").increment();
            }
        }
    }

    @PreDestroy
    public void shutdown() throws InterruptedException {
        executor.shutdown();
        if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
            logger.warn("Expansion executor did not finish within 30s, {} jobs dropped", executor.shutdownNow().size());
        }
    }
}
