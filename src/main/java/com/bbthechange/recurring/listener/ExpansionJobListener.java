package com.bbthechange.recurring.listener;

import com.bbthechange.recurring.config.ExpansionProperties;
import com.bbthechange.recurring.model.ExpansionJob;
import com.bbthechange.recurring.service.ExpansionJobSink;
import com.bbthechange.recurring.service.ExpansionWorkerService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.awspring.cloud.sqs.annotation.SqsListener;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * SQS listener for series expansion jobs.
 * Failed jobs are re-queued with an incremented attempt until expansion.max-attempts is reached;
 * the received message is always acknowledged.
 */
@Component
@ConditionalOnProperty(name = "expansion.sqs.enabled", havingValue = "true")
public class ExpansionJobListener {

    private static final Logger logger = LoggerFactory.getLogger(ExpansionJobListener.class);

    private final ExpansionWorkerService worker;
    private final ExpansionJobSink jobSink;
    private final ExpansionProperties properties;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    public ExpansionJobListener(ExpansionWorkerService worker,
                                ExpansionJobSink jobSink,
                                ExpansionProperties properties,
                                ObjectMapper objectMapper,
                                MeterRegistry meterRegistry) {
        this.worker = worker;
        this.jobSink = jobSink;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
    }

    @SqsListener(value = "${expansion.queue}", factory = "expansionListenerFactory")
    public void handleMessage(String messageBody) {
        ExpansionJob job = null;
        try {
            JsonNode node = objectMapper.readTree(messageBody);
            JsonNode typeNode = node.get("type");

            if (typeNode == null || typeNode.isNull()) {
                logger.warn("Received expansion message without type field: {}", messageBody);
                meterRegistry.counter("recurring_expansion_messages_total", "status", "missing_type").increment();
                return;
            }

            String messageType = typeNode.asText();
            if (!ExpansionJob.TYPE.equals(messageType)) {
                logger.warn("Unknown expansion message type: {}", messageType);
                meterRegistry.counter("recurring_expansion_messages_total", "status", "unknown_type").increment();
                return;
            }

            job = objectMapper.treeToValue(node, ExpansionJob.class);
            logger.info("Processing expansion job {}: series={}, attempt={}", job.getJobId(), job.getSeriesId(), job.getAttempt());
            worker.process(job);
            meterRegistry.counter("recurring_expansion_messages_total", "status", "success").increment();

        } catch (Exception e) {
            logger.error("Error processing expansion message: {}", messageBody, e);
            meterRegistry.counter("recurring_expansion_messages_total", "status", "error").increment();
            retry(job);
            // Don't rethrow - the retry is a new message, this one is acknowledged
        }
    }

    private void retry(ExpansionJob job) {
        if (job == null) {
            return;
        }
        if (job.getAttempt() >= properties.getMaxAttempts()) {
            logger.error("Expansion job {} for series {} failed after {} attempts, giving up",
                job.getJobId(), job.getSeriesId(), job.getAttempt());
            meterRegistry.counter("recurring_expansion_jobs_total", "sink", "sqs", "status", "failed").increment();
            return;
        }
        try {
            jobSink.enqueue(job.nextAttempt());
        } catch (RuntimeException e) {
            logger.error("Could not re-queue expansion job {} for series {}", job.getJobId(), job.getSeriesId(), e);
            meterRegistry.counter("recurring_expansion_jobs_total", "sink", "sqs", "status", "requeue_error").increment();
        }
    }
}
