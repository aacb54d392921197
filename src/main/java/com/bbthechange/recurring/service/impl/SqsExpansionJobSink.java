package com.bbthechange.recurring.service.impl;

import com.bbthechange.recurring.config.ExpansionProperties;
import com.bbthechange.recurring.model.ExpansionJob;
import com.bbthechange.recurring.service.ExpansionJobSink;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Sends expansion jobs to the SQS expansion queue.
 * Only active when expansion.sqs.enabled=true.
 */
@Service
@ConditionalOnProperty(name = "expansion.sqs.enabled", havingValue = "true")
public class SqsExpansionJobSink implements ExpansionJobSink {

    private static final Logger logger = LoggerFactory.getLogger(SqsExpansionJobSink.class);

    private final SqsAsyncClient sqsAsyncClient;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final String queueUrl;

    public SqsExpansionJobSink(SqsAsyncClient sqsAsyncClient, ObjectMapper objectMapper,
                               MeterRegistry meterRegistry, ExpansionProperties properties) {
        this.sqsAsyncClient = sqsAsyncClient;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.queueUrl = properties.getQueueUrl();
    }

    @Override
    public void enqueue(ExpansionJob job) {
        if (job.getJobId() == null) {
            job.setJobId(UUID.randomUUID().toString());
        }

        String messageBody;
        try {
            messageBody = objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize expansion job for series {}", job.getSeriesId(), e);
            meterRegistry.counter("recurring_expansion_jobs_total", "sink", "sqs", "status", "serialization_error").increment();
            throw new IllegalStateException("Could not serialize expansion job", e);
        }

        SendMessageRequest request = SendMessageRequest.builder()
            .queueUrl(queueUrl)
            .messageBody(messageBody)
            .build();

        CompletableFuture<?> future = sqsAsyncClient.sendMessage(request);
        future.whenComplete((response, error) -> {
            if (error != null) {
                logger.error("Failed to send expansion job {} for series {}", job.getJobId(), job.getSeriesId(), error);
                meterRegistry.counter("recurring_expansion_jobs_total", "sink", "sqs", "status", "error").increment();
            } else {
                logger.info("Sent expansion job {}: series={}, until={}, attempt={}",
                    job.getJobId(), job.getSeriesId(), job.getExpandUntil(), job.getAttempt());
                meterRegistry.counter("recurring_expansion_jobs_total", "sink", "sqs", "status", "success").increment();
            }
        });
    }
}
