package com.bbthechange.recurring.service.impl;

import com.bbthechange.recurring.config.ExpansionProperties;
import com.bbthechange.recurring.model.ExpansionJob;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageResponse;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SqsExpansionJobSinkTest {

    private static final String QUEUE_URL = "https://sqs.us-west-2.amazonaws.com/123456789012/series-expansion";

    @Mock
    private SqsAsyncClient sqsAsyncClient;

    private ObjectMapper objectMapper;
    private SimpleMeterRegistry meterRegistry;
    private SqsExpansionJobSink sink;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        meterRegistry = new SimpleMeterRegistry();
        ExpansionProperties properties = new ExpansionProperties();
        properties.setQueueUrl(QUEUE_URL);
        sink = new SqsExpansionJobSink(sqsAsyncClient, objectMapper, meterRegistry, properties);
    }

    @Test
    void enqueue_SendsJobAsJson() throws Exception {
        // Given
        String seriesId = UUID.randomUUID().toString();
        ExpansionJob job = ExpansionJob.forSeries(seriesId, Instant.parse("2025-06-01T00:00:00Z"));
        when(sqsAsyncClient.sendMessage(any(SendMessageRequest.class)))
            .thenReturn(CompletableFuture.completedFuture(SendMessageResponse.builder().messageId("m-1").build()));

        // When
        sink.enqueue(job);

        // Then
        ArgumentCaptor<SendMessageRequest> captor = ArgumentCaptor.forClass(SendMessageRequest.class);
        verify(sqsAsyncClient).sendMessage(captor.capture());
        assertThat(captor.getValue().queueUrl()).isEqualTo(QUEUE_URL);
        JsonNode body = objectMapper.readTree(captor.getValue().messageBody());
        assertThat(body.get("type").asText()).isEqualTo(ExpansionJob.TYPE);
        assertThat(body.get("seriesId").asText()).isEqualTo(seriesId);
        assertThat(body.get("attempt").asInt()).isEqualTo(1);
        assertThat(meterRegistry.counter("recurring_expansion_jobs_total", "sink", "sqs", "status", "success").count())
            .isEqualTo(1.0);
    }

    @Test
    void enqueue_WhenSendFails_CountsError() {
        // Given
        ExpansionJob job = ExpansionJob.forSeries(UUID.randomUUID().toString(), Instant.parse("2025-06-01T00:00:00Z"));
        when(sqsAsyncClient.sendMessage(any(SendMessageRequest.class)))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("queue unavailable")));

        // When
        sink.enqueue(job);

        // Then
        assertThat(meterRegistry.counter("recurring_expansion_jobs_total", "sink", "sqs", "status", "error").count())
            .isEqualTo(1.0);
    }
}
