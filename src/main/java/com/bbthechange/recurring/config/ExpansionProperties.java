package com.bbthechange.recurring.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration for the asynchronous expansion worker.
 */
@Component
@ConfigurationProperties(prefix = "expansion")
public class ExpansionProperties {

    /** URL of the expansion queue, used when sending jobs over SQS. */
    private String queueUrl;

    /** Jobs are dropped after this many failed attempts. */
    private int maxAttempts = 10;

    /** Worker threads of the in-process sink. */
    private int localThreads = 2;

    public String getQueueUrl() {
        return queueUrl;
    }

    public void setQueueUrl(String queueUrl) {
        this.queueUrl = queueUrl;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public int getLocalThreads() {
        return localThreads;
    }

    public void setLocalThreads(int localThreads) {
        this.localThreads = localThreads;
    }
}
