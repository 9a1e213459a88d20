package com.priceintel.harvester.queue;

import lombok.Getter;

/**
 * Signals a transient failure. The queue re-runs {@link #getRetryJob()} after a backoff,
 * unless attempts are exhausted.
 */
@Getter
public class RetryableJobException extends RuntimeException {

    private final Job retryJob;

    public RetryableJobException(Job retryJob, String message, Throwable cause) {
        super(message, cause);
        this.retryJob = retryJob;
    }
}
