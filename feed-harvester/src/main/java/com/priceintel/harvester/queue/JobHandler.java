package com.priceintel.harvester.queue;

public interface JobHandler {

    /**
     * Executes one attempt. Throw {@link RetryableJobException} to ask for another attempt;
     * any other exception ends the job.
     */
    void handle(Job job, JobAttempt attempt);
}
