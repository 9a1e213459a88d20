package com.priceintel.harvester.queue;

/**
 * Which attempt of a job is running. Attempts are 1-based.
 */
public record JobAttempt(int number, int maxAttempts) {

    public boolean isFinal() {
        return number >= maxAttempts;
    }
}
