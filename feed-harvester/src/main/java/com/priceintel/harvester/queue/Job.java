package com.priceintel.harvester.queue;

/**
 * A unit of queued work. While a job with a given unique key is pending, a second job with
 * the same key is refused.
 */
public interface Job {

    int PRIORITY_MANUAL = 10;
    int PRIORITY_SCHEDULED = 5;
    int PRIORITY_BACKGROUND = 1;

    String uniqueKey();

    /** Higher runs first. */
    int priority();
}
