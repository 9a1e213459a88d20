package com.priceintel.harvester.queue;

public interface WorkQueue {

    /**
     * @return false when a job with the same unique key is already pending, or the queue is shut down
     */
    boolean enqueue(Job job);

    /** True while a job with this key is waiting, running or scheduled for retry. */
    boolean hasPending(String uniqueKey);
}
