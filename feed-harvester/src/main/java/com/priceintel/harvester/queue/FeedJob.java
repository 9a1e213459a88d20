package com.priceintel.harvester.queue;

import com.priceintel.harvester.model.TriggerType;

import java.time.Instant;

/**
 * Run one feed. runId is null on the first attempt and carries the existing run on retries.
 */
public record FeedJob(String feedId, TriggerType trigger, String uniqueKey, String runId) implements Job {

    public static FeedJob scheduled(String feedId, Instant slot) {
        return new FeedJob(feedId, TriggerType.SCHEDULED, feedId + "-scheduled-" + slot.toEpochMilli(), null);
    }

    public static FeedJob manual(String feedId) {
        return new FeedJob(feedId, TriggerType.MANUAL, manualKey(feedId), null);
    }

    public static String manualKey(String feedId) {
        return feedId + "-manual";
    }

    public FeedJob withRunId(String runId) {
        return new FeedJob(feedId, trigger, uniqueKey, runId);
    }

    @Override
    public int priority() {
        return trigger == TriggerType.MANUAL ? PRIORITY_MANUAL : PRIORITY_SCHEDULED;
    }
}
