package com.priceintel.harvester.scheduler;

import com.priceintel.harvester.queue.FeedJob;
import com.priceintel.harvester.queue.InMemoryWorkQueue;
import com.priceintel.harvester.queue.Job;
import com.priceintel.harvester.queue.JobAttempt;
import com.priceintel.harvester.queue.JobHandler;
import com.priceintel.harvester.queue.ResolveJob;
import com.priceintel.harvester.resolver.ProductResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Routes queued jobs to their processors. Starts the queue's workers once the application
 * context is ready.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JobDispatcher implements JobHandler {

    private final FeedRunProcessor feedRunProcessor;
    private final ProductResolver productResolver;
    private final InMemoryWorkQueue workQueue;

    @EventListener(ApplicationReadyEvent.class)
    public void startWorkers() {
        workQueue.start(this);
    }

    @Override
    public void handle(Job job, JobAttempt attempt) {
        if (job instanceof FeedJob feedJob) {
            feedRunProcessor.process(feedJob, attempt);
        } else if (job instanceof ResolveJob resolveJob) {
            productResolver.resolveProducts(resolveJob.sourceProductIds());
        } else {
            log.warn("No handler for job {} of type {}", job.uniqueKey(), job.getClass().getSimpleName());
        }
    }
}
