package com.priceintel.harvester.queue;

import com.priceintel.harvester.model.TriggerType;
import io.github.resilience4j.core.IntervalFunction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryWorkQueueTest {

    private static final Instant SLOT = Instant.parse("2024-06-01T12:00:00Z");

    private InMemoryWorkQueue queue;

    @AfterEach
    void tearDown() {
        if (queue != null) queue.shutdown();
    }

    private InMemoryWorkQueue newQueue(int workers, int maxAttempts) {
        queue = new InMemoryWorkQueue(workers, maxAttempts, IntervalFunction.of(Duration.ofMillis(10)));
        return queue;
    }

    @Test
    @DisplayName("manual jobs run before scheduled ones, background last, FIFO within a priority")
    void priorityOrder() throws Exception {
        newQueue(1, 1);
        List<String> order = new CopyOnWriteArrayList<>();

        queue.enqueue(new ResolveJob("resolve-1", List.of("sp-1")));
        queue.enqueue(FeedJob.scheduled("a", SLOT));
        queue.enqueue(FeedJob.scheduled("b", SLOT));
        queue.enqueue(FeedJob.manual("c"));
        queue.start((job, attempt) -> order.add(job.uniqueKey()));

        assertTrue(queue.awaitIdle(Duration.ofSeconds(5)));
        assertEquals(List.of(FeedJob.manualKey("c"), FeedJob.scheduled("a", SLOT).uniqueKey(),
                FeedJob.scheduled("b", SLOT).uniqueKey(), "resolve-1"), order);
    }

    @Test
    @DisplayName("a unique key is refused while pending and accepted again once done")
    void dedup() throws Exception {
        newQueue(1, 1);
        CountDownLatch release = new CountDownLatch(1);

        assertTrue(queue.enqueue(FeedJob.manual("a")));
        assertFalse(queue.enqueue(FeedJob.manual("a")));
        assertTrue(queue.hasPending(FeedJob.manualKey("a")));

        queue.start((job, attempt) -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        assertFalse(queue.enqueue(FeedJob.manual("a")));

        release.countDown();
        assertTrue(queue.awaitIdle(Duration.ofSeconds(5)));
        assertTrue(queue.enqueue(FeedJob.manual("a")));
    }

    @Test
    @DisplayName("retryable failures re-run the job carried by the exception until it succeeds")
    void retries() throws Exception {
        newQueue(2, 3);
        List<JobAttempt> attempts = new CopyOnWriteArrayList<>();
        List<String> runIds = new CopyOnWriteArrayList<>();

        queue.start((job, attempt) -> {
            FeedJob feedJob = (FeedJob) job;
            attempts.add(attempt);
            runIds.add(String.valueOf(feedJob.runId()));
            if (attempt.number() < 3) {
                throw new RetryableJobException(feedJob.withRunId("run-1"), "timeout", null);
            }
        });
        queue.enqueue(FeedJob.manual("a"));

        assertTrue(queue.awaitIdle(Duration.ofSeconds(5)));
        assertEquals(List.of(new JobAttempt(1, 3), new JobAttempt(2, 3), new JobAttempt(3, 3)), attempts);
        assertEquals(List.of("null", "run-1", "run-1"), runIds);
        assertTrue(attempts.get(2).isFinal());
    }

    @Test
    @DisplayName("exhausted retries and non-retryable failures release the key")
    void failuresReleaseKey() throws Exception {
        newQueue(1, 2);
        List<Integer> seen = new CopyOnWriteArrayList<>();

        queue.start((job, attempt) -> {
            seen.add(attempt.number());
            if (job instanceof FeedJob) throw new RetryableJobException(job, "still down", null);
            throw new IllegalStateException("boom");
        });
        queue.enqueue(FeedJob.manual("a"));
        queue.enqueue(new ResolveJob("resolve-1", List.of()));

        assertTrue(queue.awaitIdle(Duration.ofSeconds(5)));
        assertEquals(3, seen.size());
        assertEquals(0, queue.pendingCount());
        assertFalse(queue.hasPending(FeedJob.manualKey("a")));
    }

    @Test
    @DisplayName("shutdown stops intake")
    void shutdownRejects() {
        newQueue(1, 1);
        queue.start((job, attempt) -> { });
        queue.shutdown();

        assertFalse(queue.enqueue(new FeedJob("a", TriggerType.MANUAL, "k", null)));
        assertThrows(IllegalStateException.class, () -> queue.start((job, attempt) -> { }));
    }
}
