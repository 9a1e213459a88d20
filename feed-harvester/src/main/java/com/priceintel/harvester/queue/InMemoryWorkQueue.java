package com.priceintel.harvester.queue;

import io.github.resilience4j.core.IntervalFunction;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Comparator;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local work queue with a fixed worker pool.
 *
 * Jobs run highest priority first, FIFO within a priority. A unique key stays pending from
 * enqueue until the job finishes for good, retries included. Retries are delayed by the
 * backoff function and capped at maxAttempts.
 *
 * Lifecycle is explicit: jobs may be enqueued before {@link #start(JobHandler)}, and
 * {@link #shutdown()} stops intake and waits for running jobs.
 */
@Slf4j
public class InMemoryWorkQueue implements WorkQueue {

    private static final Duration POLL_INTERVAL = Duration.ofMillis(250);
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private final int workers;
    private final int maxAttempts;
    private final IntervalFunction backoff;

    private final PriorityBlockingQueue<Entry> queue = new PriorityBlockingQueue<>(64,
            Comparator.comparingInt((Entry e) -> -e.job().priority()).thenComparingLong(Entry::sequence));
    private final Set<String> pendingKeys = ConcurrentHashMap.newKeySet();
    private final AtomicLong sequence = new AtomicLong();

    private volatile boolean accepting = true;
    private volatile boolean running;
    private JobHandler handler;
    private ExecutorService workerPool;
    private ScheduledExecutorService retryScheduler;

    public InMemoryWorkQueue(int workers, int maxAttempts, IntervalFunction backoff) {
        if (workers < 1) throw new IllegalArgumentException("workers must be >= 1");
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        this.workers = workers;
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
    }

    public synchronized void start(JobHandler handler) {
        if (running) throw new IllegalStateException("Work queue already started");
        if (!accepting) throw new IllegalStateException("Work queue has been shut down");

        this.handler = handler;
        this.running = true;
        this.workerPool = Executors.newFixedThreadPool(workers, threadFactory("harvest-worker-"));
        this.retryScheduler = Executors.newSingleThreadScheduledExecutor(threadFactory("harvest-retry-"));
        for (int i = 0; i < workers; i++) {
            workerPool.submit(this::workLoop);
        }
        log.info("Work queue started with {} workers, {} max attempts", workers, maxAttempts);
    }

    public synchronized void shutdown() {
        accepting = false;
        if (!running) return;
        running = false;

        retryScheduler.shutdownNow();
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Workers still busy after {}s; interrupting", SHUTDOWN_GRACE.toSeconds());
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Work queue stopped; {} jobs left unprocessed", queue.size());
    }

    @Override
    public boolean enqueue(Job job) {
        if (!accepting) {
            log.warn("Rejected job {}: queue is shut down", job.uniqueKey());
            return false;
        }
        if (!pendingKeys.add(job.uniqueKey())) {
            log.debug("Job {} already pending", job.uniqueKey());
            return false;
        }
        queue.put(new Entry(job, 1, sequence.incrementAndGet()));
        return true;
    }

    @Override
    public boolean hasPending(String uniqueKey) {
        return pendingKeys.contains(uniqueKey);
    }

    public int pendingCount() {
        return pendingKeys.size();
    }

    /**
     * Blocks until no job is pending or the timeout passes.
     *
     * @return true when the queue drained
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!pendingKeys.isEmpty()) {
            if (System.nanoTime() > deadline) return false;
            Thread.sleep(10);
        }
        return true;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void workLoop() {
        while (running) {
            Entry entry;
            try {
                entry = queue.poll(POLL_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (entry != null) execute(entry);
        }
    }

    private void execute(Entry entry) {
        Job job = entry.job();
        boolean rescheduled = false;
        try {
            handler.handle(job, new JobAttempt(entry.attempt(), maxAttempts));

        } catch (RetryableJobException e) {
            if (entry.attempt() < maxAttempts && running) {
                rescheduled = scheduleRetry(entry, e);
            } else {
                log.error("Job {} failed after {} attempts: {}", job.uniqueKey(), entry.attempt(), e.getMessage());
            }
        } catch (RuntimeException e) {
            log.error("Job {} failed: {}", job.uniqueKey(), e.getMessage(), e);
        } finally {
            if (!rescheduled) pendingKeys.remove(job.uniqueKey());
        }
    }

    private boolean scheduleRetry(Entry entry, RetryableJobException e) {
        Job retry = e.getRetryJob() != null ? e.getRetryJob() : entry.job();
        long delayMs = backoff.apply(entry.attempt());
        if (!retry.uniqueKey().equals(entry.job().uniqueKey())) {
            pendingKeys.remove(entry.job().uniqueKey());
            pendingKeys.add(retry.uniqueKey());
        }

        log.warn("Job {} attempt {}/{} failed ({}); retrying in {} ms",
                retry.uniqueKey(), entry.attempt(), maxAttempts, e.getMessage(), delayMs);
        Entry next = new Entry(retry, entry.attempt() + 1, sequence.incrementAndGet());
        try {
            retryScheduler.schedule(() -> queue.put(next), delayMs, TimeUnit.MILLISECONDS);
            return true;
        } catch (RuntimeException rejected) {
            log.warn("Could not schedule retry for {}: {}", retry.uniqueKey(), rejected.getMessage());
            pendingKeys.remove(retry.uniqueKey());
            return false;
        }
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record Entry(Job job, int attempt, long sequence) {}
}
