package com.ryuqq.railway.adapter.inmemory.task;

import com.ryuqq.railway.core.spi.BackgroundTaskServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongConsumer;

/**
 * In-memory implementation of {@link BackgroundTaskServer} for testing and reference purposes.
 *
 * <p>Jobs run on the calling thread. Until a worker is bound with {@link #bind(LongConsumer)} enqueued ids are
 * only recorded; binding a worker (or calling {@link #runPending()}) executes them in enqueue order.
 * A job enqueued while another one is running is executed after it, never re-entrantly.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryTaskServer taskServer = new InMemoryTaskServer();
 * DeadLetterService deadLetters = new DeadLetterService(factory, taskServer, clock);
 * ManifestExecutor executor = new ManifestExecutor(...);
 * taskServer.bind(executor::execute);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InMemoryTaskServer implements BackgroundTaskServer {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskServer.class);

    private final AtomicLong jobSequence = new AtomicLong();
    private final Deque<Long> pending = new ArrayDeque<>();
    private final List<Long> enqueued = new ArrayList<>();
    private LongConsumer worker;
    private boolean running;

    @Override
    public synchronized String enqueue(long metadataId) {
        String jobId = "inmemory-" + jobSequence.incrementAndGet();
        pending.add(metadataId);
        enqueued.add(metadataId);
        log.debug("Enqueued metadata {} as job {}", metadataId, jobId);
        if (worker != null) {
            runPending();
        }
        return jobId;
    }

    /**
     * Binds the worker and runs everything enqueued so far.
     *
     * @param worker executes one metadata id
     */
    public synchronized void bind(LongConsumer worker) {
        if (worker == null) {
            throw new IllegalArgumentException("worker cannot be null");
        }
        this.worker = worker;
        runPending();
    }

    /**
     * Runs pending jobs in order. A failing job is logged and does not stop the rest.
     *
     * @return number of executed jobs
     */
    public synchronized int runPending() {
        if (worker == null) {
            throw new IllegalStateException("No worker bound");
        }
        if (running) {
            return 0;
        }
        running = true;
        int executed = 0;
        try {
            while (!pending.isEmpty()) {
                long metadataId = pending.poll();
                try {
                    worker.accept(metadataId);
                } catch (RuntimeException e) {
                    log.error("Background job for metadata {} failed", metadataId, e);
                }
                executed++;
            }
        } finally {
            running = false;
        }
        return executed;
    }

    /**
     * Every metadata id ever enqueued, in order.
     *
     * @return enqueued ids
     */
    public synchronized List<Long> enqueuedIds() {
        return List.copyOf(enqueued);
    }

    public synchronized int pendingCount() {
        return pending.size();
    }
}
