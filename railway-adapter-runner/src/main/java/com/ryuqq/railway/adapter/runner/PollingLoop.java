package com.ryuqq.railway.adapter.runner;

import com.ryuqq.railway.application.runtime.Runtime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * {@link Runtime}을 고정 지연으로 반복 호출하는 루프.
 *
 * <p>ManifestDispatcher, WorkQueueDispatcher, StuckJobReaper, MetadataCleaner를 각자의 주기로 실행할 때
 * 사용합니다. pump() 예외는 로그로 남기고 다음 주기에 다시 시도합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PollingLoop implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PollingLoop.class);

    private final String name;
    private final Runtime runtime;
    private final long intervalMs;
    private ScheduledExecutorService scheduler;

    public PollingLoop(String name, Runtime runtime, long intervalMs) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (runtime == null) {
            throw new IllegalArgumentException("runtime cannot be null");
        }
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be positive (current: " + intervalMs + ")");
        }
        this.name = name;
        this.runtime = runtime;
        this.intervalMs = intervalMs;
    }

    public synchronized void start() {
        if (scheduler != null) {
            throw new IllegalStateException("PollingLoop " + name + " is already started");
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "railway-" + name);
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::tick, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("PollingLoop {} started (interval: {}ms)", name, intervalMs);
    }

    public synchronized boolean isRunning() {
        return scheduler != null && !scheduler.isShutdown();
    }

    /**
     * 루프 종료. 진행 중인 pump()가 끝날 때까지 intervalMs 만큼 대기합니다.
     */
    @Override
    public synchronized void close() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(intervalMs, TimeUnit.MILLISECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        log.info("PollingLoop {} stopped", name);
    }

    void tick() {
        try {
            int processed = runtime.pump();
            if (processed > 0) {
                log.debug("PollingLoop {} processed {} items", name, processed);
            }
        } catch (Exception e) {
            log.error("PollingLoop {} pump failed", name, e);
        }
    }
}
