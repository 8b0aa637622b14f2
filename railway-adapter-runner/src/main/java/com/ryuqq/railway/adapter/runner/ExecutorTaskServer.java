package com.ryuqq.railway.adapter.runner;

import com.ryuqq.railway.core.spi.BackgroundTaskServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.LongConsumer;

/**
 * 스레드 풀 기반 {@link BackgroundTaskServer} 구현체.
 *
 * <p>enqueue된 Metadata id를 고정 크기 스레드 풀에서 실행합니다. 워커는 {@link #start(LongConsumer)}로
 * 나중에 연결하므로 DeadLetterService처럼 task server가 필요한 컴포넌트를 먼저 만들 수 있습니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>작업 제출 및 job id 발급</li>
 *   <li>작업 실패 로깅 (다른 작업에 영향 없음)</li>
 *   <li>graceful shutdown</li>
 * </ul>
 *
 * <pre>
 * ExecutorTaskServer taskServer = new ExecutorTaskServer(new ExecutorTaskServerConfig());
 * DeadLetterService deadLetters = new DeadLetterService(factory, taskServer, clock);
 * ManifestExecutor executor = new ManifestExecutor(...);
 * taskServer.start(executor::execute);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExecutorTaskServer implements BackgroundTaskServer {

    private static final Logger log = LoggerFactory.getLogger(ExecutorTaskServer.class);

    private final ExecutorTaskServerConfig config;
    private final ExecutorService workerExecutor;
    private volatile LongConsumer worker;

    public ExecutorTaskServer(ExecutorTaskServerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.workerExecutor = Executors.newFixedThreadPool(config.concurrency());
    }

    /**
     * 워커 연결. 이후 enqueue된 작업부터 실행됩니다.
     *
     * @param worker Metadata id 하나를 실행하는 워커
     * @throws IllegalStateException 이미 시작된 경우
     */
    public synchronized void start(LongConsumer worker) {
        if (worker == null) {
            throw new IllegalArgumentException("worker cannot be null");
        }
        if (this.worker != null) {
            throw new IllegalStateException("ExecutorTaskServer is already started");
        }
        this.worker = worker;
    }

    /**
     * @throws IllegalStateException 워커가 연결되지 않았거나 종료된 경우
     */
    @Override
    public String enqueue(long metadataId) {
        LongConsumer current = worker;
        if (current == null) {
            throw new IllegalStateException("ExecutorTaskServer is not started");
        }
        String jobId = UUID.randomUUID().toString();
        try {
            workerExecutor.submit(() -> run(current, jobId, metadataId));
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("ExecutorTaskServer is shut down", e);
        }
        log.debug("Enqueued metadata {} as job {}", metadataId, jobId);
        return jobId;
    }

    /**
     * 서버 종료 (리소스 정리).
     *
     * <p>진행 중인 작업이 완료되도록 shutdownTimeoutMs 동안 대기합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            log.warn("Background jobs did not finish within {}ms, interrupting", config.shutdownTimeoutMs());
            workerExecutor.shutdownNow();
        }
    }

    private void run(LongConsumer current, String jobId, long metadataId) {
        try {
            current.accept(metadataId);
        } catch (Exception e) {
            log.error("Background job {} for metadata {} failed", jobId, metadataId, e);
        }
    }
}
