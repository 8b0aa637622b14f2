package com.ryuqq.railway.core.step;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 비동기 I/O를 수행하는 Step.
 *
 * <p>엔진은 Step 사이를 병렬로 실행하지 않습니다. {@link #run(Object)}은 future 완료를 기다린 뒤
 * 원래 예외를 꺼내 던지며, future가 취소되면 {@link CancellationException}을 그대로 전파합니다.</p>
 *
 * @param <I> 입력 타입
 * @param <O> 출력 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface AsyncStep<I, O> extends Step<I, O> {

    /**
     * 비동기 실행.
     *
     * @param input 입력 값
     * @return 출력 future
     */
    CompletableFuture<O> runAsync(I input);

    @Override
    default O run(I input) throws Exception {
        CompletableFuture<O> future = runAsync(input);
        if (future == null) {
            throw new IllegalStateException("runAsync returned null future: " + name());
        }
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            CancellationException cancelled = new CancellationException("Interrupted while awaiting " + name());
            cancelled.initCause(e);
            throw cancelled;
        } catch (ExecutionException e) {
            throw unwrap(e.getCause(), e);
        }
    }

    private static Exception unwrap(Throwable cause, Exception wrapper) {
        Throwable current = cause;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        if (current instanceof Exception exception) {
            return exception;
        }
        if (current instanceof Error error) {
            throw error;
        }
        return wrapper;
    }
}
