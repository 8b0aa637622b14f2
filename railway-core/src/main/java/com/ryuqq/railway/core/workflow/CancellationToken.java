package com.ryuqq.railway.core.workflow;

import java.util.concurrent.CancellationException;

/**
 * Workflow 실행 취소 신호.
 *
 * <p>Workflow는 매 Step 실행 직전에 신호를 확인합니다. 토큰은 메모리에도 저장되므로
 * 오래 걸리는 Step은 생성자 인자로 받아 스스로 확인할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private volatile boolean cancellationRequested;

    public CancellationToken() {
        this(true);
    }

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * 절대 취소되지 않는 공유 토큰.
     *
     * @return NONE 토큰
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * 취소 요청.
     *
     * @throws IllegalStateException {@link #none()} 토큰에 호출한 경우
     */
    public void cancel() {
        if (!cancellable) {
            throw new IllegalStateException("CancellationToken.none() cannot be cancelled");
        }
        cancellationRequested = true;
    }

    public boolean isCancellationRequested() {
        return cancellationRequested;
    }

    /**
     * 취소되었으면 예외 발생.
     *
     * @throws CancellationException 취소가 요청된 경우
     */
    public void throwIfCancellationRequested() {
        if (cancellationRequested) {
            throw new CancellationException("Operation was cancelled");
        }
    }
}
