package com.ryuqq.railway.core.result;

/**
 * 실패 트랙.
 *
 * <p>Step이 던진 예외를 그대로 보관합니다. 메시지를 다시 쓰지 않으므로
 * 호출자는 원래 예외 타입으로 catch 할 수 있습니다.</p>
 *
 * @param exception 실패 원인 (null 불가)
 * @param <T> 성공했을 경우의 값 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Failure<T>(Exception exception) implements Result<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException exception이 null인 경우
     */
    public Failure {
        if (exception == null) {
            throw new IllegalArgumentException("exception cannot be null");
        }
    }

    /**
     * 값 타입만 바꾼 동일한 실패.
     *
     * @param <U> 새 값 타입
     * @return 같은 exception을 가진 Failure
     */
    public <U> Failure<U> recast() {
        return new Failure<>(exception);
    }
}
