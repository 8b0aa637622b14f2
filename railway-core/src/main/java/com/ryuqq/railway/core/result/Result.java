package com.ryuqq.railway.core.result;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.function.Function;

/**
 * Step 실행 결과 (Railway 두 갈래).
 *
 * <p>Result는 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Success}: 값을 가진 성공 트랙</li>
 *   <li>{@link Failure}: 예외를 가진 실패 트랙</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 엔진은 두 태그만 분기합니다.
 * 실패 트랙에 올라간 값은 이후 Step을 실행하지 않고 그대로 전달됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Result&lt;String&gt; result = workflow.runEither(42);
 * if (result instanceof Success&lt;String&gt; success) {
 *     System.out.println(success.value());
 * } else if (result instanceof Failure&lt;String&gt; failure) {
 *     log.warn("failed", failure.exception());
 * }
 * </pre>
 *
 * @param <T> 성공 값 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface Result<T> permits Success, Failure {

    /**
     * 성공 결과 생성.
     *
     * @param value 성공 값 (null 허용)
     * @param <T> 값 타입
     * @return Success 인스턴스
     */
    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    /**
     * 실패 결과 생성.
     *
     * @param exception 실패 원인
     * @param <T> 값 타입
     * @return Failure 인스턴스
     * @throws IllegalArgumentException exception이 null인 경우
     */
    static <T> Result<T> failure(Exception exception) {
        return new Failure<>(exception);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default boolean isFailure() {
        return this instanceof Failure;
    }

    /**
     * 실패 원인이 취소인지 확인.
     *
     * @return 취소로 인한 실패이면 true
     */
    default boolean isCancelled() {
        return this instanceof Failure<T> failure
            && failure.exception() instanceof CancellationException;
    }

    /**
     * 성공 값 변환. 실패는 그대로 전달합니다.
     *
     * @param mapper 변환 함수
     * @param <U> 변환 후 타입
     * @return 변환된 Result
     */
    default <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        if (this instanceof Success<T> success) {
            return new Success<>(mapper.apply(success.value()));
        }
        return ((Failure<T>) this).recast();
    }
}
