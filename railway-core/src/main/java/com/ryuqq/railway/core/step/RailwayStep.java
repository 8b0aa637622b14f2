package com.ryuqq.railway.core.step;

import com.ryuqq.railway.core.result.Failure;
import com.ryuqq.railway.core.result.Result;
import com.ryuqq.railway.core.result.Success;

/**
 * Step을 Railway 트랙 위에서 실행하는 어댑터.
 *
 * <p>모든 Step 실행은 이 어댑터를 거칩니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>입력이 실패 트랙이면 Step을 실행하지 않고 실패를 그대로 전달</li>
 *   <li>입력이 성공 트랙이면 Step을 실행하고 결과를 성공 트랙에 올림</li>
 *   <li>Step이 던진 예외는 실패 트랙으로 변환 (취소 예외 포함, Error는 전파)</li>
 * </ul>
 *
 * @param <I> 입력 타입
 * @param <O> 출력 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RailwayStep<I, O> {

    private final Step<I, O> step;

    public RailwayStep(Step<I, O> step) {
        if (step == null) {
            throw new IllegalArgumentException("step cannot be null");
        }
        this.step = step;
    }

    /**
     * 트랙 위에서 Step 실행.
     *
     * @param input 이전 단계 결과
     * @return Step 결과 (예외를 던지지 않음)
     */
    public Result<O> apply(Result<I> input) {
        if (input instanceof Failure<I> failure) {
            return failure.recast();
        }
        I value = ((Success<I>) input).value();
        try {
            return Result.success(step.run(value));
        } catch (Exception e) {
            return Result.failure(e);
        }
    }

    public Step<I, O> step() {
        return step;
    }
}
