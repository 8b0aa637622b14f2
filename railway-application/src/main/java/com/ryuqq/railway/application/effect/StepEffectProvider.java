package com.ryuqq.railway.application.effect;

/**
 * Step 단위 Effect Provider.
 *
 * <p>{@link EffectWorkflow}가 Step 실행 직전과 직후에 {@link EffectRunner}를 통해 호출합니다.
 * 예외는 {@link EffectRunner}가 로그만 남기고 삼키므로 Step 실행에 영향을 주지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface StepEffectProvider extends AutoCloseable {

    /**
     * Step 실행 직전.
     *
     * @param execution 시작 정보 (결과 없음)
     */
    void beforeStep(StepExecution execution);

    /**
     * Step 실행 직후 (성공/실패 모두).
     *
     * @param execution 종료 정보
     */
    void afterStep(StepExecution execution);

    @Override
    void close();
}
