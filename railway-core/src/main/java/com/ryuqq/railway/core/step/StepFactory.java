package com.ryuqq.railway.core.step;

/**
 * Step 생성 함수.
 *
 * @param <S> 생성할 Step 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StepFactory<S extends Step<?, ?>> {

    /**
     * Step 생성.
     *
     * @param dependencies 메모리 기반 의존성 조회
     * @return 새 Step 인스턴스
     */
    S create(DependencyResolver dependencies);
}
