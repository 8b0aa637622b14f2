package com.ryuqq.railway.core.step;

import java.lang.reflect.Type;

/**
 * Step 생성에 필요한 의존성을 Workflow 메모리에서 꺼내주는 함수.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface DependencyResolver {

    /**
     * 타입에 해당하는 값 조회.
     *
     * @param type 요청 타입
     * @return 값
     * @throws com.ryuqq.railway.core.workflow.WorkflowException 메모리와 서비스 어디에서도 찾지 못한 경우
     */
    Object resolve(Type type);

    default <T> T resolve(Class<T> type) {
        return type.cast(resolve((Type) type));
    }
}
