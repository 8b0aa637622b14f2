package com.ryuqq.railway.core.memory;

import java.lang.reflect.Type;
import java.util.Optional;

/**
 * 메모리에 없는 타입을 외부에서 찾아주는 조회 함수.
 *
 * <p>Workflow의 메모리 조회가 실패했을 때 Tuple 분해 다음 순서로 호출됩니다.
 * DI 컨테이너 연동 시 이 인터페이스를 구현합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ServiceProvider {

    /**
     * 타입에 해당하는 서비스 조회.
     *
     * @param type 요청 타입
     * @return 서비스 인스턴스 (없으면 empty)
     */
    Optional<Object> find(Type type);
}
