package com.ryuqq.railway.application.effect;

import com.ryuqq.railway.core.model.Entity;
import com.ryuqq.railway.core.model.Metadata;
import com.ryuqq.railway.core.workflow.CancellationToken;

/**
 * Effect Provider.
 *
 * <p>Workflow 실행의 부수 효과(영속화, 파라미터 직렬화, 변경 로그 등)를 담당합니다.
 * {@link EffectRunner}가 모든 활성 Provider에 같은 호출을 순서대로 전달하며,
 * 한 Provider의 예외는 로그만 남기고 다른 Provider 호출을 막지 않습니다.</p>
 *
 * <p><strong>호출 시점:</strong></p>
 * <ul>
 *   <li>track: Metadata 생성 직후</li>
 *   <li>update: 상태 전이, Step 시작/종료, Workflow 종료 시</li>
 *   <li>onError: 실패 종료 시 마지막 saveChanges 직전 1회</li>
 *   <li>saveChanges: 초기화, Step 시작/종료, Workflow 종료 시</li>
 *   <li>close: 매 실행 종료 시 (다음 실행은 새 Provider 사용)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface EffectProvider extends AutoCloseable {

    /**
     * 새 모델 추적 시작.
     *
     * @param model 추적할 모델
     */
    void track(Entity<?> model);

    /**
     * 추적 중인 모델이 변경되었음을 알림.
     *
     * @param model 변경된 모델
     */
    void update(Entity<?> model);

    /**
     * 누적된 변경 반영.
     *
     * @param token 취소 토큰
     */
    void saveChanges(CancellationToken token);

    /**
     * Workflow 실패 알림.
     *
     * @param metadata 실패한 실행 기록 (이미 FAILED 상태)
     * @param exception 실패 원인
     * @param token 취소 토큰
     */
    default void onError(Metadata metadata, Exception exception, CancellationToken token) {
    }

    @Override
    void close();
}
