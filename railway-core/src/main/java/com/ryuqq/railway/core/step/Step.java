package com.ryuqq.railway.core.step;

/**
 * 하나의 작업 단위.
 *
 * <p>Step은 입력 하나를 받아 출력 하나를 만듭니다. 실패는 예외로 표현하며,
 * 예외는 {@link RailwayStep}이 실패 트랙으로 변환하므로 Workflow 밖으로 새지 않습니다.</p>
 *
 * <p><strong>구현 규칙:</strong></p>
 * <ul>
 *   <li>타입 인자는 구현 클래스 선언에서 고정되어야 함 ({@code implements Step<Order, Receipt>})</li>
 *   <li>입력이 필요 없으면 {@code Step<Unit, X>}</li>
 *   <li>여러 값을 받거나 반환하려면 {@code Tuple2..Tuple7}</li>
 *   <li>자동 생성되는 Step은 public 생성자가 정확히 하나여야 하며 생성자 인자는 메모리에서 채워짐</li>
 * </ul>
 *
 * @param <I> 입력 타입
 * @param <O> 출력 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Step<I, O> {

    /**
     * Step 실행.
     *
     * @param input 입력 값
     * @return 출력 값
     * @throws Exception 비즈니스 실패
     */
    O run(I input) throws Exception;

    /**
     * 진행 상황 및 실패 기록에 쓰이는 이름.
     *
     * @return 기본값은 클래스 단순 이름
     */
    default String name() {
        String simpleName = getClass().getSimpleName();
        return simpleName.isEmpty() ? getClass().getName() : simpleName;
    }
}
