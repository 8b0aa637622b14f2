package com.ryuqq.railway.core.workflow;

/**
 * Workflow 구성 또는 실행 오류.
 *
 * <p>메모리에서 타입을 찾지 못한 경우, Step 생성자 형태가 잘못된 경우,
 * 스케줄 등록이 잘못된 경우 등 비즈니스 로직 바깥의 오류를 나타냅니다.
 * {@code Workflow.run}은 checked 예외를 이 타입으로 감싸 다시 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class WorkflowException extends RuntimeException {

    public WorkflowException(String message) {
        super(message);
    }

    public WorkflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
