package com.ryuqq.railway.core.step;

import com.ryuqq.railway.core.type.TypeArguments;
import com.ryuqq.railway.core.type.TypeKeys;
import com.ryuqq.railway.core.workflow.WorkflowException;

import java.lang.reflect.Type;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Step 구현 타입의 입력/출력 선언 타입.
 *
 * @param inputType 입력 타입
 * @param outputType 출력 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StepSignature(Type inputType, Type outputType) {

    private static final Map<Class<?>, StepSignature> CACHE = new ConcurrentHashMap<>();

    public StepSignature {
        if (inputType == null) {
            throw new IllegalArgumentException("inputType cannot be null");
        }
        if (outputType == null) {
            throw new IllegalArgumentException("outputType cannot be null");
        }
    }

    /**
     * Step 클래스(또는 Step을 상속한 인터페이스)의 시그니처 조회. 결과는 타입별로 캐시됩니다.
     *
     * @param stepType Step 구현 타입
     * @return 시그니처
     * @throws WorkflowException 타입 인자를 확정할 수 없는 경우 (람다, raw 타입 등)
     */
    public static StepSignature of(Class<?> stepType) {
        if (stepType == null) {
            throw new IllegalArgumentException("stepType cannot be null");
        }
        return CACHE.computeIfAbsent(stepType, StepSignature::resolve);
    }

    private static StepSignature resolve(Class<?> stepType) {
        Type[] arguments = TypeArguments.resolve(stepType, Step.class)
            .orElseThrow(() -> new WorkflowException(stepType.getName() + " does not implement Step."));
        if (TypeKeys.isUnresolved(arguments[0]) || TypeKeys.isUnresolved(arguments[1])) {
            throw new WorkflowException("Could not determine input and output types of step "
                + stepType.getName() + ". Declare concrete type arguments on the step class.");
        }
        return new StepSignature(arguments[0], arguments[1]);
    }
}
