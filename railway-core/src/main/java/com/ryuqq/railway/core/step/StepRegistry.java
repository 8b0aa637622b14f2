package com.ryuqq.railway.core.step;

import com.ryuqq.railway.core.workflow.WorkflowException;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Type;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Step 타입 → 생성 함수 레지스트리.
 *
 * <p>Workflow가 {@code chain(StepType.class)}로 Step을 요청하면 이 레지스트리가 인스턴스를 만듭니다.</p>
 *
 * <p><strong>생성 순서:</strong></p>
 * <ol>
 *   <li>{@link #register(Class, StepFactory)}로 등록된 팩토리가 있으면 사용</li>
 *   <li>없으면 유일한 public 생성자를 찾아 인자를 메모리에서 채워 호출
 *       (생성자와 파라미터 타입은 Step 타입별로 캐시)</li>
 * </ol>
 *
 * <p>public 생성자가 없거나 둘 이상이면 {@link WorkflowException}을 던지며,
 * Workflow는 이를 실패 트랙에 기록합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StepRegistry {

    private static final Map<Class<?>, ConstructorPlan> CONSTRUCTORS = new ConcurrentHashMap<>();

    private final Map<Class<?>, StepFactory<?>> factories = new ConcurrentHashMap<>();

    /**
     * Step 팩토리 등록.
     *
     * @param stepType Step 타입
     * @param factory 생성 함수
     * @param <S> Step 타입
     * @return this (체이닝용)
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws IllegalStateException 이미 등록된 Step 타입인 경우
     */
    public <S extends Step<?, ?>> StepRegistry register(Class<S> stepType, StepFactory<S> factory) {
        if (stepType == null) {
            throw new IllegalArgumentException("stepType cannot be null");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        StepFactory<?> previous = factories.putIfAbsent(stepType, factory);
        if (previous != null) {
            throw new IllegalStateException("Step factory already registered: " + stepType.getName());
        }
        return this;
    }

    public boolean isRegistered(Class<?> stepType) {
        return factories.containsKey(stepType);
    }

    /**
     * Step 인스턴스 생성.
     *
     * @param stepType Step 타입
     * @param dependencies 의존성 조회
     * @param <S> Step 타입
     * @return 새 인스턴스
     * @throws WorkflowException 생성자 형태가 잘못되었거나 의존성을 찾지 못한 경우
     */
    public <S extends Step<?, ?>> S create(Class<S> stepType, DependencyResolver dependencies) {
        StepFactory<?> factory = factories.get(stepType);
        if (factory != null) {
            Object step = factory.create(dependencies);
            if (step == null) {
                throw new WorkflowException("Step factory returned null for " + stepType.getName());
            }
            return stepType.cast(step);
        }
        ConstructorPlan plan = CONSTRUCTORS.computeIfAbsent(stepType, StepRegistry::planFor);
        return stepType.cast(plan.instantiate(dependencies));
    }

    private static ConstructorPlan planFor(Class<?> stepType) {
        if (stepType.isInterface() || java.lang.reflect.Modifier.isAbstract(stepType.getModifiers())) {
            throw new WorkflowException("Step type " + stepType.getName()
                + " is abstract. Register a factory or chain a concrete step.");
        }
        Constructor<?>[] constructors = stepType.getConstructors();
        if (constructors.length != 1) {
            throw new WorkflowException("Step classes can only have a single public constructor ("
                + stepType.getName() + " has " + constructors.length + ").");
        }
        Constructor<?> constructor = constructors[0];
        return new ConstructorPlan(constructor, constructor.getGenericParameterTypes());
    }

    private record ConstructorPlan(Constructor<?> constructor, Type[] parameterTypes) {

        Object instantiate(DependencyResolver dependencies) {
            Object[] arguments = new Object[parameterTypes.length];
            for (int i = 0; i < parameterTypes.length; i++) {
                arguments[i] = dependencies.resolve(parameterTypes[i]);
            }
            try {
                return constructor.newInstance(arguments);
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause();
                throw new WorkflowException("Constructor of " + constructor.getDeclaringClass().getName()
                    + " failed: " + (cause == null ? e.getMessage() : cause.getMessage()), cause == null ? e : cause);
            } catch (ReflectiveOperationException e) {
                throw new WorkflowException("Could not construct step " + constructor.getDeclaringClass().getName(), e);
            }
        }
    }
}
