package com.ryuqq.railway.core.workflow;

import com.ryuqq.railway.core.memory.ServiceProvider;
import com.ryuqq.railway.core.memory.TypedMemory;
import com.ryuqq.railway.core.result.Failure;
import com.ryuqq.railway.core.result.Result;
import com.ryuqq.railway.core.result.Success;
import com.ryuqq.railway.core.step.DependencyResolver;
import com.ryuqq.railway.core.step.RailwayStep;
import com.ryuqq.railway.core.step.Step;
import com.ryuqq.railway.core.step.StepRegistry;
import com.ryuqq.railway.core.step.StepSignature;
import com.ryuqq.railway.core.tuple.Tuples;
import com.ryuqq.railway.core.type.TypeArguments;
import com.ryuqq.railway.core.type.TypeKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;

/**
 * Railway 방식 Workflow 실행 엔진.
 *
 * <p>사용자는 이 클래스를 상속해 {@link #runInternal(Object)}에서 Step들을 연결합니다.
 * 실행마다 새 {@link TypedMemory}와 실패 슬롯이 만들어지며, 실패 슬롯이 채워지면
 * 이후의 모든 chain 호출은 아무것도 하지 않고 통과합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * public class FormatNumber extends Workflow&lt;Integer, String&gt; {
 *     {@literal @}Override
 *     protected Result&lt;String&gt; runInternal(Integer input) {
 *         return activate(input)
 *             .chain(IntToString.class)
 *             .resolve();
 *     }
 * }
 *
 * String text = new FormatNumber().run(42);          // "42"
 * Result&lt;String&gt; result = new FormatNumber().runEither(42);
 * </pre>
 *
 * <p><strong>Resolve 우선순위:</strong></p>
 * <ol>
 *   <li>실패 슬롯</li>
 *   <li>ShortCircuit 값</li>
 *   <li>메모리에서 선언된 반환 타입 조회</li>
 *   <li>타입을 찾지 못한 실패</li>
 * </ol>
 *
 * <p>한 인스턴스는 한 번에 한 스레드에서만 실행해야 합니다.</p>
 *
 * @param <I> 입력 타입
 * @param <O> 반환 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class Workflow<I, O> {

    private static final Logger log = LoggerFactory.getLogger(Workflow.class);

    private final Type inputType;
    private final Type outputType;
    private final Map<Type, Object> services = new HashMap<>();

    private String externalId = UUID.randomUUID().toString();
    private Long parentId;
    private StepRegistry stepRegistry = new StepRegistry();
    private ServiceProvider serviceProvider;

    private TypedMemory memory = new TypedMemory();
    private CancellationToken cancellationToken = CancellationToken.none();
    private Exception exception;
    private String failureStep;
    private O shortCircuitValue;
    private boolean shortCircuitValueSet;

    protected Workflow() {
        Type[] arguments = TypeArguments.resolve(getClass(), Workflow.class)
            .orElseThrow(() -> new IllegalStateException("Cannot resolve Workflow type arguments"));
        if (TypeKeys.isUnresolved(arguments[0]) || TypeKeys.isUnresolved(arguments[1])) {
            throw new IllegalStateException("Workflow " + getClass().getName()
                + " must declare concrete input and output types");
        }
        this.inputType = arguments[0];
        this.outputType = arguments[1];
    }

    /**
     * Step 연결 본문. 보통 {@code activate(input)...resolve()} 형태입니다.
     *
     * @param input 입력 값
     * @return 최종 결과
     */
    protected abstract Result<O> runInternal(I input);

    // ============================================================
    // 실행 진입점
    // ============================================================

    /**
     * 실행 후 값을 반환하고, 실패면 원래 예외를 던집니다.
     *
     * @param input 입력 값
     * @return 결과 값
     * @throws RuntimeException 실패 시 원래 unchecked 예외, checked 예외는 {@link WorkflowException}으로 감쌈
     */
    public final O run(I input) {
        return run(input, CancellationToken.none());
    }

    public final O run(I input, CancellationToken token) {
        Result<O> result = execute(input, token);
        if (result instanceof Failure<O> failure) {
            throw rethrowable(failure.exception());
        }
        return ((Success<O>) result).value();
    }

    /**
     * 실행 후 결과를 예외 없이 반환합니다. 취소만은 예외로 전파됩니다.
     *
     * @param input 입력 값
     * @return Success 또는 Failure
     * @throws CancellationException 실행이 취소된 경우
     */
    public final Result<O> runEither(I input) {
        return runEither(input, CancellationToken.none());
    }

    public final Result<O> runEither(I input, CancellationToken token) {
        Result<O> result = execute(input, token);
        if (result instanceof Failure<O> failure && failure.exception() instanceof CancellationException cancelled) {
            throw cancelled;
        }
        return result;
    }

    /**
     * 상태 초기화 후 {@link #runInternal(Object)} 실행.
     *
     * <p>하위 클래스는 실행 전후 처리를 위해 재정의할 수 있으며 예외를 던지지 않아야 합니다.</p>
     *
     * @param input 입력 값
     * @param token 취소 토큰
     * @return 최종 결과
     */
    protected Result<O> execute(I input, CancellationToken token) {
        reset(token == null ? CancellationToken.none() : token);
        Result<O> result;
        try {
            result = runInternal(input);
        } catch (Exception e) {
            recordFailure(e, null);
            result = Result.failure(e);
        }
        if (result == null) {
            result = Result.failure(new WorkflowException(getClass().getSimpleName() + ".runInternal returned null"));
        }
        if (result instanceof Failure<O> failure) {
            recordFailure(failure.exception(), null);
        }
        return result;
    }

    private void reset(CancellationToken token) {
        this.memory = new TypedMemory();
        this.cancellationToken = token;
        this.exception = null;
        this.failureStep = null;
        this.shortCircuitValue = null;
        this.shortCircuitValueSet = false;
        memory.put(CancellationToken.class, token);
    }

    // ============================================================
    // Activate
    // ============================================================

    /**
     * 입력 값을 메모리에 저장.
     *
     * <p>주 입력은 선언 타입, 구체 클래스, 구현 인터페이스 키로 저장되며 추가 입력은 런타임 타입으로 저장됩니다.
     * 주 입력이 null이면 실패 슬롯을 채우고 이후 단계는 모두 건너뜁니다.</p>
     *
     * @param input 주 입력
     * @param otherInputs 추가 입력 (null 원소는 무시)
     * @return this
     */
    public final Workflow<I, O> activate(I input, Object... otherInputs) {
        if (input == null) {
            recordFailure(new WorkflowException("Input (" + TypeKeys.displayName(inputType) + ") is null."), null);
            return this;
        }
        memory.store(inputType, input);
        if (otherInputs != null) {
            for (Object other : otherInputs) {
                memory.store(other);
            }
        }
        return this;
    }

    // ============================================================
    // Chain
    // ============================================================

    /**
     * Step 타입으로 연결. Step은 {@link StepRegistry}가 생성하며 생성자 인자는 메모리에서 채워집니다.
     *
     * @param stepType Step 타입
     * @return this
     */
    public final Workflow<I, O> chain(Class<? extends Step<?, ?>> stepType) {
        if (isShortCircuited()) {
            return this;
        }
        Step<?, ?> step = construct(stepType);
        if (step == null) {
            return this;
        }
        return chainWithSignature(step, signatureOf(stepType));
    }

    /**
     * Step 인스턴스로 연결. 입력은 메모리에서 Step의 입력 타입으로 조회합니다.
     *
     * @param step Step 인스턴스
     * @return this
     */
    public final Workflow<I, O> chain(Step<?, ?> step) {
        if (isShortCircuited()) {
            return this;
        }
        if (step == null) {
            recordFailure(new WorkflowException("Step cannot be null"), null);
            return this;
        }
        return chainWithSignature(step, signatureOf(step.getClass()));
    }

    /**
     * Step 인스턴스와 입력을 직접 지정해 연결하고 결과를 돌려받습니다.
     *
     * <p>성공한 출력은 메모리에도 저장되고, 실패는 실패 슬롯에 기록됩니다.</p>
     *
     * @param step Step 인스턴스
     * @param input 입력 결과
     * @param <A> 입력 타입
     * @param <B> 출력 타입
     * @return Step 결과 (이미 실패 상태면 기존 실패)
     */
    protected final <A, B> Result<B> chain(Step<A, B> step, Result<A> input) {
        if (exception != null) {
            return Result.failure(exception);
        }
        if (step == null || input == null) {
            WorkflowException error = new WorkflowException("Step and input cannot be null");
            recordFailure(error, null);
            return Result.failure(error);
        }
        StepSignature signature = signatureOf(step.getClass());
        if (signature == null) {
            return Result.failure(exception);
        }
        Result<B> output = invoke(step, input);
        if (output instanceof Success<B> success) {
            storeOutput(signature.outputType(), success.value());
        } else {
            recordFailure(((Failure<B>) output).exception(), step.name());
        }
        return output;
    }

    /**
     * 메모리에 들어 있는 인터페이스 구현체로 연결.
     *
     * <p>실행 시점에 구현체를 바꿔 끼울 수 있도록 Step 인터페이스 타입으로 조회합니다.</p>
     *
     * @param stepInterface {@code Step}을 상속한 인터페이스
     * @return this
     */
    public final Workflow<I, O> iChain(Class<? extends Step<?, ?>> stepInterface) {
        if (isShortCircuited()) {
            return this;
        }
        if (stepInterface == null || !stepInterface.isInterface()) {
            recordFailure(new WorkflowException("IChain requires an interface type, but got "
                + (stepInterface == null ? "null" : stepInterface.getName()) + "."), null);
            return this;
        }
        Optional<Object> instance = extract(stepInterface);
        if (instance.isEmpty()) {
            return this;
        }
        StepSignature signature = signatureOf(stepInterface);
        if (signature == null) {
            return this;
        }
        return chainWithSignature((Step<?, ?>) instance.get(), signature);
    }

    // ============================================================
    // ShortCircuit
    // ============================================================

    /**
     * 실패해도 되는 Step 연결.
     *
     * <p>Step 실패는 버려지고 Workflow는 그대로 진행합니다. 성공 출력의 타입이 Workflow 반환 타입과 같으면
     * ShortCircuit 값으로 잡아 두고 {@link #resolve()}가 메모리보다 먼저 사용합니다.
     * 취소는 버리지 않고 실패 슬롯에 기록합니다.</p>
     *
     * @param stepType Step 타입
     * @return this
     */
    public final Workflow<I, O> shortCircuit(Class<? extends Step<?, ?>> stepType) {
        if (isShortCircuited()) {
            return this;
        }
        Step<?, ?> step = construct(stepType);
        if (step == null) {
            return this;
        }
        return shortCircuitWithSignature(step, signatureOf(stepType));
    }

    public final Workflow<I, O> shortCircuit(Step<?, ?> step) {
        if (isShortCircuited()) {
            return this;
        }
        if (step == null) {
            recordFailure(new WorkflowException("Step cannot be null"), null);
            return this;
        }
        return shortCircuitWithSignature(step, signatureOf(step.getClass()));
    }

    // ============================================================
    // Extract
    // ============================================================

    /**
     * 메모리에 있는 source 객체에서 target 타입 속성을 꺼내 메모리에 올립니다.
     *
     * @param sourceType 메모리에서 찾을 원본 타입
     * @param targetType 꺼낼 속성 타입
     * @return this
     */
    public final Workflow<I, O> extract(Class<?> sourceType, Class<?> targetType) {
        if (isShortCircuited()) {
            return this;
        }
        Optional<Object> source = extract(sourceType);
        source.ifPresent(value -> extractMember(value, targetType));
        return this;
    }

    /**
     * 직접 넘긴 source 객체에서 target 타입 속성을 꺼내 메모리에 올립니다.
     *
     * <p>record 컴포넌트(선언 순서), 이름순 public getter, public 필드 순으로 첫 번째로 일치하는 것만 사용합니다.
     * 찾지 못하거나 값이 null이면 실패입니다.</p>
     *
     * @param source 원본 객체
     * @param targetType 꺼낼 속성 타입
     * @return this
     */
    public final Workflow<I, O> extractFrom(Object source, Class<?> targetType) {
        if (isShortCircuited()) {
            return this;
        }
        if (source == null) {
            recordFailure(new WorkflowException("Could not extract (" + targetType.getSimpleName()
                + ") from null source."), null);
            return this;
        }
        extractMember(source, targetType);
        return this;
    }

    // ============================================================
    // Resolve
    // ============================================================

    /**
     * 최종 결과 결정.
     *
     * @return 실패 슬롯 → ShortCircuit 값 → 메모리 조회 → 타입 없음 실패 순으로 결정된 결과
     */
    public final Result<O> resolve() {
        if (exception != null) {
            return Result.failure(exception);
        }
        if (shortCircuitValueSet) {
            return Result.success(shortCircuitValue);
        }
        Optional<Object> value = extract(outputType);
        if (value.isPresent()) {
            return Result.success(castOutput(value.get()));
        }
        return Result.failure(exception);
    }

    /**
     * runInternal이 직접 만든 결과를 반영해 최종 결과 결정. 실패 슬롯이 채워져 있으면 그것이 우선합니다.
     *
     * @param returned 직접 만든 결과
     * @return 최종 결과
     */
    public final Result<O> resolve(Result<O> returned) {
        if (exception != null) {
            return Result.failure(exception);
        }
        return returned == null ? resolve() : returned;
    }

    // ============================================================
    // 서비스 및 설정
    // ============================================================

    /**
     * 메모리에 없을 때 조회할 서비스 등록. 구체 클래스와 구현 인터페이스 키로 등록됩니다.
     *
     * @param services 서비스 인스턴스
     * @return this
     */
    public final Workflow<I, O> addServices(Object... services) {
        for (Object service : services) {
            if (service == null) {
                throw new IllegalArgumentException("service cannot be null");
            }
            this.services.put(service.getClass(), service);
            for (Class<?> implemented : TypeKeys.allInterfaces(service.getClass())) {
                this.services.put(implemented, service);
            }
        }
        return this;
    }

    public final <T> Workflow<I, O> addService(Class<T> type, T service) {
        if (type == null || service == null) {
            throw new IllegalArgumentException("type and service cannot be null");
        }
        services.put(type, service);
        return this;
    }

    public final Workflow<I, O> useServiceProvider(ServiceProvider serviceProvider) {
        this.serviceProvider = serviceProvider;
        return this;
    }

    public final Workflow<I, O> useStepRegistry(StepRegistry stepRegistry) {
        if (stepRegistry == null) {
            throw new IllegalArgumentException("stepRegistry cannot be null");
        }
        this.stepRegistry = stepRegistry;
        return this;
    }

    // ============================================================
    // Step 경계 hook
    // ============================================================

    /**
     * Step 실행 직전 호출. 기본 구현은 아무것도 하지 않습니다.
     *
     * @param stepName Step 이름
     */
    protected void beforeStep(String stepName) {
    }

    /**
     * Step 실행 직후 호출 (성공/실패 모두). 기본 구현은 아무것도 하지 않습니다.
     *
     * @param stepName Step 이름
     * @param result Step 결과
     */
    protected void afterStep(String stepName, Result<?> result) {
    }

    // ============================================================
    // 조회
    // ============================================================

    public final Optional<Exception> getException() {
        return Optional.ofNullable(exception);
    }

    /**
     * 실패 슬롯을 채운 Step 이름.
     *
     * @return Step 이름 (Step 밖에서 실패했거나 실패가 없으면 empty)
     */
    public final Optional<String> getFailureStep() {
        return Optional.ofNullable(failureStep);
    }

    public final boolean isShortCircuitValueSet() {
        return shortCircuitValueSet;
    }

    public final String getExternalId() {
        return externalId;
    }

    public final void setExternalId(String externalId) {
        if (externalId == null || externalId.isBlank()) {
            throw new IllegalArgumentException("externalId cannot be null or blank");
        }
        this.externalId = externalId;
    }

    public final Long getParentId() {
        return parentId;
    }

    public final void setParentId(Long parentId) {
        this.parentId = parentId;
    }

    public String getWorkflowName() {
        return getClass().getName();
    }

    public final Type getInputType() {
        return inputType;
    }

    public final Type getOutputType() {
        return outputType;
    }

    protected final TypedMemory memory() {
        return memory;
    }

    protected final CancellationToken cancellationToken() {
        return cancellationToken;
    }

    // ============================================================
    // 내부 구현
    // ============================================================

    private boolean isShortCircuited() {
        return exception != null;
    }

    private Workflow<I, O> chainWithSignature(Step<?, ?> step, StepSignature signature) {
        if (signature == null) {
            return this;
        }
        Optional<Object> input = extract(signature.inputType());
        if (input.isEmpty()) {
            return this;
        }
        Result<?> output = runStep(step, input.get());
        if (output instanceof Success<?> success) {
            storeOutput(signature.outputType(), success.value());
        } else {
            recordFailure(((Failure<?>) output).exception(), step.name());
        }
        return this;
    }

    private Workflow<I, O> shortCircuitWithSignature(Step<?, ?> step, StepSignature signature) {
        if (signature == null) {
            return this;
        }
        Optional<Object> input = extract(signature.inputType());
        if (input.isEmpty()) {
            return this;
        }
        Result<?> output = runStep(step, input.get());
        if (output instanceof Failure<?> failure) {
            if (failure.exception() instanceof CancellationException) {
                recordFailure(failure.exception(), step.name());
            } else {
                log.debug("ShortCircuit step {} failed and was skipped: {}", step.name(),
                    failure.exception().getMessage());
            }
            return this;
        }
        Object value = ((Success<?>) output).value();
        storeOutput(signature.outputType(), value);
        if (signature.outputType().equals(outputType)) {
            shortCircuitValue = castOutput(value);
            shortCircuitValueSet = true;
        }
        return this;
    }

    /**
     * 메모리에서 꺼낸 값으로 Step 실행. 값은 signature의 입력 타입 키로 저장된 것이므로 A에 대입 가능합니다.
     */
    private <A, B> Result<B> runStep(Step<A, B> step, Object input) {
        A value = (A) input;
        return invoke(step, Result.success(value));
    }

    private O castOutput(Object value) {
        return (O) value;
    }

    private <A, B> Result<B> invoke(Step<A, B> step, Result<A> input) {
        String stepName = step.name();
        if (cancellationToken.isCancellationRequested()) {
            return Result.failure(new CancellationException("Workflow was cancelled before step " + stepName));
        }
        beforeStep(stepName);
        Result<B> output = new RailwayStep<>(step).apply(input);
        afterStep(stepName, output);
        return output;
    }

    private void storeOutput(Type declaredType, Object value) {
        if (value != null) {
            memory.store(declaredType, value);
        }
    }

    private StepSignature signatureOf(Class<?> stepType) {
        try {
            return StepSignature.of(stepType);
        } catch (WorkflowException e) {
            recordFailure(e, null);
            return null;
        }
    }

    private Step<?, ?> construct(Class<? extends Step<?, ?>> stepType) {
        if (stepType == null) {
            recordFailure(new WorkflowException("Step type cannot be null"), null);
            return null;
        }
        try {
            return stepRegistry.create(stepType, this::require);
        } catch (WorkflowException e) {
            recordFailure(e, stepType.getSimpleName());
            return null;
        }
    }

    private Object require(Type type) {
        Optional<Object> value = lookup(type);
        return value.orElseThrow(() -> new WorkflowException(notFoundMessage(type)));
    }

    /**
     * 메모리 조회. 찾지 못하면 실패 슬롯에 "Could not find type" 오류를 기록하고 empty를 반환합니다.
     *
     * @param type 조회할 타입
     * @return 값
     */
    protected final Optional<Object> extract(Type type) {
        try {
            Optional<Object> value = lookup(type);
            if (value.isEmpty()) {
                recordFailure(new WorkflowException(notFoundMessage(type)), null);
            }
            return value;
        } catch (WorkflowException e) {
            recordFailure(e, null);
            return Optional.empty();
        }
    }

    private Optional<Object> lookup(Type type) {
        Optional<Object> direct = memory.get(type);
        if (direct.isPresent()) {
            return direct;
        }
        if (Tuples.isTuple(type)) {
            List<Type> elementTypes = Tuples.elementTypes(type);
            Tuples.checkArity(elementTypes.size());
            List<Object> elements = new ArrayList<>(elementTypes.size());
            for (Type elementType : elementTypes) {
                Optional<Object> element = lookup(elementType);
                if (element.isEmpty()) {
                    return Optional.empty();
                }
                elements.add(element.get());
            }
            return Optional.of(Tuples.fromValues(elements));
        }
        Object service = services.get(type);
        if (service != null) {
            return Optional.of(service);
        }
        if (serviceProvider != null) {
            Optional<Object> provided = serviceProvider.find(type);
            if (provided.isPresent()) {
                return provided;
            }
        }
        if (TypeKeys.rawClass(type) == Logger.class) {
            return Optional.of(LoggerFactory.getLogger(getClass()));
        }
        return Optional.empty();
    }

    private void extractMember(Object source, Class<?> targetType) {
        Class<?> sourceClass = source.getClass();
        Optional<Member> member = findMember(sourceClass, targetType);
        if (member.isEmpty()) {
            recordFailure(new WorkflowException("Could not find type (" + targetType.getSimpleName()
                + ") on (" + sourceClass.getSimpleName() + ")."), null);
            return;
        }
        Object value;
        try {
            value = member.get().read(source);
        } catch (ReflectiveOperationException e) {
            recordFailure(new WorkflowException("Could not read (" + targetType.getSimpleName()
                + ") from (" + sourceClass.getSimpleName() + ").", e), null);
            return;
        }
        if (value == null) {
            recordFailure(new WorkflowException("Null value for type (" + targetType.getSimpleName()
                + ") on (" + sourceClass.getSimpleName() + ")."), null);
            return;
        }
        memory.store(targetType, value);
    }

    private static Optional<Member> findMember(Class<?> sourceClass, Class<?> targetType) {
        if (sourceClass.isRecord()) {
            for (RecordComponent component : sourceClass.getRecordComponents()) {
                if (component.getType() == targetType) {
                    Method accessor = component.getAccessor();
                    return Optional.of(accessor::invoke);
                }
            }
        }
        Optional<Method> getter = Arrays.stream(sourceClass.getMethods())
            .filter(method -> method.getParameterCount() == 0)
            .filter(method -> !Modifier.isStatic(method.getModifiers()))
            .filter(method -> method.getDeclaringClass() != Object.class)
            .filter(method -> method.getName().startsWith("get") || method.getName().startsWith("is"))
            .filter(method -> method.getReturnType() == targetType)
            .min(Comparator.comparing(Method::getName));
        if (getter.isPresent()) {
            Method method = getter.get();
            return Optional.of(method::invoke);
        }
        for (Field field : sourceClass.getFields()) {
            if (!Modifier.isStatic(field.getModifiers()) && field.getType() == targetType) {
                return Optional.of(field::get);
            }
        }
        return Optional.empty();
    }

    private void recordFailure(Exception failure, String stepName) {
        if (exception == null && failure != null) {
            exception = failure;
            failureStep = stepName;
        }
    }

    private static String notFoundMessage(Type type) {
        return "Could not find type: (" + TypeKeys.displayName(type) + ").";
    }

    private static RuntimeException rethrowable(Exception exception) {
        if (exception instanceof RuntimeException runtime) {
            return runtime;
        }
        return new WorkflowException(exception.getMessage(), exception);
    }

    @FunctionalInterface
    private interface Member {
        Object read(Object source) throws ReflectiveOperationException;
    }
}
