package com.ryuqq.railway.application.effect;

import com.ryuqq.railway.core.model.Entity;
import com.ryuqq.railway.core.model.Metadata;
import com.ryuqq.railway.core.workflow.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Effect Provider fan-out 조정자.
 *
 * <p>Provider는 첫 호출 시점에 활성화된 팩토리로부터 생성되고 {@link #close()}까지 재사용됩니다.
 * close 후 다시 호출하면 새 Provider 집합을 만들기 때문에, 같은 Workflow 인스턴스가 여러 번
 * 실행되어도 실행마다 독립된 Provider를 사용합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>활성 Provider 생성 (비활성 팩토리는 create 호출 안 함)</li>
 *   <li>track/update/saveChanges/onError를 모든 Provider에 순서대로 전달</li>
 *   <li>beforeStep/afterStep을 모든 Step Provider에 순서대로 전달</li>
 *   <li>Provider별 예외 격리 (로그 후 다음 Provider 계속)</li>
 *   <li>close 시 모든 Provider 정리 (한 Provider 실패가 나머지 정리를 막지 않음)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EffectRunner implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EffectRunner.class);

    private final List<EffectProviderFactory> factories;
    private final List<StepEffectProviderFactory> stepFactories;
    private final EffectProviderRegistry registry;
    private List<EffectProvider> activeProviders;
    private List<StepEffectProvider> activeStepProviders;

    public EffectRunner(List<? extends EffectProviderFactory> factories) {
        this(factories, List.of(), new EffectProviderRegistry());
    }

    public EffectRunner(List<? extends EffectProviderFactory> factories, EffectProviderRegistry registry) {
        this(factories, List.of(), registry);
    }

    /**
     * 생성자.
     *
     * @param factories Provider 팩토리 목록 (호출 순서)
     * @param stepFactories Step Provider 팩토리 목록 (호출 순서)
     * @param registry 활성화 스위치
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public EffectRunner(List<? extends EffectProviderFactory> factories,
                        List<? extends StepEffectProviderFactory> stepFactories,
                        EffectProviderRegistry registry) {
        if (factories == null) {
            throw new IllegalArgumentException("factories cannot be null");
        }
        if (stepFactories == null) {
            throw new IllegalArgumentException("stepFactories cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.factories = List.copyOf(factories);
        this.stepFactories = List.copyOf(stepFactories);
        this.registry = registry;
    }

    public static Supplier<EffectRunner> supplier(List<? extends EffectProviderFactory> factories,
                                                  EffectProviderRegistry registry) {
        return supplier(factories, List.of(), registry);
    }

    /**
     * 실행마다 새 EffectRunner를 만드는 공급자.
     *
     * @param factories Provider 팩토리 목록
     * @param stepFactories Step Provider 팩토리 목록
     * @param registry 활성화 스위치
     * @return 공급자
     */
    public static Supplier<EffectRunner> supplier(List<? extends EffectProviderFactory> factories,
                                                  List<? extends StepEffectProviderFactory> stepFactories,
                                                  EffectProviderRegistry registry) {
        List<EffectProviderFactory> snapshot = List.copyOf(factories);
        List<StepEffectProviderFactory> stepSnapshot = List.copyOf(stepFactories);
        return () -> new EffectRunner(snapshot, stepSnapshot, registry);
    }

    public void track(Entity<?> model) {
        runAll(providers(), "track", provider -> provider.track(model));
    }

    public void update(Entity<?> model) {
        runAll(providers(), "update", provider -> provider.update(model));
    }

    public void saveChanges(CancellationToken token) {
        runAll(providers(), "saveChanges", provider -> provider.saveChanges(token));
    }

    public void onError(Metadata metadata, Exception exception, CancellationToken token) {
        runAll(providers(), "onError", provider -> provider.onError(metadata, exception, token));
    }

    public void beforeStep(StepExecution execution) {
        runAll(stepProviders(), "beforeStep", provider -> provider.beforeStep(execution));
    }

    public void afterStep(StepExecution execution) {
        runAll(stepProviders(), "afterStep", provider -> provider.afterStep(execution));
    }

    /**
     * 현재 Provider 정리. 다음 호출 시 Provider를 새로 만듭니다.
     */
    @Override
    public void close() {
        closeAll(activeProviders);
        closeAll(activeStepProviders);
        activeProviders = null;
        activeStepProviders = null;
    }

    /**
     * 현재 활성 Provider 수 (필요 시 생성).
     *
     * @return Provider 수
     */
    public int activeProviderCount() {
        return providers().size();
    }

    public int activeStepProviderCount() {
        return stepProviders().size();
    }

    private <P> void runAll(List<P> providers, String operation, Consumer<P> action) {
        for (P provider : providers) {
            try {
                action.accept(provider);
            } catch (Exception e) {
                log.error("Effect provider {} failed during {}", provider.getClass().getName(), operation, e);
            }
        }
    }

    private void closeAll(List<? extends AutoCloseable> providers) {
        if (providers == null) {
            return;
        }
        for (AutoCloseable provider : providers) {
            try {
                provider.close();
            } catch (Exception e) {
                log.error("Failed to dispose effect provider {}", provider.getClass().getName(), e);
            }
        }
    }

    private List<EffectProvider> providers() {
        if (activeProviders == null) {
            activeProviders = createAll(factories, EffectProviderFactory::create);
        }
        return activeProviders;
    }

    private List<StepEffectProvider> stepProviders() {
        if (activeStepProviders == null) {
            activeStepProviders = createAll(stepFactories, StepEffectProviderFactory::create);
        }
        return activeStepProviders;
    }

    private <F, P> List<P> createAll(List<F> source, Function<F, P> create) {
        List<P> created = new ArrayList<>();
        for (F factory : source) {
            if (!registry.isEnabled(factory.getClass())) {
                log.debug("Effect provider factory {} is disabled", factory.getClass().getName());
                continue;
            }
            try {
                P provider = create.apply(factory);
                if (provider != null) {
                    created.add(provider);
                }
            } catch (Exception e) {
                log.error("Failed to create effect provider from {}", factory.getClass().getName(), e);
            }
        }
        return created;
    }
}
