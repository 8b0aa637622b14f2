package com.ryuqq.railway.adapter.runner;

import com.ryuqq.railway.adapter.inmemory.store.InMemoryDataContextFactory;
import com.ryuqq.railway.application.effect.DataContextEffectProviderFactory;
import com.ryuqq.railway.application.effect.EffectRunner;
import com.ryuqq.railway.application.effect.EffectWorkflow;
import com.ryuqq.railway.application.json.JsonMapper;
import com.ryuqq.railway.application.registry.WorkflowBus;
import com.ryuqq.railway.application.registry.WorkflowRegistry;
import com.ryuqq.railway.core.model.Metadata;
import com.ryuqq.railway.core.result.Result;
import com.ryuqq.railway.core.spi.DataContext;
import com.ryuqq.railway.core.statemachine.WorkflowState;
import com.ryuqq.railway.core.workflow.WorkflowException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * ManifestExecutor 유닛 테스트.
 *
 * <p>실행 전에 실패하는 경로(미등록 Workflow, 읽을 수 없는 입력, 잘못된 상태)를 검증합니다.
 * 정상 실행과 재시도 흐름은 testkit 계약 테스트가 다룹니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ManifestExecutorTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    public record Ping(int count) {
    }

    static final class PingWorkflow extends EffectWorkflow<Ping, Integer> {
        PingWorkflow(EffectRunner runner) {
            super(runner);
        }

        @Override
        protected Result<Integer> runInternal(Ping input) {
            return Result.success(input.count());
        }
    }

    @Mock
    private ExecutionFailureHandler failureHandler;

    private InMemoryDataContextFactory factory;
    private ManifestExecutor executor;

    @BeforeEach
    void setUp() {
        factory = new InMemoryDataContextFactory();
        WorkflowRegistry registry = new WorkflowRegistry().register(Ping.class, PingWorkflow.class, PingWorkflow::new);
        WorkflowBus bus = new WorkflowBus(registry,
            () -> new EffectRunner(List.of(new DataContextEffectProviderFactory(factory))));
        executor = new ManifestExecutor(factory, registry, bus, new JsonMapper(), failureHandler,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private long insertPending(String name, String input) {
        try (DataContext context = factory.create()) {
            Metadata metadata = Metadata.create(name, null, NOW);
            metadata.setManifestId(1L);
            metadata.setInput(input);
            long id = context.metadata().add(metadata).getId();
            context.saveChanges();
            return id;
        }
    }

    private Metadata reload(long id) {
        try (DataContext context = factory.create()) {
            return context.metadata().findById(id).orElseThrow();
        }
    }

    @Test
    void execute_등록되지_않은_Workflow면_실행_없이_FAILED_후_재시도_판단() {
        // given
        long id = insertPending("com.example.Removed", "{}");

        // when
        executor.execute(id);

        // then
        Metadata failed = reload(id);
        assertThat(failed.getWorkflowState()).isEqualTo(WorkflowState.FAILED);
        assertThat(failed.getFailureException()).isEqualTo(WorkflowException.class.getName());
        assertThat(failed.getFailureReason()).contains("is not registered");
        assertThat(failed.getEndTime()).isEqualTo(NOW);
        verify(failureHandler).handle(any(Metadata.class), contains("is not registered"));
    }

    @Test
    void execute_입력을_읽을_수_없으면_실행_없이_FAILED() {
        // given
        long id = insertPending(PingWorkflow.class.getName(), "{broken");

        // when
        executor.execute(id);

        // then
        Metadata failed = reload(id);
        assertThat(failed.getWorkflowState()).isEqualTo(WorkflowState.FAILED);
        assertThat(failed.getFailureReason()).startsWith("Could not read input of");
        verify(failureHandler).handle(any(Metadata.class), anyString());
    }

    @Test
    void execute_PENDING이_아니거나_없는_Metadata면_예외() {
        // given
        long id = insertPending(PingWorkflow.class.getName(), "{\"count\":1}");
        executor.execute(id);

        // when & then
        assertThat(reload(id).getWorkflowState()).isEqualTo(WorkflowState.COMPLETED);
        assertThatThrownBy(() -> executor.execute(id))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("is not Pending");
        assertThatThrownBy(() -> executor.execute(404L))
            .isInstanceOf(WorkflowException.class)
            .hasMessageContaining("No metadata found with id 404");
        verify(failureHandler, never()).handle(any(), any());
    }
}
