package com.ryuqq.railway.application.effect;

import com.ryuqq.railway.core.model.Entity;
import com.ryuqq.railway.core.model.Metadata;
import com.ryuqq.railway.core.result.Result;
import com.ryuqq.railway.core.result.Success;
import com.ryuqq.railway.core.statemachine.WorkflowState;
import com.ryuqq.railway.core.step.Step;
import com.ryuqq.railway.core.workflow.CancellationToken;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * EffectWorkflow 유닛 테스트.
 *
 * <p>Metadata 생명주기가 Effect Provider에 어떤 순서로 전달되는지 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class EffectWorkflowTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    /**
     * 호출 시점의 Metadata 상태를 기록하는 Provider.
     */
    static final class RecordingProvider implements EffectProvider {
        final List<String> events = new ArrayList<>();
        boolean closed;

        @Override
        public void track(Entity<?> model) {
            events.add("track:" + ((Metadata) model).getWorkflowState());
        }

        @Override
        public void update(Entity<?> model) {
            Metadata metadata = (Metadata) model;
            events.add("update:" + metadata.getWorkflowState()
                + (metadata.getCurrentlyRunningStep() == null ? "" : ":" + metadata.getCurrentlyRunningStep()));
        }

        @Override
        public void saveChanges(CancellationToken token) {
            events.add("save");
        }

        @Override
        public void onError(Metadata metadata, Exception exception, CancellationToken token) {
            events.add("error:" + exception.getClass().getSimpleName());
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    static final class Length implements Step<String, Integer> {
        @Override
        public Integer run(String input) {
            if (input.isEmpty()) {
                throw new IllegalArgumentException("input cannot be empty");
            }
            return input.length();
        }
    }

    static final class LengthWorkflow extends EffectWorkflow<String, Integer> {
        LengthWorkflow(EffectRunner runner, Clock clock) {
            super(runner, clock);
        }

        @Override
        protected Result<Integer> runInternal(String input) {
            return activate(input).chain(new Length()).resolve();
        }
    }

    /**
     * Step 경계 호출을 기록하는 Provider.
     */
    static final class RecordingStepProvider implements StepEffectProvider {
        final List<StepExecution> executions = new ArrayList<>();

        @Override
        public void beforeStep(StepExecution execution) {
            executions.add(execution);
        }

        @Override
        public void afterStep(StepExecution execution) {
            executions.add(execution);
        }

        @Override
        public void close() {
        }
    }

    /**
     * 모든 호출에서 예외를 던지는 Provider.
     */
    static final class BrokenProvider implements EffectProvider {
        @Override
        public void track(Entity<?> model) {
            throw new IllegalStateException("database is down");
        }

        @Override
        public void update(Entity<?> model) {
            throw new IllegalStateException("database is down");
        }

        @Override
        public void saveChanges(CancellationToken token) {
            throw new IllegalStateException("database is down");
        }

        @Override
        public void close() {
            throw new IllegalStateException("database is down");
        }
    }

    private RecordingProvider provider;

    private LengthWorkflow newWorkflow() {
        provider = new RecordingProvider();
        return new LengthWorkflow(new EffectRunner(List.<EffectProviderFactory>of(() -> provider)), clock);
    }

    @Test
    void 성공_시_IN_PROGRESS_추적_후_Step_진행과_COMPLETED_저장() {
        // given
        LengthWorkflow workflow = newWorkflow();

        // when
        Integer result = workflow.run("abcd");

        // then
        assertThat(result).isEqualTo(4);
        assertThat(provider.events).containsExactly(
            "track:IN_PROGRESS", "save",
            "update:IN_PROGRESS:Length", "save",
            "update:IN_PROGRESS", "save",
            "update:COMPLETED", "save");
        assertThat(provider.closed).isTrue();
        Metadata metadata = workflow.getMetadata();
        assertThat(metadata.getWorkflowState()).isEqualTo(WorkflowState.COMPLETED);
        assertThat(metadata.getOutputObject()).isEqualTo(4);
        assertThat(metadata.getInputObject()).isEqualTo("abcd");
        assertThat(metadata.getEndTime()).isEqualTo(NOW);
    }

    @Test
    void 실패_시_FAILED_기록과_onError_호출() {
        // given
        LengthWorkflow workflow = newWorkflow();

        // when
        Result<Integer> result = workflow.runEither("");

        // then
        assertThat(result.isFailure()).isTrue();
        assertThat(provider.events).contains("error:IllegalArgumentException", "update:FAILED");
        Metadata metadata = workflow.getMetadata();
        assertThat(metadata.getFailureStep()).isEqualTo("Length");
        assertThat(metadata.getFailureReason()).isEqualTo("input cannot be empty");
    }

    @Test
    void 취소_시_CANCELLED_기록하고_onError는_호출하지_않음() {
        // given
        LengthWorkflow workflow = newWorkflow();
        CancellationToken token = new CancellationToken();
        token.cancel();

        // when & then
        assertThatThrownBy(() -> workflow.runEither("abc", token)).isInstanceOf(CancellationException.class);
        assertThat(workflow.getMetadata().getWorkflowState()).isEqualTo(WorkflowState.CANCELLED);
        assertThat(provider.events).noneMatch(event -> event.startsWith("error:"));
    }

    @Test
    void useMetadata_저장되지_않은_Metadata는_거부() {
        // given
        LengthWorkflow workflow = newWorkflow();
        Metadata transientMetadata = Metadata.create(LengthWorkflow.class.getName(), null, NOW);

        // when & then
        assertThatThrownBy(() -> workflow.useMetadata(transientMetadata))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void useMetadata_PENDING_Metadata를_이어서_사용() {
        // given
        LengthWorkflow workflow = newWorkflow();
        Metadata pending = Metadata.create(LengthWorkflow.class.getName(), "scheduled-1", NOW);
        pending.setId(7L);

        // when
        workflow.useMetadata(pending).run("xy");

        // then
        assertThat(workflow.getMetadata()).isSameAs(pending);
        assertThat(pending.getWorkflowState()).isEqualTo(WorkflowState.COMPLETED);
        assertThat(provider.events.get(0)).isEqualTo("track:IN_PROGRESS");
    }

    @Test
    void 같은_인스턴스를_두_번_실행해도_실행마다_새_Provider로_기록() {
        // given
        List<RecordingProvider> providers = new ArrayList<>();
        EffectRunner runner = new EffectRunner(List.<EffectProviderFactory>of(() -> {
            RecordingProvider created = new RecordingProvider();
            providers.add(created);
            return created;
        }));
        LengthWorkflow workflow = new LengthWorkflow(runner, clock);

        // when
        Result<Integer> first = workflow.runEither("abcd");
        Metadata firstMetadata = workflow.getMetadata();
        Result<Integer> second = workflow.runEither("abcdef");

        // then
        assertThat(first).isEqualTo(new Success<>(4));
        assertThat(second).isEqualTo(new Success<>(6));
        assertThat(providers).hasSize(2);
        assertThat(providers).allSatisfy(recorded -> {
            assertThat(recorded.closed).isTrue();
            assertThat(recorded.events).startsWith("track:IN_PROGRESS").endsWith("update:COMPLETED", "save");
        });
        assertThat(workflow.getMetadata()).isNotSameAs(firstMetadata);
        assertThat(workflow.getMetadata().getOutputObject()).isEqualTo(6);
    }

    @Test
    void Provider가_모두_실패해도_Workflow_결과는_그대로() {
        // given
        LengthWorkflow workflow = new LengthWorkflow(
            new EffectRunner(List.<EffectProviderFactory>of(BrokenProvider::new)), clock);

        // when
        Result<Integer> result = workflow.runEither("abc");

        // then
        assertThat(result).isEqualTo(new Success<>(3));
        assertThat(workflow.getMetadata().getWorkflowState()).isEqualTo(WorkflowState.COMPLETED);
    }

    @Test
    void Step_Provider는_Step_전후로_실행_정보를_받음() {
        // given
        RecordingStepProvider stepProvider = new RecordingStepProvider();
        EffectRunner runner = new EffectRunner(List.of(), List.<StepEffectProviderFactory>of(() -> stepProvider),
            new EffectProviderRegistry());
        LengthWorkflow workflow = new LengthWorkflow(runner, clock);

        // when
        workflow.runEither("");

        // then
        assertThat(stepProvider.executions).hasSize(2);
        StepExecution before = stepProvider.executions.get(0);
        StepExecution after = stepProvider.executions.get(1);
        assertThat(before.stepName()).isEqualTo("Length");
        assertThat(before.isFinished()).isFalse();
        assertThat(after.isFinished()).isTrue();
        assertThat(after.isSucceeded()).isFalse();
        assertThat(after.failure()).hasValueSatisfying(
            exception -> assertThat(exception).hasMessage("input cannot be empty"));
        assertThat(after.startedAt()).isEqualTo(NOW);
    }

    @Test
    void Step_종료_후_실행_중_Step_기록을_해제하고_저장() {
        // given
        LengthWorkflow workflow = newWorkflow();

        // when
        workflow.runEither("");

        // then
        assertThat(provider.events).containsSubsequence(
            "update:IN_PROGRESS:Length", "save", "update:IN_PROGRESS", "save", "error:IllegalArgumentException",
            "update:FAILED", "save");
    }
}
