package com.ryuqq.railway.application.registry;

import com.ryuqq.railway.application.effect.EffectRunner;
import com.ryuqq.railway.application.effect.EffectWorkflow;
import com.ryuqq.railway.core.result.Result;
import com.ryuqq.railway.core.result.Success;
import com.ryuqq.railway.core.workflow.WorkflowException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * WorkflowRegistry / WorkflowBus 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class WorkflowRegistryTest {

    interface Command {
    }

    record Rename(String name) implements Command {
    }

    static final class Echo extends EffectWorkflow<String, String> {
        Echo(EffectRunner runner) {
            super(runner);
        }

        @Override
        protected Result<String> runInternal(String input) {
            return activate(input).resolve();
        }
    }

    static final class HandleCommand extends EffectWorkflow<Command, String> {
        HandleCommand(EffectRunner runner) {
            super(runner);
        }

        @Override
        protected Result<String> runInternal(Command input) {
            return resolve(Result.success(input.getClass().getSimpleName()));
        }
    }

    @Test
    void register_같은_입력_타입_중복_등록_거부() {
        // given
        WorkflowRegistry registry = new WorkflowRegistry().register(String.class, Echo.class, Echo::new);

        // when & then
        assertThatThrownBy(() -> registry.register(String.class, Echo.class, Echo::new))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void findByInputType_하위_타입_입력도_찾음() {
        // given
        WorkflowRegistry registry = new WorkflowRegistry().register(Command.class, HandleCommand.class, HandleCommand::new);

        // when & then
        assertThat(registry.findByInputType(Rename.class))
            .hasValueSatisfying(registration -> assertThat(registration.workflowType()).isEqualTo(HandleCommand.class));
        assertThat(registry.findByWorkflowName(HandleCommand.class.getName())).isPresent();
        assertThat(registry.findByInputType(Integer.class)).isEmpty();
    }

    @Test
    void validate_등록되지_않은_조합이면_WorkflowException() {
        // given
        WorkflowRegistry registry = new WorkflowRegistry().register(String.class, Echo.class, Echo::new);

        // when & then
        assertThatThrownBy(() -> registry.validate(HandleCommand.class, Rename.class))
            .isInstanceOf(WorkflowException.class)
            .hasMessageContaining("is not registered");
        assertThat(registry.validate(Echo.class, String.class).workflowName()).isEqualTo(Echo.class.getName());
    }

    @Test
    void bus_입력_타입으로_Workflow를_찾아_실행() {
        // given
        WorkflowRegistry registry = new WorkflowRegistry()
            .register(String.class, Echo.class, Echo::new)
            .register(Command.class, HandleCommand.class, HandleCommand::new);
        WorkflowBus bus = new WorkflowBus(registry, () -> new EffectRunner(List.of()));

        // when
        Result<?> echoed = bus.run("hello");
        Result<?> handled = bus.run(new Rename("x"));

        // then
        assertThat(echoed).isEqualTo(new Success<>("hello"));
        assertThat(handled).isEqualTo(new Success<>("Rename"));
    }

    @Test
    void bus_등록되지_않은_입력이면_WorkflowException() {
        // given
        WorkflowBus bus = new WorkflowBus(new WorkflowRegistry(), () -> new EffectRunner(List.of()));

        // when & then
        assertThatThrownBy(() -> bus.run(42))
            .isInstanceOf(WorkflowException.class)
            .hasMessageContaining("No workflow registered for input type java.lang.Integer");
        assertThatThrownBy(() -> bus.run(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void factory가_다른_타입을_반환하면_IllegalStateException() {
        // given
        WorkflowRegistration<String> registration = new WorkflowRegistration<>(String.class, Echo.class, runner -> null);

        // when & then
        assertThatThrownBy(() -> registration.create(new EffectRunner(List.of())))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("returned null");
    }
}
