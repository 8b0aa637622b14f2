package com.ryuqq.railway.testkit.contract;

import com.ryuqq.railway.application.registry.WorkflowRegistry;
import com.ryuqq.railway.core.model.Metadata;
import com.ryuqq.railway.core.result.Failure;
import com.ryuqq.railway.core.result.Result;
import com.ryuqq.railway.core.statemachine.WorkflowState;
import com.ryuqq.railway.core.workflow.CancellationToken;
import com.ryuqq.railway.core.workflow.WorkflowException;
import com.ryuqq.railway.testkit.contract.fixture.FormatNumberWorkflow;
import com.ryuqq.railway.testkit.contract.fixture.InvocationCounter;
import com.ryuqq.railway.testkit.contract.fixture.Order;
import com.ryuqq.railway.testkit.contract.fixture.OrderWorkflow;
import com.ryuqq.railway.testkit.contract.fixture.Receipt;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for workflow execution through the bus with persisted Metadata.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Auto-extracted chain resolves the declared return type and records Completed metadata</li>
 *   <li>Null primary input fails before any step runs</li>
 *   <li>A failed step stops every later step</li>
 *   <li>A failed ShortCircuit step is absorbed</li>
 *   <li>A cancelled token runs no step and records Cancelled metadata</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ExecutionContractTest extends AbstractContractTest {

    private final InvocationCounter counter = new InvocationCounter();

    @Override
    protected void registerWorkflows(WorkflowRegistry registry) {
        registry.register(Integer.class, FormatNumberWorkflow.class, runner -> new FormatNumberWorkflow(runner, clock));
        registry.register(Order.class, OrderWorkflow.class, runner -> new OrderWorkflow(runner, clock, counter));
    }

    @Test
    void testIntToString_WhenInputIs42_CompletesWithSerializedOutput() {
        // When
        Result<?> result = bus.run(42);

        // Then
        assertEquals(Result.success("42"), result);
        List<Metadata> runs = allMetadata();
        assertEquals(1, runs.size());
        Metadata metadata = runs.get(0);
        assertEquals(WorkflowState.COMPLETED, metadata.getWorkflowState());
        assertEquals(FormatNumberWorkflow.class.getName(), metadata.getName());
        assertEquals("42", metadata.getInput());
        assertEquals("\"42\"", metadata.getOutput());
        assertEquals(START, metadata.getEndTime());
    }

    @Test
    void testActivate_WhenInputIsNull_FailsWithoutRunningSteps() {
        // Given
        OrderWorkflow workflow = new OrderWorkflow(effectRunners.get(), clock, counter);

        // When
        Result<Receipt> result = workflow.runEither(null);

        // Then
        assertTrue(result.isFailure());
        Exception exception = ((Failure<Receipt>) result).exception();
        assertInstanceOf(WorkflowException.class, exception);
        assertTrue(exception.getMessage().contains("is null"), exception.getMessage());
        assertEquals(0, counter.total(), "No step should run for a null input");
        assertWorkflowState(workflow.getMetadata().getId(), WorkflowState.FAILED);
    }

    @Test
    void testChain_WhenStepFails_LaterStepsAreNeverInvoked() {
        // When
        Result<?> result = bus.run(new Order("order-1", 0));

        // Then
        assertTrue(result.isFailure());
        assertEquals(1, counter.count("ValidateOrder"));
        assertEquals(0, counter.count("IssueReceipt"), "IssueReceipt must not run after ValidateOrder failed");

        Metadata metadata = allMetadata().get(0);
        assertEquals(WorkflowState.FAILED, metadata.getWorkflowState());
        assertEquals("ValidateOrder", metadata.getFailureStep());
        assertEquals(IllegalArgumentException.class.getName(), metadata.getFailureException());
        assertEquals("Quantity must be positive (current: 0)", metadata.getFailureReason());
        assertNotNull(metadata.getStackTrace());
    }

    @Test
    void testShortCircuit_WhenStepFails_FailureIsAbsorbed() {
        // When
        Result<?> result = bus.run(new Order("order-2", 3));

        // Then
        assertEquals(Result.success(new Receipt("order-2", "ISSUED")), result);
        assertEquals(1, counter.count("CachedReceipt"));
        assertEquals(1, counter.count("IssueReceipt"));
        assertEquals(WorkflowState.COMPLETED, allMetadata().get(0).getWorkflowState());
    }

    @Test
    void testResolve_WhenShortCircuitValueSet_ItBeatsMemory() {
        // When
        Result<?> result = bus.run(new Order("cached-1", 3));

        // Then
        assertEquals(Result.success(new Receipt("cached-1", "CACHED")), result);
        assertEquals(1, counter.count("IssueReceipt"), "Later steps still run after a short-circuit value");
    }

    @Test
    void testResolve_WhenFailureAndShortCircuitValueSet_FailureWins() {
        // When
        Result<?> result = bus.run(new Order("cached-2", 0));

        // Then
        assertTrue(result instanceof Failure<?>);
        assertInstanceOf(IllegalArgumentException.class, ((Failure<?>) result).exception());
    }

    @Test
    void testRun_WhenTokenAlreadyCancelled_NoStepRunsAndMetadataIsCancelled() {
        // Given
        CancellationToken token = new CancellationToken();
        token.cancel();

        // When / Then
        assertThrows(CancellationException.class, () -> bus.run(new Order("order-3", 1), null, token));
        assertEquals(0, counter.total());
        Metadata metadata = allMetadata().get(0);
        assertEquals(WorkflowState.CANCELLED, metadata.getWorkflowState());
        assertNotNull(metadata.getEndTime());
    }

    @Test
    void testRun_WhenParentGiven_MetadataIsNested() {
        // Given
        bus.run(42);
        long parentId = allMetadata().get(0).getId();

        // When
        bus.run(new Order("order-4", 1), parentId, CancellationToken.none());

        // Then
        Metadata child = allMetadata().stream()
            .filter(row -> row.getName().equals(OrderWorkflow.class.getName()))
            .findFirst()
            .orElseThrow();
        assertEquals(parentId, child.getParentId());
        assertTrue(child.getOutput().contains("ISSUED"), child.getOutput());
    }
}
