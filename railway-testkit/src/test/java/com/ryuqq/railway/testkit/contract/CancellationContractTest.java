package com.ryuqq.railway.testkit.contract;

import com.ryuqq.railway.application.registry.WorkflowRegistry;
import com.ryuqq.railway.core.model.Manifest;
import com.ryuqq.railway.core.model.Metadata;
import com.ryuqq.railway.core.schedule.ManifestOptions;
import com.ryuqq.railway.core.schedule.Schedule;
import com.ryuqq.railway.core.spi.DataContext;
import com.ryuqq.railway.core.statemachine.WorkflowState;
import com.ryuqq.railway.core.workflow.CancellationToken;
import com.ryuqq.railway.testkit.contract.fixture.InvocationCounter;
import com.ryuqq.railway.testkit.contract.fixture.Order;
import com.ryuqq.railway.testkit.contract.fixture.OrderWorkflow;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for cancelled executions.
 *
 * <p>Cancellation ends the run as CANCELLED and is never treated as a failure: no retry is queued,
 * no dead letter is created and the retry count is untouched.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CancellationContractTest extends AbstractContractTest {

    private final InvocationCounter counter = new InvocationCounter();

    @Override
    protected void registerWorkflows(WorkflowRegistry registry) {
        registry.register(Order.class, OrderWorkflow.class, runner -> new OrderWorkflow(runner, clock, counter));
    }

    @Test
    void testExecute_WhenTokenCancelled_EndsCancelledWithoutRetryOrDeadLetter() {
        // Given
        Manifest manifest = scheduler.schedule(OrderWorkflow.class, "cancel-me", new Order("cancel-me", 0),
            Schedule.manual(), ManifestOptions.defaults().withMaxRetries(0));
        Metadata pending = insertPendingRun(manifest);
        CancellationToken token = new CancellationToken();
        token.cancel();

        // When
        executor.execute(pending.getId(), token);

        // Then
        assertWorkflowState(pending.getId(), WorkflowState.CANCELLED);
        assertEquals(0, counter.total());
        assertTrue(workQueueOf("cancel-me").isEmpty());
        assertTrue(deadLettersOf("cancel-me").isEmpty());
        assertEquals(0, manifest("cancel-me").getRetryCount());
        assertNull(manifest("cancel-me").getLastSuccessfulRun());
    }

    @Test
    void testExecute_WhenMetadataNotPending_ThrowsIllegalStateException() {
        // Given
        Manifest manifest = scheduler.schedule(OrderWorkflow.class, "done", new Order("done", 1),
            Schedule.manual(), ManifestOptions.defaults());
        Metadata pending = insertPendingRun(manifest);
        executor.execute(pending.getId());

        // When / Then
        assertThrows(IllegalStateException.class, () -> executor.execute(pending.getId()));
        assertEquals(1, counter.count("IssueReceipt"));
    }

    private Metadata insertPendingRun(Manifest manifest) {
        try (DataContext context = dataContextFactory.create()) {
            Metadata metadata = Metadata.create(manifest.getName(), null, clock.instant());
            metadata.setManifestId(manifest.getId());
            metadata.setInput(manifest.getProperties());
            context.metadata().add(metadata);
            context.saveChanges();
            return metadata;
        }
    }
}
