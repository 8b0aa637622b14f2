package com.ryuqq.railway.core.model;

import com.ryuqq.railway.core.statemachine.WorkflowState;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Metadata 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class MetadataTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    @Test
    void create_StartsPendingWithGeneratedExternalId() {
        // When
        Metadata metadata = Metadata.create("com.example.Sync", null, NOW);

        // Then
        assertEquals(WorkflowState.PENDING, metadata.getWorkflowState());
        assertNotNull(metadata.getExternalId());
        assertEquals(NOW, metadata.getStartTime());
        assertNull(metadata.getEndTime());
    }

    @Test
    void fail_RecordsStepExceptionAndStackTrace() {
        // Given
        Metadata metadata = Metadata.create("com.example.Sync", "run-1", NOW);
        metadata.markInProgress();
        metadata.markStepStarted("LoadCustomers", NOW);

        // When
        metadata.fail(NOW.plusSeconds(5), "LoadCustomers", new IllegalStateException("connection refused"));

        // Then
        assertEquals(WorkflowState.FAILED, metadata.getWorkflowState());
        assertEquals("LoadCustomers", metadata.getFailureStep());
        assertEquals(IllegalStateException.class.getName(), metadata.getFailureException());
        assertEquals("connection refused", metadata.getFailureReason());
        assertTrue(metadata.getStackTrace().contains("connection refused"));
        assertNull(metadata.getCurrentlyRunningStep());
        assertEquals(NOW.plusSeconds(5), metadata.getEndTime());
    }

    @Test
    void complete_FromPending_ThrowsIllegalStateException() {
        // Given
        Metadata metadata = Metadata.create("com.example.Sync", null, NOW);

        // When & Then
        assertThrows(IllegalStateException.class, () -> metadata.complete(NOW));
    }

    @Test
    void markStepStarted_OnTerminalMetadata_ThrowsIllegalStateException() {
        // Given
        Metadata metadata = Metadata.create("com.example.Sync", null, NOW);
        metadata.failWithReason(NOW, "java.util.concurrent.TimeoutException", "timed out");

        // When & Then
        assertThrows(IllegalStateException.class, () -> metadata.markStepStarted("Next", NOW));
    }

    @Test
    void copy_IsIndependentOfOriginal() {
        // Given
        Metadata metadata = Metadata.create("com.example.Sync", null, NOW);

        // When
        Metadata copy = metadata.copy();
        copy.markInProgress();

        // Then
        assertEquals(WorkflowState.PENDING, metadata.getWorkflowState());
        assertEquals(WorkflowState.IN_PROGRESS, copy.getWorkflowState());
    }

    @Test
    void create_BlankName_ThrowsIllegalArgumentException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> Metadata.create(" ", null, NOW));
    }
}
