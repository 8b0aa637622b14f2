package com.ryuqq.railway.adapter.inmemory.task;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link InMemoryTaskServer}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryTaskServerTest {

    @Test
    void testEnqueue_WhenNoWorkerBound_RecordsUntilBind() {
        // Given
        InMemoryTaskServer taskServer = new InMemoryTaskServer();
        List<Long> executed = new ArrayList<>();

        // When
        String firstJob = taskServer.enqueue(1L);
        taskServer.enqueue(2L);

        // Then
        assertEquals("inmemory-1", firstJob);
        assertEquals(2, taskServer.pendingCount());
        assertThrows(IllegalStateException.class, taskServer::runPending);

        taskServer.bind(executed::add);
        assertEquals(List.of(1L, 2L), executed);
        assertEquals(0, taskServer.pendingCount());
    }

    @Test
    void testEnqueue_WhenCalledFromRunningJob_RunsAfterCurrentJob() {
        // Given
        InMemoryTaskServer taskServer = new InMemoryTaskServer();
        List<String> events = new ArrayList<>();
        taskServer.bind(metadataId -> {
            events.add("start " + metadataId);
            if (metadataId == 1L) {
                taskServer.enqueue(2L);
            }
            events.add("end " + metadataId);
        });

        // When
        taskServer.enqueue(1L);

        // Then
        assertEquals(List.of("start 1", "end 1", "start 2", "end 2"), events);
        assertEquals(List.of(1L, 2L), taskServer.enqueuedIds());
    }

    @Test
    void testRunPending_WhenJobFails_ContinuesWithRemainingJobs() {
        // Given
        InMemoryTaskServer taskServer = new InMemoryTaskServer();
        List<Long> executed = new ArrayList<>();
        taskServer.enqueue(1L);
        taskServer.enqueue(2L);

        // When
        taskServer.bind(metadataId -> {
            if (metadataId == 1L) {
                throw new IllegalStateException("boom");
            }
            executed.add(metadataId);
        });

        // Then
        assertEquals(List.of(2L), executed);
    }
}
