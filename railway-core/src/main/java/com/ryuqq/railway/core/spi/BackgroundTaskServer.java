package com.ryuqq.railway.core.spi;

/**
 * Background Task Server SPI.
 *
 * <p>Runs the workflow execution recorded by a PENDING metadata row outside the caller's thread
 * (or inline, for the in-memory implementation).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface BackgroundTaskServer {

    /**
     * Enqueues execution of a pending metadata row.
     *
     * @param metadataId id of a PENDING metadata row
     * @return implementation-specific job id
     */
    String enqueue(long metadataId);
}
