package com.ryuqq.railway.application.runtime;

/**
 * Polling runtime.
 *
 * <p>One call to {@link #pump()} performs a single polling cycle: find due work, claim it atomically,
 * hand it on, and return. Callers drive the loop (a scheduled executor, a framework scheduler, or a test).</p>
 *
 * <p><strong>Implementations:</strong></p>
 * <ul>
 *   <li>Manifest dispatcher: due manifests → work queue entries</li>
 *   <li>Work queue dispatcher: queued entries → pending metadata → background task server</li>
 * </ul>
 *
 * <p><strong>Concurrency Behavior:</strong></p>
 * <ul>
 *   <li>Several instances may pump concurrently against the same data store</li>
 *   <li>Claims are conditional updates; losing a claim race skips the item silently</li>
 *   <li>A claim older than the visibility timeout is treated as abandoned and may be re-claimed</li>
 * </ul>
 *
 * <p><strong>Exception Handling:</strong></p>
 * <ul>
 *   <li>Per-item errors are logged and do not abort the cycle</li>
 *   <li>Thrown exceptions indicate the data store itself is unavailable</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Runtime {

    /**
     * Executes a single polling cycle.
     *
     * @return number of items handed on in this cycle
     */
    int pump();
}
