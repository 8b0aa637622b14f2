package com.ryuqq.railway.core.spi;

import com.ryuqq.railway.core.model.DeadLetter;
import com.ryuqq.railway.core.model.LogEntry;
import com.ryuqq.railway.core.model.Manifest;
import com.ryuqq.railway.core.model.Metadata;
import com.ryuqq.railway.core.model.WorkQueueEntry;

/**
 * Data Context SPI (Service Provider Interface).
 *
 * <p>A unit of work over the five persisted tables. Implementations back it with a database; the in-memory
 * adapter is the reference implementation used by tests.</p>
 *
 * <p><strong>Transactions:</strong></p>
 * <pre>
 * try (DataContext context = factory.create();
 *      DataContextTransaction tx = context.beginTransaction()) {
 *     context.manifests().add(manifest);
 *     context.saveChanges();   // flushed into the transaction, not yet visible
 *     tx.commit();             // visible to every other context
 * }                            // closing an uncommitted transaction rolls back
 * </pre>
 *
 * <p>Without an open transaction {@link #saveChanges()} commits immediately.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface DataContext extends AutoCloseable {

    Table<Metadata> metadata();

    Table<Manifest> manifests();

    Table<WorkQueueEntry> workQueue();

    Table<DeadLetter> deadLetters();

    Table<LogEntry> logs();

    /**
     * Opens a transaction. Only one transaction may be open per context.
     *
     * @return transaction handle
     * @throws IllegalStateException if a transaction is already open
     */
    DataContextTransaction beginTransaction();

    /**
     * Flushes staged changes.
     *
     * @return number of flushed row changes
     */
    int saveChanges();

    /**
     * Discards unsaved changes and rolls back an open transaction.
     */
    @Override
    void close();
}
