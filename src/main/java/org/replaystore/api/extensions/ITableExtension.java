package org.replaystore.api.extensions;

import org.replaystore.api.contracts.PrioritizedItem;
import org.replaystore.api.errors.FailedPreconditionException;
import org.replaystore.table.Table;

/**
 * Observer of table mutations.
 * <p>
 * Hooks of all registered extensions run synchronously, in registration order,
 * while the table holds its lock. Each hook sees the table state already
 * mutated by the step that triggered it. Every hook has a no-op default, so an
 * extension only implements what it needs.
 * <p>
 * A hook that blocks stalls the whole table. Expensive work must be run through
 * {@link TableLock#runUnlocked(Runnable)}.
 * <p>
 * An extension is bound to at most one table at a time.
 */
public interface ITableExtension {

    /**
     * Binds the extension to a table. Called by the table when the extension is
     * registered, without the table lock held.
     *
     * @param table The table
     * @throws FailedPreconditionException if the extension is already bound to a table
     */
    void registerTable(Table table) throws FailedPreconditionException;

    /**
     * Unbinds the extension from a table. Called with the table lock held.
     *
     * @param lock  The table lock
     * @param table The table, must be the one the extension is bound to
     * @throws IllegalStateException if the extension is bound to a different table
     */
    void unregisterTable(TableLock lock, Table table);

    /**
     * Called after an item has been inserted.
     */
    default void onInsert(TableLock lock, PrioritizedItem item) {
    }

    /**
     * Called after an item has been removed, explicitly, by eviction or because it
     * reached the maximum number of samples.
     */
    default void onDelete(TableLock lock, PrioritizedItem item) {
    }

    /**
     * Called after the priority of an item changed.
     */
    default void onUpdate(TableLock lock, PrioritizedItem item) {
    }

    /**
     * Called after an item has been sampled. {@code item} carries the incremented
     * times-sampled counter.
     */
    default void onSample(TableLock lock, PrioritizedItem item) {
    }

    /**
     * Called after the table has been reset.
     */
    default void onReset(TableLock lock) {
    }
}
