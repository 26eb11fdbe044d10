package org.replaystore.table.extensions;

import org.replaystore.api.contracts.PrioritizedItem;
import org.replaystore.api.errors.FailedPreconditionException;
import org.replaystore.api.extensions.ITableExtension;
import org.replaystore.api.extensions.TableLock;
import org.replaystore.table.Table;

/**
 * Base class for extensions that are bound to a single table and do not need
 * to release the table lock.
 * <p>
 * The lock-aware hooks forward to {@code applyOnX} methods without the lock
 * argument; subclasses override whichever they need. Subclasses that want to
 * release the lock override the lock-aware hook itself.
 */
public abstract class AbstractTableExtension implements ITableExtension {

    /**
     * Whether the extension is bound to a table.
     */
    public enum RegistrationState {
        UNREGISTERED,
        REGISTERED
    }

    private RegistrationState state = RegistrationState.UNREGISTERED;
    private Table table;

    @Override
    public synchronized void registerTable(Table table) throws FailedPreconditionException {
        if (state == RegistrationState.REGISTERED) {
            throw new FailedPreconditionException(String.format(
                    "Attempting to register table '%s' with an extension that is already registered with table '%s'",
                    table.name(), this.table.name()));
        }
        state = RegistrationState.REGISTERED;
        this.table = table;
    }

    /**
     * Unbinds the extension. Tables are compared by identity, not by name.
     *
     * @throws IllegalStateException if the extension is not bound to {@code table}
     */
    @Override
    public synchronized void unregisterTable(TableLock lock, Table table) {
        if (state != RegistrationState.REGISTERED || this.table != table) {
            throw new IllegalStateException(String.format(
                    "Table '%s' attempted to unregister an extension bound to %s",
                    table.name(),
                    state == RegistrationState.REGISTERED ? "another table named '" + this.table.name() + "'" : "no table"));
        }
        state = RegistrationState.UNREGISTERED;
        this.table = null;
    }

    public synchronized RegistrationState getRegistrationState() {
        return state;
    }

    /**
     * Returns the bound table, or {@code null} when unregistered.
     */
    public synchronized Table getTable() {
        return table;
    }

    /**
     * Returns the name of the bound table, or {@code null} when unregistered.
     */
    public synchronized String getTableName() {
        return table == null ? null : table.name();
    }

    @Override
    public void onInsert(TableLock lock, PrioritizedItem item) {
        applyOnInsert(item);
    }

    @Override
    public void onDelete(TableLock lock, PrioritizedItem item) {
        applyOnDelete(item);
    }

    @Override
    public void onUpdate(TableLock lock, PrioritizedItem item) {
        applyOnUpdate(item);
    }

    @Override
    public void onSample(TableLock lock, PrioritizedItem item) {
        applyOnSample(item);
    }

    @Override
    public void onReset(TableLock lock) {
        applyOnReset();
    }

    protected void applyOnInsert(PrioritizedItem item) {
    }

    protected void applyOnDelete(PrioritizedItem item) {
    }

    protected void applyOnUpdate(PrioritizedItem item) {
    }

    protected void applyOnSample(PrioritizedItem item) {
    }

    protected void applyOnReset() {
    }
}
