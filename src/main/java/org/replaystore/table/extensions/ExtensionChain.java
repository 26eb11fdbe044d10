package org.replaystore.table.extensions;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.replaystore.api.contracts.PrioritizedItem;
import org.replaystore.api.extensions.ITableExtension;
import org.replaystore.api.extensions.TableLock;

/**
 * Ordered list of the extensions registered with a table.
 * <p>
 * Fires hooks in registration order. The list is copy-on-write because a hook
 * may release the table lock, during which other threads can register or
 * unregister extensions; a firing pass always completes over the extensions
 * present when it started.
 * <p>
 * After every hook the chain verifies that the lock is held again. A hook
 * returning without the lock is a programming error.
 */
public class ExtensionChain {

    private final TableLock lock;
    private final List<ITableExtension> extensions = new CopyOnWriteArrayList<>();

    /**
     * Creates an empty chain.
     *
     * @param lock The lock handed to every hook
     */
    public ExtensionChain(TableLock lock) {
        this.lock = lock;
    }

    public void add(ITableExtension extension) {
        extensions.add(extension);
    }

    public boolean remove(ITableExtension extension) {
        return extensions.remove(extension);
    }

    public boolean contains(ITableExtension extension) {
        return extensions.contains(extension);
    }

    /**
     * Returns a snapshot of the registered extensions in registration order.
     */
    public List<ITableExtension> extensions() {
        return List.copyOf(extensions);
    }

    public void fireInsert(PrioritizedItem item) {
        fire(item, ITableExtension::onInsert);
    }

    public void fireDelete(PrioritizedItem item) {
        fire(item, ITableExtension::onDelete);
    }

    public void fireUpdate(PrioritizedItem item) {
        fire(item, ITableExtension::onUpdate);
    }

    public void fireSample(PrioritizedItem item) {
        fire(item, ITableExtension::onSample);
    }

    public void fireReset() {
        for (ITableExtension extension : extensions) {
            extension.onReset(lock);
            checkReacquired(extension);
        }
    }

    private void fire(PrioritizedItem item, HookCall hook) {
        for (ITableExtension extension : extensions) {
            hook.call(extension, lock, item);
            checkReacquired(extension);
        }
    }

    private void checkReacquired(ITableExtension extension) {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException(
                    "Extension " + extension.getClass().getName() + " returned without holding the table lock");
        }
    }

    @FunctionalInterface
    private interface HookCall {
        void call(ITableExtension extension, TableLock lock, PrioritizedItem item);
    }
}
