package org.replaystore.api.extensions;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Guard over a table's exclusive lock, handed to extension hooks.
 * <p>
 * Hooks run while the table lock is held. A hook that needs to do expensive
 * work can give the lock up temporarily through {@link #runUnlocked(Runnable)}
 * or {@link #supplyUnlocked(Supplier)}. Both reacquire the lock before they
 * return, even when the action throws, so a hook cannot return to the table
 * with the lock released. There is no other way to release it.
 * <p>
 * While the lock is released, other callers may mutate the table. Hooks must
 * not assume the item they were called with is still present afterwards.
 */
public final class TableLock {

    private final ReentrantLock lock;

    /**
     * Wraps the lock of a table.
     *
     * @param lock The table lock
     */
    public TableLock(ReentrantLock lock) {
        this.lock = lock;
    }

    /**
     * Returns whether the calling thread holds the table lock.
     *
     * @return {@code true} if held by the current thread
     */
    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    /**
     * Releases the table lock, runs {@code action} and reacquires the lock.
     *
     * @param action The work to run without the lock
     * @throws IllegalStateException if the calling thread does not hold the lock
     */
    public void runUnlocked(Runnable action) {
        supplyUnlocked(() -> {
            action.run();
            return null;
        });
    }

    /**
     * Releases the table lock, computes a value and reacquires the lock.
     *
     * @param action The work to run without the lock
     * @param <T>    The result type
     * @return the value computed by {@code action}
     * @throws IllegalStateException if the calling thread does not hold the lock
     */
    public <T> T supplyUnlocked(Supplier<T> action) {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Table lock is not held by the current thread");
        }
        // Reentrant holds (e.g. a hook calling back into the table) are all released.
        int holds = lock.getHoldCount();
        for (int i = 0; i < holds; i++) {
            lock.unlock();
        }
        try {
            return action.get();
        } finally {
            for (int i = 0; i < holds; i++) {
                lock.lock();
            }
        }
    }
}
