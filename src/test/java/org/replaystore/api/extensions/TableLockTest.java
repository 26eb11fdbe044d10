package org.replaystore.api.extensions;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
class TableLockTest {

    private final ReentrantLock lock = new ReentrantLock();
    private final TableLock tableLock = new TableLock(lock);

    @Test
    void releasesAllHoldsWhileUnlockedAndRestoresThem() throws Exception {
        lock.lock();
        lock.lock();
        try {
            String result = tableLock.supplyUnlocked(() -> {
                assertFalse(lock.isHeldByCurrentThread());
                // Another thread can take the lock in the meantime.
                return CompletableFuture.supplyAsync(() -> {
                    boolean acquired = lock.tryLock();
                    if (acquired) {
                        lock.unlock();
                    }
                    return acquired ? "acquired" : "blocked";
                }).join();
            });

            assertEquals("acquired", result);
            assertEquals(2, lock.getHoldCount());
        } finally {
            lock.unlock();
            lock.unlock();
        }
    }

    @Test
    void reacquiresWhenActionThrows() {
        lock.lock();
        try {
            assertThatThrownBy(() -> tableLock.runUnlocked(() -> {
                throw new IllegalArgumentException("boom");
            })).isInstanceOf(IllegalArgumentException.class);

            assertTrue(tableLock.isHeldByCurrentThread());
        } finally {
            lock.unlock();
        }
    }

    @Test
    void rejectsUseWithoutHoldingTheLock() throws Exception {
        assertThatThrownBy(() -> tableLock.runUnlocked(() -> { }))
                .isInstanceOf(IllegalStateException.class);

        lock.lock();
        try {
            Boolean heldElsewhere = CompletableFuture.supplyAsync(tableLock::isHeldByCurrentThread)
                    .get(5, TimeUnit.SECONDS);
            assertFalse(heldElsewhere);
        } finally {
            lock.unlock();
        }
    }
}
