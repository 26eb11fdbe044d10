package org.replaystore.table.extensions;

import java.util.concurrent.locks.ReentrantLock;

import org.replaystore.api.contracts.PrioritizedItem;
import org.replaystore.api.extensions.ITableExtension;
import org.replaystore.api.extensions.TableLock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class ExtensionChainTest {

    @Mock
    private ITableExtension first;

    @Mock
    private ITableExtension second;

    private final ReentrantLock lock = new ReentrantLock();
    private final TableLock tableLock = new TableLock(lock);
    private final PrioritizedItem item = PrioritizedItem.newBuilder().setKey(7).setTable("t").build();
    private ExtensionChain chain;

    @BeforeEach
    void setUp() {
        chain = new ExtensionChain(tableLock);
        lock.lock();
    }

    @AfterEach
    void tearDown() {
        while (lock.isHeldByCurrentThread()) {
            lock.unlock();
        }
    }

    @Test
    void firesHooksInRegistrationOrder() {
        chain.add(first);
        chain.add(second);

        chain.fireInsert(item);
        chain.fireSample(item);
        chain.fireUpdate(item);
        chain.fireDelete(item);
        chain.fireReset();

        InOrder order = inOrder(first, second);
        order.verify(first).onInsert(tableLock, item);
        order.verify(second).onInsert(tableLock, item);
        order.verify(first).onSample(tableLock, item);
        order.verify(second).onSample(tableLock, item);
        order.verify(first).onUpdate(tableLock, item);
        order.verify(second).onUpdate(tableLock, item);
        order.verify(first).onDelete(tableLock, item);
        order.verify(second).onDelete(tableLock, item);
        order.verify(first).onReset(tableLock);
        order.verify(second).onReset(tableLock);
    }

    @Test
    void removedExtensionIsNoLongerCalled() {
        chain.add(first);
        chain.add(second);

        assertThat(chain.remove(first)).isTrue();
        chain.fireInsert(item);

        verify(first, never()).onInsert(tableLock, item);
        verify(second).onInsert(tableLock, item);
        assertThat(chain.extensions()).containsExactly(second);
        assertThat(chain.contains(first)).isFalse();
    }

    @Test
    void hookReturningWithoutLockIsDetected() {
        doAnswer(invocation -> {
            lock.unlock();
            return null;
        }).when(first).onInsert(tableLock, item);
        chain.add(first);

        assertThatThrownBy(() -> chain.fireInsert(item))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("without holding the table lock");
    }

    @Test
    void hookMayTemporarilyReleaseTheLock() {
        doAnswer(invocation -> {
            TableLock handed = invocation.getArgument(0);
            handed.runUnlocked(() -> assertThat(lock.isHeldByCurrentThread()).isFalse());
            return null;
        }).when(first).onDelete(tableLock, item);
        chain.add(first);
        chain.add(second);

        chain.fireDelete(item);

        verify(second).onDelete(tableLock, item);
        assertThat(lock.isHeldByCurrentThread()).isTrue();
    }
}
