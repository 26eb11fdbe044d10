package org.replaystore.table.chunks;

import org.replaystore.api.contracts.ChunkData;
import org.replaystore.api.errors.InvalidArgumentException;
import org.replaystore.api.errors.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.replaystore.test.utils.TableTestUtils.chunk;

@Tag("unit")
class ChunkStoreTest {

    private ChunkStore store;

    @BeforeEach
    void setUp() {
        store = new ChunkStore();
    }

    @Test
    void chunkIsEvictedWhenLastReferenceIsReleased() throws Exception {
        ChunkData chunk = chunk(1);
        assertTrue(store.put(chunk));
        store.addRef(1);
        store.addRef(1);

        assertFalse(store.release(1));
        assertEquals(1, store.refCount(1));
        assertSame(chunk, store.get(1));

        assertTrue(store.release(1));
        assertFalse(store.contains(1));
        assertEquals(0, store.refCount(1));
        assertThatThrownBy(() -> store.get(1)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void puttingEqualChunkAgainIsNoOp() throws Exception {
        store.put(chunk(1));
        store.addRef(1);

        assertFalse(store.put(chunk(1)));
        assertEquals(1, store.refCount(1));
        assertEquals(1, store.size());
    }

    @Test
    void differentPayloadUnderSameKeyIsRejected() throws Exception {
        store.put(chunk(1, 1, 0, 3));

        assertThatThrownBy(() -> store.put(chunk(1, 1, 0, 4))).isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> store.checkCompatible(chunk(1, 2, 0, 3)))
                .isInstanceOf(InvalidArgumentException.class);
        store.checkCompatible(chunk(1, 1, 0, 3));
        store.checkCompatible(chunk(2));
    }

    @Test
    void episodesAreCountedAcrossChunks() throws Exception {
        store.put(chunk(1, 100, 0, 9));
        store.put(chunk(2, 100, 10, 19));
        store.put(chunk(3, 200, 0, 4));
        for (long key = 1; key <= 3; key++) {
            store.addRef(key);
        }
        assertEquals(2, store.numEpisodes());

        store.release(1);
        assertEquals(2, store.numEpisodes());

        store.release(2);
        assertEquals(1, store.numEpisodes());
    }

    @Test
    void misuseOfReferencesIsAnIllegalState() throws Exception {
        assertThatThrownBy(() -> store.addRef(5)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> store.release(5)).isInstanceOf(IllegalStateException.class);

        store.put(chunk(5));
        assertThatThrownBy(() -> store.release(5)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void clearDropsEverything() throws Exception {
        store.put(chunk(1));
        store.put(chunk(2));
        store.addRef(1);

        store.clear();

        assertThat(store.size()).isZero();
        assertThat(store.numEpisodes()).isZero();
    }
}
