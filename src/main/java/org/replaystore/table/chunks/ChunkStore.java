package org.replaystore.table.chunks;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import org.replaystore.api.contracts.ChunkData;
import org.replaystore.api.errors.InvalidArgumentException;
import org.replaystore.api.errors.NotFoundException;

/**
 * Arena of chunk payloads keyed by chunk id, each with an explicit reference
 * count held by the items that cite it.
 * <p>
 * A chunk is evicted exactly when its count drops back to zero. Items never
 * form cycles, so plain counting is sufficient.
 * <p>
 * Thread Safety: {@link #get(long)} and {@link #contains(long)} are lock-free;
 * payloads are immutable protobuf messages. All mutating methods (and the
 * counting queries) must be called under the owning table's lock.
 */
public class ChunkStore {

    private static final class Entry {
        final ChunkData chunk;
        int refCount;

        Entry(ChunkData chunk) {
            this.chunk = chunk;
        }
    }

    private final Map<Long, Entry> chunks = new ConcurrentHashMap<>();
    private final Long2IntOpenHashMap chunksPerEpisode = new Long2IntOpenHashMap();

    /**
     * Checks that {@code chunk} can be stored: either its key is free or the
     * same payload is already stored under it.
     *
     * @param chunk The chunk to check
     * @throws InvalidArgumentException if a different payload is stored under the same key
     */
    public void checkCompatible(ChunkData chunk) throws InvalidArgumentException {
        Entry existing = chunks.get(chunk.getChunkKey());
        if (existing != null && !existing.chunk.equals(chunk)) {
            throw new InvalidArgumentException(String.format(
                    "Chunk %d is already stored with a different payload", chunk.getChunkKey()));
        }
    }

    /**
     * Stores a chunk with a reference count of zero. Storing an equal chunk again
     * is a no-op.
     *
     * @param chunk The chunk to store
     * @return {@code true} if the chunk was not stored before
     * @throws InvalidArgumentException if a different payload is stored under the same key
     */
    public boolean put(ChunkData chunk) throws InvalidArgumentException {
        checkCompatible(chunk);
        if (chunks.containsKey(chunk.getChunkKey())) {
            return false;
        }
        chunks.put(chunk.getChunkKey(), new Entry(chunk));
        chunksPerEpisode.addTo(chunk.getSequenceRange().getEpisodeId(), 1);
        return true;
    }

    /**
     * Returns a stored chunk.
     *
     * @param key The chunk key
     * @return the chunk payload
     * @throws NotFoundException if no chunk is stored under the key
     */
    public ChunkData get(long key) throws NotFoundException {
        Entry entry = chunks.get(key);
        if (entry == null) {
            throw new NotFoundException("Chunk " + key + " not found");
        }
        return entry.chunk;
    }

    public boolean contains(long key) {
        return chunks.containsKey(key);
    }

    /**
     * Increments the reference count of a stored chunk.
     *
     * @param key The chunk key
     * @throws IllegalStateException if the chunk is not stored
     */
    public void addRef(long key) {
        Entry entry = chunks.get(key);
        if (entry == null) {
            throw new IllegalStateException("Cannot reference chunk " + key + ": not stored");
        }
        entry.refCount++;
    }

    /**
     * Decrements the reference count of a chunk and evicts it when the count
     * reaches zero.
     *
     * @param key The chunk key
     * @return {@code true} if the chunk was evicted
     * @throws IllegalStateException if the chunk is not stored or not referenced
     */
    public boolean release(long key) {
        Entry entry = chunks.get(key);
        if (entry == null || entry.refCount <= 0) {
            throw new IllegalStateException("Cannot release chunk " + key + ": not referenced");
        }
        if (--entry.refCount > 0) {
            return false;
        }
        chunks.remove(key);
        long episode = entry.chunk.getSequenceRange().getEpisodeId();
        if (chunksPerEpisode.addTo(episode, -1) == 1) {
            chunksPerEpisode.remove(episode);
        }
        return true;
    }

    /**
     * Returns the reference count of a chunk, or 0 if it is not stored.
     */
    public int refCount(long key) {
        Entry entry = chunks.get(key);
        return entry == null ? 0 : entry.refCount;
    }

    public int size() {
        return chunks.size();
    }

    /**
     * Returns the number of distinct episodes covered by the stored chunks.
     */
    public int numEpisodes() {
        return chunksPerEpisode.size();
    }

    /**
     * Drops every chunk regardless of its reference count.
     */
    public void clear() {
        chunks.clear();
        chunksPerEpisode.clear();
    }
}
