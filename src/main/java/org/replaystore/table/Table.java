package org.replaystore.table;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import org.replaystore.api.contracts.ChunkData;
import org.replaystore.api.contracts.KeyWithPriority;
import org.replaystore.api.contracts.PrioritizedItem;
import org.replaystore.api.contracts.SampleInfo;
import org.replaystore.api.contracts.SliceRange;
import org.replaystore.api.contracts.TableInfo;
import org.replaystore.api.contracts.TableSignature;
import org.replaystore.api.contracts.TensorSpec;
import org.replaystore.api.distributions.IKeyDistribution;
import org.replaystore.api.distributions.KeyWithProbability;
import org.replaystore.api.errors.CancelledException;
import org.replaystore.api.errors.FailedPreconditionException;
import org.replaystore.api.errors.InvalidArgumentException;
import org.replaystore.api.errors.NotFoundException;
import org.replaystore.api.errors.ResourceExhaustedException;
import org.replaystore.api.errors.TableException;
import org.replaystore.api.extensions.ITableExtension;
import org.replaystore.api.extensions.TableLock;
import org.replaystore.table.chunks.ChunkStore;
import org.replaystore.table.distributions.FifoDistribution;
import org.replaystore.table.distributions.KeyDistributions;
import org.replaystore.table.distributions.LifoDistribution;
import org.replaystore.table.extensions.ExtensionChain;
import org.replaystore.table.ratelimiting.RateLimiter;
import org.replaystore.table.signature.SignatureValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * A prioritized, rate limited collection of items referencing chunks of
 * sequence data.
 * <p>
 * The table is a monitor: one exclusive lock guards the item index, the sampler
 * and remover distributions, the rate limiter counters and the chunk reference
 * counts. Insert, sample, update, delete and reset are mutually exclusive and
 * applied in lock acquisition order. The only suspension points are the rate
 * limiter waits, which release the lock until the call may proceed.
 * <p>
 * Within each operation the sub-steps run in a fixed order and extension hooks
 * fire after the state for their step has been mutated. Operations that fail
 * with a {@link TableException} leave no partial mutation behind.
 * <p>
 * Chunk payloads are immutable; {@link #getChunk(long)} reads them without the
 * lock.
 */
public class Table implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Table.class);

    private final String name;
    private final IKeyDistribution sampler;
    private final IKeyDistribution remover;
    private final long maxSize;
    private final int maxTimesSampled;
    private final RateLimiter rateLimiter;
    private final SignatureValidator signatureValidator;

    private final ReentrantLock lock = new ReentrantLock();
    private final TableLock tableLock = new TableLock(lock);
    private final ExtensionChain extensions = new ExtensionChain(tableLock);
    private final ChunkStore chunkStore = new ChunkStore();
    private final Long2ObjectOpenHashMap<TableItem> items = new Long2ObjectOpenHashMap<>();

    private boolean closed;

    /**
     * Creates a table.
     *
     * @param name            The table name, unique within a registry
     * @param sampler         Distribution selecting items on sample
     * @param remover         Distribution selecting items to evict when full
     * @param maxSize         Maximum number of items, at least 1
     * @param maxTimesSampled Samples after which an item is deleted, 0 for unlimited
     * @param rateLimiter     An unregistered rate limiter
     * @param signature       Optional signature inserted chunks must match, may be {@code null}
     * @throws IllegalArgumentException if a parameter is invalid or the rate limiter is already in use
     */
    public Table(String name, IKeyDistribution sampler, IKeyDistribution remover, long maxSize,
                 int maxTimesSampled, RateLimiter rateLimiter, TableSignature signature) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Table name must not be blank");
        }
        if (sampler == remover) {
            throw new IllegalArgumentException("Sampler and remover of table '" + name + "' must be distinct instances");
        }
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be at least 1 for table '" + name + "', got: " + maxSize);
        }
        if (maxTimesSampled < 0) {
            throw new IllegalArgumentException(
                    "maxTimesSampled cannot be negative for table '" + name + "', got: " + maxTimesSampled);
        }
        this.name = name;
        this.sampler = sampler;
        this.remover = remover;
        this.maxSize = maxSize;
        this.maxTimesSampled = maxTimesSampled;
        this.rateLimiter = rateLimiter;
        this.signatureValidator = signature == null ? null : new SignatureValidator(signature);
        try {
            rateLimiter.registerTable(lock, items::size);
        } catch (FailedPreconditionException e) {
            throw new IllegalArgumentException("Rate limiter of table '" + name + "' is already used by another table", e);
        }
        log.debug("Created table '{}' (maxSize={}, maxTimesSampled={}, sampler={}, remover={})",
                name, maxSize, maxTimesSampled, sampler.getClass().getSimpleName(), remover.getClass().getSimpleName());
    }

    /**
     * Creates a table from configuration.
     *
     * @param name    The table name
     * @param options Configuration containing:
     *                <ul>
     *                  <li>{@code maxSize} - Maximum number of items</li>
     *                  <li>{@code maxTimesSampled} - Samples before deletion (default: 0, unlimited)</li>
     *                  <li>{@code sampler}, {@code remover} - Distribution blocks, see {@link KeyDistributions}</li>
     *                  <li>{@code rateLimiter} - See {@link RateLimiter#fromConfig(Config)}</li>
     *                  <li>{@code signature} - Optional list of {@code {name, dtype, shape}} tensor specs</li>
     *                </ul>
     * @return a new table
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public static Table fromConfig(String name, Config options) {
        Config finalConfig = options.withFallback(ConfigFactory.parseMap(Map.of("maxTimesSampled", 0)));
        try {
            return new Table(
                    name,
                    KeyDistributions.fromConfig(finalConfig.getConfig("sampler")),
                    KeyDistributions.fromConfig(finalConfig.getConfig("remover")),
                    finalConfig.getLong("maxSize"),
                    finalConfig.getInt("maxTimesSampled"),
                    RateLimiter.fromConfig(finalConfig.getConfig("rateLimiter")),
                    finalConfig.hasPath("signature") ? parseSignature(finalConfig) : null);
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for table '" + name + "'", e);
        }
    }

    /**
     * Creates a queue: items are sampled once each in insertion order, and
     * inserts block while {@code maxSize} items are waiting.
     *
     * @param name    The table name
     * @param maxSize Queue capacity
     * @return a new table
     */
    public static Table queue(String name, long maxSize) {
        return new Table(name, new FifoDistribution(), new FifoDistribution(), maxSize, 1,
                RateLimiter.queue(maxSize), null);
    }

    /**
     * Creates a stack: like {@link #queue(String, long)} but the newest item is
     * sampled first.
     *
     * @param name    The table name
     * @param maxSize Stack capacity
     * @return a new table
     */
    public static Table stack(String name, long maxSize) {
        return new Table(name, new LifoDistribution(), new LifoDistribution(), maxSize, 1,
                RateLimiter.stack(maxSize), null);
    }

    // ==================== Operations ====================

    /**
     * Inserts an item, waiting for the rate limiter without deadline.
     *
     * @see #insert(PrioritizedItem, List, Duration)
     */
    public boolean insert(PrioritizedItem item, List<ChunkData> chunks) throws TableException {
        return insert(item, chunks, null);
    }

    /**
     * Inserts an item, or assigns the new priority if the key is already present.
     * <p>
     * {@code chunks} supplies the payloads of the referenced chunks that are not
     * yet stored in the table; chunks already stored may be omitted. When the
     * table is full, items chosen by the remover are evicted first.
     *
     * @param item    The item; {@code times_sampled} and {@code inserted_at} are ignored
     * @param chunks  Payloads of the referenced chunks
     * @param timeout Maximum rate limiter wait, or {@code null} to wait without deadline
     * @return {@code true} if a new item was inserted, {@code false} if an existing one was updated
     * @throws InvalidArgumentException    if the item, its slice or its chunks are malformed
     * @throws CancelledException          if the rate limiter wait was aborted
     * @throws ResourceExhaustedException  if no room can be made
     */
    public boolean insert(PrioritizedItem item, List<ChunkData> chunks, Duration timeout) throws TableException {
        Map<Long, ChunkData> supplied = validateItem(item, chunks);

        lock.lock();
        try {
            resolveChunks(item, supplied);
            if (items.containsKey(item.getKey())) {
                assignPriority(items.get(item.getKey()), item.getPriority());
                return false;
            }

            rateLimiter.awaitCanInsert(1, timeout);

            // The lock was possibly released while waiting.
            if (items.containsKey(item.getKey())) {
                assignPriority(items.get(item.getKey()), item.getPriority());
                return false;
            }
            List<ChunkData> resolved = resolveChunks(item, supplied);

            evictUntilFits();

            for (ChunkData chunk : resolved) {
                chunkStore.put(chunk);
            }
            long[] chunkKeys = new long[item.getChunkKeysCount()];
            for (int i = 0; i < chunkKeys.length; i++) {
                chunkKeys[i] = item.getChunkKeys(i);
                chunkStore.addRef(chunkKeys[i]);
            }
            TableItem tableItem = new TableItem(
                    item.getKey(), chunkKeys, item.getSequenceRange(), item.getPriority(), Instant.now());
            items.put(tableItem.key(), tableItem);
            sampler.insert(tableItem.key(), tableItem.priority());
            remover.insert(tableItem.key(), tableItem.priority());

            extensions.fireInsert(tableItem.toProto(name));
            rateLimiter.insert(1);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Samples an item, waiting for the rate limiter without deadline.
     *
     * @see #sample(Duration)
     */
    public SampledItem sample() throws TableException {
        return sample(null);
    }

    /**
     * Samples an item using the sampler distribution.
     * <p>
     * The item's times-sampled counter is incremented; if it reaches
     * {@code maxTimesSampled} the item is deleted.
     *
     * @param timeout Maximum rate limiter wait, or {@code null} to wait without deadline
     * @return the sampled item with its probability, the table size at sample time and its chunks
     * @throws CancelledException          if the rate limiter wait was aborted
     * @throws FailedPreconditionException if the sampler cannot select a key (all priorities zero)
     */
    public SampledItem sample(Duration timeout) throws TableException {
        lock.lock();
        try {
            rateLimiter.awaitCanSample(1, timeout);

            KeyWithProbability selected = sampler.sample();
            TableItem item = items.get(selected.key());
            if (item == null) {
                throw new IllegalStateException(String.format(
                        "Sampler of table '%s' returned key %d which is not in the table", name, selected.key()));
            }
            long tableSize = items.size();
            int timesSampled = item.incrementTimesSampled();
            PrioritizedItem snapshot = item.toProto(name);
            List<ChunkData> chunks = chunksOf(item);

            extensions.fireSample(snapshot);

            // A hook may have released the lock, in which case the item can already be gone.
            if (maxTimesSampled > 0 && timesSampled >= maxTimesSampled && items.get(item.key()) == item) {
                deleteItem(item);
            }
            rateLimiter.sample(1);

            return new SampledItem(SampleInfo.newBuilder()
                    .setItem(snapshot)
                    .setProbability(selected.probability())
                    .setTableSize(tableSize)
                    .build(), chunks);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Changes the priority of an item.
     *
     * @param key      The item key
     * @param priority The new priority
     * @throws NotFoundException        if the key is not in the table
     * @throws InvalidArgumentException if a distribution rejects the priority
     */
    public void update(long key, double priority) throws TableException {
        lock.lock();
        try {
            validatePriority(priority);
            TableItem item = items.get(key);
            if (item == null) {
                throw new NotFoundException(String.format("Item %d not found in table '%s'", key, name));
            }
            assignPriority(item, priority);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Deletes an item and releases its chunk references.
     *
     * @param key The item key
     * @throws NotFoundException if the key is not in the table
     */
    public void delete(long key) throws NotFoundException {
        lock.lock();
        try {
            TableItem item = items.get(key);
            if (item == null) {
                throw new NotFoundException(String.format("Item %d not found in table '%s'", key, name));
            }
            deleteItem(item);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies a batch of priority updates followed by a batch of deletions.
     * <p>
     * Keys that are not in the table are skipped. All priorities are validated
     * before anything is applied.
     *
     * @param updates New priorities
     * @param deletes Keys to delete
     * @throws InvalidArgumentException if a distribution rejects one of the priorities
     */
    public void mutateItems(List<KeyWithPriority> updates, List<Long> deletes) throws InvalidArgumentException {
        lock.lock();
        try {
            for (KeyWithPriority update : updates) {
                validatePriority(update.getPriority());
            }
            for (KeyWithPriority update : updates) {
                TableItem item = items.get(update.getKey());
                if (item == null) {
                    log.debug("Skipping update of unknown item {} in table '{}'", update.getKey(), name);
                    continue;
                }
                assignPriority(item, update.getPriority());
            }
            for (long key : deletes) {
                TableItem item = items.get(key);
                if (item == null) {
                    log.debug("Skipping deletion of unknown item {} in table '{}'", key, name);
                    continue;
                }
                deleteItem(item);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every item and chunk and zeroes the rate limiter counters.
     */
    public void reset() {
        lock.lock();
        try {
            for (TableItem item : items.values()) {
                for (long chunkKey : item.chunkKeys()) {
                    chunkStore.release(chunkKey);
                }
            }
            items.clear();
            sampler.clear();
            remover.clear();
            if (chunkStore.size() != 0) {
                log.error("Table '{}' still held {} chunks after releasing every item, dropping them",
                        name, chunkStore.size());
                chunkStore.clear();
            }
            rateLimiter.reset();
            extensions.fireReset();
            log.debug("Reset table '{}'", name);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels all pending and future rate limited calls. Update, delete and
     * reset keep working. Idempotent.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            rateLimiter.cancel();
            log.info("Closed table '{}' with {} items", name, items.size());
        } finally {
            lock.unlock();
        }
    }

    // ==================== Extensions ====================

    /**
     * Registers an extension. Its hooks fire for every subsequent mutation, after
     * those of previously registered extensions.
     *
     * @param extension The extension
     * @throws FailedPreconditionException if the extension is already bound to a table
     */
    public void registerExtension(ITableExtension extension) throws FailedPreconditionException {
        lock.lock();
        try {
            if (extensions.contains(extension)) {
                throw new FailedPreconditionException(String.format(
                        "Extension is already registered with table '%s'", name));
            }
        } finally {
            lock.unlock();
        }
        extension.registerTable(this);
        lock.lock();
        try {
            extensions.add(extension);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Unregisters an extension.
     *
     * @param extension The extension, must be registered with this table
     * @throws IllegalStateException if the extension is bound to another table
     */
    public void unregisterExtension(ITableExtension extension) {
        lock.lock();
        try {
            extension.unregisterTable(tableLock, this);
            extensions.remove(extension);
        } finally {
            lock.unlock();
        }
    }

    public List<ITableExtension> getExtensions() {
        return extensions.extensions();
    }

    // ==================== Queries ====================

    public String name() {
        return name;
    }

    public long size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a snapshot of an item.
     *
     * @param key The item key
     * @return the item, or empty if the key is not in the table
     */
    public Optional<PrioritizedItem> getItem(long key) {
        lock.lock();
        try {
            TableItem item = items.get(key);
            return item == null ? Optional.empty() : Optional.of(item.toProto(name));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a stored chunk without taking the table lock.
     *
     * @param key The chunk key
     * @return the chunk payload
     * @throws NotFoundException if no live item references the chunk
     */
    public ChunkData getChunk(long key) throws NotFoundException {
        return chunkStore.get(key);
    }

    /**
     * Returns the reference count of a chunk, 0 if it is not stored.
     */
    public int chunkRefCount(long key) {
        lock.lock();
        try {
            return chunkStore.refCount(key);
        } finally {
            lock.unlock();
        }
    }

    public int numChunks() {
        lock.lock();
        try {
            return chunkStore.size();
        } finally {
            lock.unlock();
        }
    }

    public long insertCount() {
        lock.lock();
        try {
            return rateLimiter.getInsertCount();
        } finally {
            lock.unlock();
        }
    }

    public long sampleCount() {
        lock.lock();
        try {
            return rateLimiter.getSampleCount();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Builds the table info from live state.
     */
    public TableInfo info() {
        lock.lock();
        try {
            TableInfo.Builder builder = TableInfo.newBuilder()
                    .setName(name)
                    .setSamplerOptions(sampler.options())
                    .setRemoverOptions(remover.options())
                    .setMaxSize(maxSize)
                    .setMaxTimesSampled(maxTimesSampled)
                    .setRateLimiterInfo(rateLimiter.info())
                    .setCurrentSize(items.size())
                    .setNumEpisodes(chunkStore.numEpisodes());
            if (signatureValidator != null) {
                builder.setSignature(signatureValidator.signature());
            }
            return builder.build();
        } finally {
            lock.unlock();
        }
    }

    // ==================== Internals ====================

    private Map<Long, ChunkData> validateItem(PrioritizedItem item, List<ChunkData> chunks)
            throws InvalidArgumentException {
        if (!item.getTable().isEmpty() && !item.getTable().equals(name)) {
            throw new InvalidArgumentException(String.format(
                    "Item %d targets table '%s' but was inserted into '%s'", item.getKey(), item.getTable(), name));
        }
        if (item.getChunkKeysCount() == 0) {
            throw new InvalidArgumentException("Item " + item.getKey() + " does not reference any chunks");
        }
        SliceRange slice = item.getSequenceRange();
        if (slice.getOffset() < 0 || slice.getLength() < 1) {
            throw new InvalidArgumentException(String.format(
                    "Item %d has an invalid slice (offset=%d, length=%d)",
                    item.getKey(), slice.getOffset(), slice.getLength()));
        }
        if (Double.isNaN(item.getPriority())) {
            throw new InvalidArgumentException("Item " + item.getKey() + " has a NaN priority");
        }

        Map<Long, ChunkData> supplied = new HashMap<>();
        for (ChunkData chunk : chunks) {
            if (chunk.getSequenceRange().getEnd() < chunk.getSequenceRange().getStart()) {
                throw new InvalidArgumentException(String.format(
                        "Chunk %d has a sequence range ending before it starts (start=%d, end=%d)",
                        chunk.getChunkKey(), chunk.getSequenceRange().getStart(), chunk.getSequenceRange().getEnd()));
            }
            if (signatureValidator != null) {
                signatureValidator.validate(chunk);
            }
            ChunkData previous = supplied.put(chunk.getChunkKey(), chunk);
            if (previous != null && !previous.equals(chunk)) {
                throw new InvalidArgumentException(
                        "Chunk " + chunk.getChunkKey() + " was supplied twice with different payloads");
            }
        }
        return supplied;
    }

    /**
     * Resolves the chunks referenced by an item, in order, and checks that they
     * can be stored and cover the item's slice. Requires the lock.
     */
    private List<ChunkData> resolveChunks(PrioritizedItem item, Map<Long, ChunkData> supplied)
            throws InvalidArgumentException {
        validatePriority(item.getPriority());
        List<ChunkData> resolved = new ArrayList<>(item.getChunkKeysCount());
        long combinedLength = 0;
        for (long chunkKey : item.getChunkKeysList()) {
            ChunkData chunk = supplied.get(chunkKey);
            if (chunk != null) {
                chunkStore.checkCompatible(chunk);
            } else if (chunkStore.contains(chunkKey)) {
                chunk = getStoredChunk(chunkKey);
            } else {
                throw new InvalidArgumentException(String.format(
                        "Item %d references chunk %d which was neither supplied nor stored",
                        item.getKey(), chunkKey));
            }
            resolved.add(chunk);
            combinedLength += (long) chunk.getSequenceRange().getEnd() - chunk.getSequenceRange().getStart() + 1;
        }
        SliceRange slice = item.getSequenceRange();
        if ((long) slice.getOffset() + slice.getLength() > combinedLength) {
            throw new InvalidArgumentException(String.format(
                    "Slice of item %d (offset=%d, length=%d) exceeds the %d timesteps of its chunks",
                    item.getKey(), slice.getOffset(), slice.getLength(), combinedLength));
        }
        return resolved;
    }

    // Requires the lock and a key known to be stored.
    private ChunkData getStoredChunk(long chunkKey) {
        try {
            return chunkStore.get(chunkKey);
        } catch (NotFoundException e) {
            throw new IllegalStateException(String.format(
                    "Chunk %d vanished from table '%s' while the lock was held", chunkKey, name), e);
        }
    }

    private void validatePriority(double priority) throws InvalidArgumentException {
        if (Double.isNaN(priority)) {
            throw new InvalidArgumentException("Priority must not be NaN");
        }
        sampler.validatePriority(priority);
        remover.validatePriority(priority);
    }

    // Either both distributions take the new priority or neither does.
    private void assignPriority(TableItem item, double priority) throws InvalidArgumentException {
        try {
            sampler.update(item.key(), priority);
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException(String.format(
                    "Sampler of table '%s' rejected priority %s for item %d", name, priority, item.key()), e);
        }
        try {
            remover.update(item.key(), priority);
        } catch (IllegalArgumentException e) {
            sampler.update(item.key(), item.priority());
            throw new InvalidArgumentException(String.format(
                    "Remover of table '%s' rejected priority %s for item %d", name, priority, item.key()), e);
        }
        item.setPriority(priority);
        extensions.fireUpdate(item.toProto(name));
    }

    private void evictUntilFits() throws ResourceExhaustedException {
        while (items.size() >= maxSize) {
            if (remover.size() == 0) {
                throw new ResourceExhaustedException(String.format(
                        "Table '%s' is full (%d items) and the remover has nothing to evict", name, items.size()));
            }
            KeyWithProbability victim;
            try {
                victim = remover.sample();
            } catch (FailedPreconditionException e) {
                throw new ResourceExhaustedException(String.format(
                        "Table '%s' is full and the remover cannot select an item to evict", name), e);
            }
            TableItem item = items.get(victim.key());
            if (item == null) {
                throw new IllegalStateException(String.format(
                        "Remover of table '%s' returned key %d which is not in the table", name, victim.key()));
            }
            log.debug("Evicting item {} from full table '{}'", victim.key(), name);
            deleteItem(item);
        }
    }

    private void deleteItem(TableItem item) {
        items.remove(item.key());
        sampler.delete(item.key());
        remover.delete(item.key());
        for (long chunkKey : item.chunkKeys()) {
            chunkStore.release(chunkKey);
        }
        rateLimiter.delete();
        extensions.fireDelete(item.toProto(name));
    }

    private List<ChunkData> chunksOf(TableItem item) {
        List<ChunkData> chunks = new ArrayList<>(item.chunkKeys().length);
        for (long chunkKey : item.chunkKeys()) {
            try {
                chunks.add(chunkStore.get(chunkKey));
            } catch (NotFoundException e) {
                throw new IllegalStateException(String.format(
                        "Item %d of table '%s' references evicted chunk %d", item.key(), name, chunkKey), e);
            }
        }
        return chunks;
    }

    private static TableSignature parseSignature(Config options) {
        TableSignature.Builder signature = TableSignature.newBuilder();
        for (Config tensor : options.getConfigList("signature")) {
            TensorSpec.Builder spec = TensorSpec.newBuilder()
                    .setName(tensor.hasPath("name") ? tensor.getString("name") : "")
                    .setDtype(tensor.getString("dtype"));
            if (tensor.hasPath("shape")) {
                spec.addAllShape(tensor.getLongList("shape"));
            }
            signature.addTensors(spec);
        }
        return signature.build();
    }
}
