package org.replaystore.table.distributions;

import java.util.Random;

import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import org.replaystore.api.contracts.KeyDistributionOptions;
import org.replaystore.api.distributions.IKeyDistribution;
import org.replaystore.api.distributions.KeyWithProbability;

/**
 * Selects every present key with equal probability {@code 1/N}.
 * <p>
 * Keys live in a dense array with a key-to-slot index. Deleting moves the last
 * key into the freed slot, so insert, delete and sample are all O(1).
 * Priorities are ignored.
 */
public class UniformDistribution implements IKeyDistribution {

    private final Random random;
    private final LongArrayList keys = new LongArrayList();
    private final Long2IntOpenHashMap slots = new Long2IntOpenHashMap();

    /**
     * Creates a uniform distribution.
     *
     * @param random Source of randomness for sampling
     */
    public UniformDistribution(Random random) {
        this.random = random;
        this.slots.defaultReturnValue(-1);
    }

    @Override
    public void insert(long key, double priority) {
        if (slots.containsKey(key)) {
            throw new IllegalStateException("Key " + key + " already present in uniform distribution");
        }
        slots.put(key, keys.size());
        keys.add(key);
    }

    @Override
    public void delete(long key) {
        int slot = slots.remove(key);
        if (slot < 0) {
            throw new IllegalStateException("Key " + key + " not present in uniform distribution");
        }
        int last = keys.size() - 1;
        if (slot != last) {
            long moved = keys.getLong(last);
            keys.set(slot, moved);
            slots.put(moved, slot);
        }
        keys.removeLong(last);
    }

    @Override
    public void update(long key, double priority) {
        if (!slots.containsKey(key)) {
            throw new IllegalStateException("Key " + key + " not present in uniform distribution");
        }
    }

    @Override
    public KeyWithProbability sample() {
        if (keys.isEmpty()) {
            throw new IllegalStateException("Cannot sample from an empty uniform distribution");
        }
        int slot = random.nextInt(keys.size());
        return new KeyWithProbability(keys.getLong(slot), 1.0 / keys.size());
    }

    @Override
    public long size() {
        return keys.size();
    }

    @Override
    public void clear() {
        keys.clear();
        slots.clear();
    }

    @Override
    public KeyDistributionOptions options() {
        return KeyDistributionOptions.newBuilder()
                .setUniform(true)
                .setIsDeterministic(false)
                .build();
    }
}
