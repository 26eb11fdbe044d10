package org.replaystore.table.distributions;

import it.unimi.dsi.fastutil.longs.LongLinkedOpenHashSet;
import org.replaystore.api.contracts.KeyDistributionOptions;
import org.replaystore.api.distributions.IKeyDistribution;
import org.replaystore.api.distributions.KeyWithProbability;

/**
 * Selects the oldest key still present. Deterministic, every sample has
 * probability 1.0.
 * <p>
 * Backed by a linked hash set, so insert, delete and sample are O(1).
 * Priorities are ignored.
 */
public class FifoDistribution implements IKeyDistribution {

    private final LongLinkedOpenHashSet keys = new LongLinkedOpenHashSet();

    @Override
    public void insert(long key, double priority) {
        if (!keys.add(key)) {
            throw new IllegalStateException("Key " + key + " already present in FIFO distribution");
        }
    }

    @Override
    public void delete(long key) {
        if (!keys.remove(key)) {
            throw new IllegalStateException("Key " + key + " not present in FIFO distribution");
        }
    }

    @Override
    public void update(long key, double priority) {
        if (!keys.contains(key)) {
            throw new IllegalStateException("Key " + key + " not present in FIFO distribution");
        }
    }

    @Override
    public KeyWithProbability sample() {
        if (keys.isEmpty()) {
            throw new IllegalStateException("Cannot sample from an empty FIFO distribution");
        }
        return new KeyWithProbability(keys.firstLong(), 1.0);
    }

    @Override
    public long size() {
        return keys.size();
    }

    @Override
    public void clear() {
        keys.clear();
    }

    @Override
    public KeyDistributionOptions options() {
        return KeyDistributionOptions.newBuilder()
                .setFifo(true)
                .setIsDeterministic(true)
                .build();
    }
}
