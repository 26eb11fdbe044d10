package org.replaystore.table.distributions;

import java.util.Comparator;
import java.util.TreeSet;

import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import org.replaystore.api.contracts.KeyDistributionOptions;
import org.replaystore.api.distributions.IKeyDistribution;
import org.replaystore.api.distributions.KeyWithProbability;

/**
 * Selects the key with the lowest (min heap) or highest (max heap) priority.
 * <p>
 * Ties are broken by insertion order, oldest first. Updating a priority keeps
 * the key's original insertion order, so sampling is fully deterministic.
 * Insert, update and delete are O(log n), sample is O(log n).
 */
public class HeapDistribution implements IKeyDistribution {

    private record Node(long key, double priority, long sequence) {
    }

    private final boolean minHeap;
    private final TreeSet<Node> heap;
    private final Long2ObjectOpenHashMap<Node> nodes = new Long2ObjectOpenHashMap<>();
    private long nextSequence;

    /**
     * Creates a heap distribution.
     *
     * @param minHeap {@code true} to sample the lowest priority first, {@code false} for the highest
     */
    public HeapDistribution(boolean minHeap) {
        this.minHeap = minHeap;
        Comparator<Node> byPriority = Comparator.comparingDouble(Node::priority);
        if (!minHeap) {
            byPriority = byPriority.reversed();
        }
        this.heap = new TreeSet<>(byPriority.thenComparingLong(Node::sequence));
    }

    @Override
    public void insert(long key, double priority) {
        if (nodes.containsKey(key)) {
            throw new IllegalStateException("Key " + key + " already present in heap distribution");
        }
        Node node = new Node(key, priority, nextSequence++);
        nodes.put(key, node);
        heap.add(node);
    }

    @Override
    public void delete(long key) {
        Node node = nodes.remove(key);
        if (node == null) {
            throw new IllegalStateException("Key " + key + " not present in heap distribution");
        }
        heap.remove(node);
    }

    @Override
    public void update(long key, double priority) {
        Node old = nodes.get(key);
        if (old == null) {
            throw new IllegalStateException("Key " + key + " not present in heap distribution");
        }
        heap.remove(old);
        Node updated = new Node(key, priority, old.sequence());
        nodes.put(key, updated);
        heap.add(updated);
    }

    @Override
    public KeyWithProbability sample() {
        if (heap.isEmpty()) {
            throw new IllegalStateException("Cannot sample from an empty heap distribution");
        }
        return new KeyWithProbability(heap.first().key(), 1.0);
    }

    @Override
    public long size() {
        return nodes.size();
    }

    @Override
    public void clear() {
        nodes.clear();
        heap.clear();
    }

    @Override
    public KeyDistributionOptions options() {
        return KeyDistributionOptions.newBuilder()
                .setHeap(KeyDistributionOptions.Heap.newBuilder().setMinHeap(minHeap))
                .setIsDeterministic(true)
                .build();
    }
}
