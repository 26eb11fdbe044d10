package org.replaystore.table.distributions;

import java.util.Arrays;
import java.util.Random;

import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import org.replaystore.api.contracts.KeyDistributionOptions;
import org.replaystore.api.distributions.IKeyDistribution;
import org.replaystore.api.distributions.KeyWithProbability;
import org.replaystore.api.errors.FailedPreconditionException;
import org.replaystore.api.errors.InvalidArgumentException;

/**
 * Selects key {@code k} with probability {@code p(k)^e / sum(p^e)} where
 * {@code e} is the priority exponent.
 * <p>
 * Weights are kept in a sum tree: a complete binary tree stored in an array
 * whose leaves hold {@code p^e} and whose inner nodes hold the sum of their
 * children. Leaves are dense: deleting a key moves the last leaf into the freed
 * slot. Insert, update, delete and sample are O(log n).
 * <p>
 * Inner nodes are always recomputed from their children rather than adjusted by
 * deltas, so rounding errors cannot accumulate over long runs.
 * <p>
 * A key with priority zero (and a positive exponent) stays in the distribution
 * but can never be sampled. Sampling when all weights are zero fails.
 * <p>
 * Every weight and the total weight must stay finite. Priorities whose weight
 * or whose contribution to the total would overflow are rejected.
 */
public class PrioritizedDistribution implements IKeyDistribution {

    private static final int INITIAL_CAPACITY = 16;

    private final double exponent;
    private final Random random;

    private final Long2IntOpenHashMap slots = new Long2IntOpenHashMap();
    private long[] leafKeys;
    private double[] priorities;
    // tree[1] is the root, leaves start at index `capacity`
    private double[] tree;
    private int capacity;
    private int size;

    /**
     * Creates a prioritized distribution.
     *
     * @param exponent Priority exponent, must be non-negative
     * @param random   Source of randomness for sampling
     * @throws IllegalArgumentException if the exponent is negative or not finite
     */
    public PrioritizedDistribution(double exponent, Random random) {
        if (!(exponent >= 0.0) || Double.isInfinite(exponent)) {
            throw new IllegalArgumentException("Priority exponent must be a non-negative finite number, got: " + exponent);
        }
        this.exponent = exponent;
        this.random = random;
        this.slots.defaultReturnValue(-1);
        allocate(INITIAL_CAPACITY);
    }

    /**
     * Rejects priorities that are negative, NaN or infinite, whose weight
     * {@code p^e} overflows, or whose weight added to the current total overflows.
     * The total check ignores the weight an update would replace, so it is
     * conservative for updates.
     */
    @Override
    public void validatePriority(double priority) throws InvalidArgumentException {
        if (!(priority >= 0.0) || Double.isInfinite(priority)) {
            throw new InvalidArgumentException(
                    "Priority must be a non-negative finite number for prioritized sampling, got: " + priority);
        }
        double weight = Math.pow(priority, exponent);
        if (!Double.isFinite(weight)) {
            throw new InvalidArgumentException(String.format(
                    "Priority %s raised to the exponent %s overflows", priority, exponent));
        }
        if (!Double.isFinite(tree[1] + weight)) {
            throw new InvalidArgumentException(String.format(
                    "Priority %s would overflow the total weight %s of the distribution", priority, tree[1]));
        }
    }

    @Override
    public void insert(long key, double priority) {
        if (slots.containsKey(key)) {
            throw new IllegalStateException("Key " + key + " already present in prioritized distribution");
        }
        checkWeight(priority, 0.0);
        if (size == capacity) {
            grow();
        }
        int slot = size++;
        slots.put(key, slot);
        leafKeys[slot] = key;
        setLeaf(slot, priority);
    }

    @Override
    public void delete(long key) {
        int slot = slots.remove(key);
        if (slot < 0) {
            throw new IllegalStateException("Key " + key + " not present in prioritized distribution");
        }
        int last = size - 1;
        if (slot != last) {
            long moved = leafKeys[last];
            leafKeys[slot] = moved;
            slots.put(moved, slot);
            setLeaf(slot, priorities[last]);
        }
        priorities[last] = 0.0;
        leafKeys[last] = 0L;
        setWeight(last, 0.0);
        size--;
    }

    @Override
    public void update(long key, double priority) {
        int slot = slots.get(key);
        if (slot < 0) {
            throw new IllegalStateException("Key " + key + " not present in prioritized distribution");
        }
        checkWeight(priority, tree[capacity + slot]);
        setLeaf(slot, priority);
    }

    @Override
    public KeyWithProbability sample() throws FailedPreconditionException {
        if (size == 0) {
            throw new IllegalStateException("Cannot sample from an empty prioritized distribution");
        }
        double total = tree[1];
        if (!(total > 0.0)) {
            throw new FailedPreconditionException(
                    "Cannot sample: the priorities of all " + size + " items are zero");
        }

        double target = random.nextDouble() * total;
        int node = 1;
        while (node < capacity) {
            int left = 2 * node;
            double leftSum = tree[left];
            double rightSum = tree[left + 1];
            if ((target < leftSum && leftSum > 0.0) || rightSum <= 0.0) {
                node = left;
            } else {
                target -= leftSum;
                node = left + 1;
            }
        }
        int slot = node - capacity;
        return new KeyWithProbability(leafKeys[slot], tree[node] / total);
    }

    @Override
    public long size() {
        return size;
    }

    @Override
    public void clear() {
        slots.clear();
        allocate(INITIAL_CAPACITY);
        size = 0;
    }

    @Override
    public KeyDistributionOptions options() {
        return KeyDistributionOptions.newBuilder()
                .setPrioritized(KeyDistributionOptions.Prioritized.newBuilder()
                        .setPriorityExponent(exponent))
                .setIsDeterministic(false)
                .build();
    }

    /**
     * Returns the sum of all weights ({@code p^e}). Exposed for tests.
     *
     * @return the weight at the root of the sum tree
     */
    double totalWeight() {
        return tree[1];
    }

    // Leaves the tree untouched when the new weight or the new total would not be finite.
    private void checkWeight(double priority, double replacedWeight) {
        if (!(priority >= 0.0) || Double.isInfinite(priority)) {
            throw new IllegalArgumentException("Invalid priority for prioritized distribution: " + priority);
        }
        double weight = Math.pow(priority, exponent);
        if (!Double.isFinite(weight) || !Double.isFinite(tree[1] - replacedWeight + weight)) {
            throw new IllegalArgumentException(String.format(
                    "Priority %s overflows the weights of the prioritized distribution", priority));
        }
    }

    private void setLeaf(int slot, double priority) {
        priorities[slot] = priority;
        setWeight(slot, Math.pow(priority, exponent));
    }

    // Vacant leaves must weigh zero, so they are written here directly: pow(0, 0) is 1.
    private void setWeight(int slot, double weight) {
        int node = capacity + slot;
        tree[node] = weight;
        node >>= 1;
        while (node >= 1) {
            tree[node] = tree[2 * node] + tree[2 * node + 1];
            node >>= 1;
        }
    }

    private void allocate(int newCapacity) {
        capacity = newCapacity;
        leafKeys = new long[newCapacity];
        priorities = new double[newCapacity];
        tree = new double[2 * newCapacity];
    }

    private void grow() {
        int oldCapacity = capacity;
        double[] oldTree = tree;
        long[] oldKeys = leafKeys;
        double[] oldPriorities = priorities;

        allocate(oldCapacity * 2);
        System.arraycopy(oldKeys, 0, leafKeys, 0, oldCapacity);
        System.arraycopy(oldPriorities, 0, priorities, 0, oldCapacity);
        System.arraycopy(oldTree, oldCapacity, tree, capacity, oldCapacity);
        Arrays.fill(tree, capacity + oldCapacity, 2 * capacity, 0.0);
        for (int node = capacity - 1; node >= 1; node--) {
            tree[node] = tree[2 * node] + tree[2 * node + 1];
        }
    }
}
