package org.replaystore.api.distributions;

import org.replaystore.api.contracts.KeyDistributionOptions;
import org.replaystore.api.errors.FailedPreconditionException;
import org.replaystore.api.errors.InvalidArgumentException;

/**
 * A strategy for selecting item keys, used by a table both as its sampler
 * (which item to return from a sample call) and as its remover (which item to
 * evict when the table is full).
 * <p>
 * The table keeps every live key in both of its distributions, so an
 * implementation may assume that {@link #insert} is never called for a present
 * key and that {@link #delete} and {@link #update} are never called for an
 * absent one. Violations indicate corrupted state and are reported with
 * {@link IllegalStateException}.
 * <p>
 * Thread Safety: Not thread-safe. All calls happen under the owning table's lock.
 */
public interface IKeyDistribution {

    /**
     * Adds a key.
     *
     * @param key      The item key
     * @param priority The priority of the item
     */
    void insert(long key, double priority);

    /**
     * Removes a key.
     *
     * @param key The item key
     */
    void delete(long key);

    /**
     * Changes the priority of a present key.
     *
     * @param key      The item key
     * @param priority The new priority
     */
    void update(long key, double priority);

    /**
     * Selects a key without removing it.
     *
     * @return The selected key and the probability it had of being selected
     * @throws FailedPreconditionException if no key can be selected (e.g. all weights are zero)
     * @throws IllegalStateException       if the distribution is empty
     */
    KeyWithProbability sample() throws FailedPreconditionException;

    /**
     * Returns the number of keys in the distribution.
     *
     * @return the number of keys
     */
    long size();

    /**
     * Removes all keys.
     */
    void clear();

    /**
     * Describes this distribution in the wire format used by table info.
     *
     * @return the options this distribution was built from
     */
    KeyDistributionOptions options();

    /**
     * Checks a priority before the table commits to an insert or update, so that
     * a rejected priority leaves no partial mutation behind.
     *
     * @param priority The priority to check
     * @throws InvalidArgumentException if the distribution cannot hold the priority
     */
    default void validatePriority(double priority) throws InvalidArgumentException {
    }
}
