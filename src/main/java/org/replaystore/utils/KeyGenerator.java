package org.replaystore.utils;

import java.security.SecureRandom;
import java.util.Random;

import org.replaystore.api.contracts.Uint128;

/**
 * Generates random chunk and item keys.
 * <p>
 * Producers write to the same tables without coordinating, so keys are drawn
 * at random: 64-bit keys for chunks and items, 128-bit keys where collisions
 * across many producers must be ruled out. Zero is never returned since it is
 * the unset value of the wire format.
 * <p>
 * Thread Safety: Thread-safe if the underlying {@link Random} is
 * ({@link SecureRandom} and {@link Random} both are).
 */
public class KeyGenerator {

    private final Random random;

    public KeyGenerator() {
        this(new SecureRandom());
    }

    /**
     * Creates a generator backed by the given random source (e.g. a seeded
     * {@link Random} for reproducible tests).
     *
     * @param random Source of randomness
     */
    public KeyGenerator(Random random) {
        this.random = random;
    }

    /**
     * Returns a random, non-zero 64-bit key.
     */
    public long nextKey() {
        long key;
        do {
            key = random.nextLong();
        } while (key == 0L);
        return key;
    }

    /**
     * Returns a random, non-zero 128-bit key.
     */
    public Uint128 nextUint128() {
        long high = random.nextLong();
        long low = random.nextLong();
        if (high == 0L && low == 0L) {
            low = 1L;
        }
        return of(high, low);
    }

    public static Uint128 of(long high, long low) {
        return Uint128.newBuilder().setHigh(high).setLow(low).build();
    }

    /**
     * Formats a 128-bit key as 32 lower-case hex digits, high half first.
     *
     * @param key The key
     * @return the hex representation
     */
    public static String toHexString(Uint128 key) {
        return String.format("%016x%016x", key.getHigh(), key.getLow());
    }
}
