package org.replaystore.table.ratelimiting;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import java.util.function.LongSupplier;

import org.replaystore.api.contracts.RateLimiterInfo;
import org.replaystore.api.errors.CancelledException;
import org.replaystore.api.errors.FailedPreconditionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Keeps the ratio between inserts and samples of a table within bounds.
 * <p>
 * The limiter tracks the cursor {@code insertCount * samplesPerInsert - sampleCount}.
 * An insert is blocked while it would push the cursor above {@code maxDiff}; a
 * sample is blocked while the table holds fewer than {@code minSizeToSample}
 * items or the sample would push the cursor below {@code minDiff}. Both bounds
 * are inclusive, so the cursor never leaves {@code [minDiff, maxDiff]}.
 * <p>
 * {@code maxDiff} must leave room for {@code minSizeToSample} inserts without
 * any sample, otherwise the table could never fill up far enough to be sampled.
 * <p>
 * The limiter is a monitor bound to the lock of the table it is registered
 * with: waiting releases the table lock, and the check-then-wait transition is
 * atomic because every state change happens under that same lock.
 * <p>
 * Thread Safety: All methods except the constructor and the factories must be
 * called with the table lock held.
 */
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final double samplesPerInsert;
    private final long minSizeToSample;
    private final double minDiff;
    private final double maxDiff;

    private final CallStats insertStats = new CallStats();
    private final CallStats sampleStats = new CallStats();

    private ReentrantLock lock;
    private LongSupplier tableSize;
    private Condition insertAllowed;
    private Condition sampleAllowed;

    private long insertCount;
    private long sampleCount;
    private boolean cancelled;

    /**
     * Creates a rate limiter.
     *
     * @param samplesPerInsert Average number of samples per inserted item, must be positive
     * @param minSizeToSample  Minimum table size before sampling starts, must be at least 1
     * @param minDiff          Lower bound of the cursor
     * @param maxDiff          Upper bound of the cursor, must not be below {@code minDiff}
     *                         nor below {@code samplesPerInsert * minSizeToSample}
     * @throws IllegalArgumentException if a parameter is out of range
     */
    public RateLimiter(double samplesPerInsert, long minSizeToSample, double minDiff, double maxDiff) {
        if (!(samplesPerInsert > 0.0)) {
            throw new IllegalArgumentException("samplesPerInsert must be positive, got: " + samplesPerInsert);
        }
        if (minSizeToSample < 1) {
            throw new IllegalArgumentException("minSizeToSample must be at least 1, got: " + minSizeToSample);
        }
        if (!(minDiff <= maxDiff)) {
            throw new IllegalArgumentException(String.format(
                    "minDiff (%s) must not be greater than maxDiff (%s)", minDiff, maxDiff));
        }
        if (maxDiff < samplesPerInsert * minSizeToSample) {
            throw new IllegalArgumentException(String.format(
                    "maxDiff (%s) must be at least samplesPerInsert * minSizeToSample (%s), "
                            + "otherwise the table can never reach the size required for sampling",
                    maxDiff, samplesPerInsert * minSizeToSample));
        }
        this.samplesPerInsert = samplesPerInsert;
        this.minSizeToSample = minSizeToSample;
        this.minDiff = minDiff;
        this.maxDiff = maxDiff;
    }

    /**
     * Creates a rate limiter from configuration.
     *
     * @param options Configuration with {@code samplesPerInsert}, {@code minSizeToSample}
     *                and optional {@code minDiff}/{@code maxDiff} (unbounded when absent)
     * @return a new, unregistered rate limiter
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public static RateLimiter fromConfig(Config options) {
        try {
            return new RateLimiter(
                    options.getDouble("samplesPerInsert"),
                    options.getLong("minSizeToSample"),
                    options.hasPath("minDiff") ? options.getDouble("minDiff") : -Double.MAX_VALUE,
                    options.hasPath("maxDiff") ? options.getDouble("maxDiff") : Double.MAX_VALUE);
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid rate limiter configuration", e);
        }
    }

    /**
     * Blocks sampling until the table holds {@code minSize} items, then never limits.
     *
     * @param minSize Minimum table size before sampling starts
     * @return a new rate limiter
     */
    public static RateLimiter minSize(long minSize) {
        return new RateLimiter(1.0, minSize, -Double.MAX_VALUE, Double.MAX_VALUE);
    }

    /**
     * Every item is sampled exactly once, inserts block while {@code size} items
     * are waiting to be sampled.
     *
     * @param size Maximum number of unsampled items
     * @return a new rate limiter
     */
    public static RateLimiter queue(long size) {
        return new RateLimiter(1.0, 1, 0.0, size);
    }

    /**
     * Same limits as {@link #queue(long)}; the table decides the order.
     *
     * @param size Maximum number of unsampled items
     * @return a new rate limiter
     */
    public static RateLimiter stack(long size) {
        return queue(size);
    }

    /**
     * Keeps the observed samples per insert close to {@code samplesPerInsert}, allowing
     * a deviation of {@code errorBuffer} around the cursor reached at {@code minSizeToSample}.
     *
     * @param samplesPerInsert Target samples per insert
     * @param minSizeToSample  Minimum table size before sampling starts
     * @param errorBuffer      Allowed deviation, at least {@code 2 * max(1, samplesPerInsert)}
     * @return a new rate limiter
     * @throws IllegalArgumentException if the error buffer is too small to avoid deadlocks
     */
    public static RateLimiter sampleToInsertRatio(double samplesPerInsert, long minSizeToSample, double errorBuffer) {
        double minBuffer = 2 * Math.max(1.0, samplesPerInsert);
        if (errorBuffer < minBuffer) {
            throw new IllegalArgumentException(String.format(
                    "errorBuffer must be at least %s for samplesPerInsert %s, got: %s",
                    minBuffer, samplesPerInsert, errorBuffer));
        }
        double offset = samplesPerInsert * minSizeToSample;
        return new RateLimiter(samplesPerInsert, minSizeToSample, offset - errorBuffer, offset + errorBuffer);
    }

    /**
     * Binds this limiter to the lock of a table. Conditions are created from
     * that lock, so waiting releases it.
     *
     * @param tableLock   The table lock
     * @param sizeSupplier Supplies the current table size, read under the lock
     * @throws FailedPreconditionException if the limiter is already registered with a table
     */
    public void registerTable(ReentrantLock tableLock, LongSupplier sizeSupplier) throws FailedPreconditionException {
        if (this.lock != null) {
            throw new FailedPreconditionException("Rate limiter is already registered with a table");
        }
        this.lock = tableLock;
        this.tableSize = sizeSupplier;
        this.insertAllowed = tableLock.newCondition();
        this.sampleAllowed = tableLock.newCondition();
    }

    /**
     * Waits until {@code n} more inserts are allowed.
     *
     * @param n       Number of inserts
     * @param timeout Maximum wait, or {@code null} to wait without deadline
     * @throws CancelledException if interrupted, timed out or cancelled while waiting
     */
    public void awaitCanInsert(int n, Duration timeout) throws CancelledException {
        await(insertStats, insertAllowed, () -> canInsert(n), timeout, "insert");
    }

    /**
     * Waits until {@code n} more samples are allowed.
     *
     * @param n       Number of samples
     * @param timeout Maximum wait, or {@code null} to wait without deadline
     * @throws CancelledException if interrupted, timed out or cancelled while waiting
     */
    public void awaitCanSample(int n, Duration timeout) throws CancelledException {
        await(sampleStats, sampleAllowed, () -> canSample(n), timeout, "sample");
    }

    public boolean canInsert(int n) {
        checkHeld();
        return (insertCount + n) * samplesPerInsert - sampleCount <= maxDiff;
    }

    public boolean canSample(int n) {
        checkHeld();
        if (tableSize.getAsLong() < minSizeToSample) {
            return false;
        }
        return insertCount * samplesPerInsert - sampleCount - n >= minDiff;
    }

    /**
     * Records a completed insert call of {@code n} items and wakes waiting samplers.
     */
    public void insert(int n) {
        checkHeld();
        insertCount += n;
        insertStats.recordCompleted();
        sampleAllowed.signalAll();
    }

    /**
     * Records a completed sample call of {@code n} items and wakes waiting inserters.
     */
    public void sample(int n) {
        checkHeld();
        sampleCount += n;
        sampleStats.recordCompleted();
        insertAllowed.signalAll();
    }

    /**
     * Notifies the limiter that the table shrank, which may unblock inserts.
     */
    public void delete() {
        checkHeld();
        insertAllowed.signalAll();
    }

    /**
     * Zeroes both counters and wakes all waiters.
     */
    public void reset() {
        checkHeld();
        insertCount = 0;
        sampleCount = 0;
        insertAllowed.signalAll();
        sampleAllowed.signalAll();
    }

    /**
     * Aborts all pending waits and makes every later wait fail with
     * {@link CancelledException}.
     */
    public void cancel() {
        checkHeld();
        cancelled = true;
        insertAllowed.signalAll();
        sampleAllowed.signalAll();
    }

    /**
     * Builds the wire description of this limiter, including call statistics.
     */
    public RateLimiterInfo info() {
        long now = System.nanoTime();
        return RateLimiterInfo.newBuilder()
                .setSamplesPerInsert(samplesPerInsert)
                .setMinDiff(minDiff)
                .setMaxDiff(maxDiff)
                .setMinSizeToSample(minSizeToSample)
                .setInsertStats(insertStats.toProto(now))
                .setSampleStats(sampleStats.toProto(now))
                .build();
    }

    public long getInsertCount() {
        return insertCount;
    }

    public long getSampleCount() {
        return sampleCount;
    }

    /**
     * Returns {@code insertCount * samplesPerInsert - sampleCount}.
     */
    public double cursor() {
        return insertCount * samplesPerInsert - sampleCount;
    }

    public double getSamplesPerInsert() {
        return samplesPerInsert;
    }

    public long getMinSizeToSample() {
        return minSizeToSample;
    }

    public double getMinDiff() {
        return minDiff;
    }

    public double getMaxDiff() {
        return maxDiff;
    }

    private void await(CallStats stats, Condition condition, BooleanSupplier canProceed,
                       Duration timeout, String kind) throws CancelledException {
        checkHeld();
        if (cancelled) {
            throw new CancelledException("Rate limiter has been cancelled, " + kind + " rejected");
        }
        if (canProceed.getAsBoolean()) {
            return;
        }

        long start = System.nanoTime();
        long remainingNanos = timeout == null ? Long.MAX_VALUE : timeout.toNanos();
        boolean succeeded = false;
        stats.startWait(start);
        log.debug("{} blocked by rate limiter (cursor={}, inserts={}, samples={})",
                kind, cursor(), insertCount, sampleCount);
        try {
            while (!canProceed.getAsBoolean()) {
                if (cancelled) {
                    throw new CancelledException("Rate limiter cancelled while " + kind + " was waiting");
                }
                if (timeout == null) {
                    condition.await();
                } else {
                    if (remainingNanos <= 0) {
                        throw new CancelledException(String.format(
                                "Timed out after %d ms waiting for %s to be allowed", timeout.toMillis(), kind));
                    }
                    remainingNanos = condition.awaitNanos(remainingNanos);
                }
            }
            succeeded = true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancelledException("Interrupted while waiting for " + kind + " to be allowed", e);
        } finally {
            long end = System.nanoTime();
            stats.finishWait(start, end, succeeded);
            if (succeeded) {
                log.debug("{} unblocked after {} ms", kind, TimeUnit.NANOSECONDS.toMillis(end - start));
            }
        }
    }

    private void checkHeld() {
        if (lock == null) {
            throw new IllegalStateException("Rate limiter is not registered with a table");
        }
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Rate limiter used without holding the table lock");
        }
    }

    // Package-private accessors for tests.

    long pendingInserts() {
        return insertStats.pending();
    }

    long pendingSamples() {
        return sampleStats.pending();
    }
}
