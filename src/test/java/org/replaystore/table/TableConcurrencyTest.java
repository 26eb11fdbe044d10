package org.replaystore.table;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.replaystore.api.contracts.ChunkData;
import org.replaystore.api.contracts.PrioritizedItem;
import org.replaystore.api.errors.CancelledException;
import org.replaystore.api.errors.TableException;
import org.replaystore.api.extensions.TableLock;
import org.replaystore.table.distributions.FifoDistribution;
import org.replaystore.table.distributions.UniformDistribution;
import org.replaystore.table.extensions.AbstractTableExtension;
import org.replaystore.table.ratelimiting.RateLimiter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.replaystore.test.utils.TableTestUtils.insertSimple;

/**
 * Multi-threaded tests of rate limited inserts and samples.
 */
@Tag("integration")
class TableConcurrencyTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(8);
    private final List<Table> tables = new ArrayList<>();

    @AfterEach
    void tearDown() throws InterruptedException {
        tables.forEach(Table::close);
        executor.shutdownNow();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
    }

    private Table table(RateLimiter rateLimiter, long maxSize) {
        Table table = new Table("replay", new FifoDistribution(), new FifoDistribution(), maxSize, 0,
                rateLimiter, null);
        tables.add(table);
        return table;
    }

    private static long pendingInserts(Table table) {
        return table.info().getRateLimiterInfo().getInsertStats().getPending();
    }

    private static long pendingSamples(Table table) {
        return table.info().getRateLimiterInfo().getSampleStats().getPending();
    }

    @Test
    void insertsAndSamplesAlternateWithinTheCursorBounds() throws Exception {
        Table table = table(new RateLimiter(1.0, 1, -1.0, 1.0), 100);
        insertSimple(table, 1, 1.0);

        // Cursor is 1: a second insert would exceed maxDiff.
        Future<?> insert = executor.submit(() -> {
            insertSimple(table, 2, 1.0);
            return null;
        });
        await().atMost(5, TimeUnit.SECONDS).until(() -> pendingInserts(table) == 1);
        assertEquals(1, table.size());

        table.sample();
        insert.get(5, TimeUnit.SECONDS);
        assertEquals(2, table.size());

        // Cursor is 1 again: two samples bring it to -1, the third must wait.
        table.sample();
        table.sample();
        Future<SampledItem> sample = executor.submit(() -> table.sample());
        await().atMost(5, TimeUnit.SECONDS).until(() -> pendingSamples(table) == 1);

        insertSimple(table, 3, 1.0);
        assertThat(sample.get(5, TimeUnit.SECONDS)).isNotNull();
        assertEquals(-1, table.insertCount() - table.sampleCount());
        assertEquals(1, table.info().getRateLimiterInfo().getInsertStats().getLimited());
        assertEquals(1, table.info().getRateLimiterInfo().getSampleStats().getLimited());
    }

    @Test
    void sampleLandingOnMinDiffProceedsAndTheNextOneWaitsForAnInsert() throws Exception {
        Table table = table(new RateLimiter(1.0, 1, -1.0, 1.0), 100);
        insertSimple(table, 1, 1.0);

        // Cursor 1 -> 0, then 0 -> -1: the lower bound is inclusive.
        table.sample(Duration.ofMillis(200));
        table.sample(Duration.ofMillis(200));
        assertEquals(-1, table.insertCount() - table.sampleCount());

        Future<SampledItem> blocked = executor.submit(() -> table.sample());
        await().atMost(5, TimeUnit.SECONDS).until(() -> pendingSamples(table) == 1);
        assertThat(blocked.isDone()).isFalse();

        insertSimple(table, 2, 1.0);

        assertThat(blocked.get(5, TimeUnit.SECONDS)).isNotNull();
        assertEquals(-1, table.insertCount() - table.sampleCount());
    }

    @Test
    void sampleBlocksUntilMinSizeIsReached() throws Exception {
        Table table = table(RateLimiter.minSize(3), 100);

        Future<SampledItem> sample = executor.submit(() -> table.sample());
        insertSimple(table, 1, 1.0);
        insertSimple(table, 2, 1.0);
        await().atMost(5, TimeUnit.SECONDS).until(() -> pendingSamples(table) == 1);
        assertThat(sample.isDone()).isFalse();

        insertSimple(table, 3, 1.0);

        assertThat(sample.get(5, TimeUnit.SECONDS).info().getTableSize()).isEqualTo(3);
    }

    @Test
    void closeCancelsPendingCalls() throws Exception {
        Table table = table(RateLimiter.minSize(1), 100);

        CompletableFuture<Throwable> outcome = CompletableFuture.supplyAsync(() -> {
            try {
                table.sample();
                return null;
            } catch (TableException e) {
                return e;
            }
        }, executor);
        await().atMost(5, TimeUnit.SECONDS).until(() -> pendingSamples(table) == 1);

        table.close();

        assertThat(outcome.get(5, TimeUnit.SECONDS)).isInstanceOf(CancelledException.class);
        assertEquals(0, pendingSamples(table));
    }

    @Test
    void concurrentProducersAndConsumersNeverBreakTheCursorBounds() throws Exception {
        Table table = new Table("replay", new UniformDistribution(new Random(5)), new FifoDistribution(), 1_000, 0,
                new RateLimiter(1.0, 1, 0.0, 5.0), null);
        tables.add(table);
        CursorCheckingExtension checker = new CursorCheckingExtension(0.0, 5.0);
        table.registerExtension(checker);

        int workers = 4;
        int perWorker = 200;
        List<Future<?>> futures = new ArrayList<>();
        for (int w = 0; w < workers; w++) {
            long base = (w + 1) * 10_000L;
            futures.add(executor.submit(() -> {
                for (int i = 0; i < perWorker; i++) {
                    insertSimple(table, base + i, 1.0);
                }
                return null;
            }));
            futures.add(executor.submit(() -> {
                for (int i = 0; i < perWorker; i++) {
                    table.sample();
                }
                return null;
            }));
        }
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }

        assertThat(checker.violations).isEmpty();
        assertEquals(workers * perWorker, table.insertCount());
        assertEquals(workers * perWorker, table.sampleCount());
        assertEquals(workers * perWorker, table.size());
        assertEquals(workers * perWorker, table.numChunks());
    }

    @Test
    void hookReleasingTheLockDoesNotCorruptTheTable() throws Exception {
        Table table = new Table("replay", new FifoDistribution(), new FifoDistribution(), 10, 1,
                RateLimiter.minSize(1), null);
        tables.add(table);
        insertSimple(table, 1, 1.0);
        table.registerExtension(new AbstractTableExtension() {
            @Override
            public void onSample(TableLock lock, PrioritizedItem item) {
                // Another caller deletes the item while the lock is released.
                lock.runUnlocked(() -> CompletableFuture.runAsync(() -> {
                    try {
                        table.delete(item.getKey());
                    } catch (TableException e) {
                        throw new IllegalStateException(e);
                    }
                }, executor).join());
            }
        });

        SampledItem sampled = table.sample();

        assertEquals(1L, sampled.key());
        assertThat(sampled.chunks()).extracting(ChunkData::getChunkKey).containsExactly(1L);
        assertEquals(0, table.size());
        assertEquals(0, table.numChunks());
        assertEquals(1, table.sampleCount());
    }

    /**
     * Checks the cursor from inside the hooks, where the counters do not yet
     * include the call being made.
     */
    private static final class CursorCheckingExtension extends AbstractTableExtension {
        private final double minDiff;
        private final double maxDiff;
        final List<String> violations = Collections.synchronizedList(new ArrayList<>());

        CursorCheckingExtension(double minDiff, double maxDiff) {
            this.minDiff = minDiff;
            this.maxDiff = maxDiff;
        }

        @Override
        protected void applyOnInsert(PrioritizedItem item) {
            double next = getTable().insertCount() + 1 - getTable().sampleCount();
            if (next > maxDiff) {
                violations.add("insert of " + item.getKey() + " moved cursor to " + next);
            }
        }

        @Override
        protected void applyOnSample(PrioritizedItem item) {
            double next = getTable().insertCount() - getTable().sampleCount() - 1;
            if (next < minDiff) {
                violations.add("sample of " + item.getKey() + " moved cursor to " + next);
            }
        }
    }
}
