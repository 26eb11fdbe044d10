package org.replaystore.table;

import java.time.Instant;

import org.replaystore.api.contracts.PrioritizedItem;
import org.replaystore.api.contracts.SliceRange;

import com.google.protobuf.Timestamp;

/**
 * Live state of an item inside a table. Priority and times-sampled are mutated
 * under the table lock; callers only ever see {@link PrioritizedItem} snapshots.
 */
final class TableItem {

    private final long key;
    private final long[] chunkKeys;
    private final SliceRange sliceRange;
    private final Timestamp insertedAt;
    private double priority;
    private int timesSampled;

    TableItem(long key, long[] chunkKeys, SliceRange sliceRange, double priority, Instant insertedAt) {
        this.key = key;
        this.chunkKeys = chunkKeys;
        this.sliceRange = sliceRange;
        this.priority = priority;
        this.insertedAt = Timestamp.newBuilder()
                .setSeconds(insertedAt.getEpochSecond())
                .setNanos(insertedAt.getNano())
                .build();
    }

    long key() {
        return key;
    }

    long[] chunkKeys() {
        return chunkKeys;
    }

    double priority() {
        return priority;
    }

    void setPriority(double priority) {
        this.priority = priority;
    }

    int timesSampled() {
        return timesSampled;
    }

    int incrementTimesSampled() {
        return ++timesSampled;
    }

    PrioritizedItem toProto(String tableName) {
        PrioritizedItem.Builder builder = PrioritizedItem.newBuilder()
                .setKey(key)
                .setTable(tableName)
                .setSequenceRange(sliceRange)
                .setPriority(priority)
                .setTimesSampled(timesSampled)
                .setInsertedAt(insertedAt);
        for (long chunkKey : chunkKeys) {
            builder.addChunkKeys(chunkKey);
        }
        return builder.build();
    }
}
