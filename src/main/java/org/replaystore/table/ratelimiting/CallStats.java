package org.replaystore.table.ratelimiting;

import org.replaystore.api.contracts.RateLimiterCallStats;

import com.google.protobuf.Duration;

/**
 * Wait statistics of one call kind (insert or sample). Observability only.
 * <p>
 * A call is completed once the table has applied it, so a call that passed the
 * limiter but then failed is not counted. A call is limited as soon as it had
 * to wait, whether the wait ended in success or cancellation.
 * <p>
 * Pending wait time is derived from the sum of the start times of the pending
 * calls, so no per-call bookkeeping is needed.
 * <p>
 * Thread Safety: Not thread-safe, guarded by the table lock.
 */
final class CallStats {

    private long pending;
    private long completed;
    private long limited;
    private long completedWaitNanos;
    private long pendingStartNanosSum;

    void recordCompleted() {
        completed++;
    }

    void startWait(long startNanos) {
        pending++;
        pendingStartNanosSum += startNanos;
    }

    void finishWait(long startNanos, long endNanos, boolean succeeded) {
        pending--;
        pendingStartNanosSum -= startNanos;
        limited++;
        if (succeeded) {
            completedWaitNanos += endNanos - startNanos;
        }
    }

    long pending() {
        return pending;
    }

    RateLimiterCallStats toProto(long nowNanos) {
        return RateLimiterCallStats.newBuilder()
                .setPending(pending)
                .setCompleted(completed)
                .setLimited(limited)
                .setCompletedWaitTime(toDuration(completedWaitNanos))
                .setPendingWaitTime(toDuration(pending * nowNanos - pendingStartNanosSum))
                .build();
    }

    private static Duration toDuration(long nanos) {
        return Duration.newBuilder()
                .setSeconds(nanos / 1_000_000_000L)
                .setNanos((int) (nanos % 1_000_000_000L))
                .build();
    }
}
