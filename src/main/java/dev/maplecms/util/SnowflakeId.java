package dev.maplecms.util;

import java.time.Instant;
import java.util.function.LongSupplier;

/**
 * 64-bit time-ordered id generator.
 *
 * <pre>
 * | 1 bit (sign, always 0) | 41 bits (ms since 2025-01-01) | 10 bits (node) | 12 bits (sequence) |
 * </pre>
 *
 * Ids minted by one generator are strictly increasing; generators with distinct
 * node ids never collide.
 */
public final class SnowflakeId {

    // 2025-01-01T00:00:00Z
    static final long EPOCH_MILLIS = 1735689600000L;

    private static final int NODE_BITS = 10;
    private static final int SEQUENCE_BITS = 12;

    public static final long MAX_NODE_ID = (1L << NODE_BITS) - 1;
    private static final long SEQUENCE_MASK = (1L << SEQUENCE_BITS) - 1;

    private static final int NODE_SHIFT = SEQUENCE_BITS;
    private static final int TIME_SHIFT = SEQUENCE_BITS + NODE_BITS;

    // Backward clock jumps up to this many ms are absorbed by reusing the last timestamp
    private static final long MAX_CLOCK_DRIFT_MS = 5;

    private final long nodeId;
    private final LongSupplier clock;

    private long lastTimestamp = -1L;
    private long sequence = 0L;

    public SnowflakeId(long nodeId) {
        this(nodeId, System::currentTimeMillis);
    }

    SnowflakeId(long nodeId, LongSupplier clock) {
        if (nodeId < 0 || nodeId > MAX_NODE_ID) {
            throw new IllegalArgumentException(
                    "Node ID must be between 0 and " + MAX_NODE_ID + ", got: " + nodeId);
        }
        this.nodeId = nodeId;
        this.clock = clock;
    }

    public synchronized long nextId() {
        long now = clock.getAsLong() - EPOCH_MILLIS;

        if (now < lastTimestamp) {
            long drift = lastTimestamp - now;
            if (drift > MAX_CLOCK_DRIFT_MS) {
                throw new IllegalStateException(
                        "Clock moved backwards by " + drift + "ms. Refusing to generate ID.");
            }
            now = lastTimestamp;
        }

        if (now == lastTimestamp) {
            sequence = (sequence + 1) & SEQUENCE_MASK;
            if (sequence == 0) {
                now = awaitNextMillis(lastTimestamp);
            }
        } else {
            sequence = 0;
        }

        lastTimestamp = now;
        return (now << TIME_SHIFT) | (nodeId << NODE_SHIFT) | sequence;
    }

    public static Instant createdAt(long id) {
        return Instant.ofEpochMilli((id >>> TIME_SHIFT) + EPOCH_MILLIS);
    }

    public static int nodeOf(long id) {
        return (int) ((id >>> NODE_SHIFT) & MAX_NODE_ID);
    }

    private long awaitNextMillis(long after) {
        long now = clock.getAsLong() - EPOCH_MILLIS;
        while (now <= after) {
            Thread.onSpinWait();
            now = clock.getAsLong() - EPOCH_MILLIS;
        }
        return now;
    }

    @Override
    public String toString() {
        return "SnowflakeId{nodeId=" + nodeId + "}";
    }
}
