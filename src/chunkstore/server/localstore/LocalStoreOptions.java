package chunkstore.server.localstore;

import chunkstore.server.util.*;
import chunkstore.shared.storage.*;
import chunkstore.shared.util.*;

import java.time.*;
import java.util.*;
import java.util.function.*;

public class LocalStoreOptions {
    public static final long DEFAULT_CAPACITY = 5_000_000;
    public static final double DEFAULT_GC_TARGET_RATIO = 0.9;
    public static final int DEFAULT_GC_BATCH_SIZE = 200;

    // absent means use the key persisted in the store, or generate one on first open
    public final Optional<byte[]> baseKey;
    public final long capacity;
    public final double gcTargetRatio;
    public final int gcBatchSize;
    public final boolean collectGarbageInBackground;
    public final LongSupplier clock;

    public LocalStoreOptions(Optional<byte[]> baseKey,
                             long capacity,
                             double gcTargetRatio,
                             int gcBatchSize,
                             boolean collectGarbageInBackground,
                             LongSupplier clock) {
        if (capacity <= 0)
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        if (gcTargetRatio < 0 || gcTargetRatio > 1)
            throw new IllegalArgumentException("gc target ratio must be between 0 and 1: " + gcTargetRatio);
        if (gcBatchSize <= 0)
            throw new IllegalArgumentException("gc batch size must be positive: " + gcBatchSize);
        if (baseKey.isPresent() && baseKey.get().length != ChunkAddress.LENGTH)
            throw new IllegalArgumentException("Base key must be " + ChunkAddress.LENGTH + " bytes");
        this.baseKey = baseKey;
        this.capacity = capacity;
        this.gcTargetRatio = gcTargetRatio;
        this.gcBatchSize = gcBatchSize;
        this.collectGarbageInBackground = collectGarbageInBackground;
        this.clock = clock;
    }

    /** The gc size a collection run reduces the store to. */
    public long gcTarget() {
        return (long) (capacity * gcTargetRatio);
    }

    public LocalStoreOptions withCapacity(long capacity) {
        return new LocalStoreOptions(baseKey, capacity, gcTargetRatio, gcBatchSize, collectGarbageInBackground, clock);
    }

    public LocalStoreOptions withGcBatchSize(int gcBatchSize) {
        return new LocalStoreOptions(baseKey, capacity, gcTargetRatio, gcBatchSize, collectGarbageInBackground, clock);
    }

    public LocalStoreOptions withBackgroundGc(boolean collectGarbageInBackground) {
        return new LocalStoreOptions(baseKey, capacity, gcTargetRatio, gcBatchSize, collectGarbageInBackground, clock);
    }

    public LocalStoreOptions withClock(LongSupplier clock) {
        return new LocalStoreOptions(baseKey, capacity, gcTargetRatio, gcBatchSize, collectGarbageInBackground, clock);
    }

    public LocalStoreOptions withBaseKey(byte[] baseKey) {
        return new LocalStoreOptions(Optional.of(baseKey), capacity, gcTargetRatio, gcBatchSize, collectGarbageInBackground, clock);
    }

    /** Nanoseconds since the epoch. */
    public static long now() {
        Instant now = Instant.now();
        return now.getEpochSecond() * 1_000_000_000L + now.getNano();
    }

    public static LocalStoreOptions defaults() {
        return new LocalStoreOptions(Optional.empty(), DEFAULT_CAPACITY,
                DEFAULT_GC_TARGET_RATIO, DEFAULT_GC_BATCH_SIZE, true, LocalStoreOptions::now);
    }

    public static LocalStoreOptions fromArgs(Args a) {
        return new LocalStoreOptions(
                a.getOptionalArg("base-key").map(ArrayOps::hexToBytes),
                a.getLong("capacity", DEFAULT_CAPACITY),
                a.getDouble("gc-target-ratio", DEFAULT_GC_TARGET_RATIO),
                a.getInt("gc-batch-size", DEFAULT_GC_BATCH_SIZE),
                a.getBoolean("gc-in-background", true),
                LocalStoreOptions::now);
    }
}
