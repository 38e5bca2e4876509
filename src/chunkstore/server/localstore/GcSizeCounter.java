package chunkstore.server.localstore;

import chunkstore.server.shed.*;

/** The persisted number of entries in the gc index. It only changes in the same batch as the gc index.
 */
public class GcSizeCounter {

    private final Uint64Field gcSize;

    public GcSizeCounter(Uint64Field gcSize) {
        this.gcSize = gcSize;
    }

    public long get() {
        return gcSize.get();
    }

    /**
     * Stage the counter update for a change to the gc index.
     *
     * @param batch
     * @param delta
     * @return the size the counter will have once the batch is written
     * @throws IllegalStateException if the counter would become negative
     */
    public long applyDelta(Batch batch, long delta) {
        long current = gcSize.get();
        if (delta == 0)
            return current;
        long updated = current + delta;
        if (updated < 0)
            throw new IllegalStateException("Gc size would drop below zero: " + current + " " + delta);
        gcSize.putInBatch(batch, updated);
        return updated;
    }
}
