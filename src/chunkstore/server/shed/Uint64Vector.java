package chunkstore.server.shed;

import chunkstore.shared.util.*;

/** Persisted unsigned counters addressed by a small index.
 */
public class Uint64Vector {
    private final OrderedStore db;
    private final byte[] keyPrefix;

    Uint64Vector(OrderedStore db, byte[] keyPrefix) {
        this.db = db;
        this.keyPrefix = keyPrefix;
    }

    private byte[] key(long index) {
        return ArrayOps.concat(keyPrefix, ArrayOps.longToBytes(index));
    }

    public long get(long index) {
        return db.get(key(index))
                .map(v -> ArrayOps.bytesToLong(v, 0))
                .orElse(0L);
    }

    public void put(long index, long value) {
        Batch batch = new Batch();
        putInBatch(batch, index, value);
        db.write(batch);
    }

    public void putInBatch(Batch batch, long index, long value) {
        batch.put(key(index), ArrayOps.longToBytes(value));
    }

    /** Increment the counter at index, persisting it before returning the new value.
     */
    public long inc(long index) {
        long next = get(index) + 1;
        put(index, next);
        return next;
    }
}
