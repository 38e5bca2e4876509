package chunkstore.server.shed;

import chunkstore.shared.util.*;

/** A single persisted unsigned counter. An absent value reads as zero.
 */
public class Uint64Field {
    private final OrderedStore db;
    private final byte[] key;

    Uint64Field(OrderedStore db, byte[] key) {
        this.db = db;
        this.key = key;
    }

    public long get() {
        return db.get(key)
                .map(v -> ArrayOps.bytesToLong(v, 0))
                .orElse(0L);
    }

    public void putInBatch(Batch batch, long value) {
        batch.put(key, ArrayOps.longToBytes(value));
    }
}
