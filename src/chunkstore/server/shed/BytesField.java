package chunkstore.server.shed;

import java.util.*;

/** A single persisted byte string.
 */
public class BytesField {
    private final OrderedStore db;
    private final byte[] key;

    BytesField(OrderedStore db, byte[] key) {
        this.db = db;
        this.key = key;
    }

    public Optional<byte[]> get() {
        return db.get(key);
    }

    public void put(byte[] value) {
        Batch batch = new Batch();
        batch.put(key, value);
        db.write(batch);
    }
}
