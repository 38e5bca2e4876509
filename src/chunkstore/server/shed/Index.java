package chunkstore.server.shed;

import chunkstore.shared.util.*;

import java.util.*;
import java.util.function.*;

/** A named key space of an {@link OrderedStore}, identified by a one byte prefix.
 */
public class Index<T> {
    public final String name;
    private final OrderedStore db;
    private final byte[] prefix;
    private final IndexFuncs<T> funcs;

    Index(String name, byte prefix, OrderedStore db, IndexFuncs<T> funcs) {
        this.name = name;
        this.prefix = new byte[]{prefix};
        this.db = db;
        this.funcs = funcs;
    }

    private byte[] key(T fields) {
        return ArrayOps.concat(prefix, funcs.encodeKey(fields));
    }

    private T decode(Pair<byte[], byte[]> entry) {
        T keyItem = funcs.decodeKey(Arrays.copyOfRange(entry.left, prefix.length, entry.left.length));
        return funcs.decodeValue(keyItem, entry.right);
    }

    public Optional<T> get(T keyFields) {
        return db.get(key(keyFields))
                .map(value -> funcs.decodeValue(keyFields, value));
    }

    public boolean has(T keyFields) {
        return db.has(key(keyFields));
    }

    public void putInBatch(Batch batch, T item) {
        batch.put(key(item), funcs.encodeValue(item));
    }

    public void deleteInBatch(Batch batch, T keyFields) {
        batch.delete(key(keyFields));
    }

    /**
     * Visit items in key order.
     *
     * @param keyPrefix restricts the iteration to keys (after the index prefix) starting with these bytes
     * @param keyStart the encoded key to start at, if present
     * @param visitor returns true to stop
     */
    public void iterate(byte[] keyPrefix, Optional<byte[]> keyStart, Function<T, Boolean> visitor) {
        db.iterate(keyStart.map(k -> ArrayOps.concat(prefix, k)), ArrayOps.concat(prefix, keyPrefix), e -> visitor.apply(decode(e)));
    }

    public void iterate(Function<T, Boolean> visitor) {
        iterate(new byte[0], Optional.empty(), visitor);
    }

    public Optional<T> last(byte[] keyPrefix) {
        return db.last(ArrayOps.concat(prefix, keyPrefix))
                .map(this::decode);
    }

    public long count() {
        return db.count(prefix);
    }
}
