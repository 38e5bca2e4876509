package chunkstore.server.shed;

import chunkstore.shared.util.*;

import java.nio.charset.*;
import java.util.*;

/** Mounts indexes and counters on one {@link OrderedStore} so they can be written together in a single batch.
 *
 *  Prefix 0 holds counters, keyed by name. Every index claims its own non zero prefix.
 */
public class Shed implements AutoCloseable {
    private static final byte FIELDS_PREFIX = 0;

    private final OrderedStore db;
    private final Map<Byte, String> indexPrefixes = new HashMap<>();
    private final Set<String> fieldNames = new HashSet<>();

    public Shed(OrderedStore db) {
        this.db = db;
    }

    public synchronized <T> Index<T> newIndex(String name, int prefix, IndexFuncs<T> funcs) {
        if (prefix <= FIELDS_PREFIX || prefix > 0xff)
            throw new IllegalArgumentException("Invalid index prefix " + prefix + " for " + name);
        String existing = indexPrefixes.putIfAbsent((byte) prefix, name);
        if (existing != null)
            throw new IllegalStateException("Index prefix " + prefix + " already used by " + existing);
        return new Index<>(name, (byte) prefix, db, funcs);
    }

    public Uint64Field newUint64Field(String name) {
        return new Uint64Field(db, fieldKey(name));
    }

    public BytesField newBytesField(String name) {
        return new BytesField(db, fieldKey(name));
    }

    public Uint64Vector newUint64Vector(String name) {
        return new Uint64Vector(db, fieldKey(name));
    }

    private synchronized byte[] fieldKey(String name) {
        if (! fieldNames.add(name))
            throw new IllegalStateException("Field " + name + " already exists");
        byte[] nameBytes = name.getBytes(StandardCharsets.UTF_8);
        return ArrayOps.concat(new byte[]{FIELDS_PREFIX}, ArrayOps.longToBytes(nameBytes.length), nameBytes);
    }

    public void write(Batch batch) {
        db.write(batch);
    }

    @Override
    public void close() {
        db.close();
    }
}
