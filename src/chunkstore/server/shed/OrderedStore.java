package chunkstore.server.shed;

import chunkstore.shared.util.*;

import java.util.*;
import java.util.function.*;

/** A persistent mapping from byte keys to byte values, iterated in unsigned lexicographic key order.
 *
 *  Implementations throw {@link chunkstore.shared.storage.StorageEngineException} for any I/O failure.
 */
public interface OrderedStore extends AutoCloseable {

    Optional<byte[]> get(byte[] key);

    default boolean has(byte[] key) {
        return get(key).isPresent();
    }

    /** Apply every operation in the batch, or none of them.
     */
    void write(Batch batch);

    /**
     * Visit the entries whose key starts with prefix, in ascending key order, beginning at startFrom if present.
     *
     * @param startFrom
     * @param prefix
     * @param visitor returns true to stop the iteration
     */
    void iterate(Optional<byte[]> startFrom, byte[] prefix, Function<Pair<byte[], byte[]>, Boolean> visitor);

    Optional<Pair<byte[], byte[]>> last(byte[] prefix);

    long count(byte[] prefix);

    @Override
    void close();
}
