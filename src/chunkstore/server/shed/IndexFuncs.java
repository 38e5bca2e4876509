package chunkstore.server.shed;

/** The key and value encoding of one index. Keys exclude the index prefix byte.
 */
public interface IndexFuncs<T> {

    byte[] encodeKey(T fields);

    T decodeKey(byte[] key);

    byte[] encodeValue(T fields);

    /** Combine the fields decoded from a value with those of the item that addressed it. */
    T decodeValue(T keyItem, byte[] value);
}
