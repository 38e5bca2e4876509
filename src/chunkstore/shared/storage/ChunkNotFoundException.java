package chunkstore.shared.storage;

/** A required index entry for a chunk is missing.
 */
public class ChunkNotFoundException extends RuntimeException {
    public final String index;
    public final ChunkAddress address;

    public ChunkNotFoundException(String index, ChunkAddress address) {
        super("Chunk " + address + " not found in " + index);
        this.index = index;
        this.address = address;
    }
}
