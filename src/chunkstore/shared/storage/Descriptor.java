package chunkstore.shared.storage;

import java.util.*;

/** A pull index entry: a chunk address and the bin id it was assigned in its bin.
 */
public class Descriptor {
    public final ChunkAddress address;
    public final long binId;

    public Descriptor(ChunkAddress address, long binId) {
        this.address = address;
        this.binId = binId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Descriptor that = (Descriptor) o;
        return binId == that.binId && address.equals(that.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, binId);
    }

    @Override
    public String toString() {
        return address + ":" + binId;
    }
}
