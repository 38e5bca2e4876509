package chunkstore.shared.storage;

import java.util.*;

public class Chunk {
    public final ChunkAddress address;
    private final byte[] data;

    public Chunk(ChunkAddress address, byte[] data) {
        this.address = address;
        this.data = data;
    }

    public byte[] data() {
        return Arrays.copyOf(data, data.length);
    }

    public int size() {
        return data.length;
    }

    public static Chunk of(byte[] data) {
        return new Chunk(ChunkAddress.hash(data), Arrays.copyOf(data, data.length));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Chunk chunk = (Chunk) o;
        return address.equals(chunk.address) && Arrays.equals(data, chunk.data);
    }

    @Override
    public int hashCode() {
        return 31 * address.hashCode() + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "Chunk(" + address + ", " + data.length + " bytes)";
    }
}
