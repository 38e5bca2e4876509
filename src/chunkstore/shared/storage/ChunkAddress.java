package chunkstore.shared.storage;

import chunkstore.shared.util.*;

import java.security.*;
import java.util.*;

/** The content address of a chunk: the sha-256 hash of its data.
 */
public class ChunkAddress implements Comparable<ChunkAddress> {
    public static final int LENGTH = 32;

    private final byte[] hash;

    public ChunkAddress(byte[] hash) {
        if (hash.length != LENGTH)
            throw new IllegalArgumentException("Chunk address must be " + LENGTH + " bytes, got " + hash.length);
        this.hash = Arrays.copyOf(hash, hash.length);
    }

    public byte[] toBytes() {
        return Arrays.copyOf(hash, hash.length);
    }

    public byte byteAt(int index) {
        return hash[index];
    }

    public static ChunkAddress fromHex(String hex) {
        return new ChunkAddress(ArrayOps.hexToBytes(hex));
    }

    public static ChunkAddress hash(byte[] data) {
        try {
            return new ChunkAddress(MessageDigest.getInstance("SHA-256").digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    @Override
    public int compareTo(ChunkAddress o) {
        return ArrayOps.compareUnsigned(hash, o.hash);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(hash, ((ChunkAddress) o).hash);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(hash);
    }

    @Override
    public String toString() {
        return ArrayOps.bytesToHex(hash);
    }
}
