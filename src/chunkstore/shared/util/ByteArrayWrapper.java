package chunkstore.shared.util;

import java.util.Arrays;

/** A convenience wrapper for using byte arrays as keys in sorted collections.
 *
 *  Ordering is unsigned lexicographic, the same order an ordered key value engine iterates keys in.
 */
public class ByteArrayWrapper implements Comparable<ByteArrayWrapper>
{
    public final byte[] data;

    public ByteArrayWrapper(byte[] data)
    {
        this.data = data;
    }

    @Override
    public int hashCode()
    {
        return Arrays.hashCode(data);
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        ByteArrayWrapper other = (ByteArrayWrapper) obj;
        return Arrays.equals(data, other.data);
    }

    @Override
    public int compareTo(ByteArrayWrapper o) {
        return ArrayOps.compareUnsigned(data, o.data);
    }

    @Override
    public String toString() {
        return ArrayOps.bytesToHex(data);
    }
}
