package chunkstore.shared.util;

import java.security.*;
import java.util.*;

public class ArrayOps
{
    private static final SecureRandom RANDOM = new SecureRandom();

    public static byte[] concat(byte[] one, byte[] two)
    {
        byte[] res = new byte[one.length+two.length];
        System.arraycopy(one, 0, res, 0, one.length);
        System.arraycopy(two, 0, res, one.length, two.length);
        return res;
    }

    public static byte[] concat(byte[]... parts)
    {
        int total = 0;
        for (byte[] part : parts)
            total += part.length;
        byte[] res = new byte[total];
        int offset = 0;
        for (byte[] part : parts) {
            System.arraycopy(part, 0, res, offset, part.length);
            offset += part.length;
        }
        return res;
    }

    public static int compareUnsigned(byte[] a, byte[] b) {
        int len = Math.min(a.length, b.length);
        for (int i=0; i < len; i++)
            if (a[i] != b[i])
                return (0xff & a[i]) - (0xff & b[i]);
        return a.length - b.length;
    }

    /** The smallest key greater than every key starting with prefix, or empty if there is none.
     */
    public static Optional<byte[]> prefixUpperBound(byte[] prefix) {
        byte[] res = Arrays.copyOf(prefix, prefix.length);
        for (int i = res.length - 1; i >= 0; i--) {
            if ((res[i] & 0xff) != 0xff) {
                res[i]++;
                return Optional.of(Arrays.copyOf(res, i + 1));
            }
        }
        return Optional.empty();
    }

    public static byte[] longToBytes(long value) {
        byte[] res = new byte[8];
        for (int i = 7; i >= 0; i--) {
            res[i] = (byte) value;
            value >>>= 8;
        }
        return res;
    }

    public static long bytesToLong(byte[] data, int offset) {
        if (data.length < offset + 8)
            throw new IllegalStateException("Need 8 bytes at offset " + offset + " but have " + data.length);
        long res = 0;
        for (int i = 0; i < 8; i++)
            res = (res << 8) | (data[offset + i] & 0xff);
        return res;
    }

    public static byte[] hexToBytes(String hex)
    {
        if (hex.length() % 2 != 0)
            throw new IllegalArgumentException("Hex string must have an even length: " + hex);
        byte[] res = new byte[hex.length()/2];
        for (int i=0; i < res.length; i++)
            res[i] = (byte) Integer.parseInt(hex.substring(2*i, 2*i+2), 16);
        return res;
    }

    private static String[] HEX_DIGITS = new String[]{
            "0", "1", "2", "3", "4", "5", "6", "7", "8", "9", "a", "b", "c", "d", "e", "f"};
    private static String[] HEX = new String[256];
    static {
        for (int i=0; i < 256; i++)
            HEX[i] = HEX_DIGITS[(i >> 4) & 0xF] + HEX_DIGITS[i & 0xF];
    }

    public static String byteToHex(byte b) {
        return HEX[b & 0xFF];
    }

    public static String bytesToHex(byte[] data)
    {
        StringBuilder s = new StringBuilder();
        for (byte b : data)
            s.append(byteToHex(b));
        return s.toString();
    }

    public static byte[] random(int length)
    {
        byte[] res = new byte[length];
        RANDOM.nextBytes(res);
        return res;
    }
}
