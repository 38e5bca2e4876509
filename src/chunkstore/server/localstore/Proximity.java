package chunkstore.server.localstore;

import chunkstore.shared.storage.*;

/** Kademlia style proximity order: the number of leading bits two addresses share, capped at MAX_PO.
 */
public class Proximity {
    public static final int MAX_PO = 16;

    public static int of(byte[] base, ChunkAddress address) {
        int bytes = Math.min(MAX_PO / 8 + 1, Math.min(base.length, ChunkAddress.LENGTH));
        for (int i = 0; i < bytes; i++) {
            int xor = (base[i] ^ address.byteAt(i)) & 0xff;
            for (int j = 0; j < 8; j++) {
                if (((xor >> (7 - j)) & 0x01) != 0)
                    return Math.min(i * 8 + j, MAX_PO);
            }
        }
        return MAX_PO;
    }
}
