package chunkstore.server.tests;

import chunkstore.server.localstore.*;
import chunkstore.shared.storage.*;
import org.junit.*;

public class ProximityTests {

    private static ChunkAddress address(int... prefix) {
        byte[] hash = new byte[ChunkAddress.LENGTH];
        for (int i = 0; i < prefix.length; i++)
            hash[i] = (byte) prefix[i];
        return new ChunkAddress(hash);
    }

    @Test
    public void leadingSharedBits() {
        byte[] base = new byte[ChunkAddress.LENGTH];
        Assert.assertEquals(0, Proximity.of(base, address(0x80)));
        Assert.assertEquals(1, Proximity.of(base, address(0x40)));
        Assert.assertEquals(7, Proximity.of(base, address(0x01)));
        Assert.assertEquals(8, Proximity.of(base, address(0, 0x80)));
        Assert.assertEquals(15, Proximity.of(base, address(0, 0x01)));
    }

    @Test
    public void cappedAtMaxPo() {
        byte[] base = new byte[ChunkAddress.LENGTH];
        Assert.assertEquals(Proximity.MAX_PO, Proximity.of(base, address(0, 0, 0x80)));
        Assert.assertEquals(Proximity.MAX_PO, Proximity.of(base, address(0, 0, 0, 0xff)));
        Assert.assertEquals(Proximity.MAX_PO, Proximity.of(base, address()));
    }

    @Test
    public void relativeToBase() {
        byte[] base = new byte[ChunkAddress.LENGTH];
        base[0] = (byte) 0xf0;
        Assert.assertEquals(4, Proximity.of(base, address(0xf8)));
        Assert.assertEquals(0, Proximity.of(base, address(0x70)));
    }
}
