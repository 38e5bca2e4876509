package chunkstore.server.tests;

import chunkstore.server.localstore.*;
import chunkstore.server.shed.*;
import org.junit.*;

public class GcSizeCounterTests {

    @Test
    public void stagesUpdateInBatch() {
        try (Shed shed = new Shed(new RamOrderedStore())) {
            GcSizeCounter counter = new GcSizeCounter(shed.newUint64Field("gc-size"));
            Batch batch = new Batch();
            Assert.assertEquals(3, counter.applyDelta(batch, 3));
            Assert.assertEquals("not written yet", 0, counter.get());
            shed.write(batch);
            Assert.assertEquals(3, counter.get());

            Batch unchanged = new Batch();
            Assert.assertEquals(3, counter.applyDelta(unchanged, 0));
            Assert.assertTrue(unchanged.isEmpty());
        }
    }

    @Test
    public void negativeSizeIsRejected() {
        try (Shed shed = new Shed(new RamOrderedStore())) {
            GcSizeCounter counter = new GcSizeCounter(shed.newUint64Field("gc-size"));
            Batch batch = new Batch();
            counter.applyDelta(batch, 1);
            shed.write(batch);

            Batch drift = new Batch();
            try {
                counter.applyDelta(drift, -2);
                Assert.fail("Gc size can't go below zero");
            } catch (IllegalStateException expected) {}
            Assert.assertTrue(drift.isEmpty());
            Assert.assertEquals(1, counter.get());
        }
    }
}
