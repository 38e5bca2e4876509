package chunkstore.server.tests;

import chunkstore.server.*;
import chunkstore.server.localstore.*;
import chunkstore.server.shed.*;
import chunkstore.shared.storage.*;
import org.junit.*;

import java.util.*;
import java.util.concurrent.*;

public class AtomicityTests {
    private static final Random random = new Random(11);

    @Test
    public void failedCommitChangesNothing() throws Exception {
        StoreFixtures.FailingOrderedStore engine = new StoreFixtures.FailingOrderedStore(new RamOrderedStore());
        try (LocalStore store = new LocalStore(engine, StoreFixtures.options())) {
            Chunk chunk = StoreFixtures.randomChunk(random);
            StoreFixtures.storeBody(store, chunk);
            Map<String, Long> before = store.indexCounts();
            PullTrigger trigger = store.registerPullTrigger(store.bin(chunk.address));
            double errorsBefore = AggregatedMetrics.LOCALSTORE_SET_ERRORS.labels("access").get();

            engine.failWrites = true;
            try {
                store.set(ModeSet.ACCESS, chunk.address);
                Assert.fail("Write should have failed");
            } catch (StorageEngineException expected) {}
            engine.failWrites = false;

            Assert.assertEquals(before, store.indexCounts());
            Assert.assertEquals(new ChunkState.Indexed(true, false), store.state(chunk.address));
            Assert.assertEquals(0, store.gcSize());
            Assert.assertFalse("no notification for a failed write", trigger.await(200, TimeUnit.MILLISECONDS));
            Assert.assertEquals(errorsBefore + 1, AggregatedMetrics.LOCALSTORE_SET_ERRORS.labels("access").get(), 0.0);

            store.set(ModeSet.ACCESS, chunk.address);
            Assert.assertTrue(trigger.await(1, TimeUnit.SECONDS));
            Assert.assertEquals(1, store.gcSize());
        }
    }

    @Test
    public void sequencerFailureChangesNothing() {
        BinIdSequencer broken = new BinIdSequencer() {
            @Override
            public long nextBinId(int bin) {
                throw new BinIdSequencerException(bin, new StorageEngineException("Disk full"));
            }

            @Override
            public long currentBinId(int bin) {
                return 0;
            }
        };
        try (LocalStore store = new LocalStore(new RamOrderedStore(), StoreFixtures.options(), broken)) {
            ChunkAddress address = StoreFixtures.randomChunk(random).address;
            try {
                store.set(ModeSet.ACCESS, address);
                Assert.fail("Access needs a bin id");
            } catch (BinIdSequencerException expected) {}

            Assert.assertEquals(ChunkState.ABSENT, store.state(address));
            Assert.assertEquals(0, store.gcSize());
            for (long count : store.indexCounts().values())
                Assert.assertEquals(0L, count);
        }
    }

    @Test
    public void persistedSequencerFailure() {
        StoreFixtures.FailingOrderedStore engine = new StoreFixtures.FailingOrderedStore(new RamOrderedStore());
        try (LocalStore store = new LocalStore(engine, StoreFixtures.options())) {
            engine.failWrites = true;
            try {
                store.set(ModeSet.ACCESS, StoreFixtures.randomChunk(random).address);
                Assert.fail("Bin id couldn't be persisted");
            } catch (BinIdSequencerException e) {
                Assert.assertTrue(e.getCause() instanceof StorageEngineException);
            }
        }
    }

    private static final int RETRIEVAL_DATA = 1, RETRIEVAL_ACCESS = 2, PIN = 7;

    private static void assertReadErrorChangesNothing(LocalStore store, StoreFixtures.FailingOrderedStore engine,
                                                      ModeSet mode, ChunkAddress address, int failingIndex) throws Exception {
        Map<String, Long> before = store.indexCounts();
        long gcSizeBefore = store.gcSize();
        ChunkState stateBefore = store.state(address);
        PullTrigger trigger = store.registerPullTrigger(store.bin(address));
        try {
            engine.failReadsOf = StoreFixtures.indexKeys(failingIndex);
            try {
                store.set(mode, address);
                Assert.fail(mode + " should have failed reading index " + failingIndex);
            } catch (StorageEngineException expected) {}
            engine.failReadsOf = key -> false;

            Assert.assertEquals(before, store.indexCounts());
            Assert.assertEquals(gcSizeBefore, store.gcSize());
            Assert.assertEquals(stateBefore, store.state(address));
            Assert.assertTrue(store.isGcSizeConsistent());
            Assert.assertFalse("no notification for a failed read", trigger.await(100, TimeUnit.MILLISECONDS));
        } finally {
            engine.failReadsOf = key -> false;
            store.unregisterPullTrigger(trigger);
        }
    }

    @Test
    public void failedReadsChangeNothing() throws Exception {
        StoreFixtures.FailingOrderedStore engine = new StoreFixtures.FailingOrderedStore(new RamOrderedStore());
        try (LocalStore store = new LocalStore(engine, StoreFixtures.options())) {
            Chunk uploaded = StoreFixtures.randomChunk(random);
            StoreFixtures.storeBody(store, uploaded);

            assertReadErrorChangesNothing(store, engine, ModeSet.ACCESS, uploaded.address, RETRIEVAL_DATA);
            assertReadErrorChangesNothing(store, engine, ModeSet.ACCESS, uploaded.address, RETRIEVAL_ACCESS);
            // sync stages its access and push updates before it checks the pins
            assertReadErrorChangesNothing(store, engine, ModeSet.SYNC, uploaded.address, PIN);
            Assert.assertEquals(List.of(uploaded.address), store.pendingPush(10));

            assertReadErrorChangesNothing(store, engine, ModeSet.PIN, uploaded.address, PIN);
            Assert.assertFalse(store.isExcludedFromGc(uploaded.address));

            store.set(ModeSet.PIN, uploaded.address);
            assertReadErrorChangesNothing(store, engine, ModeSet.UNPIN, uploaded.address, PIN);
            Assert.assertEquals(1, store.pinCounter(uploaded.address));

            ChunkAddress unknown = StoreFixtures.randomChunk(random).address;
            assertReadErrorChangesNothing(store, engine, ModeSet.ACCESS, unknown, RETRIEVAL_DATA);
            Assert.assertEquals(ChunkState.ABSENT, store.state(unknown));
        }
    }
}
