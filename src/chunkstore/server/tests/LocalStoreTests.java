package chunkstore.server.tests;

import chunkstore.server.localstore.*;
import chunkstore.shared.storage.*;
import org.junit.*;
import org.junit.runner.*;
import org.junit.runners.*;

import java.util.*;

@RunWith(Parameterized.class)
public class LocalStoreTests {
    private static final Random random = new Random(28);

    private final String engine;
    private LocalStore store;

    public LocalStoreTests(String engine) {
        this.engine = engine;
    }

    @Parameterized.Parameters(name = "{0}")
    public static Collection<Object[]> parameters() {
        return StoreFixtures.engines();
    }

    @Before
    public void open() {
        store = StoreFixtures.build(engine);
    }

    @After
    public void close() {
        store.close();
    }

    private long count(String index) {
        return store.indexCounts().get(index);
    }

    private List<Descriptor> pulled(ChunkAddress address) {
        return store.pullDescriptors(store.bin(address), 0, 0, 1000);
    }

    @Test
    public void accessIndexesNewChunk() {
        ChunkAddress address = StoreFixtures.randomChunk(random).address;
        store.set(ModeSet.ACCESS, address);

        Assert.assertEquals(new ChunkState.Indexed(false, true), store.state(address));
        Assert.assertEquals(1, store.gcSize());
        Assert.assertEquals(0L, count("retrievalData"));
        Assert.assertEquals(1L, count("retrievalAccess"));
        Assert.assertEquals(1L, count("pull"));
        Assert.assertEquals(1L, count("gc"));
        Assert.assertEquals(List.of(new Descriptor(address, 1)), pulled(address));
    }

    @Test
    public void accessIsIdempotent() {
        ChunkAddress address = StoreFixtures.randomChunk(random).address;
        store.set(ModeSet.ACCESS, address);
        store.set(ModeSet.ACCESS, address);

        Assert.assertEquals(1, store.gcSize());
        Assert.assertEquals(1L, count("gc"));
        Assert.assertEquals("same bin id both times", List.of(new Descriptor(address, 1)), pulled(address));
        Assert.assertTrue(store.isGcSizeConsistent());
    }

    @Test
    public void accessKeepsBinIdOfStoredChunk() {
        Chunk first = StoreFixtures.randomChunkInBin(random, store, 0);
        Chunk second = StoreFixtures.randomChunkInBin(random, store, 0);
        StoreFixtures.storeBody(store, first);
        StoreFixtures.storeBody(store, second);

        store.set(ModeSet.ACCESS, first.address);

        Assert.assertEquals(Arrays.asList(new Descriptor(first.address, 1), new Descriptor(second.address, 2)),
                store.pullDescriptors(0, 0, 0, 10));
        Assert.assertEquals("access doesn't clear the push queue of a stored chunk", 2, store.pendingPush(10).size());
        Assert.assertEquals(new ChunkState.Indexed(true, true), store.state(first.address));
    }

    @Test
    public void syncClearsPushAndMakesCollectable() {
        Chunk chunk = StoreFixtures.randomChunk(random);
        StoreFixtures.storeBody(store, chunk);
        Assert.assertEquals(List.of(chunk.address), store.pendingPush(10));
        Assert.assertEquals(new ChunkState.Indexed(true, false), store.state(chunk.address));

        store.set(ModeSet.SYNC, chunk.address);

        Assert.assertTrue(store.pendingPush(10).isEmpty());
        Assert.assertEquals(1, store.gcSize());
        Assert.assertEquals(new ChunkState.Indexed(true, true), store.state(chunk.address));

        store.set(ModeSet.SYNC, chunk.address);
        Assert.assertEquals(1, store.gcSize());
        Assert.assertTrue(store.isGcSizeConsistent());
    }

    @Test
    public void syncWithoutDataLeavesNoTrace() {
        ChunkAddress address = StoreFixtures.randomChunk(random).address;
        store.set(ModeSet.SYNC, address);

        Assert.assertEquals(ChunkState.ABSENT, store.state(address));
        Assert.assertEquals(0, store.gcSize());
        for (Map.Entry<String, Long> e : store.indexCounts().entrySet())
            Assert.assertEquals(e.getKey(), 0L, (long) e.getValue());
    }

    @Test
    public void syncDoesNotMakePinnedChunkCollectable() {
        Chunk chunk = StoreFixtures.randomChunk(random);
        StoreFixtures.storeBody(store, chunk);
        store.set(ModeSet.PIN, chunk.address);
        store.set(ModeSet.SYNC, chunk.address);

        Assert.assertEquals(new ChunkState.Pinned(1, false), store.state(chunk.address));
        Assert.assertEquals(0, store.gcSize());
        Assert.assertTrue(store.pendingPush(10).isEmpty());
    }

    @Test
    public void removeClearsEveryIndex() {
        Chunk chunk = StoreFixtures.randomChunk(random);
        StoreFixtures.storeBody(store, chunk);
        store.set(ModeSet.ACCESS, chunk.address);
        Assert.assertEquals(1, store.gcSize());

        store.set(ModeSet.REMOVE, chunk.address);

        Assert.assertFalse(store.has(chunk.address));
        Assert.assertEquals(ChunkState.ABSENT, store.state(chunk.address));
        Assert.assertEquals(0, store.gcSize());
        Assert.assertEquals(0L, count("retrievalData"));
        Assert.assertEquals(0L, count("retrievalAccess"));
        Assert.assertEquals(0L, count("pull"));
        Assert.assertEquals(0L, count("gc"));

        try {
            store.set(ModeSet.REMOVE, chunk.address);
            Assert.fail("Removed a chunk twice");
        } catch (ChunkNotFoundException e) {
            Assert.assertEquals("retrievalData", e.index);
            Assert.assertEquals(chunk.address, e.address);
        }
    }

    @Test
    public void removeOfUncollectableChunkKeepsGcSize() {
        Chunk collectable = StoreFixtures.randomChunk(random);
        Chunk uploaded = StoreFixtures.randomChunk(random);
        store.put(ModePut.REQUEST, collectable);
        StoreFixtures.storeBody(store, uploaded);
        Assert.assertEquals(1, store.gcSize());

        store.set(ModeSet.REMOVE, uploaded.address);

        Assert.assertEquals(1, store.gcSize());
        Assert.assertTrue(store.isGcSizeConsistent());
    }

    @Test
    public void pinCountsReferences() {
        ChunkAddress address = StoreFixtures.randomChunk(random).address;
        for (int i = 0; i < 3; i++)
            store.set(ModeSet.PIN, address);
        Assert.assertEquals(3, store.pinCounter(address));
        Assert.assertTrue(store.isExcludedFromGc(address));
        Assert.assertEquals(1L, count("gcExclude"));

        store.set(ModeSet.UNPIN, address);
        store.set(ModeSet.UNPIN, address);
        Assert.assertEquals(1, store.pinCounter(address));

        store.set(ModeSet.UNPIN, address);
        Assert.assertEquals(0, store.pinCounter(address));
        Assert.assertEquals("no zero counters are stored", 0L, count("pin"));

        try {
            store.set(ModeSet.UNPIN, address);
            Assert.fail("Unpinned a chunk that isn't pinned");
        } catch (ChunkNotFoundException e) {
            Assert.assertEquals("pin", e.index);
        }
    }

    @Test
    public void pinDoesNotRemoveGcEntry() {
        Chunk chunk = StoreFixtures.randomChunk(random);
        store.put(ModePut.REQUEST, chunk);
        store.set(ModeSet.PIN, chunk.address);

        Assert.assertEquals(new ChunkState.Pinned(1, true), store.state(chunk.address));
        Assert.assertEquals(1, store.gcSize());
    }

    /** Access doesn't look at pins, so it makes a pinned chunk collectable again. Gc exclusion still protects it.
     */
    @Test
    public void accessMakesPinnedChunkCollectableAgain() {
        Chunk chunk = StoreFixtures.randomChunk(random);
        StoreFixtures.storeBody(store, chunk);
        store.set(ModeSet.PIN, chunk.address);
        store.set(ModeSet.SYNC, chunk.address);
        Assert.assertEquals(0, store.gcSize());

        store.set(ModeSet.ACCESS, chunk.address);

        Assert.assertEquals(new ChunkState.Pinned(1, true), store.state(chunk.address));
        Assert.assertEquals(1, store.gcSize());
        Assert.assertTrue(store.isExcludedFromGc(chunk.address));
    }

    @Test
    public void lifecycle() {
        Chunk a = StoreFixtures.randomChunk(random);
        StoreFixtures.storeBody(store, a);

        store.set(ModeSet.ACCESS, a.address);
        Assert.assertEquals(new ChunkState.Indexed(true, true), store.state(a.address));
        Assert.assertEquals(1, store.gcSize());

        store.set(ModeSet.PIN, a.address);
        Assert.assertEquals(1, store.pinCounter(a.address));
        Assert.assertTrue(store.isExcludedFromGc(a.address));

        store.set(ModeSet.SYNC, a.address);
        Assert.assertEquals(new ChunkState.Pinned(1, false), store.state(a.address));
        Assert.assertEquals(0, store.gcSize());

        store.set(ModeSet.UNPIN, a.address);
        Assert.assertEquals(0, store.pinCounter(a.address));
        Assert.assertEquals(new ChunkState.Indexed(true, false), store.state(a.address));

        store.set(ModeSet.REMOVE, a.address);
        Assert.assertEquals(ChunkState.ABSENT, store.state(a.address));
        Assert.assertEquals(0, store.gcSize());
        Assert.assertTrue(store.isGcSizeConsistent());
    }

    @Test
    public void gcSizeMatchesGcIndex() {
        List<Chunk> chunks = new ArrayList<>();
        for (int i = 0; i < 20; i++)
            chunks.add(StoreFixtures.randomChunk(random));
        ModeSet[] modes = ModeSet.values();
        ModePut[] putModes = ModePut.values();
        Random r = new Random(7);
        for (int i = 0; i < 400; i++) {
            Chunk chunk = chunks.get(r.nextInt(chunks.size()));
            try {
                if (r.nextInt(4) == 0)
                    store.put(putModes[r.nextInt(putModes.length)], chunk);
                else
                    store.set(modes[r.nextInt(modes.length)], chunk.address);
            } catch (ChunkNotFoundException expected) {}
            Assert.assertTrue("gc size after op " + i, store.isGcSizeConsistent());
        }
    }

    @Test
    public void invalidMode() {
        ChunkAddress address = StoreFixtures.randomChunk(random).address;
        try {
            store.set(null, address);
            Assert.fail("Accepted a missing mode");
        } catch (InvalidModeException expected) {}
        Assert.assertEquals(ChunkState.ABSENT, store.state(address));

        try {
            ModeSet.byName("touch");
            Assert.fail("Accepted an unknown mode");
        } catch (InvalidModeException expected) {}

        try {
            ModeSet.byCode(5);
            Assert.fail("Accepted an unknown mode");
        } catch (InvalidModeException expected) {}
        Assert.assertEquals(ModeSet.UNPIN, ModeSet.byName("Unpin"));
    }
}
