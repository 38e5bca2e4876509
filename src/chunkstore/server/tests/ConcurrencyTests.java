package chunkstore.server.tests;

import chunkstore.server.localstore.*;
import chunkstore.shared.storage.*;
import org.junit.*;
import org.junit.runner.*;
import org.junit.runners.*;

import java.util.*;
import java.util.concurrent.*;

@RunWith(Parameterized.class)
public class ConcurrencyTests {

    private final String engine;

    public ConcurrencyTests(String engine) {
        this.engine = engine;
    }

    @Parameterized.Parameters(name = "{0}")
    public static Collection<Object[]> parameters() {
        return StoreFixtures.engines();
    }

    @Test
    public void concurrentSetsKeepIndexesConsistent() throws Exception {
        Random seed = new Random(21);
        List<Chunk> chunks = new ArrayList<>();
        for (int i = 0; i < 30; i++)
            chunks.add(StoreFixtures.randomChunk(seed));

        try (LocalStore store = StoreFixtures.build(engine)) {
            ExecutorService pool = Executors.newFixedThreadPool(8);
            List<Future<?>> done = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                Random r = new Random(t);
                done.add(pool.submit(() -> {
                    for (int i = 0; i < 150; i++) {
                        Chunk chunk = chunks.get(r.nextInt(chunks.size()));
                        try {
                            switch (r.nextInt(6)) {
                                case 0:
                                    store.put(ModePut.UPLOAD, chunk);
                                    break;
                                case 1:
                                    store.set(ModeSet.ACCESS, chunk.address);
                                    break;
                                case 2:
                                    store.set(ModeSet.SYNC, chunk.address);
                                    break;
                                case 3:
                                    store.set(ModeSet.REMOVE, chunk.address);
                                    break;
                                case 4:
                                    store.set(ModeSet.PIN, chunk.address);
                                    break;
                                default:
                                    store.set(ModeSet.UNPIN, chunk.address);
                            }
                        } catch (ChunkNotFoundException expected) {}
                    }
                }));
            }
            for (Future<?> f : done)
                f.get(60, TimeUnit.SECONDS);
            pool.shutdown();

            Assert.assertTrue(store.isGcSizeConsistent());
            for (int bin = 0; bin <= Proximity.MAX_PO; bin++) {
                List<Descriptor> pulled = store.pullDescriptors(bin, 0, 0, 10_000);
                Set<Long> binIds = new HashSet<>();
                Set<ChunkAddress> addresses = new HashSet<>();
                for (Descriptor d : pulled) {
                    Assert.assertTrue("bin ids are unique", binIds.add(d.binId));
                    Assert.assertTrue("one pull entry per chunk", addresses.add(d.address));
                    Assert.assertEquals(bin, store.bin(d.address));
                }
            }
        }
    }
}
