package chunkstore.server.tests;

import chunkstore.server.localstore.*;
import chunkstore.server.shed.*;
import chunkstore.shared.storage.*;
import chunkstore.shared.util.*;

import java.util.*;
import java.util.concurrent.atomic.*;
import java.util.function.*;

public class StoreFixtures {

    public static Collection<Object[]> engines() {
        return Arrays.asList(new Object[][]{
                {"ram"},
                {"sqlite"}
        });
    }

    public static OrderedStore engine(String type) {
        switch (type) {
            case "ram":
                return new RamOrderedStore();
            case "sqlite":
                return JdbcOrderedStore.build(":memory:");
            default:
                throw new IllegalArgumentException("Unknown engine " + type);
        }
    }

    /** A clock that moves forward one nanosecond every time it is read. */
    public static LongSupplier tickingClock() {
        AtomicLong time = new AtomicLong(1_000_000);
        return time::incrementAndGet;
    }

    public static LocalStoreOptions options() {
        return LocalStoreOptions.defaults()
                .withBackgroundGc(false)
                .withClock(tickingClock())
                .withBaseKey(new byte[ChunkAddress.LENGTH]);
    }

    public static LocalStore build(String engine) {
        return new LocalStore(engine(engine), options());
    }

    public static Chunk randomChunk(Random r) {
        byte[] data = new byte[64];
        r.nextBytes(data);
        return Chunk.of(data);
    }

    public static Chunk randomChunkInBin(Random r, LocalStore store, int bin) {
        while (true) {
            Chunk chunk = randomChunk(r);
            if (store.bin(chunk.address) == bin)
                return chunk;
        }
    }

    /** Writes the retrieval data of a chunk the way a body store would, queued for push and pull. */
    public static void storeBody(LocalStore store, Chunk chunk) {
        store.put(ModePut.UPLOAD, chunk);
    }

    /** Keys of the index mounted at this prefix. */
    public static Predicate<byte[]> indexKeys(int prefix) {
        return key -> key.length > 0 && key[0] == (byte) prefix;
    }

    /** An engine whose writes, or reads of chosen keys, can be made to fail. */
    public static class FailingOrderedStore implements OrderedStore {
        private final OrderedStore target;
        public volatile boolean failWrites = false;
        public volatile Predicate<byte[]> failReadsOf = key -> false;

        public FailingOrderedStore(OrderedStore target) {
            this.target = target;
        }

        @Override
        public Optional<byte[]> get(byte[] key) {
            if (failReadsOf.test(key))
                throw new StorageEngineException("Read error");
            return target.get(key);
        }

        @Override
        public void write(Batch batch) {
            if (failWrites)
                throw new StorageEngineException("Disk full");
            target.write(batch);
        }

        @Override
        public void iterate(Optional<byte[]> startFrom, byte[] prefix, Function<Pair<byte[], byte[]>, Boolean> visitor) {
            if (failReadsOf.test(prefix))
                throw new StorageEngineException("Read error");
            target.iterate(startFrom, prefix, visitor);
        }

        @Override
        public Optional<Pair<byte[], byte[]>> last(byte[] prefix) {
            return target.last(prefix);
        }

        @Override
        public long count(byte[] prefix) {
            return target.count(prefix);
        }

        @Override
        public void close() {
            target.close();
        }
    }
}
