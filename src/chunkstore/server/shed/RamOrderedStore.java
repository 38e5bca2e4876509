package chunkstore.server.shed;

import chunkstore.shared.util.*;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.locks.*;
import java.util.function.*;

public class RamOrderedStore implements OrderedStore {

    private final ConcurrentSkipListMap<ByteArrayWrapper, byte[]> entries = new ConcurrentSkipListMap<>();
    // batches are applied under the write lock so readers never see half of one
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public Optional<byte[]> get(byte[] key) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.get(new ByteArrayWrapper(key)));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void write(Batch batch) {
        lock.writeLock().lock();
        try {
            for (Batch.Op op : batch.ops()) {
                if (op.isDelete())
                    entries.remove(new ByteArrayWrapper(op.key));
                else
                    entries.put(new ByteArrayWrapper(op.key), op.value());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private NavigableMap<ByteArrayWrapper, byte[]> range(byte[] from, byte[] prefix) {
        Optional<byte[]> upper = ArrayOps.prefixUpperBound(prefix);
        ByteArrayWrapper lower = new ByteArrayWrapper(from);
        return upper.isPresent() ?
                entries.subMap(lower, true, new ByteArrayWrapper(upper.get()), false) :
                entries.tailMap(lower, true);
    }

    @Override
    public void iterate(Optional<byte[]> startFrom, byte[] prefix, Function<Pair<byte[], byte[]>, Boolean> visitor) {
        byte[] from = startFrom.filter(s -> ArrayOps.compareUnsigned(s, prefix) > 0).orElse(prefix);
        lock.readLock().lock();
        try {
            for (Map.Entry<ByteArrayWrapper, byte[]> e : range(from, prefix).entrySet()) {
                if (visitor.apply(new Pair<>(e.getKey().data, e.getValue())))
                    return;
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Pair<byte[], byte[]>> last(byte[] prefix) {
        lock.readLock().lock();
        try {
            Map.Entry<ByteArrayWrapper, byte[]> last = range(prefix, prefix).lastEntry();
            return last == null ?
                    Optional.empty() :
                    Optional.of(new Pair<>(last.getKey().data, last.getValue()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long count(byte[] prefix) {
        lock.readLock().lock();
        try {
            return range(prefix, prefix).size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void close() {}
}
