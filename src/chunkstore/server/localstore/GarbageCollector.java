package chunkstore.server.localstore;

import chunkstore.server.*;
import chunkstore.server.shed.*;
import chunkstore.server.util.*;
import chunkstore.shared.storage.*;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import java.util.function.*;
import java.util.logging.*;

/** Evicts the least recently accessed chunks once the gc index reaches the store's capacity.
 */
public class GarbageCollector {
    private static final Logger LOG = Logging.LOG();

    public static class Result {
        public final long collected, excluded;
        // false if the run stopped at the batch size before reaching the target
        public final boolean done;

        public Result(long collected, long excluded, boolean done) {
            this.collected = collected;
            this.excluded = excluded;
            this.done = done;
        }

        @Override
        public String toString() {
            return "collected " + collected + ", excluded " + excluded + (done ? "" : ", more to collect");
        }
    }

    private final Shed shed;
    private final ChunkIndexes indexes;
    private final GcSizeCounter gcSize;
    private final Object batchMutex;
    private final LocalStoreOptions options;
    private final BlockingQueue<Boolean> trigger = new ArrayBlockingQueue<>(1);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private Thread worker;

    public GarbageCollector(Shed shed, ChunkIndexes indexes, GcSizeCounter gcSize, Object batchMutex, LocalStoreOptions options) {
        this.shed = shed;
        this.indexes = indexes;
        this.gcSize = gcSize;
        this.batchMutex = batchMutex;
        this.options = options;
    }

    /**
     * Run one collection. First every gc exclusion is applied, dropping excluded chunks from the gc index, then chunks
     * are evicted oldest access first until the gc size reaches the target or a batch worth has been collected.
     *
     * @return
     */
    public Result collect() {
        synchronized (batchMutex) {
            Batch batch = new Batch();
            long size = gcSize.get();
            long target = options.gcTarget();
            Set<ChunkAddress> excludedAddresses = new HashSet<>();
            AtomicLong excluded = new AtomicLong(0);
            AtomicLong collected = new AtomicLong(0);
            AtomicBoolean done = new AtomicBoolean(true);

            indexes.gcExclude.iterate(item -> {
                excludedAddresses.add(item.address);
                Optional<Item> accessed = indexes.retrievalAccess.get(item);
                if (accessed.isPresent() && indexes.gc.has(accessed.get())) {
                    indexes.gc.deleteInBatch(batch, accessed.get());
                    excluded.incrementAndGet();
                }
                if (! indexes.pin.has(item))
                    indexes.gcExclude.deleteInBatch(batch, item);
                return false;
            });

            indexes.gc.iterate(item -> {
                if (size - excluded.get() - collected.get() <= target)
                    return true;
                if (excludedAddresses.contains(item.address))
                    return false;
                indexes.retrievalData.deleteInBatch(batch, item);
                indexes.retrievalAccess.deleteInBatch(batch, item);
                indexes.pull.deleteInBatch(batch, item);
                indexes.gc.deleteInBatch(batch, item);
                if (collected.incrementAndGet() >= options.gcBatchSize) {
                    done.set(false);
                    return true;
                }
                return false;
            });

            long updatedSize = gcSize.applyDelta(batch, -(excluded.get() + collected.get()));
            shed.write(batch);
            AggregatedMetrics.GC_COLLECTED.inc(collected.get());
            AggregatedMetrics.GC_SIZE.set(updatedSize);
            return new Result(collected.get(), excluded.get(), done.get());
        }
    }

    /** Collect until a run reaches the gc target.
     */
    public long collectAll() {
        return collectWhile(() -> true);
    }

    private long collectWhile(BooleanSupplier carryOn) {
        long total = 0;
        while (carryOn.getAsBoolean()) {
            Result res = collect();
            total += res.collected;
            if (res.done || res.collected == 0)
                break;
        }
        return total;
    }

    /** Ask the background worker for a collection. Requests made while one is pending are merged.
     */
    public void trigger() {
        trigger.offer(true);
    }

    public synchronized void start() {
        if (running.getAndSet(true))
            return;
        worker = new Thread(() -> {
            while (running.get()) {
                try {
                    trigger.take();
                    long collected = collectWhile(running::get);
                    LOG.info("Garbage collection removed " + collected + " chunks");
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                } catch (Exception e) {
                    LOG.log(Level.SEVERE, e, e::getMessage);
                }
            }
        }, "Garbage Collector");
        worker.setDaemon(true);
        worker.start();
    }

    /** Stop the background worker and wait for a run in progress to finish its current batch.
     */
    public synchronized void stop() {
        running.set(false);
        if (worker == null)
            return;
        worker.interrupt();
        try {
            worker.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        worker = null;
    }

    public synchronized boolean isRunning() {
        return worker != null && worker.isAlive();
    }
}
