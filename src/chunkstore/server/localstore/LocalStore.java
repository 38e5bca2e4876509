package chunkstore.server.localstore;

import chunkstore.server.*;
import chunkstore.server.shed.*;
import chunkstore.server.util.*;
import chunkstore.shared.storage.*;
import chunkstore.shared.util.*;
import io.prometheus.client.Histogram;

import java.util.*;
import java.util.concurrent.atomic.*;
import java.util.function.*;
import java.util.logging.*;

/** The local chunk store: one set of indexes per chunk kept consistent by writing every change in a single batch.
 *
 *  All mutations (set, put and garbage collection) are serialized by a single store wide lock. Reads don't take it.
 */
public class LocalStore implements AutoCloseable {
    private static final Logger LOG = Logging.LOG();

    private final Shed shed;
    private final ChunkIndexes indexes;
    private final BinIdSequencer binIds;
    private final GcSizeCounter gcSize;
    private final PullSubscriptions pullSubscriptions = new PullSubscriptions();
    private final GarbageCollector garbageCollector;
    private final LocalStoreOptions options;
    private final byte[] baseKey;
    private final Object batchMutex = new Object();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public LocalStore(OrderedStore db, LocalStoreOptions options) {
        this(db, options, Optional.empty());
    }

    public LocalStore(OrderedStore db, LocalStoreOptions options, BinIdSequencer binIds) {
        this(db, options, Optional.of(binIds));
    }

    private LocalStore(OrderedStore db, LocalStoreOptions options, Optional<BinIdSequencer> binIds) {
        this.shed = new Shed(db);
        this.options = options;
        try {
            this.baseKey = resolveBaseKey(shed.newBytesField("base-key"), options.baseKey);
        } catch (RuntimeException e) {
            shed.close();
            throw e;
        }
        this.indexes = new ChunkIndexes(shed, this::bin);
        this.binIds = binIds.orElseGet(() -> new ShedBinIdSequencer(indexes.binIds));
        this.gcSize = new GcSizeCounter(indexes.gcSize);
        this.garbageCollector = new GarbageCollector(shed, indexes, gcSize, batchMutex, options);
        if (options.collectGarbageInBackground)
            garbageCollector.start();
    }

    private static byte[] resolveBaseKey(BytesField persisted, Optional<byte[]> configured) {
        Optional<byte[]> existing = persisted.get();
        if (existing.isPresent()) {
            if (configured.isPresent() && ! Arrays.equals(configured.get(), existing.get()))
                throw new IllegalStateException("Store was created with base key " + ArrayOps.bytesToHex(existing.get()) +
                        " but " + ArrayOps.bytesToHex(configured.get()) + " was configured");
            return existing.get();
        }
        byte[] baseKey = configured.orElseGet(() -> ArrayOps.random(ChunkAddress.LENGTH));
        persisted.put(baseKey);
        return baseKey;
    }

    private static class Transition {
        static final Transition NONE = new Transition(0, Optional.empty());

        final long gcSizeChange;
        final Optional<Integer> triggerPull;

        Transition(long gcSizeChange, Optional<Integer> triggerPull) {
            this.gcSizeChange = gcSizeChange;
            this.triggerPull = triggerPull;
        }

        Transition(long gcSizeChange) {
            this(gcSizeChange, Optional.empty());
        }
    }

    /** The pull sync bin of an address: its proximity to this store's base key.
     */
    public int bin(ChunkAddress address) {
        return Proximity.of(baseKey, address);
    }

    public byte[] baseKey() {
        return Arrays.copyOf(baseKey, baseKey.length);
    }

    private long now() {
        return options.clock.getAsLong();
    }

    /**
     * Update the indexes of a chunk for a change in its state. Either every index update for the change is written,
     * or, if an exception is thrown, none are.
     *
     * @param mode
     * @param address
     * @throws InvalidModeException if mode is null
     * @throws ChunkNotFoundException when removing a chunk without data or unpinning a chunk that isn't pinned
     * @throws StorageEngineException
     * @throws BinIdSequencerException
     */
    public void set(ModeSet mode, ChunkAddress address) {
        String label = mode == null ? "invalid" : mode.label;
        AggregatedMetrics.LOCALSTORE_SET.labels(label).inc();
        Histogram.Timer timer = AggregatedMetrics.LOCALSTORE_SET_DURATION.labels(label).startTimer();
        try {
            applySet(mode, address);
        } catch (RuntimeException e) {
            AggregatedMetrics.LOCALSTORE_SET_ERRORS.labels(label).inc();
            LOG.log(Level.FINE, "set " + label + " " + address + " failed: " + e.getMessage(), e);
            throw e;
        } finally {
            timer.observeDuration();
        }
    }

    private void applySet(ModeSet mode, ChunkAddress address) {
        if (mode == null)
            throw new InvalidModeException("No set mode given");
        Transition t;
        long updatedGcSize;
        synchronized (batchMutex) {
            Batch batch = new Batch();
            Item item = Item.of(address);
            switch (mode) {
                case ACCESS:
                    t = setAccess(batch, item);
                    break;
                case SYNC:
                    t = setSync(batch, item);
                    break;
                case REMOVE:
                    t = setRemove(batch, item);
                    break;
                case PIN:
                    t = setPin(batch, item);
                    break;
                case UNPIN:
                    t = setUnpin(batch, item);
                    break;
                default:
                    throw new InvalidModeException("Unknown set mode: " + mode);
            }
            updatedGcSize = gcSize.applyDelta(batch, t.gcSizeChange);
            shed.write(batch);
        }
        afterCommit(t.triggerPull.map(Collections::singleton).orElse(Collections.emptySet()), updatedGcSize);
    }

    private void afterCommit(Set<Integer> pullBins, long updatedGcSize) {
        for (int bin : pullBins)
            pullSubscriptions.trigger(bin);
        AggregatedMetrics.GC_SIZE.set(updatedGcSize);
        if (updatedGcSize >= options.capacity && options.collectGarbageInBackground)
            garbageCollector.trigger();
    }

    /** Store fields for a chunk without a data record: those of an earlier access if there was one, or new ones.
     */
    private Item firstIndexFields(Item item, Optional<Item> accessed) {
        if (accessed.isPresent() && accessed.get().binId > 0)
            return item.withStoreTimestamp(accessed.get().storeTimestamp)
                    .withBinId(accessed.get().binId);
        return item.withStoreTimestamp(now())
                .withBinId(binIds.nextBinId(bin(item.address)));
    }

    /** Stage the removal of the gc entry written by the previous access.
     *
     * @return the gc size change, -1 only if the entry exists
     */
    private long dropGcEntry(Batch batch, Optional<Item> accessed) {
        if (accessed.isEmpty())
            return 0;
        indexes.gc.deleteInBatch(batch, accessed.get());
        return indexes.gc.has(accessed.get()) ? -1 : 0;
    }

    private Transition setAccess(Batch batch, Item item) {
        Optional<Item> stored = indexes.retrievalData.get(item);
        Optional<Item> accessed = indexes.retrievalAccess.get(item);
        if (stored.isPresent()) {
            item = item.withStoreTimestamp(stored.get().storeTimestamp)
                    .withBinId(stored.get().binId);
        } else {
            item = firstIndexFields(item, accessed);
            indexes.push.deleteInBatch(batch, item);
        }

        long gcSizeChange = dropGcEntry(batch, accessed);
        item = item.withAccessTimestamp(now());
        indexes.retrievalAccess.putInBatch(batch, item);
        indexes.pull.putInBatch(batch, item);
        // pins are not checked here, an accessed pinned chunk re-enters the gc index until the next gc exclusion pass
        indexes.gc.putInBatch(batch, item);
        gcSizeChange++;
        return new Transition(gcSizeChange, Optional.of(bin(item.address)));
    }

    private Transition setSync(Batch batch, Item item) {
        Optional<Item> stored = indexes.retrievalData.get(item);
        if (stored.isEmpty()) {
            // nothing to sync, only clear a push queue entry left by an earlier store
            indexes.retrievalAccess.get(item)
                    .ifPresent(accessed -> indexes.push.deleteInBatch(batch, accessed));
            return Transition.NONE;
        }
        item = item.withStoreTimestamp(stored.get().storeTimestamp)
                .withBinId(stored.get().binId);

        Optional<Item> accessed = indexes.retrievalAccess.get(item);
        long gcSizeChange = dropGcEntry(batch, accessed);
        item = item.withAccessTimestamp(now());
        indexes.retrievalAccess.putInBatch(batch, item);
        indexes.push.deleteInBatch(batch, item);

        if (! indexes.pin.has(item)) {
            indexes.gc.putInBatch(batch, item);
            gcSizeChange++;
        }
        return new Transition(gcSizeChange);
    }

    private Transition setRemove(Batch batch, Item item) {
        ChunkAddress address = item.address;
        Optional<Item> accessed = indexes.retrievalAccess.get(item);
        if (accessed.isPresent())
            item = item.withAccessTimestamp(accessed.get().accessTimestamp);
        Item stored = indexes.retrievalData.get(item)
                .orElseThrow(() -> new ChunkNotFoundException(indexes.retrievalData.name, address));
        item = item.withStoreTimestamp(stored.storeTimestamp)
                .withBinId(stored.binId);

        indexes.retrievalData.deleteInBatch(batch, item);
        indexes.retrievalAccess.deleteInBatch(batch, item);
        indexes.pull.deleteInBatch(batch, item);
        indexes.gc.deleteInBatch(batch, item);
        // deletes don't report whether a key existed, so check the gc entry before the batch is written
        return new Transition(indexes.gc.has(item) ? -1 : 0);
    }

    private Transition setPin(Batch batch, Item item) {
        Optional<Item> pinned = indexes.pin.get(item);
        long existing = 0;
        if (pinned.isPresent())
            existing = pinned.get().pinCounter;
        else
            indexes.gcExclude.putInBatch(batch, item);
        indexes.pin.putInBatch(batch, item.withPinCounter(existing + 1));
        return Transition.NONE;
    }

    private Transition setUnpin(Batch batch, Item item) {
        ChunkAddress address = item.address;
        Item pinned = indexes.pin.get(item)
                .orElseThrow(() -> new ChunkNotFoundException(indexes.pin.name, address));
        if (pinned.pinCounter > 1)
            indexes.pin.putInBatch(batch, item.withPinCounter(pinned.pinCounter - 1));
        else
            indexes.pin.deleteInBatch(batch, item);
        return Transition.NONE;
    }

    /**
     * Store chunks, indexing new ones according to how they arrived. Chunks already stored, or repeated earlier in
     * the same call, are left as they are.
     *
     * @param mode
     * @param chunks
     * @return for each chunk, whether it already existed
     */
    public List<Boolean> put(ModePut mode, Chunk... chunks) {
        String label = mode == null ? "invalid" : mode.label;
        AggregatedMetrics.LOCALSTORE_PUT.labels(label).inc();
        Histogram.Timer timer = AggregatedMetrics.LOCALSTORE_PUT_DURATION.labels(label).startTimer();
        try {
            return applyPut(mode, Arrays.asList(chunks));
        } catch (RuntimeException e) {
            AggregatedMetrics.LOCALSTORE_PUT_ERRORS.labels(label).inc();
            LOG.log(Level.FINE, "put " + label + " failed: " + e.getMessage(), e);
            throw e;
        } finally {
            timer.observeDuration();
        }
    }

    private List<Boolean> applyPut(ModePut mode, List<Chunk> chunks) {
        if (mode == null)
            throw new InvalidModeException("No put mode given");
        List<Boolean> exists = new ArrayList<>(chunks.size());
        Set<Integer> pullBins = new HashSet<>();
        long updatedGcSize;
        synchronized (batchMutex) {
            Batch batch = new Batch();
            Set<ChunkAddress> seen = new HashSet<>();
            long gcSizeChange = 0;
            for (Chunk chunk : chunks) {
                Item item = Item.of(chunk);
                if (! seen.add(chunk.address) || indexes.retrievalData.has(item)) {
                    exists.add(true);
                    continue;
                }
                exists.add(false);
                Optional<Item> accessed = indexes.retrievalAccess.get(item);
                item = firstIndexFields(item, accessed);
                indexes.retrievalData.putInBatch(batch, item);
                switch (mode) {
                    case REQUEST:
                        gcSizeChange += setGc(batch, item, accessed);
                        break;
                    case UPLOAD:
                        indexes.pull.putInBatch(batch, item);
                        indexes.push.putInBatch(batch, item);
                        pullBins.add(bin(item.address));
                        break;
                    case SYNC:
                        indexes.pull.putInBatch(batch, item);
                        pullBins.add(bin(item.address));
                        gcSizeChange += setGc(batch, item, accessed);
                        break;
                    default:
                        throw new InvalidModeException("Unknown put mode: " + mode);
                }
            }
            updatedGcSize = gcSize.applyDelta(batch, gcSizeChange);
            shed.write(batch);
        }
        afterCommit(pullBins, updatedGcSize);
        return exists;
    }

    private long setGc(Batch batch, Item item, Optional<Item> accessed) {
        long gcSizeChange = dropGcEntry(batch, accessed);
        Item updated = item.withAccessTimestamp(now());
        indexes.retrievalAccess.putInBatch(batch, updated);
        indexes.gc.putInBatch(batch, updated);
        return gcSizeChange + 1;
    }

    public Optional<Chunk> get(ChunkAddress address) {
        return indexes.retrievalData.get(Item.of(address))
                .map(Item::toChunk);
    }

    public boolean has(ChunkAddress address) {
        return indexes.retrievalData.has(Item.of(address));
    }

    public ChunkState state(ChunkAddress address) {
        Item key = Item.of(address);
        Optional<Item> pinned = indexes.pin.get(key);
        boolean stored = indexes.retrievalData.has(key);
        Optional<Item> accessed = indexes.retrievalAccess.get(key);
        boolean gcEligible = accessed.isPresent() && indexes.gc.has(accessed.get());
        if (pinned.isPresent())
            return new ChunkState.Pinned(pinned.get().pinCounter, gcEligible);
        if (stored || accessed.isPresent())
            return new ChunkState.Indexed(stored, gcEligible);
        return ChunkState.ABSENT;
    }

    public long pinCounter(ChunkAddress address) {
        return indexes.pin.get(Item.of(address))
                .map(i -> i.pinCounter)
                .orElse(0L);
    }

    public boolean isExcludedFromGc(ChunkAddress address) {
        return indexes.gcExclude.has(Item.of(address));
    }

    public long gcSize() {
        return gcSize.get();
    }

    public Map<String, Long> indexCounts() {
        return indexes.counts();
    }

    /** Whether the persisted gc size equals the number of gc index entries. Counts the whole gc index.
     */
    public boolean isGcSizeConsistent() {
        synchronized (batchMutex) {
            return gcSize.get() == indexes.gc.count();
        }
    }

    /** Chunks waiting to be pushed, oldest first.
     */
    public List<ChunkAddress> pendingPush(int limit) {
        List<ChunkAddress> res = new ArrayList<>();
        if (limit <= 0)
            return res;
        indexes.push.iterate(item -> {
            res.add(item.address);
            return res.size() >= limit;
        });
        return res;
    }

    /**
     * The pull index of a bin in bin id order.
     *
     * @param bin
     * @param since only bin ids greater than this
     * @param until only bin ids up to and including this, 0 for no limit
     * @param limit the maximum number of descriptors to return, nothing is returned if it isn't positive
     * @return
     */
    public List<Descriptor> pullDescriptors(int bin, long since, long until, int limit) {
        if (bin < 0 || bin > Proximity.MAX_PO)
            throw new IllegalArgumentException("Invalid bin " + bin);
        List<Descriptor> res = new ArrayList<>();
        if (limit <= 0)
            return res;
        byte[] binPrefix = new byte[]{(byte) bin};
        byte[] start = ArrayOps.concat(binPrefix, ArrayOps.longToBytes(since + 1));
        indexes.pull.iterate(binPrefix, Optional.of(start), item -> {
            if (until > 0 && item.binId > until)
                return true;
            res.add(new Descriptor(item.address, item.binId));
            return res.size() >= limit;
        });
        return res;
    }

    /** The bin id of the last chunk in the pull index of a bin, or 0 if it is empty.
     */
    public long lastPullBinId(int bin) {
        return indexes.pull.last(new byte[]{(byte) bin})
                .map(item -> item.binId)
                .orElse(0L);
    }

    /**
     * Deliver the pull index of a bin, including chunks added later, on a background thread.
     *
     * @param bin
     * @param since deliver bin ids greater than this
     * @param until stop after delivering this bin id, 0 to keep going until closed
     * @param sink
     * @return
     */
    public PullSubscription subscribePull(int bin, long since, long until, Consumer<Descriptor> sink) {
        if (bin < 0 || bin > Proximity.MAX_PO)
            throw new IllegalArgumentException("Invalid bin " + bin);
        return new PullSubscription(this, pullSubscriptions, bin, since, until, sink);
    }

    public PullTrigger registerPullTrigger(int bin) {
        return pullSubscriptions.register(bin);
    }

    public void unregisterPullTrigger(PullTrigger trigger) {
        pullSubscriptions.unregister(trigger);
    }

    public GarbageCollector.Result collectGarbage() {
        return garbageCollector.collect();
    }

    /** Run garbage collection batches until the gc size is at or below the target.
     *
     * @return the number of chunks collected
     */
    public long collectGarbageFully() {
        return garbageCollector.collectAll();
    }

    public int openPullSubscriptions() {
        return pullSubscriptions.openSubscriptions();
    }

    /** Stop pull subscriptions and background gc, then close the engine.
     */
    @Override
    public void close() {
        if (closed.getAndSet(true))
            return;
        pullSubscriptions.closeAll();
        garbageCollector.stop();
        shed.close();
    }
}
