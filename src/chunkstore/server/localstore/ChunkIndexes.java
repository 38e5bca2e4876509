package chunkstore.server.localstore;

import chunkstore.server.shed.*;
import chunkstore.shared.storage.*;
import chunkstore.shared.util.*;

import java.util.*;
import java.util.function.*;

/** The local store indexes, all mounted on one {@link Shed} so a single batch can update any of them.
 */
public class ChunkIndexes {
    private static final int L = ChunkAddress.LENGTH;
    private static final byte[] NO_VALUE = new byte[0];

    // chunk data, with the time it was stored and its bin id
    public final Index<Item> retrievalData;
    // last access time of a chunk, with the store fields it was indexed under
    public final Index<Item> retrievalAccess;
    // chunks waiting to be pushed to the network, oldest first
    public final Index<Item> push;
    // chunks per bin in bin id order, for pull syncing
    public final Index<Item> pull;
    // garbage collection candidates, least recently accessed first
    public final Index<Item> gc;
    // chunks to drop from the gc index on the next collection
    public final Index<Item> gcExclude;
    // pin counts
    public final Index<Item> pin;

    public final Uint64Field gcSize;
    public final Uint64Vector binIds;

    public ChunkIndexes(Shed shed, ToIntFunction<ChunkAddress> bin) {
        retrievalData = shed.newIndex("retrievalData", 1, new IndexFuncs<>() {
            @Override
            public byte[] encodeKey(Item fields) {
                return fields.address.toBytes();
            }

            @Override
            public Item decodeKey(byte[] key) {
                return Item.of(new ChunkAddress(key));
            }

            @Override
            public byte[] encodeValue(Item fields) {
                return ArrayOps.concat(ArrayOps.longToBytes(fields.storeTimestamp), ArrayOps.longToBytes(fields.binId), fields.data);
            }

            @Override
            public Item decodeValue(Item keyItem, byte[] value) {
                return keyItem.withStoreTimestamp(ArrayOps.bytesToLong(value, 0))
                        .withBinId(ArrayOps.bytesToLong(value, 8))
                        .withData(Arrays.copyOfRange(value, 16, value.length));
            }
        });
        retrievalAccess = shed.newIndex("retrievalAccess", 2, new IndexFuncs<>() {
            @Override
            public byte[] encodeKey(Item fields) {
                return fields.address.toBytes();
            }

            @Override
            public Item decodeKey(byte[] key) {
                return Item.of(new ChunkAddress(key));
            }

            @Override
            public byte[] encodeValue(Item fields) {
                return ArrayOps.concat(ArrayOps.longToBytes(fields.accessTimestamp),
                        ArrayOps.longToBytes(fields.storeTimestamp),
                        ArrayOps.longToBytes(fields.binId));
            }

            @Override
            public Item decodeValue(Item keyItem, byte[] value) {
                return keyItem.withAccessTimestamp(ArrayOps.bytesToLong(value, 0))
                        .withStoreTimestamp(ArrayOps.bytesToLong(value, 8))
                        .withBinId(ArrayOps.bytesToLong(value, 16));
            }
        });
        push = shed.newIndex("push", 3, new IndexFuncs<>() {
            @Override
            public byte[] encodeKey(Item fields) {
                return ArrayOps.concat(ArrayOps.longToBytes(fields.storeTimestamp), fields.address.toBytes());
            }

            @Override
            public Item decodeKey(byte[] key) {
                return Item.of(new ChunkAddress(Arrays.copyOfRange(key, 8, 8 + L)))
                        .withStoreTimestamp(ArrayOps.bytesToLong(key, 0));
            }

            @Override
            public byte[] encodeValue(Item fields) {
                return NO_VALUE;
            }

            @Override
            public Item decodeValue(Item keyItem, byte[] value) {
                return keyItem;
            }
        });
        pull = shed.newIndex("pull", 4, new IndexFuncs<>() {
            @Override
            public byte[] encodeKey(Item fields) {
                return ArrayOps.concat(new byte[]{(byte) bin.applyAsInt(fields.address)},
                        ArrayOps.longToBytes(fields.binId),
                        fields.address.toBytes());
            }

            @Override
            public Item decodeKey(byte[] key) {
                return Item.of(new ChunkAddress(Arrays.copyOfRange(key, 9, 9 + L)))
                        .withBinId(ArrayOps.bytesToLong(key, 1));
            }

            @Override
            public byte[] encodeValue(Item fields) {
                return NO_VALUE;
            }

            @Override
            public Item decodeValue(Item keyItem, byte[] value) {
                return keyItem;
            }
        });
        gc = shed.newIndex("gc", 5, new IndexFuncs<>() {
            @Override
            public byte[] encodeKey(Item fields) {
                return ArrayOps.concat(ArrayOps.longToBytes(fields.accessTimestamp),
                        ArrayOps.longToBytes(fields.binId),
                        fields.address.toBytes());
            }

            @Override
            public Item decodeKey(byte[] key) {
                return Item.of(new ChunkAddress(Arrays.copyOfRange(key, 16, 16 + L)))
                        .withAccessTimestamp(ArrayOps.bytesToLong(key, 0))
                        .withBinId(ArrayOps.bytesToLong(key, 8));
            }

            @Override
            public byte[] encodeValue(Item fields) {
                return NO_VALUE;
            }

            @Override
            public Item decodeValue(Item keyItem, byte[] value) {
                return keyItem;
            }
        });
        gcExclude = shed.newIndex("gcExclude", 6, new IndexFuncs<>() {
            @Override
            public byte[] encodeKey(Item fields) {
                return fields.address.toBytes();
            }

            @Override
            public Item decodeKey(byte[] key) {
                return Item.of(new ChunkAddress(key));
            }

            @Override
            public byte[] encodeValue(Item fields) {
                return NO_VALUE;
            }

            @Override
            public Item decodeValue(Item keyItem, byte[] value) {
                return keyItem;
            }
        });
        pin = shed.newIndex("pin", 7, new IndexFuncs<>() {
            @Override
            public byte[] encodeKey(Item fields) {
                return fields.address.toBytes();
            }

            @Override
            public Item decodeKey(byte[] key) {
                return Item.of(new ChunkAddress(key));
            }

            @Override
            public byte[] encodeValue(Item fields) {
                return ArrayOps.longToBytes(fields.pinCounter);
            }

            @Override
            public Item decodeValue(Item keyItem, byte[] value) {
                return keyItem.withPinCounter(ArrayOps.bytesToLong(value, 0));
            }
        });
        gcSize = shed.newUint64Field("gc-size");
        binIds = shed.newUint64Vector("bin-ids");
    }

    /** The number of entries in every index, by index name.
     */
    public Map<String, Long> counts() {
        Map<String, Long> res = new LinkedHashMap<>();
        for (Index<Item> index : List.of(retrievalData, retrievalAccess, push, pull, gc, gcExclude, pin))
            res.put(index.name, index.count());
        return res;
    }
}
