package chunkstore.server.localstore;

import chunkstore.shared.storage.*;

import java.util.*;

/** One chunk's fields as they are spread over the local store indexes. Zero means unset for every number.
 */
public class Item {
    private static final byte[] EMPTY = new byte[0];

    public final ChunkAddress address;
    public final byte[] data;
    public final long storeTimestamp, accessTimestamp, binId, pinCounter;

    public Item(ChunkAddress address, byte[] data, long storeTimestamp, long accessTimestamp, long binId, long pinCounter) {
        this.address = Objects.requireNonNull(address);
        this.data = data;
        this.storeTimestamp = storeTimestamp;
        this.accessTimestamp = accessTimestamp;
        this.binId = binId;
        this.pinCounter = pinCounter;
    }

    public static Item of(ChunkAddress address) {
        return new Item(address, EMPTY, 0, 0, 0, 0);
    }

    public static Item of(Chunk chunk) {
        return new Item(chunk.address, chunk.data(), 0, 0, 0, 0);
    }

    public Item withData(byte[] data) {
        return new Item(address, data, storeTimestamp, accessTimestamp, binId, pinCounter);
    }

    public Item withStoreTimestamp(long storeTimestamp) {
        return new Item(address, data, storeTimestamp, accessTimestamp, binId, pinCounter);
    }

    public Item withAccessTimestamp(long accessTimestamp) {
        return new Item(address, data, storeTimestamp, accessTimestamp, binId, pinCounter);
    }

    public Item withBinId(long binId) {
        return new Item(address, data, storeTimestamp, accessTimestamp, binId, pinCounter);
    }

    public Item withPinCounter(long pinCounter) {
        return new Item(address, data, storeTimestamp, accessTimestamp, binId, pinCounter);
    }

    public Chunk toChunk() {
        return new Chunk(address, data);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Item item = (Item) o;
        return storeTimestamp == item.storeTimestamp &&
                accessTimestamp == item.accessTimestamp &&
                binId == item.binId &&
                pinCounter == item.pinCounter &&
                address.equals(item.address) &&
                Arrays.equals(data, item.data);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(address, storeTimestamp, accessTimestamp, binId, pinCounter);
        return 31 * result + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "Item{" + address +
                ", stored=" + storeTimestamp +
                ", accessed=" + accessTimestamp +
                ", bin id=" + binId +
                ", pins=" + pinCounter +
                ", " + data.length + " bytes}";
    }
}
