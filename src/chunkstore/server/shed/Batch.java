package chunkstore.server.shed;

import java.util.*;

/** Index writes staged for a single atomic commit.
 *
 *  Operations are applied in the order they were staged, so a delete followed by a put of the same key leaves the
 *  key present. Nothing in a batch is visible to reads until the batch is written.
 */
public class Batch {

    public static final class Op {
        public final byte[] key;
        private final byte[] value;

        private Op(byte[] key, byte[] value) {
            this.key = key;
            this.value = value;
        }

        public boolean isDelete() {
            return value == null;
        }

        public byte[] value() {
            if (value == null)
                throw new IllegalStateException("Delete has no value");
            return value;
        }
    }

    private final List<Op> ops = new ArrayList<>();

    public void put(byte[] key, byte[] value) {
        ops.add(new Op(key, Objects.requireNonNull(value)));
    }

    public void delete(byte[] key) {
        ops.add(new Op(key, null));
    }

    public List<Op> ops() {
        return Collections.unmodifiableList(ops);
    }

    public boolean isEmpty() {
        return ops.isEmpty();
    }
}
