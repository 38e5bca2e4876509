package chunkstore.server.localstore;

import java.util.*;

/** A chunk's lifecycle state as derived from the index entries that exist for it.
 */
public abstract class ChunkState {

    public static final ChunkState ABSENT = new Absent();

    private ChunkState() {}

    public abstract long pinCounter();

    public abstract boolean isGcEligible();

    /** No data, access record or pin exists for the address. */
    public static final class Absent extends ChunkState {
        private Absent() {}

        @Override
        public long pinCounter() {
            return 0;
        }

        @Override
        public boolean isGcEligible() {
            return false;
        }

        @Override
        public String toString() {
            return "Absent";
        }
    }

    /** Indexed for retrieval and pull syncing, and not pinned. */
    public static final class Indexed extends ChunkState {
        public final boolean stored, gcEligible;

        public Indexed(boolean stored, boolean gcEligible) {
            this.stored = stored;
            this.gcEligible = gcEligible;
        }

        @Override
        public long pinCounter() {
            return 0;
        }

        @Override
        public boolean isGcEligible() {
            return gcEligible;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Indexed indexed = (Indexed) o;
            return stored == indexed.stored && gcEligible == indexed.gcEligible;
        }

        @Override
        public int hashCode() {
            return Objects.hash(stored, gcEligible);
        }

        @Override
        public String toString() {
            return "Indexed(stored=" + stored + ", gc=" + gcEligible + ")";
        }
    }

    public static final class Pinned extends ChunkState {
        public final long count;
        // a pinned chunk can still be in the gc index, see LocalStore.set
        public final boolean gcEligible;

        public Pinned(long count, boolean gcEligible) {
            if (count <= 0)
                throw new IllegalArgumentException("Pin count must be positive: " + count);
            this.count = count;
            this.gcEligible = gcEligible;
        }

        @Override
        public long pinCounter() {
            return count;
        }

        @Override
        public boolean isGcEligible() {
            return gcEligible;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Pinned pinned = (Pinned) o;
            return count == pinned.count && gcEligible == pinned.gcEligible;
        }

        @Override
        public int hashCode() {
            return Objects.hash(count, gcEligible);
        }

        @Override
        public String toString() {
            return "Pinned(" + count + ", gc=" + gcEligible + ")";
        }
    }
}
