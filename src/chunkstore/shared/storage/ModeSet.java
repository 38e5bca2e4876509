package chunkstore.shared.storage;

import java.util.*;

/** The index transitions a caller can request for a stored chunk.
 */
public enum ModeSet {
    /** The chunk was retrieved or touched; (re)index it for pull and gc. */
    ACCESS(0, "access"),
    /** The chunk was pushed to the network; drop it from the push queue and make it collectable. */
    SYNC(1, "sync"),
    /** Remove every trace of the chunk from the retrieval, pull and gc indexes. */
    REMOVE(2, "remove"),
    /** Add a pin reference. */
    PIN(3, "pin"),
    /** Drop a pin reference. */
    UNPIN(4, "unpin");

    public final int code;
    public final String label;

    ModeSet(int code, String label) {
        this.code = code;
        this.label = label;
    }

    private static final Map<Integer, ModeSet> byCode = new HashMap<>();
    private static final Map<String, ModeSet> byName = new HashMap<>();
    static {
        for (ModeSet mode : values()) {
            byCode.put(mode.code, mode);
            byName.put(mode.label, mode);
        }
    }

    public static ModeSet byCode(int code) {
        ModeSet mode = byCode.get(code);
        if (mode == null)
            throw new InvalidModeException("Unknown set mode: " + code);
        return mode;
    }

    public static ModeSet byName(String name) {
        ModeSet mode = name == null ? null : byName.get(name.toLowerCase(Locale.ROOT));
        if (mode == null)
            throw new InvalidModeException("Unknown set mode: " + name);
        return mode;
    }

    @Override
    public String toString() {
        return label;
    }
}
