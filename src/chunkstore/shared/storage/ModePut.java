package chunkstore.shared.storage;

import java.util.*;

/** How a chunk arrived at this node, which decides the indexes it enters on first store.
 */
public enum ModePut {
    REQUEST(0, "request"),
    UPLOAD(1, "upload"),
    SYNC(2, "sync");

    public final int code;
    public final String label;

    ModePut(int code, String label) {
        this.code = code;
        this.label = label;
    }

    public static ModePut byName(String name) {
        if (name != null)
            for (ModePut mode : values())
                if (mode.label.equals(name.toLowerCase(Locale.ROOT)))
                    return mode;
        throw new InvalidModeException("Unknown put mode: " + name);
    }

    @Override
    public String toString() {
        return label;
    }
}
