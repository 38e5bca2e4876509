package chunkstore.server;

import chunkstore.server.localstore.*;
import chunkstore.server.util.*;
import chunkstore.shared.storage.*;
import chunkstore.shared.util.*;

import java.nio.file.*;
import java.util.*;
import java.util.logging.*;

public class Main extends Builder {
    public static final String STORE_DIR = "chunkstore-dir";
    public static final Path DEFAULT_STORE_DIR_PATH =
            Paths.get(System.getProperty("user.home"), ".chunkstore");

    public static final Command.Arg ARG_STORE_DIR =
            new Command.Arg(STORE_DIR, "The directory holding the index database, config and logs", false);
    public static final Command.Arg ARG_INDEX_SQL_FILE =
            new Command.Arg("index-sql-file", "The filename for the chunk index (or :memory: for ram based)", true, "chunkindex.sql");
    public static final Command.Arg ARG_CAPACITY =
            new Command.Arg("capacity", "The number of gc eligible chunks above which garbage collection runs", false, "" + LocalStoreOptions.DEFAULT_CAPACITY);
    public static final Command.Arg ARG_GC_TARGET_RATIO =
            new Command.Arg("gc-target-ratio", "The fraction of capacity garbage collection reduces the store to", false, "" + LocalStoreOptions.DEFAULT_GC_TARGET_RATIO);
    public static final Command.Arg ARG_GC_BATCH_SIZE =
            new Command.Arg("gc-batch-size", "The maximum number of chunks removed in one garbage collection batch", false, "" + LocalStoreOptions.DEFAULT_GC_BATCH_SIZE);
    public static final Command.Arg ARG_BASE_KEY =
            new Command.Arg("base-key", "The hex encoded 32 byte key that chunk bins are measured from", false);
    public static final Command.Arg ARG_COLLECT_METRICS =
            new Command.Arg("collect-metrics", "Export metrics to prometheus", false, "false");
    public static final Command.Arg ARG_METRICS_ADDRESS =
            new Command.Arg("metrics.address", "The address to export metrics on", false, "localhost");
    public static final Command.Arg ARG_METRICS_PORT =
            new Command.Arg("metrics.port", "The port to export metrics on", false, "8001");

    private static final List<Command.Arg> STORE_ARGS = Arrays.asList(
            ARG_STORE_DIR,
            ARG_INDEX_SQL_FILE,
            ARG_CAPACITY,
            ARG_GC_TARGET_RATIO,
            ARG_GC_BATCH_SIZE,
            ARG_BASE_KEY,
            ARG_COLLECT_METRICS,
            ARG_METRICS_ADDRESS,
            ARG_METRICS_PORT
    );

    private static List<Command.Arg> withStoreArgs(Command.Arg... extra) {
        List<Command.Arg> res = new ArrayList<>(Arrays.asList(extra));
        res.addAll(STORE_ARGS);
        return res;
    }

    public static final Command<ChunkState> SET = new Command<>("set",
            "Change the state of a chunk in the local store",
            a -> {
                ModeSet mode = ModeSet.byName(a.getArg("mode"));
                ChunkAddress address = ChunkAddress.fromHex(a.getArg("address"));
                try (LocalStore store = buildLocalStore(a.with("gc-in-background", "false"))) {
                    store.set(mode, address);
                    ChunkState state = store.state(address);
                    System.out.println(address + " " + state);
                    return state;
                }
            },
            withStoreArgs(
                    new Command.Arg("mode", "One of access, sync, remove, pin or unpin", true),
                    new Command.Arg("address", "The hex encoded chunk address", true)
            )
    );

    public static final Command<ChunkAddress> PUT = new Command<>("put",
            "Store a chunk in the local store",
            a -> {
                ModePut mode = ModePut.byName(a.getArg("mode"));
                Chunk chunk = Chunk.of(ArrayOps.hexToBytes(a.getArg("data")));
                try (LocalStore store = buildLocalStore(a.with("gc-in-background", "false"))) {
                    boolean existed = store.put(mode, chunk).get(0);
                    System.out.println(chunk.address + (existed ? " already stored" : " stored"));
                    return chunk.address;
                }
            },
            withStoreArgs(
                    new Command.Arg("mode", "One of request, upload or sync", false, "upload"),
                    new Command.Arg("data", "The hex encoded chunk data", true)
            )
    );

    public static final Command<Long> GC = new Command<>("gc",
            "Garbage collect the local store down to its target size",
            a -> {
                try (LocalStore store = buildLocalStore(a.with("gc-in-background", "false"))) {
                    long collected = store.collectGarbageFully();
                    System.out.println("Collected " + collected + " chunks, gc size is now " + store.gcSize());
                    return collected;
                }
            },
            STORE_ARGS
    );

    public static final Command<Map<String, Long>> STATS = new Command<>("stats",
            "Print the size of every index in the local store",
            a -> {
                try (LocalStore store = buildLocalStore(a.with("gc-in-background", "false"))) {
                    Map<String, Long> counts = store.indexCounts();
                    counts.forEach((name, count) -> System.out.println(name + ": " + count));
                    System.out.println("gc size: " + store.gcSize());
                    System.out.println("base key: " + ArrayOps.bytesToHex(store.baseKey()));
                    return counts;
                }
            },
            STORE_ARGS
    );

    public static final Command<Void> MAIN = new Command<>("Main",
            "Run a chunk store command",
            args -> {
                System.out.println("Run with -help to show options");
                return null;
            },
            Collections.emptyList(),
            Arrays.asList(
                    SET,
                    PUT,
                    GC,
                    STATS
            )
    );

    public static void main(String[] args) {
        try {
            MAIN.main(Args.parse(args));
        } catch (Throwable e) {
            e.printStackTrace();
            Logging.LOG().log(Level.SEVERE, e, () -> e.getMessage());
            System.exit(-1);
        }
    }
}
