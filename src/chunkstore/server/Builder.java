package chunkstore.server;

import chunkstore.server.localstore.*;
import chunkstore.server.shed.*;
import chunkstore.server.util.*;

import java.io.*;
import java.util.logging.*;

public class Builder {
    private static final Logger LOG = Logging.LOG();

    public static OrderedStore buildIndexStore(Args a) {
        String dbPath = Sqlite.getDbPath(a, "index-sql-file");
        if (! dbPath.equals(":memory:"))
            a.getStoreDir().toFile().mkdirs();
        return JdbcOrderedStore.build(dbPath);
    }

    public static LocalStore buildLocalStore(Args a) {
        startMetrics(a);
        LocalStoreOptions options = LocalStoreOptions.fromArgs(a);
        LocalStore store = new LocalStore(buildIndexStore(a), options);
        LOG.info("Opened local store in " + a.getStoreDir() + " with capacity " + options.capacity);
        return store;
    }

    public static void startMetrics(Args a) {
        if (! a.getBoolean("collect-metrics", false))
            return;
        String address = a.getArg("metrics.address", "localhost");
        int port = a.getInt("metrics.port", 8001);
        try {
            AggregatedMetrics.startExporter(address, port);
        } catch (IOException e) {
            throw new UncheckedIOException("Couldn't start metrics exporter on " + address + ":" + port, e);
        }
    }
}
