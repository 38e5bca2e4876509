package chunkstore.server;

import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import io.prometheus.client.exporter.HTTPServer;
import chunkstore.server.util.*;

import java.io.IOException;
import java.util.*;

/**
 * A wrapper around the prometheus metrics and HTTP exporter.
 */
public class AggregatedMetrics {
    private static Counter build(String name, String help, String... labels) {
        return Counter.build()
                .name(name).help(help).labelNames(labels).register();
    }

    private static Histogram duration(String name, String help) {
        return Histogram.build()
                .labelNames("mode")
                .name(name)
                .help(help)
                .exponentialBuckets(0.0001, 2, 16)
                .register();
    }

    public static final Counter LOCALSTORE_SET = build("localstore_set_total", "Total local store set calls.", "mode");
    public static final Counter LOCALSTORE_SET_ERRORS = build("localstore_set_errors_total", "Total failed local store set calls.", "mode");
    public static final Histogram LOCALSTORE_SET_DURATION = duration("localstore_set_duration", "Time to apply a local store set call, in seconds");

    public static final Counter LOCALSTORE_PUT = build("localstore_put_total", "Total local store put calls.", "mode");
    public static final Counter LOCALSTORE_PUT_ERRORS = build("localstore_put_errors_total", "Total failed local store put calls.", "mode");
    public static final Histogram LOCALSTORE_PUT_DURATION = duration("localstore_put_duration", "Time to apply a local store put call, in seconds");

    public static final Counter GC_COLLECTED = build("localstore_gc_collected_total", "Total chunks removed by garbage collection.");
    public static final Gauge GC_SIZE = Gauge.build()
            .name("localstore_gc_size")
            .help("Chunks currently eligible for garbage collection.")
            .register();

    private static Set<String> runningExporters = new HashSet<>();

    public static synchronized void startExporter(String address, int port) throws IOException {
        String addr = address + ":" + port;
        if (runningExporters.contains(addr))
            return;
        Logging.LOG().info("Starting metrics server at " + addr);
        HTTPServer server = new HTTPServer(address, port);
        runningExporters.add(addr);
        //shutdown hook on signal
        Runtime.getRuntime().addShutdownHook(new Thread(() -> server.close()));
    }
}
