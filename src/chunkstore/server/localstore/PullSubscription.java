package chunkstore.server.localstore;

import chunkstore.server.util.*;
import chunkstore.shared.storage.*;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import java.util.function.*;
import java.util.logging.*;

/** Delivers the pull index of one bin in bin id order, each descriptor once, re-reading whenever the bin is triggered.
 */
public class PullSubscription implements AutoCloseable {
    private static final Logger LOG = Logging.LOG();
    private static final int READ_LIMIT = 1000;

    public final int bin;
    private final long until;
    private final LocalStore store;
    private final PullSubscriptions subscriptions;
    private final Consumer<Descriptor> sink;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicLong lastDelivered;
    private final PullTrigger trigger;
    private final Thread reader;

    PullSubscription(LocalStore store, PullSubscriptions subscriptions, int bin, long since, long until, Consumer<Descriptor> sink) {
        this.store = store;
        this.subscriptions = subscriptions;
        this.bin = bin;
        this.until = until;
        this.sink = sink;
        this.lastDelivered = new AtomicLong(since);
        this.trigger = subscriptions.register(bin);
        this.reader = new Thread(this::run, "Pull subscription - bin " + bin);
        reader.setDaemon(true);
        trigger.signal();
        subscriptions.opened(this);
        reader.start();
    }

    private void run() {
        try {
            while (running.get()) {
                if (! trigger.await(1, TimeUnit.SECONDS))
                    continue;
                if (deliverAvailable())
                    return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Pull subscription for bin " + bin + " failed: " + e.getMessage(), e);
        } finally {
            running.set(false);
            subscriptions.unregister(trigger);
            subscriptions.ended(this);
        }
    }

    /**
     * @return whether the subscription has delivered everything up to its end
     */
    private boolean deliverAvailable() {
        while (running.get()) {
            List<Descriptor> available = store.pullDescriptors(bin, lastDelivered.get(), until, READ_LIMIT);
            for (Descriptor d : available) {
                if (! running.get())
                    return true;
                sink.accept(d);
                lastDelivered.set(d.binId);
                if (until > 0 && d.binId >= until)
                    return true;
            }
            if (available.size() < READ_LIMIT)
                return false;
        }
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }

    public long lastDeliveredBinId() {
        return lastDelivered.get();
    }

    /** Wait for the subscription to stop by itself, which it does once it has delivered its last bin id.
     */
    public boolean awaitCompletion(long timeout, TimeUnit unit) throws InterruptedException {
        reader.join(unit.toMillis(timeout));
        return ! reader.isAlive();
    }

    @Override
    public void close() {
        running.set(false);
        reader.interrupt();
        try {
            reader.join(5_000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
