package chunkstore.server.localstore;

import java.util.*;
import java.util.concurrent.*;

/** Wakes pull subscribers when new chunks enter the pull index of their bin.
 *
 *  This is only a hint to re-read the pull index, nothing is delivered through it.
 */
public class PullSubscriptions {

    private final Map<Integer, List<PullTrigger>> triggers = new ConcurrentHashMap<>();
    private final Set<PullSubscription> open = ConcurrentHashMap.newKeySet();

    public PullTrigger register(int bin) {
        PullTrigger trigger = new PullTrigger(bin);
        triggers.computeIfAbsent(bin, b -> new CopyOnWriteArrayList<>()).add(trigger);
        return trigger;
    }

    public void unregister(PullTrigger trigger) {
        List<PullTrigger> forBin = triggers.get(trigger.bin);
        if (forBin != null)
            forBin.remove(trigger);
    }

    public void trigger(int bin) {
        List<PullTrigger> forBin = triggers.get(bin);
        if (forBin == null)
            return;
        for (PullTrigger t : forBin)
            t.signal();
    }

    void opened(PullSubscription subscription) {
        open.add(subscription);
    }

    void ended(PullSubscription subscription) {
        open.remove(subscription);
    }

    public int openSubscriptions() {
        return open.size();
    }

    /** Stop every open subscription and wait for their readers to exit.
     */
    public void closeAll() {
        for (PullSubscription subscription : new ArrayList<>(open))
            subscription.close();
    }
}
