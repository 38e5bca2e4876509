package chunkstore.server.localstore;

import java.util.concurrent.*;

/** A wake up signal for one pull subscriber. Signals coalesce: any number of signals before an await wake it once.
 */
public class PullTrigger {
    public final int bin;
    private final BlockingQueue<Boolean> signal = new ArrayBlockingQueue<>(1);

    PullTrigger(int bin) {
        this.bin = bin;
    }

    public void signal() {
        signal.offer(true);
    }

    /**
     * @param timeout
     * @param unit
     * @return whether a signal arrived before the timeout
     * @throws InterruptedException
     */
    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        return signal.poll(timeout, unit) != null;
    }
}
