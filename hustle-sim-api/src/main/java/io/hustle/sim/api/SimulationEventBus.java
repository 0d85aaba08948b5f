package io.hustle.sim.api;

import java.util.ArrayDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Deferred notification queue shared by the engines.
 *
 * Engines post() events while they mutate and flush() at the end of every public
 * operation. Delivery happens only from flush(), which keeps the
 * "notify after mutation, never during" ordering.
 *
 * REENTRANCY:
 *   A listener that calls back into an engine causes new posts and a nested flush().
 *   The nested flush() returns immediately; the outer delivery loop picks the new
 *   events up after the current one, so ordering stays FIFO.
 *
 * BATCHING:
 *   An engine whose operation calls into another engine wraps the call in
 *   beginBatch() / endBatch(). flush() is deferred while a batch is open and the
 *   outermost endBatch() delivers everything at once.
 *
 * FAILURE POLICY:
 *   A listener that throws is logged and skipped. Other listeners still receive
 *   the event and the simulation step carries on.
 *
 * THREAD SAFETY:
 *   Listener registration is safe from any thread (CopyOnWriteArrayList).
 *   post() / flush() belong to the simulation thread.
 */
public final class SimulationEventBus {

    private static final Logger log = LogManager.getLogger(SimulationEventBus.class);

    private final CopyOnWriteArrayList<SimulationListener> listeners =
        new CopyOnWriteArrayList<>();

    private final ArrayDeque<SimulationEvent> pending = new ArrayDeque<>();

    private boolean dispatching = false;

    private int batchDepth = 0;

    private long deliveredCount = 0L;

    // -- Listener management --------------------------------------------------

    public void addListener(SimulationListener listener) {
        if (listener != null) listeners.add(listener);
    }

    public void removeListener(SimulationListener listener) {
        listeners.remove(listener);
    }

    public int listenerCount() { return listeners.size(); }

    // -- Queue ----------------------------------------------------------------

    /**
     * Queues an event for delivery on the next flush().
     *
     * @param event the event; null is ignored
     */
    public void post(SimulationEvent event) {
        if (event != null) pending.addLast(event);
    }

    /** Number of events waiting for delivery. */
    public int pendingCount() { return pending.size(); }

    /** Total events delivered since construction. */
    public long deliveredCount() { return deliveredCount; }

    /**
     * Delivers all queued events, including any posted by listeners during delivery.
     *
     * @return number of events delivered by this call; 0 for a nested or batched call
     */
    public int flush() {
        if (dispatching || batchDepth > 0) {
            return 0;
        }
        dispatching = true;
        int delivered = 0;
        try {
            SimulationEvent event;
            while ((event = pending.pollFirst()) != null) {
                for (SimulationListener listener : listeners) {
                    try {
                        listener.onEvent(event);
                    } catch (RuntimeException e) {
                        log.error("listener {} failed on {}", listener, event, e);
                    }
                }
                delivered++;
            }
        } finally {
            dispatching = false;
        }
        deliveredCount += delivered;
        return delivered;
    }

    /** Opens a batch. Must be paired with endBatch(), typically in a finally block. */
    public void beginBatch() {
        batchDepth++;
    }

    /**
     * Closes a batch. The outermost close flushes.
     *
     * @return number of events delivered; 0 while an outer batch is still open
     */
    public int endBatch() {
        if (batchDepth == 0) {
            throw new IllegalStateException("endBatch() without beginBatch()");
        }
        batchDepth--;
        return batchDepth == 0 ? flush() : 0;
    }

    /** True while a batch is open. */
    public boolean inBatch() {
        return batchDepth > 0;
    }

    /** Drops queued events without delivering them. Used when a save is loaded. */
    public void clearPending() {
        pending.clear();
    }
}
