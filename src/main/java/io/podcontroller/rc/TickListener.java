package io.podcontroller.rc;

/**
 * Called on the watch thread after every completed reconciliation pass.
 */
@FunctionalInterface
public interface TickListener {

    TickListener NOOP = (watch, errorCount) -> {
    };

    /**
     * @param watch the loop that completed the pass
     * @param errorCount errors the pass reported on the error queue
     */
    void tickCompleted(DesireWatch watch, int errorCount);
}
