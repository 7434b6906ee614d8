package io.podcontroller.rc;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static io.podcontroller.config.Constants.WATCH_ERROR_QUEUE_CAPACITY;

/**
 * Handle on a running desire-watch loop: the queue its errors are reported on, and the
 * quit signal. {@link #stop()} returns only after the loop has acknowledged it, and the
 * loop performs no store writes after acknowledging.
 */
@Slf4j
public class DesireWatch {

    private static final Object WAKE = new Object();

    private final String rcId;
    private final BlockingQueue<Throwable> errors = new LinkedBlockingQueue<>(WATCH_ERROR_QUEUE_CAPACITY);
    private final BlockingQueue<Object> wakeups = new LinkedBlockingQueue<>(1);
    private final AtomicBoolean quit = new AtomicBoolean(false);
    private final AtomicLong reported = new AtomicLong();
    private final CountDownLatch acknowledged = new CountDownLatch(1);

    DesireWatch(String rcId) {
        this.rcId = rcId;
    }

    public String getRcId() {
        return rcId;
    }

    /**
     * Errors reported by the loop, oldest first. Consumers drain it at their own pace;
     * when full, new errors are dropped and logged.
     */
    public BlockingQueue<Throwable> errors() {
        return errors;
    }

    /**
     * Signal quit and wait for the loop to acknowledge.
     */
    public void stop() throws InterruptedException {
        requestStop();
        acknowledged.await();
    }

    /**
     * Signal quit and wait at most {@code timeout} for the acknowledgement.
     *
     * @return true if the loop acknowledged in time
     */
    public boolean stop(Duration timeout) throws InterruptedException {
        requestStop();
        return acknowledged.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isStopped() {
        return acknowledged.getCount() == 0;
    }

    private void requestStop() {
        if (quit.compareAndSet(false, true)) {
            log.info("[RC: {}] Quit requested", rcId);
        }
        wakeups.offer(WAKE);
    }

    // =================================================================
    // LOOP SIDE
    // =================================================================

    boolean quitRequested() {
        return quit.get();
    }

    /**
     * Request another pass. Wakeups arriving while one is already pending coalesce.
     */
    void wake() {
        wakeups.offer(WAKE);
    }

    /**
     * Block until woken, quit, or the fallback interval elapses.
     */
    void awaitNextTick(Duration fallbackInterval) throws InterruptedException {
        wakeups.poll(fallbackInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    void report(Throwable error) {
        reported.incrementAndGet();
        log.warn("[RC: {}] {}", rcId, error.getMessage());
        if (!errors.offer(error)) {
            log.warn("[RC: {}] Error queue full, dropping: {}", rcId, error.getMessage());
        }
    }

    /**
     * Errors reported since the loop started, including dropped ones.
     */
    long reportedCount() {
        return reported.get();
    }

    void acknowledge() {
        acknowledged.countDown();
        log.info("[RC: {}] Watch loop stopped", rcId);
    }
}
