package triagent.orchestrator.worker;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pause and stop flags for a worker loop. Signal handlers and operators only set
 * flags here; the loop checks them at its own pause-check step.
 */
public final class CancellationToken {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private volatile boolean pauseRequested;
    private volatile boolean stopRequested;

    public void requestPause() {
        pauseRequested = true;
        signal();
    }

    public void resume() {
        pauseRequested = false;
        signal();
    }

    public void requestStop() {
        stopRequested = true;
        signal();
    }

    public boolean isPauseRequested() {
        return pauseRequested;
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    /**
     * Sleep up to {@code duration}, waking early when a flag changes.
     *
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    public void await(Duration duration) throws InterruptedException {
        if (duration.isZero() || duration.isNegative() || stopRequested) {
            return;
        }
        lock.lock();
        try {
            // One wait; any flag change ends it.
            if (!stopRequested) {
                changed.awaitNanos(duration.toNanos());
            }
        } finally {
            lock.unlock();
        }
    }

    private void signal() {
        lock.lock();
        try {
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "CancellationToken{pause=" + pauseRequested + ", stop=" + stopRequested + "}";
    }
}
