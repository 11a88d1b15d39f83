package ca.purps.offlinestorage.worker;

import java.time.Clock;

/**
 * Sliding-window restart budget. Attempt timestamps live in a ring buffer sized to the cap, so
 * only the last {@code maxRestarts} attempts are ever kept.
 */
public class RestartTracker {

    private final long[] attempts;
    private final long windowMs;
    private final Clock clock;

    private int next;
    private int count;

    public RestartTracker(int maxRestarts, long windowMs, Clock clock) {
        this.attempts = new long[Math.max(0, maxRestarts)];
        this.windowMs = windowMs;
        this.clock = clock;
    }

    /**
     * Records an attempt when the budget allows one.
     *
     * @return false when {@code maxRestarts} attempts already happened inside the window
     */
    public synchronized boolean tryAcquire() {
        long now = clock.millis();
        prune(now);
        if (count >= attempts.length) {
            return false;
        }
        attempts[next] = now;
        next = (next + 1) % attempts.length;
        count++;
        return true;
    }

    public synchronized int attemptsInWindow() {
        prune(clock.millis());
        return count;
    }

    public int getMaxRestarts() {
        return attempts.length;
    }

    public synchronized void reset() {
        count = 0;
        next = 0;
    }

    // oldest entry sits count slots behind next
    private void prune(long now) {
        while (count > 0) {
            int oldest = Math.floorMod(next - count, attempts.length);
            if (now - attempts[oldest] < windowMs) {
                break;
            }
            count--;
        }
    }

}
