package ca.purps.offlinestorage.downloader;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import ca.purps.offlinestorage.model.ProgressUpdate;
import lombok.extern.slf4j.Slf4j;

/**
 * Coalesces page-level progress into at most one callback per queue item and flush interval.
 * Only the latest update of each item is kept.
 */
@Slf4j
public class ProgressBatcher {

    private final Consumer<ProgressUpdate> callback;
    private final long flushIntervalMs;
    private final boolean flushOnComplete;
    private final ScheduledExecutorService scheduler;

    private final Object lock = new Object();
    private final Map<Long, ProgressUpdate> pending = new LinkedHashMap<>();
    private ScheduledFuture<?> scheduledFlush;

    public ProgressBatcher(Consumer<ProgressUpdate> callback, long flushIntervalMs, boolean flushOnComplete,
            ScheduledExecutorService scheduler) {
        this.callback = callback;
        this.flushIntervalMs = flushIntervalMs;
        this.flushOnComplete = flushOnComplete;
        this.scheduler = scheduler;
    }

    public void update(ProgressUpdate update) {
        boolean flushNow = flushOnComplete && update.isComplete();

        synchronized (lock) {
            pending.put(update.getQueueId(), update);
            if (!flushNow && scheduledFlush == null) {
                scheduledFlush = scheduler.schedule(this::flush, flushIntervalMs, TimeUnit.MILLISECONDS);
            }
        }

        if (flushNow) {
            flush();
        }
    }

    /**
     * Delivers every buffered update once and cancels the pending timer.
     */
    public void flush() {
        List<ProgressUpdate> updates;
        synchronized (lock) {
            if (scheduledFlush != null) {
                scheduledFlush.cancel(false);
                scheduledFlush = null;
            }
            if (pending.isEmpty()) {
                return;
            }
            updates = new ArrayList<>(pending.values());
            pending.clear();
        }

        for (ProgressUpdate update : updates) {
            try {
                callback.accept(update);
            } catch (RuntimeException e) {
                ProgressBatcher.log.error("Error delivering progress for queue item {}", update.getQueueId(), e);
            }
        }
    }

    /**
     * Drops a buffered update without delivering it.
     */
    public void remove(long queueId) {
        synchronized (lock) {
            pending.remove(queueId);
        }
    }

    public int pendingCount() {
        synchronized (lock) {
            return pending.size();
        }
    }

}
