package ca.purps.offlinestorage.metrics;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

import lombok.Synchronized;

/**
 * Running counters for the worker plus 10 second timestamp windows used for per-second rates.
 * Download timings are keyed by queue id so concurrent downloads never borrow each other's start time.
 */
public class PerformanceMetricsTracker {

    private static final long WINDOW_MS = 10_000;
    private static final long RATE_MS = 1000;

    private final Clock clock;

    private long startTime;

    private long totalDownloads;
    private final Map<Long, Long> activeDownloadStarts = new HashMap<>();
    private long completedDownloads;
    private long failedDownloads;
    private long totalPagesDownloaded;
    private long totalBytesDownloaded;

    private long completedTimingCount;
    private long completedDownloadTimeMs;
    private long completedTimingPages;

    private long eventsEmitted;
    private long lastEventTimestamp;
    private final Deque<Long> eventTimestamps = new ArrayDeque<>();

    private long databaseWrites;
    private long batchedWrites;
    private final Deque<Long> dbWriteTimestamps = new ArrayDeque<>();

    private long networkRequests;
    private long cachedRequests;
    private final Deque<Long> networkTimestamps = new ArrayDeque<>();

    public PerformanceMetricsTracker() {
        this(Clock.systemUTC());
    }

    public PerformanceMetricsTracker(Clock clock) {
        this.clock = clock;
        this.startTime = clock.millis();
        this.lastEventTimestamp = startTime;
    }

    @Synchronized
    public void downloadStarted(long queueId) {
        totalDownloads++;
        activeDownloadStarts.put(queueId, clock.millis());
    }

    @Synchronized
    public void downloadCompleted(long queueId, int pagesDownloaded) {
        completedDownloads++;
        totalPagesDownloaded += pagesDownloaded;

        Long startedAt = activeDownloadStarts.remove(queueId);
        if (startedAt != null) {
            completedTimingCount++;
            completedDownloadTimeMs += clock.millis() - startedAt;
            completedTimingPages += pagesDownloaded;
        }
    }

    @Synchronized
    public void downloadFailed(long queueId) {
        activeDownloadStarts.remove(queueId);
        failedDownloads++;
    }

    @Synchronized
    public void bytesDownloaded(long bytes) {
        totalBytesDownloaded += bytes;
    }

    @Synchronized
    public void eventEmitted() {
        long now = clock.millis();
        eventsEmitted++;
        lastEventTimestamp = now;
        record(eventTimestamps, now);
    }

    @Synchronized
    public void databaseWrite() {
        databaseWrites++;
        record(dbWriteTimestamps, clock.millis());
    }

    @Synchronized
    public void databaseBatchWrite(int count) {
        batchedWrites += count;
        record(dbWriteTimestamps, clock.millis());
    }

    @Synchronized
    public void networkRequest() {
        networkRequests++;
        record(networkTimestamps, clock.millis());
    }

    @Synchronized
    public void cacheHit() {
        cachedRequests++;
    }

    @Synchronized
    public PerformanceMetrics getMetrics() {
        long now = clock.millis();

        long totalWrites = databaseWrites + batchedWrites;
        long totalRequests = networkRequests + cachedRequests;

        return PerformanceMetrics.builder()
                .totalDownloads(totalDownloads)
                .activeDownloads(activeDownloadStarts.size())
                .completedDownloads(completedDownloads)
                .failedDownloads(failedDownloads)
                .totalPagesDownloaded(totalPagesDownloaded)
                .totalBytesDownloaded(totalBytesDownloaded)
                .eventsEmitted(eventsEmitted)
                .eventsPerSecond(rate(eventTimestamps, now))
                .lastEventTimestamp(lastEventTimestamp)
                .databaseWrites(databaseWrites)
                .databaseWritesPerSecond(rate(dbWriteTimestamps, now))
                .batchedWrites(batchedWrites)
                .batchSavingsPercent(totalWrites > 0 ? (double) batchedWrites / totalWrites * 100 : 0)
                .networkRequests(networkRequests)
                .networkRequestsPerSecond(rate(networkTimestamps, now))
                .cachedRequests(cachedRequests)
                .cacheHitRate(totalRequests > 0 ? (double) cachedRequests / totalRequests * 100 : 0)
                .averageDownloadTimeMs(completedTimingCount > 0 ? (double) completedDownloadTimeMs / completedTimingCount : 0)
                .averagePageDownloadTimeMs(completedTimingPages > 0 ? (double) completedDownloadTimeMs / completedTimingPages : 0)
                .uptimeMs(now - startTime)
                .startTime(startTime)
                .build();
    }

    @Synchronized
    public void reset() {
        startTime = clock.millis();
        totalDownloads = 0;
        activeDownloadStarts.clear();
        completedDownloads = 0;
        failedDownloads = 0;
        totalPagesDownloaded = 0;
        totalBytesDownloaded = 0;
        completedTimingCount = 0;
        completedDownloadTimeMs = 0;
        completedTimingPages = 0;
        eventsEmitted = 0;
        lastEventTimestamp = startTime;
        eventTimestamps.clear();
        databaseWrites = 0;
        batchedWrites = 0;
        dbWriteTimestamps.clear();
        networkRequests = 0;
        cachedRequests = 0;
        networkTimestamps.clear();
    }

    private static void record(Deque<Long> window, long now) {
        window.addLast(now);
        long cutoff = now - WINDOW_MS;
        while (!window.isEmpty() && window.peekFirst() < cutoff) {
            window.removeFirst();
        }
    }

    private static int rate(Deque<Long> window, long now) {
        long since = now - RATE_MS;
        return (int) window.stream().filter(timestamp -> timestamp >= since).count();
    }

}
