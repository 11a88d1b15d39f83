package ca.purps.offlinestorage.metrics;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import ca.purps.offlinestorage.MutableClock;

public class PerformanceMetricsTrackerTest {

    private MutableClock clock;
    private PerformanceMetricsTracker tracker;

    @BeforeMethod
    public void beforeMethod() {
        clock = new MutableClock(5_000_000);
        tracker = new PerformanceMetricsTracker(clock);
    }

    @Test
    public void timingsAreKeyedByQueueId() {
        tracker.downloadStarted(1);
        clock.advance(1000);
        tracker.downloadStarted(2);
        clock.advance(1000);

        // item 2 finishes first; it must not borrow item 1's start time
        tracker.downloadCompleted(2, 10);
        tracker.downloadCompleted(1, 20);

        PerformanceMetrics metrics = tracker.getMetrics();
        assert metrics.getTotalDownloads() == 2;
        assert metrics.getActiveDownloads() == 0;
        assert metrics.getCompletedDownloads() == 2;
        assert metrics.getTotalPagesDownloaded() == 30;
        assert metrics.getAverageDownloadTimeMs() == 1500.0 : "Average was " + metrics.getAverageDownloadTimeMs();
        assert metrics.getAveragePageDownloadTimeMs() == 100.0 : "Per page was " + metrics.getAveragePageDownloadTimeMs();
    }

    @Test
    public void failedDownloadLeavesActiveSet() {
        tracker.downloadStarted(1);
        tracker.downloadStarted(2);
        tracker.downloadFailed(1);

        PerformanceMetrics metrics = tracker.getMetrics();
        assert metrics.getActiveDownloads() == 1;
        assert metrics.getFailedDownloads() == 1;
        assert metrics.getAverageDownloadTimeMs() == 0 : "Failures should not count towards timings";
    }

    @Test
    public void ratesCountTheLastSecond() {
        tracker.networkRequest();
        tracker.networkRequest();
        clock.advance(1500);
        tracker.networkRequest();
        tracker.eventEmitted();

        PerformanceMetrics metrics = tracker.getMetrics();
        assert metrics.getNetworkRequests() == 3;
        assert metrics.getNetworkRequestsPerSecond() == 1 : "Rate was " + metrics.getNetworkRequestsPerSecond();
        assert metrics.getEventsPerSecond() == 1;
        assert metrics.getLastEventTimestamp() == clock.millis();
    }

    @Test
    public void percentages() {
        tracker.networkRequest();
        tracker.cacheHit();
        tracker.cacheHit();
        tracker.cacheHit();
        tracker.databaseWrite();
        tracker.databaseBatchWrite(3);

        PerformanceMetrics metrics = tracker.getMetrics();
        assert metrics.getCacheHitRate() == 75.0 : "Hit rate was " + metrics.getCacheHitRate();
        assert metrics.getBatchSavingsPercent() == 75.0 : "Savings were " + metrics.getBatchSavingsPercent();
        assert metrics.getDatabaseWritesPerSecond() == 2;
    }

    @Test
    public void resetZeroesEverything() {
        tracker.downloadStarted(1);
        tracker.downloadCompleted(1, 5);
        tracker.bytesDownloaded(4096);
        tracker.eventEmitted();
        tracker.networkRequest();
        tracker.cacheHit();
        tracker.databaseBatchWrite(2);
        clock.advance(60_000);

        tracker.reset();
        PerformanceMetrics metrics = tracker.getMetrics();

        assert metrics.getTotalDownloads() == 0;
        assert metrics.getCompletedDownloads() == 0;
        assert metrics.getTotalPagesDownloaded() == 0;
        assert metrics.getTotalBytesDownloaded() == 0;
        assert metrics.getEventsEmitted() == 0;
        assert metrics.getEventsPerSecond() == 0;
        assert metrics.getNetworkRequests() == 0;
        assert metrics.getCachedRequests() == 0;
        assert metrics.getBatchedWrites() == 0;
        assert metrics.getCacheHitRate() == 0;
        assert metrics.getUptimeMs() == 0 : "Uptime should restart, was " + metrics.getUptimeMs();
        assert metrics.getStartTime() == clock.millis();
    }

}
