package ca.purps.offlinestorage.metrics;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Read-only snapshot produced by {@link PerformanceMetricsTracker#getMetrics()}.
 */
@Value
@Jacksonized
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class PerformanceMetrics {
    private final long totalDownloads;
    private final int activeDownloads;
    private final long completedDownloads;
    private final long failedDownloads;
    private final long totalPagesDownloaded;
    private final long totalBytesDownloaded;

    private final long eventsEmitted;
    private final int eventsPerSecond;
    private final long lastEventTimestamp;

    private final long databaseWrites;
    private final int databaseWritesPerSecond;
    private final long batchedWrites;
    private final double batchSavingsPercent;

    private final long networkRequests;
    private final int networkRequestsPerSecond;
    private final long cachedRequests;
    private final double cacheHitRate;

    private final double averageDownloadTimeMs;
    private final double averagePageDownloadTimeMs;

    private final long uptimeMs;
    private final long startTime;
}
