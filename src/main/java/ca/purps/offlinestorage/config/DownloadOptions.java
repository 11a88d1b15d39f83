package ca.purps.offlinestorage.config;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Tuning for the download queue running inside the worker process.
 */
@Value
@Jacksonized
@Builder(toBuilder = true)
public class DownloadOptions {

    /** Queue items transferred at the same time. */
    @Builder.Default
    private int concurrency = 3;

    /** Pages of one chapter transferred at the same time. */
    @Builder.Default
    private int chapterConcurrency = 3;

    @Builder.Default
    private long pollingIntervalMs = 1000;

    /** Pause between chapters of a whole-manga item. */
    @Builder.Default
    private long chapterDelayMs = 0;

    @Builder.Default
    private int retryAttempts = 3;

    @Builder.Default
    private long retryDelayMs = 1000;

    @Builder.Default
    private long pageTimeoutMs = 30_000;

    @Builder.Default
    private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";

    @Builder.Default
    private long progressFlushIntervalMs = 1500;

    @Builder.Default
    private boolean flushProgressOnComplete = true;

    @Builder.Default
    private int cacheMaxSize = 100;

    @Builder.Default
    private long cacheTtlMs = 5 * 60 * 1000;

    /** Downloading items without any progress for this long are frozen. */
    @Builder.Default
    private long frozenThresholdMs = 30_000;

    /** Downloading items below 10% after this long are frozen. */
    @Builder.Default
    private long stalledThresholdMs = 120_000;

    public static DownloadOptions defaults() {
        return DownloadOptions.builder().build();
    }

}
