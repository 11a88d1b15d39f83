package ca.purps.offlinestorage.cleanup;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Jacksonized
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class StorageSettings {

    private static final long GIB = 1024L * 1024 * 1024;

    @Builder.Default
    private long maxStorageBytes = 10 * GIB;

    @Builder.Default
    private boolean autoCleanupEnabled = false;

    @Builder.Default
    private CleanupStrategy strategy = CleanupStrategy.OLDEST;

    /** Usage, in percent of {@link #maxStorageBytes}, at which cleanup starts. */
    @Builder.Default
    private int thresholdPercent = 90;

    /** Space to leave free below {@link #maxStorageBytes} once cleanup ran. */
    @Builder.Default
    private long targetFreeBytes = GIB;
}
