package ca.purps.offlinestorage.protocol.payload;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Jacksonized
@Builder
public class BackgroundSyncPayload {
    /** Metadata older than this is refreshed. */
    private final long ttlMs;
    @Builder.Default
    private final int concurrency = 2;
    @Builder.Default
    private final long delayMs = 1000;
}
