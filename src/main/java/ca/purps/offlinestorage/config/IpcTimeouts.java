package ca.purps.offlinestorage.config;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class IpcTimeouts {

    @Builder.Default
    private long startTimeoutMs = 10_000;

    @Builder.Default
    private long stopTimeoutMs = 5_000;

    @Builder.Default
    private long queryTimeoutMs = 5_000;

    @Builder.Default
    private long readyTimeoutMs = 15_000;

    public static IpcTimeouts defaults() {
        return IpcTimeouts.builder().build();
    }

}
