package ca.purps.offlinestorage.archive;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ArchiveOptions {

    @Builder.Default
    private boolean includeMetadata = true;

    @Builder.Default
    private boolean includeCover = true;

    /** 0 (store) to 9 (best). */
    @Builder.Default
    private int compressionLevel = 6;

    /** Called once per archived entry. */
    @Builder.Default
    private ArchiveProgressListener progressListener = ArchiveProgressListener.NONE;

    public static ArchiveOptions defaults() {
        return ArchiveOptions.builder().build();
    }

}
