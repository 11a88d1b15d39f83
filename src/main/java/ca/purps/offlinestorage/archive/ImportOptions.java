package ca.purps.offlinestorage.archive;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ImportOptions {

    @Builder.Default
    private ConflictResolution conflictResolution = ConflictResolution.SKIP;

    /** Check the extracted layout before anything is copied into the library. */
    @Builder.Default
    private boolean validate = true;

    /** Overall progress, 0 to 100. */
    @Builder.Default
    private ImportProgressListener progressListener = ImportProgressListener.NONE;

    public static ImportOptions defaults() {
        return ImportOptions.builder().build();
    }

}
