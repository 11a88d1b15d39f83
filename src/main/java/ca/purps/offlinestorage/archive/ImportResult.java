package ca.purps.offlinestorage.archive;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ImportResult {
    private final boolean success;
    private final boolean skipped;
    private final String extensionId;
    private final String mangaId;
    private final String mangaSlug;
    private final int chaptersImported;
    private final String error;

    public static ImportResult failure(String error) {
        return ImportResult.builder().success(false).error(error).build();
    }
}
