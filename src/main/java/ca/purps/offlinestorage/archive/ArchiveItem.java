package ca.purps.offlinestorage.archive;

import ca.purps.offlinestorage.model.OfflineMangaMetadata;
import lombok.NonNull;
import lombok.Value;

/**
 * One manga of a bulk export.
 */
@Value
public class ArchiveItem {
    @NonNull
    private final String extensionId;
    @NonNull
    private final OfflineMangaMetadata mangaMetadata;
}
