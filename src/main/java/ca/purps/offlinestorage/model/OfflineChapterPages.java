package ca.purps.offlinestorage.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Stored at {@code chapters/<folder>/metadata.json}.
 */
@Value
@Jacksonized
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class OfflineChapterPages {
    @Builder.Default
    private final int version = OfflineMangaMetadata.SCHEMA_VERSION;
    private final long downloadedAt;

    @NonNull
    private final String chapterId;
    @NonNull
    private final String mangaId;
    @NonNull
    private final String folderName;

    @NonNull
    private final List<OfflinePageMetadata> pages;
}
