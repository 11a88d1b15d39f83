package ca.purps.offlinestorage.repository;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Repository row for a manga with at least one chapter on disk.
 */
@Value
@Jacksonized
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class OfflineMangaRecord {
    @NonNull
    private final String extensionId;
    @NonNull
    private final String mangaId;
    @NonNull
    private final String mangaSlug;
    private final String title;
    private final String downloadPath;
    private final long downloadedAt;
    private final long lastUpdatedAt;
    private final long lastAccessedAt;
    private final long totalSizeBytes;
}
