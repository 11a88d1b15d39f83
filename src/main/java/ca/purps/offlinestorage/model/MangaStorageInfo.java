package ca.purps.offlinestorage.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class MangaStorageInfo {
    private final String mangaId;
    private final String mangaSlug;
    private final String title;
    private final String coverPath;
    private final String extensionId;
    private final int chapterCount;
    private final long totalBytes;
    private final long downloadedAt;
}
