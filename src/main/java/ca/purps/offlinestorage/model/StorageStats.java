package ca.purps.offlinestorage.model;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Jacksonized
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class StorageStats {
    private final long totalBytes;
    private final int mangaCount;
    private final int chapterCount;
    private final int pageCount;
    /** extensionId to bytes */
    private final Map<String, Long> byExtension;
    private final List<MangaStorageInfo> byManga;
}
