package ca.purps.offlinestorage.repository;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Jacksonized
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class OfflineChapterRecord {
    @NonNull
    private final String extensionId;
    @NonNull
    private final String mangaId;
    @NonNull
    private final String chapterId;
    private final String chapterNumber;
    private final String chapterTitle;
    @NonNull
    private final String folderName;
    private final int totalPages;
    private final long downloadedAt;
    private final long sizeBytes;
}
