package ca.purps.offlinestorage.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Jacksonized
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class DownloadHistoryItem {
    private final long id;
    private final String extensionId;
    private final String mangaId;
    private final String mangaSlug;
    private final String mangaTitle;
    private final String chapterId;
    private final String chapterNumber;
    private final String chapterTitle;
    private final DownloadStatus status;
    private final long queuedAt;
    private final Long startedAt;
    private final long completedAt;
    private final String errorMessage;
    private final int progressCurrent;
    private final int progressTotal;

    public static DownloadHistoryItem from(long id, QueuedDownload item) {
        return DownloadHistoryItem.builder()
                .id(id)
                .extensionId(item.getExtensionId())
                .mangaId(item.getMangaId())
                .mangaSlug(item.getMangaSlug())
                .mangaTitle(item.getMangaTitle())
                .chapterId(item.getChapterId())
                .chapterNumber(item.getChapterNumber())
                .chapterTitle(item.getChapterTitle())
                .status(item.getStatus())
                .queuedAt(item.getQueuedAt())
                .startedAt(item.getStartedAt())
                .completedAt(item.getCompletedAt() != null ? item.getCompletedAt() : System.currentTimeMillis())
                .errorMessage(item.getErrorMessage())
                .progressCurrent(item.getProgressCurrent())
                .progressTotal(item.getProgressTotal())
                .build();
    }
}
