package ca.purps.offlinestorage.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One unit of download work: a single chapter, or every missing chapter of a manga when
 * {@code chapterId} is absent. Instances are immutable; the repository replaces them on update.
 */
@Value
@Jacksonized
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueuedDownload {
    private final long id;
    @NonNull
    private final String extensionId;
    @NonNull
    private final String mangaId;
    @NonNull
    private final String mangaSlug;
    private final String mangaTitle;

    private final String chapterId;
    private final String chapterNumber;
    private final String chapterTitle;

    @NonNull
    @Builder.Default
    private final DownloadStatus status = DownloadStatus.QUEUED;
    private final int priority;

    private final long queuedAt;
    private final Long startedAt;
    private final Long completedAt;
    private final Long lastProgressAt;

    private final String errorMessage;
    private final int progressCurrent;
    private final int progressTotal;

    @JsonIgnore
    public boolean isChapterDownload() {
        return chapterId != null;
    }
}
