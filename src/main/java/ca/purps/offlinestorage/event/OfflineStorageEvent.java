package ca.purps.offlinestorage.event;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import ca.purps.offlinestorage.model.ProgressUpdate;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Notification pushed from the worker to every listener of the host. Only the fields that belong
 * to the {@link EventType} are set.
 */
@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class OfflineStorageEvent {
    @NonNull
    private final EventType type;
    private final Long queueId;
    private final List<Long> queueIds;
    private final String mangaId;
    private final String chapterId;
    private final Integer progressCurrent;
    private final Integer progressTotal;
    private final String error;
    private final Integer newChapterCount;
    private final Long deletedBytes;
    private final Integer deletedChapters;

    public static OfflineStorageEvent queued(List<Long> queueIds, String mangaId, String chapterId) {
        return OfflineStorageEvent.builder()
                .type(EventType.DOWNLOAD_QUEUED)
                .queueId(queueIds.get(0))
                .queueIds(List.copyOf(queueIds))
                .mangaId(mangaId)
                .chapterId(chapterId)
                .build();
    }

    public static OfflineStorageEvent started(long queueId, String mangaId, String chapterId) {
        return of(EventType.DOWNLOAD_STARTED, queueId, mangaId, chapterId);
    }

    public static OfflineStorageEvent progress(ProgressUpdate update) {
        return OfflineStorageEvent.builder()
                .type(EventType.DOWNLOAD_PROGRESS)
                .queueId(update.getQueueId())
                .mangaId(update.getMangaId())
                .chapterId(update.getChapterId())
                .progressCurrent(update.getProgressCurrent())
                .progressTotal(update.getProgressTotal())
                .build();
    }

    public static OfflineStorageEvent completed(long queueId, String mangaId, String chapterId) {
        return of(EventType.DOWNLOAD_COMPLETED, queueId, mangaId, chapterId);
    }

    public static OfflineStorageEvent failed(long queueId, String mangaId, String chapterId, String error) {
        return OfflineStorageEvent.builder()
                .type(EventType.DOWNLOAD_FAILED)
                .queueId(queueId)
                .mangaId(mangaId)
                .chapterId(chapterId)
                .error(error)
                .build();
    }

    public static OfflineStorageEvent retried(long queueId, String mangaId, String chapterId) {
        return of(EventType.DOWNLOAD_RETRIED, queueId, mangaId, chapterId);
    }

    public static OfflineStorageEvent chapterDeleted(String mangaId, String chapterId) {
        return OfflineStorageEvent.builder()
                .type(EventType.CHAPTER_DELETED)
                .mangaId(mangaId)
                .chapterId(chapterId)
                .build();
    }

    public static OfflineStorageEvent mangaDeleted(String mangaId) {
        return OfflineStorageEvent.builder()
                .type(EventType.MANGA_DELETED)
                .mangaId(mangaId)
                .build();
    }

    public static OfflineStorageEvent newChaptersAvailable(String mangaId, int newChapterCount) {
        return OfflineStorageEvent.builder()
                .type(EventType.NEW_CHAPTERS_AVAILABLE)
                .mangaId(mangaId)
                .newChapterCount(newChapterCount)
                .build();
    }

    public static OfflineStorageEvent cleanupPerformed(long deletedBytes, int deletedChapters) {
        return OfflineStorageEvent.builder()
                .type(EventType.CLEANUP_PERFORMED)
                .deletedBytes(deletedBytes)
                .deletedChapters(deletedChapters)
                .build();
    }

    private static OfflineStorageEvent of(EventType type, long queueId, String mangaId, String chapterId) {
        return OfflineStorageEvent.builder()
                .type(type)
                .queueId(queueId)
                .mangaId(mangaId)
                .chapterId(chapterId)
                .build();
    }
}
