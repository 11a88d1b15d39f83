package ca.purps.offlinestorage.repository;

import java.util.List;
import java.util.Optional;

import ca.purps.offlinestorage.model.DownloadHistoryItem;
import ca.purps.offlinestorage.model.DownloadStatus;
import ca.purps.offlinestorage.model.ProgressUpdate;
import ca.purps.offlinestorage.model.QueuedDownload;

/**
 * Persistence of the download queue, the history and the rows describing what is stored offline.
 * Queue listings are ordered by priority (highest first), then queuedAt, then id.
 */
public interface OfflineRepository {

    /**
     * Stores the items with freshly assigned ids; the ids of the arguments are ignored.
     *
     * @return assigned ids, in argument order
     */
    public List<Long> queueDownloads(List<QueuedDownload> downloads);

    public Optional<QueuedDownload> getQueueItem(long queueId);

    /**
     * Items with status {@code queued} only.
     */
    public List<QueuedDownload> getQueuedDownloads();

    public List<QueuedDownload> getAllQueueItems();

    public Optional<QueuedDownload> getNextQueuedDownload();

    /**
     * Sets {@code startedAt} on the first transition to downloading and {@code completedAt} on
     * completed/failed.
     */
    public void updateQueueStatus(long queueId, DownloadStatus status, String errorMessage);

    public void updateQueueProgressBatch(List<ProgressUpdate> updates);

    /**
     * Back to {@code queued}: error, progress and timestamps are cleared, priority is kept.
     */
    public void resetQueueItem(long queueId);

    public void deleteQueueItem(long queueId);

    public void moveQueueItemToHistory(long queueId);

    public void saveManga(OfflineMangaRecord manga);

    public Optional<OfflineMangaRecord> getManga(String extensionId, String mangaId);

    public List<OfflineMangaRecord> getAllManga();

    /**
     * Also removes the manga's chapter rows.
     */
    public void deleteManga(String extensionId, String mangaId);

    public void saveChapter(OfflineChapterRecord chapter);

    public Optional<OfflineChapterRecord> getChapter(String extensionId, String mangaId, String chapterId);

    public List<OfflineChapterRecord> getChapters(String extensionId, String mangaId);

    public void deleteChapter(String extensionId, String mangaId, String chapterId);

    /**
     * Newest first.
     */
    public List<DownloadHistoryItem> getDownloadHistory(Integer limit);

    public void deleteHistoryItem(long historyId);

    public void clearDownloadHistory();

    /**
     * Queue, history, manga and chapter rows.
     */
    public void clearAllOfflineData();

}
