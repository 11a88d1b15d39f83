package ca.purps.offlinestorage.repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

import ca.purps.offlinestorage.exception.QueueItemNotFoundException;
import ca.purps.offlinestorage.exception.RepositoryException;
import ca.purps.offlinestorage.model.DownloadHistoryItem;
import ca.purps.offlinestorage.model.DownloadStatus;
import ca.purps.offlinestorage.model.ProgressUpdate;
import ca.purps.offlinestorage.model.QueuedDownload;
import ca.purps.offlinestorage.utility.Json;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Synchronized;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps every row in a single JSON document at {@code dbPath}. The document is loaded on first use
 * and rewritten after each mutation.
 */
@Slf4j
public class JsonOfflineRepository implements OfflineRepository {

    private static final Comparator<QueuedDownload> QUEUE_ORDER = Comparator
            .comparingInt(QueuedDownload::getPriority).reversed()
            .thenComparingLong(QueuedDownload::getQueuedAt)
            .thenComparingLong(QueuedDownload::getId);

    @Data
    @NoArgsConstructor
    static class Store {
        private long nextQueueId = 1;
        private long nextHistoryId = 1;
        private List<QueuedDownload> queue = new ArrayList<>();
        private List<DownloadHistoryItem> history = new ArrayList<>();
        private List<OfflineMangaRecord> manga = new ArrayList<>();
        private List<OfflineChapterRecord> chapters = new ArrayList<>();
    }

    private final Path dbPath;
    private final Clock clock;

    @Getter(lazy = true)
    private final Store data = loadOrCreateStore();

    public JsonOfflineRepository(Path dbPath) {
        this(dbPath, Clock.systemUTC());
    }

    public JsonOfflineRepository(Path dbPath, Clock clock) {
        this.dbPath = dbPath;
        this.clock = clock;
    }

    private Store loadOrCreateStore() {
        try {
            if (Files.exists(dbPath) && Files.size(dbPath) > 0) {
                return Json.read(dbPath, Store.class);
            }
        } catch (IOException e) {
            throw new RepositoryException(String.format("Failed to load %s", dbPath), e);
        }
        return new Store();
    }

    @Override
    @Synchronized
    public List<Long> queueDownloads(List<QueuedDownload> downloads) {
        Store store = getData();
        List<Long> ids = new ArrayList<>();
        for (QueuedDownload download : downloads) {
            long id = store.getNextQueueId();
            store.setNextQueueId(id + 1);
            store.getQueue().add(download.toBuilder().id(id).build());
            ids.add(id);
        }
        save();
        return ids;
    }

    @Override
    @Synchronized
    public Optional<QueuedDownload> getQueueItem(long queueId) {
        return getData().getQueue().stream()
                .filter(item -> item.getId() == queueId)
                .findFirst();
    }

    @Override
    @Synchronized
    public List<QueuedDownload> getQueuedDownloads() {
        return getData().getQueue().stream()
                .filter(item -> item.getStatus() == DownloadStatus.QUEUED)
                .sorted(QUEUE_ORDER)
                .collect(Collectors.toList());
    }

    @Override
    @Synchronized
    public List<QueuedDownload> getAllQueueItems() {
        return getData().getQueue().stream()
                .sorted(QUEUE_ORDER)
                .collect(Collectors.toList());
    }

    @Override
    @Synchronized
    public Optional<QueuedDownload> getNextQueuedDownload() {
        return getQueuedDownloads().stream().findFirst();
    }

    @Override
    @Synchronized
    public void updateQueueStatus(long queueId, DownloadStatus status, String errorMessage) {
        long now = clock.millis();
        replaceQueueItem(queueId, item -> {
            QueuedDownload.QueuedDownloadBuilder builder = item.toBuilder()
                    .status(status)
                    .errorMessage(errorMessage);
            if (status == DownloadStatus.DOWNLOADING && item.getStartedAt() == null) {
                builder.startedAt(now).lastProgressAt(now);
            }
            if (status.isTerminal()) {
                builder.completedAt(now);
            }
            return builder.build();
        });
        save();
    }

    @Override
    @Synchronized
    public void updateQueueProgressBatch(List<ProgressUpdate> updates) {
        if (updates.isEmpty()) {
            return;
        }

        long now = clock.millis();
        for (ProgressUpdate update : updates) {
            if (getQueueItem(update.getQueueId()).isEmpty()) {
                JsonOfflineRepository.log.debug("Skipping progress for removed queue item {}", update.getQueueId());
                continue;
            }
            replaceQueueItem(update.getQueueId(), item -> item.toBuilder()
                    .progressCurrent(update.getProgressCurrent())
                    .progressTotal(update.getProgressTotal())
                    .lastProgressAt(now)
                    .build());
        }
        save();
    }

    @Override
    @Synchronized
    public void resetQueueItem(long queueId) {
        replaceQueueItem(queueId, item -> item.toBuilder()
                .status(DownloadStatus.QUEUED)
                .errorMessage(null)
                .progressCurrent(0)
                .progressTotal(0)
                .startedAt(null)
                .completedAt(null)
                .lastProgressAt(null)
                .build());
        save();
    }

    @Override
    @Synchronized
    public void deleteQueueItem(long queueId) {
        if (getData().getQueue().removeIf(item -> item.getId() == queueId)) {
            save();
        }
    }

    @Override
    @Synchronized
    public void moveQueueItemToHistory(long queueId) {
        QueuedDownload item = getQueueItem(queueId)
                .orElseThrow(() -> new QueueItemNotFoundException(queueId));

        Store store = getData();
        long historyId = store.getNextHistoryId();
        store.setNextHistoryId(historyId + 1);
        store.getHistory().add(DownloadHistoryItem.from(historyId, item));
        store.getQueue().removeIf(queued -> queued.getId() == queueId);
        save();
    }

    @Override
    @Synchronized
    public void saveManga(OfflineMangaRecord manga) {
        List<OfflineMangaRecord> rows = getData().getManga();
        rows.removeIf(row -> sameManga(row, manga.getExtensionId(), manga.getMangaId()));
        rows.add(manga);
        save();
    }

    @Override
    @Synchronized
    public Optional<OfflineMangaRecord> getManga(String extensionId, String mangaId) {
        return getData().getManga().stream()
                .filter(row -> sameManga(row, extensionId, mangaId))
                .findFirst();
    }

    @Override
    @Synchronized
    public List<OfflineMangaRecord> getAllManga() {
        return getData().getManga().stream()
                .sorted(Comparator.comparingLong(OfflineMangaRecord::getDownloadedAt).reversed())
                .collect(Collectors.toList());
    }

    @Override
    @Synchronized
    public void deleteManga(String extensionId, String mangaId) {
        getData().getManga().removeIf(row -> sameManga(row, extensionId, mangaId));
        getData().getChapters().removeIf(row -> row.getExtensionId().equals(extensionId) && row.getMangaId().equals(mangaId));
        save();
    }

    @Override
    @Synchronized
    public void saveChapter(OfflineChapterRecord chapter) {
        List<OfflineChapterRecord> rows = getData().getChapters();
        rows.removeIf(row -> sameChapter(row, chapter.getExtensionId(), chapter.getMangaId(), chapter.getChapterId()));
        rows.add(chapter);
        save();
    }

    @Override
    @Synchronized
    public Optional<OfflineChapterRecord> getChapter(String extensionId, String mangaId, String chapterId) {
        return getData().getChapters().stream()
                .filter(row -> sameChapter(row, extensionId, mangaId, chapterId))
                .findFirst();
    }

    @Override
    @Synchronized
    public List<OfflineChapterRecord> getChapters(String extensionId, String mangaId) {
        return getData().getChapters().stream()
                .filter(row -> row.getExtensionId().equals(extensionId) && row.getMangaId().equals(mangaId))
                .sorted(Comparator.comparing(OfflineChapterRecord::getFolderName))
                .collect(Collectors.toList());
    }

    @Override
    @Synchronized
    public void deleteChapter(String extensionId, String mangaId, String chapterId) {
        if (getData().getChapters().removeIf(row -> sameChapter(row, extensionId, mangaId, chapterId))) {
            save();
        }
    }

    @Override
    @Synchronized
    public List<DownloadHistoryItem> getDownloadHistory(Integer limit) {
        return getData().getHistory().stream()
                .sorted(Comparator.comparingLong(DownloadHistoryItem::getCompletedAt)
                        .thenComparingLong(DownloadHistoryItem::getId)
                        .reversed())
                .limit(limit != null && limit > 0 ? limit : Long.MAX_VALUE)
                .collect(Collectors.toList());
    }

    @Override
    @Synchronized
    public void deleteHistoryItem(long historyId) {
        if (getData().getHistory().removeIf(item -> item.getId() == historyId)) {
            save();
        }
    }

    @Override
    @Synchronized
    public void clearDownloadHistory() {
        getData().getHistory().clear();
        save();
    }

    @Override
    @Synchronized
    public void clearAllOfflineData() {
        Store store = getData();
        store.getQueue().clear();
        store.getHistory().clear();
        store.getManga().clear();
        store.getChapters().clear();
        save();
    }

    private void replaceQueueItem(long queueId, UnaryOperator<QueuedDownload> change) {
        List<QueuedDownload> queue = getData().getQueue();
        for (int i = 0; i < queue.size(); i++) {
            if (queue.get(i).getId() == queueId) {
                queue.set(i, change.apply(queue.get(i)));
                return;
            }
        }
        throw new QueueItemNotFoundException(queueId);
    }

    private static boolean sameManga(OfflineMangaRecord row, String extensionId, String mangaId) {
        return row.getExtensionId().equals(extensionId) && row.getMangaId().equals(mangaId);
    }

    private static boolean sameChapter(OfflineChapterRecord row, String extensionId, String mangaId, String chapterId) {
        return row.getExtensionId().equals(extensionId)
                && row.getMangaId().equals(mangaId)
                && row.getChapterId().equals(chapterId);
    }

    private void save() {
        try {
            Json.write(dbPath, getData());
        } catch (IOException e) {
            throw new RepositoryException("Failed to save offline repository", e);
        }
    }

}
