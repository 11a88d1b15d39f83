package ca.purps.offlinestorage.worker;

import java.nio.file.Path;
import java.time.Clock;

import ca.purps.offlinestorage.cleanup.StorageCleaner;
import ca.purps.offlinestorage.cleanup.StorageSettings;
import ca.purps.offlinestorage.downloader.OfflineStorageManager;
import ca.purps.offlinestorage.protocol.MessageCodec;
import ca.purps.offlinestorage.protocol.WorkerCommand;
import ca.purps.offlinestorage.protocol.payload.BackgroundSyncPayload;
import ca.purps.offlinestorage.protocol.payload.ChapterRef;
import ca.purps.offlinestorage.protocol.payload.HistoryIdPayload;
import ca.purps.offlinestorage.protocol.payload.HistoryQuery;
import ca.purps.offlinestorage.protocol.payload.MangaRef;
import ca.purps.offlinestorage.protocol.payload.PagePathPayload;
import ca.purps.offlinestorage.protocol.payload.PingResult;
import ca.purps.offlinestorage.protocol.payload.QueueChapterPayload;
import ca.purps.offlinestorage.protocol.payload.QueueIdPayload;
import ca.purps.offlinestorage.protocol.payload.QueueMangaPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps each command onto the {@link OfflineStorageManager}. Runs inside the worker process.
 */
@Slf4j
@RequiredArgsConstructor
public class CommandDispatcher {

    private final OfflineStorageManager manager;
    private final StorageCleaner cleaner;
    private final Clock clock;

    public CommandDispatcher(OfflineStorageManager manager) {
        this(manager, new StorageCleaner(manager), Clock.systemUTC());
    }

    /**
     * @return the value of the command's result shape, null for commands without a result
     * @throws RuntimeException whatever the manager throws; the caller reports it to the host
     */
    public Object execute(WorkerCommand command) {
        return switch (command.getType()) {
            case START -> {
                CommandDispatcher.log.info("Received start command");
                manager.start();
                yield null;
            }
            case STOP -> {
                CommandDispatcher.log.info("Received stop command");
                manager.stop();
                yield null;
            }
            case PING -> new PingResult(clock.millis());
            case IS_ACTIVE -> manager.isActive();
            case GET_ACTIVE_DOWNLOADS -> manager.getActiveDownloads();

            case QUEUE_CHAPTER -> {
                QueueChapterPayload payload = MessageCodec.payload(command, QueueChapterPayload.class);
                CommandDispatcher.log.info("queue-chapter {}/{}/{}", payload.getExtensionId(), payload.getMangaId(), payload.getChapterId());
                yield manager.queueChapter(payload.getExtensionId(), payload.getMangaId(), payload.getChapterId(), payload.getPriority());
            }
            case QUEUE_MANGA -> {
                QueueMangaPayload payload = MessageCodec.payload(command, QueueMangaPayload.class);
                CommandDispatcher.log.info("queue-manga {}/{}", payload.getExtensionId(), payload.getMangaId());
                yield manager.queueManga(payload.getExtensionId(), payload.getMangaId(), payload.getChapterIds(), payload.getPriority());
            }
            case CANCEL_DOWNLOAD -> {
                manager.cancelDownload(MessageCodec.payload(command, QueueIdPayload.class).getQueueId());
                yield null;
            }
            case RETRY_DOWNLOAD -> {
                manager.retryDownload(MessageCodec.payload(command, QueueIdPayload.class).getQueueId());
                yield null;
            }
            case RETRY_FROZEN_DOWNLOADS -> manager.retryFrozenDownloads();
            case GET_QUEUED_DOWNLOADS -> manager.getQueuedDownloads();
            case GET_DOWNLOAD_PROGRESS -> manager.getDownloadProgress(MessageCodec.payload(command, QueueIdPayload.class).getQueueId())
                    .orElse(null);

            case GET_STORAGE_STATS -> manager.getStorageStats();
            case GET_DOWNLOADED_MANGA -> manager.getDownloadedManga();
            case GET_MANGA_METADATA -> {
                MangaRef ref = MessageCodec.payload(command, MangaRef.class);
                yield manager.getMangaMetadata(ref.getExtensionId(), ref.getMangaId()).orElse(null);
            }
            case GET_DOWNLOADED_CHAPTERS -> {
                MangaRef ref = MessageCodec.payload(command, MangaRef.class);
                yield manager.getDownloadedChapters(ref.getExtensionId(), ref.getMangaId());
            }
            case GET_CHAPTER_PAGES -> {
                ChapterRef ref = MessageCodec.payload(command, ChapterRef.class);
                yield manager.getChapterPages(ref.getExtensionId(), ref.getMangaId(), ref.getChapterId()).orElse(null);
            }
            case IS_CHAPTER_DOWNLOADED -> {
                ChapterRef ref = MessageCodec.payload(command, ChapterRef.class);
                yield manager.isChapterDownloaded(ref.getExtensionId(), ref.getMangaId(), ref.getChapterId());
            }
            case GET_PAGE_PATH -> {
                PagePathPayload payload = MessageCodec.payload(command, PagePathPayload.class);
                yield manager.getPagePath(payload.getExtensionId(), payload.getMangaId(), payload.getChapterId(), payload.getFilename())
                        .map(Path::toString)
                        .orElse(null);
            }

            case DELETE_CHAPTER -> {
                ChapterRef ref = MessageCodec.payload(command, ChapterRef.class);
                manager.deleteChapter(ref.getExtensionId(), ref.getMangaId(), ref.getChapterId());
                yield null;
            }
            case DELETE_MANGA -> {
                MangaRef ref = MessageCodec.payload(command, MangaRef.class);
                manager.deleteManga(ref.getExtensionId(), ref.getMangaId());
                yield null;
            }
            case NUKE_OFFLINE_DATA -> {
                manager.nukeOfflineData();
                yield null;
            }

            case GET_DOWNLOAD_HISTORY -> {
                Integer limit = command.getPayload() != null
                        ? MessageCodec.payload(command, HistoryQuery.class).getLimit()
                        : null;
                yield manager.getDownloadHistory(limit);
            }
            case DELETE_HISTORY_ITEM -> {
                manager.deleteHistoryItem(MessageCodec.payload(command, HistoryIdPayload.class).getHistoryId());
                yield null;
            }
            case CLEAR_DOWNLOAD_HISTORY -> {
                manager.clearDownloadHistory();
                yield null;
            }

            case VALIDATE_MANGA_CHAPTER_COUNT -> {
                MangaRef ref = MessageCodec.payload(command, MangaRef.class);
                yield manager.validateMangaChapterCount(ref.getExtensionId(), ref.getMangaId());
            }
            case START_BACKGROUND_SYNC -> {
                BackgroundSyncPayload payload = MessageCodec.payload(command, BackgroundSyncPayload.class);
                manager.startBackgroundSync(payload.getTtlMs(), payload.getConcurrency(), payload.getDelayMs())
                        .whenComplete((v, e) -> {
                            if (e != null) {
                                CommandDispatcher.log.error("Background metadata sync failed", e);
                            }
                        });
                yield null;
            }

            case GET_METRICS -> manager.getMetricsSnapshot();
            case RESET_METRICS -> {
                manager.resetMetrics();
                yield null;
            }
            case PERFORM_CLEANUP -> cleaner.performCleanup(MessageCodec.payload(command, StorageSettings.class));

            default -> throw new IllegalStateException("Unhandled command: " + command.getType().getWireName());
        };
    }

}
