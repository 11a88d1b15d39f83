package ca.purps.offlinestorage.downloader;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import ca.purps.offlinestorage.catalog.CatalogSource;
import ca.purps.offlinestorage.catalog.ChapterSummary;
import ca.purps.offlinestorage.catalog.MangaDetails;
import ca.purps.offlinestorage.catalog.PageInfo;
import ca.purps.offlinestorage.config.DownloadOptions;
import ca.purps.offlinestorage.event.EventEmitter;
import ca.purps.offlinestorage.event.OfflineStorageEvent;
import ca.purps.offlinestorage.exception.DownloadException;
import ca.purps.offlinestorage.metrics.PerformanceMetricsTracker;
import ca.purps.offlinestorage.model.DownloadStatus;
import ca.purps.offlinestorage.model.OfflineChapterMetadata;
import ca.purps.offlinestorage.model.OfflineChapterPages;
import ca.purps.offlinestorage.model.OfflineMangaMetadata;
import ca.purps.offlinestorage.model.OfflinePageMetadata;
import ca.purps.offlinestorage.model.ProgressUpdate;
import ca.purps.offlinestorage.model.QueuedDownload;
import ca.purps.offlinestorage.repository.MetadataStore;
import ca.purps.offlinestorage.repository.OfflineChapterRecord;
import ca.purps.offlinestorage.repository.OfflineMangaRecord;
import ca.purps.offlinestorage.repository.OfflineRepository;
import ca.purps.offlinestorage.utility.FileSystemUtils;
import ca.purps.offlinestorage.utility.OfflinePaths;
import ca.purps.offlinestorage.utility.OfflinePaths.ChapterPaths;
import ca.purps.offlinestorage.utility.OfflinePaths.MangaPaths;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Drains the download queue. A polling task starts up to {@code concurrency} items, each on its own
 * thread; the pages of a chapter are fetched {@code chapterConcurrency} at a time.
 */
@Slf4j
public class DownloadWorker implements AutoCloseable {

    static final String CANCELLED_MESSAGE = "Cancelled by user";

    private final Path dataDir;
    private final OfflineRepository repository;
    private final MetadataStore metadataStore;
    private final CatalogSource catalog;
    private final ImageDownloader imageDownloader;
    private final ProgressBatcher progressBatcher;
    private final PerformanceMetricsTracker metrics;
    private final EventEmitter events;
    private final DownloadOptions options;
    private final Clock clock;

    private final ScheduledExecutorService scheduler;
    private final ExecutorService itemExecutor;
    private final ExecutorService pageExecutor;

    private final Map<Long, Future<?>> activeDownloads = new ConcurrentHashMap<>();
    private final Set<Long> cancelled = ConcurrentHashMap.newKeySet();

    private ScheduledFuture<?> pollingTask;

    @Builder
    private DownloadWorker(
            @NonNull Path dataDir,
            @NonNull OfflineRepository repository,
            @NonNull MetadataStore metadataStore,
            @NonNull CatalogSource catalog,
            @NonNull ImageDownloader imageDownloader,
            @NonNull ProgressBatcher progressBatcher,
            @NonNull PerformanceMetricsTracker metrics,
            @NonNull EventEmitter events,
            @NonNull DownloadOptions options,
            @NonNull ScheduledExecutorService scheduler,
            Clock clock) {
        this.dataDir = dataDir;
        this.repository = repository;
        this.metadataStore = metadataStore;
        this.catalog = catalog;
        this.imageDownloader = imageDownloader;
        this.progressBatcher = progressBatcher;
        this.metrics = metrics;
        this.events = events;
        this.options = options;
        this.scheduler = scheduler;
        this.clock = clock != null ? clock : Clock.systemUTC();

        this.itemExecutor = Executors.newFixedThreadPool(Math.max(1, options.getConcurrency()));
        this.pageExecutor = Executors.newFixedThreadPool(
                Math.max(1, options.getConcurrency()) * Math.max(1, options.getChapterConcurrency()));
    }

    public synchronized void start() {
        if (pollingTask != null) {
            DownloadWorker.log.debug("Download worker already running");
            return;
        }
        pollingTask = scheduler.scheduleWithFixedDelay(this::pollQueue, 0, options.getPollingIntervalMs(), TimeUnit.MILLISECONDS);
        DownloadWorker.log.info("Download worker started");
    }

    /**
     * Stops picking up new items; transfers already running are left to finish.
     */
    public synchronized void stop() {
        if (pollingTask == null) {
            return;
        }
        pollingTask.cancel(false);
        pollingTask = null;
        DownloadWorker.log.info("Download worker stopped");
    }

    public synchronized boolean isActive() {
        return pollingTask != null;
    }

    public List<Long> getActiveDownloads() {
        return activeDownloads.keySet().stream().sorted().collect(Collectors.toList());
    }

    public boolean isDownloading(long queueId) {
        return activeDownloads.containsKey(queueId);
    }

    /**
     * Interrupts the transfer of {@code queueId} if this worker is running it. The caller owns the
     * status change; the worker will not report the item as failed.
     */
    public boolean cancel(long queueId) {
        Future<?> future = activeDownloads.get(queueId);
        if (future == null) {
            return false;
        }
        cancelled.add(queueId);
        progressBatcher.remove(queueId);
        future.cancel(true);
        return true;
    }

    /**
     * Starts queued items until the concurrency limit is reached. Runs on the scheduler thread.
     */
    void pollQueue() {
        try {
            synchronized (this) {
                if (pollingTask == null) {
                    return;
                }
            }

            while (activeDownloads.size() < options.getConcurrency()) {
                QueuedDownload item = repository.getQueuedDownloads().stream()
                        .filter(queued -> !activeDownloads.containsKey(queued.getId()))
                        .findFirst()
                        .orElse(null);
                if (item == null) {
                    break;
                }

                // registered before the status flips so a DOWNLOADING row is never seen without its transfer
                CompletableFuture<Boolean> claimed = new CompletableFuture<>();
                Future<?> future = itemExecutor.submit(() -> {
                    if (claimed.join()) {
                        runDownload(item);
                    }
                });
                activeDownloads.put(item.getId(), future);
                try {
                    repository.updateQueueStatus(item.getId(), DownloadStatus.DOWNLOADING, null);
                } catch (RuntimeException e) {
                    activeDownloads.remove(item.getId());
                    claimed.complete(false);
                    throw e;
                }
                claimed.complete(true);
            }
        } catch (RuntimeException e) {
            DownloadWorker.log.error("Error in download queue processing", e);
        }
    }

    private void runDownload(QueuedDownload item) {
        try {
            downloadItem(item);
        } catch (RuntimeException e) {
            handleDownloadError(item, e);
        } finally {
            cancelled.remove(item.getId());
            activeDownloads.remove(item.getId());
        }
    }

    private void downloadItem(QueuedDownload item) {
        DownloadWorker.log.info("Downloading queue item {} ({} {})", item.getId(), item.getMangaSlug(),
                item.isChapterDownload() ? item.getChapterId() : "all chapters");
        metrics.downloadStarted(item.getId());
        events.emit(OfflineStorageEvent.started(item.getId(), item.getMangaId(), item.getChapterId()));

        int pages = item.isChapterDownload() ? downloadChapter(item) : downloadManga(item);
        if (cancelled.contains(item.getId())) {
            throw new DownloadException(CANCELLED_MESSAGE);
        }

        progressBatcher.flush();
        repository.updateQueueStatus(item.getId(), DownloadStatus.COMPLETED, null);
        repository.moveQueueItemToHistory(item.getId());
        metrics.downloadCompleted(item.getId(), pages);
        events.emit(OfflineStorageEvent.completed(item.getId(), item.getMangaId(), item.getChapterId()));
        DownloadWorker.log.info("Completed queue item {} ({} pages)", item.getId(), pages);
    }

    private int downloadChapter(QueuedDownload item) {
        MangaDetails manga = catalog.fetchManga(item.getExtensionId(), item.getMangaId());
        ChapterSummary chapter = manga.findChapter(item.getChapterId())
                .orElseThrow(() -> new DownloadException(String.format("Chapter %s not found in manga %s",
                        item.getChapterId(), item.getMangaId())));

        String mangaSlug = OfflinePaths.sanitizeSlug(manga.slugSource());
        ensureMangaMetadata(item.getExtensionId(), manga, mangaSlug);

        List<PageInfo> pages = catalog.fetchChapterPages(item.getExtensionId(), item.getMangaId(), chapter.getId());
        if (pages == null || pages.isEmpty()) {
            throw new DownloadException("No pages found for this chapter");
        }

        reportProgress(item, chapter.getId(), 0, pages.size());
        downloadChapterPages(item.getId(), item.getExtensionId(), mangaSlug, manga.getId(), chapter, pages,
                (current, total) -> reportProgress(item, chapter.getId(), current, total));
        return pages.size();
    }

    private int downloadManga(QueuedDownload item) {
        MangaDetails manga = catalog.fetchManga(item.getExtensionId(), item.getMangaId());
        String mangaSlug = OfflinePaths.sanitizeSlug(manga.slugSource());
        ensureMangaMetadata(item.getExtensionId(), manga, mangaSlug);

        List<ChapterSummary> chapters = manga.getChapters().stream()
                .filter(chapter -> repository.getChapter(item.getExtensionId(), manga.getId(), chapter.getId()).isEmpty())
                .collect(Collectors.toList());

        int totalPages = 0;
        for (int i = 0; i < chapters.size(); i++) {
            ChapterSummary chapter = chapters.get(i);
            List<PageInfo> pages = catalog.fetchChapterPages(item.getExtensionId(), item.getMangaId(), chapter.getId());
            if (pages == null || pages.isEmpty()) {
                DownloadWorker.log.warn("No pages for chapter {} of {}, skipping", chapter.getId(), mangaSlug);
                continue;
            }

            int chapterIndex = i;
            int chapterCount = chapters.size();
            downloadChapterPages(item.getId(), item.getExtensionId(), mangaSlug, manga.getId(), chapter, pages, (current, total) -> {
                double overall = (chapterIndex + (double) current / total) / chapterCount;
                reportProgress(item, chapter.getId(), (int) Math.floor(overall * chapterCount * 100), chapterCount * 100);
            });
            totalPages += pages.size();

            if (options.getChapterDelayMs() > 0 && i < chapters.size() - 1) {
                pause(options.getChapterDelayMs());
            }
        }
        return totalPages;
    }

    private void reportProgress(QueuedDownload item, String chapterId, int current, int total) {
        if (cancelled.contains(item.getId())) {
            return;
        }
        progressBatcher.update(ProgressUpdate.builder()
                .queueId(item.getId())
                .mangaId(item.getMangaId())
                .chapterId(chapterId)
                .progressCurrent(current)
                .progressTotal(total)
                .build());
    }

    private interface PageProgress {
        void onProgress(int current, int total);
    }

    private void downloadChapterPages(long queueId, String extensionId, String mangaSlug, String mangaId, ChapterSummary chapter,
            List<PageInfo> pages, PageProgress progress) {
        String folderName = OfflinePaths.generateChapterFolderName(chapter.getNumber() != null ? chapter.getNumber() : chapter.getId());
        ChapterPaths chapterPaths = OfflinePaths.buildChapterPaths(dataDir, extensionId, mangaSlug, folderName);
        createDirectory(chapterPaths.getPagesDir());

        List<OfflinePageMetadata> pageMetadata = new ArrayList<>();
        int batchSize = Math.max(1, options.getChapterConcurrency());
        int completed = 0;
        List<CompletableFuture<OfflinePageMetadata>> batch = List.of();

        try {
            for (int i = 0; i < pages.size(); i += batchSize) {
                if (cancelled.contains(queueId)) {
                    throw new DownloadException(CANCELLED_MESSAGE);
                }
                if (Thread.currentThread().isInterrupted()) {
                    throw new DownloadException("Download interrupted");
                }

                batch = pages.subList(i, Math.min(i + batchSize, pages.size()))
                        .stream()
                        .map(page -> CompletableFuture.supplyAsync(() -> downloadPage(queueId, page, chapterPaths), pageExecutor))
                        .collect(Collectors.toList());

                for (CompletableFuture<OfflinePageMetadata> future : batch) {
                    pageMetadata.add(await(future));
                    completed++;
                    progress.onProgress(completed, pages.size());
                }
            }
        } catch (RuntimeException e) {
            if (cancelled.contains(queueId)) {
                discardChapter(batch, chapterPaths);
            }
            throw e;
        }

        pageMetadata.sort((a, b) -> Integer.compare(a.getIndex(), b.getIndex()));
        long now = clock.millis();
        metadataStore.writeChapterPages(extensionId, mangaSlug, OfflineChapterPages.builder()
                .downloadedAt(now)
                .chapterId(chapter.getId())
                .mangaId(mangaId)
                .folderName(folderName)
                .pages(pageMetadata)
                .build());

        long chapterSize = dirSize(chapterPaths.getChapterDir());
        metadataStore.upsertChapter(extensionId, mangaSlug, OfflineChapterMetadata.builder()
                .chapterId(chapter.getId())
                .slug(OfflinePaths.sanitizeSlug(chapter.getNumber() != null ? chapter.getNumber() : chapter.getId()))
                .number(chapter.getNumber())
                .title(chapter.getTitle())
                .displayTitle(chapter.displayTitle())
                .volume(chapter.getVolume())
                .publishedAt(chapter.getPublishedAt())
                .languageCode(chapter.getLanguageCode())
                .scanlators(chapter.getScanlators())
                .folderName(folderName)
                .totalPages(pages.size())
                .downloadedAt(now)
                .sizeBytes(chapterSize)
                .build(), now);

        repository.saveChapter(OfflineChapterRecord.builder()
                .extensionId(extensionId)
                .mangaId(mangaId)
                .chapterId(chapter.getId())
                .chapterNumber(chapter.getNumber())
                .chapterTitle(chapter.getTitle())
                .folderName(folderName)
                .totalPages(pages.size())
                .downloadedAt(now)
                .sizeBytes(chapterSize)
                .build());
        metrics.databaseWrite();

        MangaPaths mangaPaths = OfflinePaths.buildMangaPaths(dataDir, extensionId, mangaSlug);
        repository.getManga(extensionId, mangaId).ifPresent(manga -> repository.saveManga(manga.toBuilder()
                .lastUpdatedAt(now)
                .totalSizeBytes(dirSize(mangaPaths.getMangaDir()))
                .build()));
        metrics.databaseWrite();
    }

    /**
     * Waits for the pages still in flight, then removes the half-written chapter folder.
     */
    private void discardChapter(List<CompletableFuture<OfflinePageMetadata>> inFlight, ChapterPaths chapterPaths) {
        CompletableFuture.allOf(inFlight.toArray(CompletableFuture[]::new))
                .handle((result, error) -> null)
                .join();
        try {
            FileSystemUtils.deleteDir(chapterPaths.getChapterDir());
            DownloadWorker.log.info("Removed partial chapter {}", chapterPaths.getChapterDir());
        } catch (IOException e) {
            DownloadWorker.log.warn("Failed to remove partial chapter {}", chapterPaths.getChapterDir(), e);
        }
    }

    private OfflinePageMetadata downloadPage(long queueId, PageInfo page, ChapterPaths chapterPaths) {
        if (cancelled.contains(queueId)) {
            throw new DownloadException(CANCELLED_MESSAGE);
        }
        DownloadedImage image = imageDownloader.downloadPage(page.getUrl(), chapterPaths.getPagesDir(), page.getIndex());
        return OfflinePageMetadata.builder()
                .index(page.getIndex())
                .originalUrl(page.getUrl())
                .filename(image.getFilename())
                .width(page.getWidth())
                .height(page.getHeight())
                .sizeBytes(image.getSizeBytes())
                .mimeType(image.getMimeType())
                .build();
    }

    /**
     * Writes {@code metadata.json}, the cover and the repository row the first time a manga is
     * downloaded; afterwards only refreshes the timestamps.
     */
    private void ensureMangaMetadata(String extensionId, MangaDetails manga, String mangaSlug) {
        long now = clock.millis();
        MangaPaths paths = OfflinePaths.buildMangaPaths(dataDir, extensionId, mangaSlug);

        if (metadataStore.updateManga(extensionId, mangaSlug, metadata -> metadata.toBuilder().lastUpdatedAt(now).build()).isPresent()) {
            return;
        }

        createDirectory(paths.getChaptersDir());

        if (manga.getCoverUrl() != null && !manga.getCoverUrl().isBlank()) {
            try {
                imageDownloader.downloadTo(manga.getCoverUrl(), paths.getCoverFile());
            } catch (DownloadException e) {
                DownloadWorker.log.warn("Failed to download cover for {}: {}", mangaSlug, e.getMessage());
            }
        }

        metadataStore.writeManga(OfflineMangaMetadata.builder()
                .downloadedAt(now)
                .lastUpdatedAt(now)
                .mangaId(manga.getId())
                .slug(mangaSlug)
                .extensionId(extensionId)
                .title(manga.getTitle())
                .description(manga.getDescription())
                .coverUrl(manga.getCoverUrl())
                .coverPath(OfflinePaths.COVER_FILE)
                .authors(manga.getAuthors())
                .artists(manga.getArtists())
                .genres(manga.getGenres())
                .tags(manga.getTags())
                .rating(manga.getRating())
                .year(manga.getYear())
                .status(manga.getStatus())
                .demographic(manga.getDemographic())
                .altTitles(manga.getAltTitles())
                .catalogChapterCount(manga.getChapters().size())
                .build());

        repository.saveManga(OfflineMangaRecord.builder()
                .extensionId(extensionId)
                .mangaId(manga.getId())
                .mangaSlug(mangaSlug)
                .title(manga.getTitle())
                .downloadPath(paths.getMangaDir().toString())
                .downloadedAt(now)
                .lastUpdatedAt(now)
                .lastAccessedAt(now)
                .totalSizeBytes(dirSize(paths.getMangaDir()))
                .build());
        metrics.databaseWrite();
    }

    private void handleDownloadError(QueuedDownload item, RuntimeException error) {
        progressBatcher.remove(item.getId());
        metrics.downloadFailed(item.getId());

        if (cancelled.contains(item.getId())) {
            DownloadWorker.log.info("Queue item {} cancelled", item.getId());
            return;
        }

        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        DownloadWorker.log.error("Download failed for queue item {} ({}): {}", item.getId(), item.getMangaSlug(), message, error);

        repository.updateQueueStatus(item.getId(), DownloadStatus.FAILED, message);
        events.emit(OfflineStorageEvent.failed(item.getId(), item.getMangaId(), item.getChapterId(), message));
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            // the page task keeps running; discardChapter waits for it
            Thread.currentThread().interrupt();
            throw new DownloadException("Download interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new DownloadException("Page download failed", e.getCause());
        }
    }

    private static void pause(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DownloadException("Download interrupted", e);
        }
    }

    private static void createDirectory(Path path) {
        try {
            FileSystemUtils.ensureDir(path);
        } catch (IOException e) {
            throw new DownloadException("Failed to create directory: " + path, e);
        }
    }

    private static long dirSize(Path path) {
        try {
            return FileSystemUtils.dirSize(path);
        } catch (IOException e) {
            DownloadWorker.log.warn("Failed to measure {}: {}", path, e.getMessage());
            return 0;
        }
    }

    @Override
    public void close() {
        stop();
        itemExecutor.shutdownNow();
        pageExecutor.shutdownNow();
        try {
            if (!itemExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                DownloadWorker.log.warn("Download threads did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

}
