package ca.purps.offlinestorage.downloader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.stream.Collectors;

import ca.purps.offlinestorage.cache.MetadataCache;
import ca.purps.offlinestorage.catalog.CachingCatalogSource;
import ca.purps.offlinestorage.catalog.CatalogSource;
import ca.purps.offlinestorage.catalog.ChapterSummary;
import ca.purps.offlinestorage.catalog.MangaDetails;
import ca.purps.offlinestorage.config.DownloadOptions;
import ca.purps.offlinestorage.event.EventEmitter;
import ca.purps.offlinestorage.event.OfflineStorageEvent;
import ca.purps.offlinestorage.event.OfflineStorageEventListener;
import ca.purps.offlinestorage.exception.ChapterAlreadyDownloadedException;
import ca.purps.offlinestorage.exception.InvalidQueueStateException;
import ca.purps.offlinestorage.exception.OfflineContentNotFoundException;
import ca.purps.offlinestorage.exception.OfflineStorageException;
import ca.purps.offlinestorage.exception.QueueItemNotFoundException;
import ca.purps.offlinestorage.exception.RepositoryException;
import ca.purps.offlinestorage.metrics.PerformanceMetrics;
import ca.purps.offlinestorage.metrics.PerformanceMetricsTracker;
import ca.purps.offlinestorage.model.ChapterCountValidation;
import ca.purps.offlinestorage.model.DownloadHistoryItem;
import ca.purps.offlinestorage.model.DownloadProgress;
import ca.purps.offlinestorage.model.DownloadStatus;
import ca.purps.offlinestorage.model.MangaStorageInfo;
import ca.purps.offlinestorage.model.OfflineChapterMetadata;
import ca.purps.offlinestorage.model.OfflineChapterPages;
import ca.purps.offlinestorage.model.OfflineMangaMetadata;
import ca.purps.offlinestorage.model.ProgressUpdate;
import ca.purps.offlinestorage.model.QueuedDownload;
import ca.purps.offlinestorage.model.StorageStats;
import ca.purps.offlinestorage.repository.MetadataStore;
import ca.purps.offlinestorage.repository.OfflineChapterRecord;
import ca.purps.offlinestorage.repository.OfflineMangaRecord;
import ca.purps.offlinestorage.repository.OfflineRepository;
import ca.purps.offlinestorage.utility.FileSystemUtils;
import ca.purps.offlinestorage.utility.OfflinePaths;
import ca.purps.offlinestorage.utility.OfflinePaths.ChapterPaths;
import ca.purps.offlinestorage.utility.OfflinePaths.MangaPaths;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Everything the worker process can be asked to do: queue management, queries over the offline
 * library, deletes and metadata maintenance. Owns the download worker and its collaborators.
 */
@Slf4j
public class OfflineStorageManager implements AutoCloseable {

    static final String CANCELLED_MESSAGE = "Cancelled by user";

    private static final List<String> COVER_CANDIDATES = List.of("cover.webp", "cover.png", "cover.jpeg", "cover.jpg");

    @Getter
    private final Path dataDir;
    private final OfflineRepository repository;
    private final MetadataStore metadataStore;
    private final CachingCatalogSource catalog;
    private final DownloadOptions options;
    private final Clock clock;

    @Getter
    private final PerformanceMetricsTracker metrics;
    @Getter
    private final EventEmitter events = new EventEmitter();
    private final MetadataCache metadataCache;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService syncExecutor;
    private final ProgressBatcher progressBatcher;
    private final DownloadWorker worker;

    @Builder
    private OfflineStorageManager(
            @NonNull Path dataDir,
            @NonNull OfflineRepository repository,
            @NonNull CatalogSource catalogSource,
            @NonNull PageFetcher pageFetcher,
            DownloadOptions options,
            Clock clock) {
        this.dataDir = dataDir;
        this.repository = repository;
        this.options = options != null ? options : DownloadOptions.defaults();
        this.clock = clock != null ? clock : Clock.systemUTC();

        this.metrics = new PerformanceMetricsTracker(this.clock);
        this.metadataStore = new MetadataStore(dataDir);
        this.metadataCache = new MetadataCache(this.options.getCacheMaxSize(), this.options.getCacheTtlMs(), this.clock);
        this.catalog = new CachingCatalogSource(catalogSource, metadataCache, metrics);

        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> daemon(runnable, "offline-storage-scheduler"));
        this.syncExecutor = Executors.newSingleThreadExecutor(runnable -> daemon(runnable, "offline-storage-sync"));

        this.events.on(event -> metrics.eventEmitted());
        this.progressBatcher = new ProgressBatcher(this::persistProgress,
                this.options.getProgressFlushIntervalMs(), this.options.isFlushProgressOnComplete(), scheduler);

        this.worker = DownloadWorker.builder()
                .dataDir(dataDir)
                .repository(repository)
                .metadataStore(metadataStore)
                .catalog(catalog)
                .imageDownloader(new ImageDownloader(pageFetcher, this.options, metrics))
                .progressBatcher(progressBatcher)
                .metrics(metrics)
                .events(events)
                .options(this.options)
                .scheduler(scheduler)
                .clock(this.clock)
                .build();
    }

    private static Thread daemon(Runnable runnable, String name) {
        Thread thread = new Thread(runnable, name);
        thread.setDaemon(true);
        return thread;
    }

    private void persistProgress(ProgressUpdate update) {
        repository.updateQueueProgressBatch(List.of(update));
        metrics.databaseBatchWrite(1);
        events.emit(OfflineStorageEvent.progress(update));
    }

    public Runnable on(OfflineStorageEventListener listener) {
        return events.on(listener);
    }

    public void start() {
        try {
            FileSystemUtils.ensureDir(OfflinePaths.offlineRoot(dataDir));
        } catch (IOException e) {
            throw new RepositoryException("Failed to create offline directory", e);
        }
        worker.start();
    }

    public void stop() {
        worker.stop();
        progressBatcher.flush();
    }

    public boolean isActive() {
        return worker.isActive();
    }

    public List<Long> getActiveDownloads() {
        return worker.getActiveDownloads();
    }

    public long queueChapter(String extensionId, String mangaId, String chapterId, int priority) {
        if (repository.getChapter(extensionId, mangaId, chapterId).isPresent()) {
            throw new ChapterAlreadyDownloadedException(String.format("Chapter %s of %s is already downloaded", chapterId, mangaId));
        }

        MangaDetails manga = catalog.fetchManga(extensionId, mangaId);
        Optional<ChapterSummary> chapter = manga.findChapter(chapterId);

        long queueId = repository.queueDownloads(List.of(queueEntry(extensionId, manga, chapterId, chapter.orElse(null), priority))).get(0);
        metrics.databaseWrite();
        events.emit(OfflineStorageEvent.queued(List.of(queueId), mangaId, chapterId));
        OfflineStorageManager.log.info("Queued chapter {} of {} as {}", chapterId, mangaId, queueId);
        return queueId;
    }

    /**
     * Queues every chapter of the manga (or only {@code chapterIds}) that is not downloaded yet.
     *
     * @return ids of the new queue items; empty when there was nothing left to download
     */
    public List<Long> queueManga(String extensionId, String mangaId, List<String> chapterIds, int priority) {
        MangaDetails manga = catalog.fetchManga(extensionId, mangaId);
        Set<String> downloaded = repository.getChapters(extensionId, mangaId).stream()
                .map(OfflineChapterRecord::getChapterId)
                .collect(Collectors.toSet());

        List<ChapterSummary> requested = manga.getChapters().stream()
                .filter(chapter -> chapterIds == null || chapterIds.contains(chapter.getId()))
                .collect(Collectors.toList());
        List<ChapterSummary> chapters = requested.stream()
                .filter(chapter -> !downloaded.contains(chapter.getId()))
                .collect(Collectors.toList());

        if (chapters.isEmpty()) {
            OfflineStorageManager.log.info("Nothing to queue for {}", mangaId);
            return List.of();
        }

        List<Long> queueIds = repository.queueDownloads(chapters.stream()
                .map(chapter -> queueEntry(extensionId, manga, chapter.getId(), chapter, priority))
                .collect(Collectors.toList()));
        metrics.databaseBatchWrite(queueIds.size());

        events.emit(OfflineStorageEvent.queued(queueIds, mangaId, chapters.get(0).getId()));
        OfflineStorageManager.log.info("Queued {} chapters of {} (skipped {} already downloaded)",
                queueIds.size(), mangaId, requested.size() - chapters.size());
        return queueIds;
    }

    private QueuedDownload queueEntry(String extensionId, MangaDetails manga, String chapterId, ChapterSummary chapter, int priority) {
        return QueuedDownload.builder()
                .extensionId(extensionId)
                .mangaId(manga.getId())
                .mangaSlug(OfflinePaths.sanitizeSlug(manga.slugSource()))
                .mangaTitle(manga.getTitle())
                .chapterId(chapterId)
                .chapterNumber(chapter != null ? chapter.getNumber() : null)
                .chapterTitle(chapter != null ? chapter.getTitle() : null)
                .priority(priority)
                .queuedAt(clock.millis())
                .build();
    }

    /**
     * Marks the item failed with {@value #CANCELLED_MESSAGE} and stops its transfer. Items that are
     * already failed are left alone.
     */
    public void cancelDownload(long queueId) {
        QueuedDownload item = requireQueueItem(queueId);
        if (item.getStatus().isTerminal()) {
            OfflineStorageManager.log.debug("Queue item {} already {}", queueId, item.getStatus().getWireName());
            return;
        }

        worker.cancel(queueId);
        progressBatcher.remove(queueId);
        repository.updateQueueStatus(queueId, DownloadStatus.FAILED, CANCELLED_MESSAGE);
        metrics.databaseWrite();
        events.emit(OfflineStorageEvent.failed(queueId, item.getMangaId(), item.getChapterId(), CANCELLED_MESSAGE));
    }

    public void retryDownload(long queueId) {
        QueuedDownload item = requireQueueItem(queueId);
        if (item.getStatus() != DownloadStatus.FAILED) {
            throw new InvalidQueueStateException(String.format("Queue item %d is %s, only failed items can be retried",
                    queueId, item.getStatus().getWireName()));
        }

        repository.resetQueueItem(queueId);
        metrics.databaseWrite();
        events.emit(OfflineStorageEvent.retried(queueId, item.getMangaId(), item.getChapterId()));
    }

    /**
     * Requeues downloading items that this process is not transferring, that have not reported
     * progress for {@code frozenThresholdMs}, or that are still under 10% after {@code stalledThresholdMs}.
     */
    public List<Long> retryFrozenDownloads() {
        long now = clock.millis();
        List<Long> retried = new ArrayList<>();

        for (QueuedDownload item : repository.getAllQueueItems()) {
            if (item.getStatus() != DownloadStatus.DOWNLOADING || !isFrozen(item, now)) {
                continue;
            }

            worker.cancel(item.getId());
            progressBatcher.remove(item.getId());
            repository.resetQueueItem(item.getId());
            retried.add(item.getId());
            events.emit(OfflineStorageEvent.retried(item.getId(), item.getMangaId(), item.getChapterId()));
        }

        if (!retried.isEmpty()) {
            OfflineStorageManager.log.info("Requeued {} frozen downloads: {}", retried.size(), retried);
        }
        return retried;
    }

    private boolean isFrozen(QueuedDownload item, long now) {
        if (!worker.isDownloading(item.getId())) {
            return true;
        }

        long startedAt = item.getStartedAt() != null ? item.getStartedAt() : item.getQueuedAt();
        long lastProgressAt = item.getLastProgressAt() != null ? item.getLastProgressAt() : startedAt;

        if (now - lastProgressAt > options.getFrozenThresholdMs()) {
            return true;
        }
        return now - startedAt > options.getStalledThresholdMs()
                && item.getProgressTotal() > 0
                && (double) item.getProgressCurrent() / item.getProgressTotal() < 0.1;
    }

    public List<QueuedDownload> getQueuedDownloads() {
        return repository.getAllQueueItems();
    }

    public Optional<DownloadProgress> getDownloadProgress(long queueId) {
        return repository.getQueueItem(queueId).map(item -> DownloadProgress.builder()
                .queueId(item.getId())
                .mangaTitle(item.getMangaTitle() != null ? item.getMangaTitle() : item.getMangaSlug())
                .chapterTitle(chapterTitle(item))
                .status(item.getStatus())
                .progressCurrent(item.getProgressCurrent())
                .progressTotal(item.getProgressTotal())
                .progressPercent(item.getProgressTotal() > 0
                        ? (int) Math.round(100.0 * item.getProgressCurrent() / item.getProgressTotal())
                        : 0)
                .errorMessage(item.getErrorMessage())
                .build());
    }

    private static String chapterTitle(QueuedDownload item) {
        if (!item.isChapterDownload()) {
            return null;
        }
        return ChapterSummary.builder()
                .id(item.getChapterId())
                .number(item.getChapterNumber())
                .title(item.getChapterTitle())
                .build()
                .displayTitle();
    }

    public List<DownloadHistoryItem> getDownloadHistory(Integer limit) {
        return repository.getDownloadHistory(limit);
    }

    public void deleteHistoryItem(long historyId) {
        repository.deleteHistoryItem(historyId);
        metrics.databaseWrite();
    }

    public void clearDownloadHistory() {
        repository.clearDownloadHistory();
        metrics.databaseWrite();
    }

    public boolean isChapterDownloaded(String extensionId, String mangaId, String chapterId) {
        return repository.getChapter(extensionId, mangaId, chapterId).isPresent();
    }

    public List<OfflineMangaMetadata> getDownloadedManga() {
        List<OfflineMangaMetadata> result = new ArrayList<>();
        for (OfflineMangaRecord manga : repository.getAllManga()) {
            loadMangaMetadata(manga, false).ifPresent(result::add);
        }
        return result;
    }

    public Optional<OfflineMangaMetadata> getMangaMetadata(String extensionId, String mangaId) {
        return repository.getManga(extensionId, mangaId).flatMap(manga -> loadMangaMetadata(manga, false));
    }

    public List<OfflineChapterMetadata> getDownloadedChapters(String extensionId, String mangaId) {
        return getMangaMetadata(extensionId, mangaId)
                .map(OfflineMangaMetadata::getChapters)
                .orElse(List.of());
    }

    public Optional<OfflineChapterPages> getChapterPages(String extensionId, String mangaId, String chapterId) {
        Optional<OfflineMangaRecord> manga = repository.getManga(extensionId, mangaId);
        Optional<OfflineChapterRecord> chapter = repository.getChapter(extensionId, mangaId, chapterId);
        if (manga.isEmpty() || chapter.isEmpty()) {
            return Optional.empty();
        }

        repository.saveManga(manga.get().toBuilder().lastAccessedAt(clock.millis()).build());
        return metadataStore.readChapterPages(extensionId, manga.get().getMangaSlug(), chapter.get().getFolderName());
    }

    /**
     * Resolves a page file of a downloaded chapter. When {@code extensionId} is null the first
     * downloaded manga with that id is used.
     */
    public Optional<Path> getPagePath(String extensionId, String mangaId, String chapterId, String filename) {
        Optional<OfflineMangaRecord> manga = extensionId != null
                ? repository.getManga(extensionId, mangaId)
                : repository.getAllManga().stream().filter(row -> row.getMangaId().equals(mangaId)).findFirst();
        if (manga.isEmpty()) {
            return Optional.empty();
        }

        return repository.getChapter(manga.get().getExtensionId(), mangaId, chapterId)
                .map(chapter -> OfflinePaths.buildChapterPaths(dataDir, chapter.getExtensionId(),
                        manga.get().getMangaSlug(), chapter.getFolderName()))
                .flatMap(paths -> OfflinePaths.resolvePage(paths, filename));
    }

    /**
     * Compares the chapters in {@code metadata.json} with the repository rows and rebuilds the
     * document from local data when they differ.
     */
    public ChapterCountValidation validateMangaChapterCount(String extensionId, String mangaId) {
        Optional<OfflineMangaRecord> manga = repository.getManga(extensionId, mangaId);
        if (manga.isEmpty()) {
            return ChapterCountValidation.builder().valid(true).rebuilt(false).build();
        }

        Optional<OfflineMangaMetadata> metadata = metadataStore.readManga(extensionId, manga.get().getMangaSlug());
        List<OfflineChapterRecord> rows = repository.getChapters(extensionId, mangaId);

        if (metadata.isPresent() && chapterIdsMatch(metadata.get(), rows)) {
            return ChapterCountValidation.builder().valid(true).rebuilt(false).build();
        }

        OfflineStorageManager.log.info("Chapter count mismatch for {}: metadata={}, repository={}", mangaId,
                metadata.map(document -> document.getChapters().size()).orElse(0), rows.size());
        rebuildMangaMetadata(manga.get(), rows, metadata.orElse(null), false);
        return ChapterCountValidation.builder().valid(false).rebuilt(true).build();
    }

    /**
     * Returns the stored document, rebuilding it when it is missing, disagrees with the
     * repository or {@code force} is set.
     */
    private Optional<OfflineMangaMetadata> loadMangaMetadata(OfflineMangaRecord manga, boolean force) {
        List<OfflineChapterRecord> rows = repository.getChapters(manga.getExtensionId(), manga.getMangaId());
        Optional<OfflineMangaMetadata> existing = metadataStore.readManga(manga.getExtensionId(), manga.getMangaSlug());

        if (!force && existing.isPresent() && chapterIdsMatch(existing.get(), rows)) {
            return existing;
        }

        OfflineStorageManager.log.info("Rebuilding metadata for {}: {}", manga.getMangaId(),
                force ? "forced" : existing.isEmpty() ? "metadata missing" : "chapter mismatch");
        return Optional.of(rebuildMangaMetadata(manga, rows, existing.orElse(null), force));
    }

    private static boolean chapterIdsMatch(OfflineMangaMetadata metadata, List<OfflineChapterRecord> rows) {
        Set<String> metadataIds = metadata.getChapters().stream()
                .map(OfflineChapterMetadata::getChapterId)
                .collect(Collectors.toSet());
        Set<String> rowIds = rows.stream()
                .map(OfflineChapterRecord::getChapterId)
                .collect(Collectors.toSet());
        return metadataIds.equals(rowIds);
    }

    /**
     * @param useCatalog also ask the catalog for fresh details; failures fall back to local data
     */
    private OfflineMangaMetadata rebuildMangaMetadata(OfflineMangaRecord manga, List<OfflineChapterRecord> rows,
            OfflineMangaMetadata existing, boolean useCatalog) {
        String extensionId = manga.getExtensionId();
        MangaPaths paths = OfflinePaths.buildMangaPaths(dataDir, extensionId, manga.getMangaSlug());
        long now = clock.millis();

        MangaDetails details = null;
        if (useCatalog) {
            try {
                details = catalog.refreshManga(extensionId, manga.getMangaId());
            } catch (OfflineStorageException e) {
                OfflineStorageManager.log.warn("Unable to fetch catalog details for {}: {}", manga.getMangaId(), e.getMessage());
            }
        }

        Map<String, ChapterSummary> catalogChapters = new LinkedHashMap<>();
        if (details != null) {
            details.getChapters().forEach(chapter -> catalogChapters.put(chapter.getId(), chapter));
        }

        List<OfflineChapterMetadata> chapters = rows.stream()
                .map(row -> buildChapterMetadata(manga, row, catalogChapters.get(row.getChapterId())))
                .collect(Collectors.toList());

        OfflineMangaMetadata.OfflineMangaMetadataBuilder builder = existing != null
                ? existing.toBuilder()
                : OfflineMangaMetadata.builder()
                        .downloadedAt(manga.getDownloadedAt() > 0 ? manga.getDownloadedAt() : now)
                        .mangaId(manga.getMangaId())
                        .slug(manga.getMangaSlug())
                        .extensionId(extensionId)
                        .title(manga.getTitle() != null ? manga.getTitle() : manga.getMangaId());

        if (details != null) {
            builder.title(details.getTitle())
                    .description(details.getDescription())
                    .coverUrl(details.getCoverUrl())
                    .authors(details.getAuthors())
                    .artists(details.getArtists())
                    .genres(details.getGenres())
                    .tags(details.getTags())
                    .rating(details.getRating())
                    .year(details.getYear())
                    .status(details.getStatus())
                    .demographic(details.getDemographic())
                    .altTitles(details.getAltTitles())
                    .catalogChapterCount(details.getChapters().size());
        }

        OfflineMangaMetadata metadata = builder
                .version(OfflineMangaMetadata.SCHEMA_VERSION)
                .lastUpdatedAt(now)
                .coverPath(resolveCoverPath(paths, existing))
                .clearChapters()
                .chapters(chapters)
                .build();
        metadataStore.writeManga(metadata);

        repository.saveManga(manga.toBuilder()
                .lastUpdatedAt(now)
                .totalSizeBytes(dirSize(paths.getMangaDir()))
                .build());
        metrics.databaseWrite();
        return metadata;
    }

    private OfflineChapterMetadata buildChapterMetadata(OfflineMangaRecord manga, OfflineChapterRecord row, ChapterSummary details) {
        ChapterPaths chapterPaths = OfflinePaths.buildChapterPaths(dataDir, manga.getExtensionId(), manga.getMangaSlug(), row.getFolderName());
        Optional<OfflineChapterPages> pages = metadataStore.readChapterPages(manga.getExtensionId(), manga.getMangaSlug(), row.getFolderName());

        String number = details != null && details.getNumber() != null ? details.getNumber() : row.getChapterNumber();
        String title = details != null && details.getTitle() != null ? details.getTitle() : row.getChapterTitle();
        ChapterSummary summary = ChapterSummary.builder().id(row.getChapterId()).number(number).title(title).build();

        String slugSource = number != null ? number : title != null ? title : row.getChapterId();
        String slug;
        try {
            slug = OfflinePaths.sanitizeSlug(slugSource);
        } catch (IllegalArgumentException e) {
            slug = OfflinePaths.sanitizeSlug(row.getChapterId());
        }

        return OfflineChapterMetadata.builder()
                .chapterId(row.getChapterId())
                .slug(slug)
                .number(number)
                .title(title)
                .displayTitle(summary.displayTitle())
                .volume(details != null ? details.getVolume() : null)
                .publishedAt(details != null ? details.getPublishedAt() : null)
                .languageCode(details != null ? details.getLanguageCode() : null)
                .scanlators(details != null ? details.getScanlators() : null)
                .folderName(row.getFolderName())
                .totalPages(pages.map(document -> document.getPages().size()).orElse(row.getTotalPages()))
                .downloadedAt(pages.map(OfflineChapterPages::getDownloadedAt).filter(at -> at > 0).orElse(row.getDownloadedAt()))
                .sizeBytes(row.getSizeBytes() > 0 ? row.getSizeBytes() : dirSize(chapterPaths.getChapterDir()))
                .build();
    }

    private static String resolveCoverPath(MangaPaths paths, OfflineMangaMetadata existing) {
        if (existing != null && existing.getCoverPath() != null
                && Files.exists(paths.getMangaDir().resolve(existing.getCoverPath()))) {
            return existing.getCoverPath();
        }
        return COVER_CANDIDATES.stream()
                .filter(candidate -> Files.exists(paths.getMangaDir().resolve(candidate)))
                .findFirst()
                .orElse(existing != null && existing.getCoverPath() != null ? existing.getCoverPath() : OfflinePaths.COVER_FILE);
    }

    /**
     * Refreshes metadata older than {@code ttlMs} from the catalog, {@code concurrency} manga at a
     * time with {@code delayMs} between batches. Runs in the background; failures are only logged.
     */
    public CompletableFuture<Void> startBackgroundSync(long ttlMs, int concurrency, long delayMs) {
        return CompletableFuture.runAsync(() -> backgroundSync(ttlMs, Math.max(1, concurrency), delayMs), syncExecutor)
                .exceptionally(error -> {
                    OfflineStorageManager.log.error("Background metadata sync failed", error);
                    return null;
                });
    }

    private void backgroundSync(long ttlMs, int concurrency, long delayMs) {
        long now = clock.millis();
        List<OfflineMangaRecord> all = repository.getAllManga();
        List<OfflineMangaRecord> stale = all.stream()
                .filter(manga -> loadMangaMetadata(manga, false)
                        .map(metadata -> now - metadata.getLastUpdatedAt() > ttlMs)
                        .orElse(false))
                .collect(Collectors.toList());

        OfflineStorageManager.log.info("Found {}/{} manga with stale metadata", stale.size(), all.size());

        for (int i = 0; i < stale.size(); i += concurrency) {
            List<CompletableFuture<Void>> batch = stale.subList(i, Math.min(i + concurrency, stale.size())).stream()
                    .map(manga -> CompletableFuture.runAsync(() -> syncManga(manga)))
                    .collect(Collectors.toList());
            CompletableFuture.allOf(batch.toArray(CompletableFuture[]::new)).join();

            if (i + concurrency < stale.size() && delayMs > 0) {
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    OfflineStorageManager.log.info("Background metadata sync interrupted");
                    return;
                }
            }
        }

        OfflineStorageManager.log.info("Background metadata sync complete");
    }

    private void syncManga(OfflineMangaRecord manga) {
        try {
            Integer knownChapters = metadataStore.readManga(manga.getExtensionId(), manga.getMangaSlug())
                    .map(OfflineMangaMetadata::getCatalogChapterCount)
                    .orElse(null);
            Integer currentChapters = loadMangaMetadata(manga, true)
                    .map(OfflineMangaMetadata::getCatalogChapterCount)
                    .orElse(null);

            if (knownChapters != null && currentChapters != null && currentChapters > knownChapters) {
                OfflineStorageManager.log.info("Discovered {} new chapters for {}", currentChapters - knownChapters, manga.getMangaSlug());
                events.emit(OfflineStorageEvent.newChaptersAvailable(manga.getMangaId(), currentChapters - knownChapters));
            }
        } catch (RuntimeException e) {
            OfflineStorageManager.log.error("Failed to sync metadata for {}", manga.getMangaSlug(), e);
        }
    }

    public void deleteChapter(String extensionId, String mangaId, String chapterId) {
        OfflineMangaRecord manga = repository.getManga(extensionId, mangaId)
                .orElseThrow(() -> new OfflineContentNotFoundException("Manga not found in offline storage: " + mangaId));
        OfflineChapterRecord chapter = repository.getChapter(extensionId, mangaId, chapterId)
                .orElseThrow(() -> new OfflineContentNotFoundException("Chapter not found in offline storage: " + chapterId));

        ChapterPaths chapterPaths = OfflinePaths.buildChapterPaths(dataDir, extensionId, manga.getMangaSlug(), chapter.getFolderName());
        deleteDirectory(chapterPaths.getChapterDir());

        repository.deleteChapter(extensionId, mangaId, chapterId);
        metadataStore.removeChapter(extensionId, manga.getMangaSlug(), chapterId, clock.millis());

        MangaPaths mangaPaths = OfflinePaths.buildMangaPaths(dataDir, extensionId, manga.getMangaSlug());
        repository.saveManga(manga.toBuilder().totalSizeBytes(dirSize(mangaPaths.getMangaDir())).build());
        metrics.databaseWrite();

        if (repository.getChapters(extensionId, mangaId).isEmpty()) {
            deleteManga(extensionId, mangaId);
        }

        events.emit(OfflineStorageEvent.chapterDeleted(mangaId, chapterId));
    }

    /**
     * @return bytes freed
     */
    public long deleteManga(String extensionId, String mangaId) {
        OfflineMangaRecord manga = repository.getManga(extensionId, mangaId)
                .orElseThrow(() -> new OfflineContentNotFoundException("Manga not found in offline storage: " + mangaId));

        MangaPaths paths = OfflinePaths.buildMangaPaths(dataDir, extensionId, manga.getMangaSlug());
        long size = dirSize(paths.getMangaDir());
        deleteDirectory(paths.getMangaDir());

        repository.deleteManga(extensionId, mangaId);
        metadataCache.invalidateManga(extensionId, mangaId);
        metrics.databaseWrite();

        events.emit(OfflineStorageEvent.mangaDeleted(mangaId));
        OfflineStorageManager.log.info("Deleted manga {} ({} bytes)", manga.getMangaSlug(), size);
        return size;
    }

    /**
     * Removes every downloaded file plus the queue, the history and all offline rows.
     */
    public void nukeOfflineData() {
        for (Long queueId : worker.getActiveDownloads()) {
            worker.cancel(queueId);
        }

        Path offlineRoot = OfflinePaths.offlineRoot(dataDir);
        deleteDirectory(offlineRoot);
        repository.clearAllOfflineData();
        metadataCache.clear();
        metrics.databaseWrite();

        try {
            FileSystemUtils.ensureDir(offlineRoot);
        } catch (IOException e) {
            throw new RepositoryException("Failed to recreate " + offlineRoot, e);
        }
        OfflineStorageManager.log.warn("All offline data deleted");
    }

    public StorageStats getStorageStats() {
        List<OfflineMangaRecord> manga = repository.getAllManga();
        Map<String, Long> byExtension = new LinkedHashMap<>();
        List<MangaStorageInfo> byManga = new ArrayList<>();
        int chapterCount = 0;
        int pageCount = 0;
        long totalBytes = 0;

        for (OfflineMangaRecord row : manga) {
            List<OfflineChapterRecord> chapters = repository.getChapters(row.getExtensionId(), row.getMangaId());
            chapterCount += chapters.size();
            pageCount += chapters.stream().mapToInt(OfflineChapterRecord::getTotalPages).sum();
            totalBytes += row.getTotalSizeBytes();
            byExtension.merge(row.getExtensionId(), row.getTotalSizeBytes(), Long::sum);

            byManga.add(MangaStorageInfo.builder()
                    .mangaId(row.getMangaId())
                    .mangaSlug(row.getMangaSlug())
                    .title(row.getTitle())
                    .coverPath(OfflinePaths.buildMangaPaths(dataDir, row.getExtensionId(), row.getMangaSlug()).getCoverFile().toString())
                    .extensionId(row.getExtensionId())
                    .chapterCount(chapters.size())
                    .totalBytes(row.getTotalSizeBytes())
                    .downloadedAt(row.getDownloadedAt())
                    .build());
        }

        byManga.sort(Comparator.comparingLong(MangaStorageInfo::getTotalBytes).reversed());
        return StorageStats.builder()
                .totalBytes(totalBytes)
                .mangaCount(manga.size())
                .chapterCount(chapterCount)
                .pageCount(pageCount)
                .byExtension(byExtension)
                .byManga(byManga)
                .build();
    }

    /**
     * Repository rows of every downloaded manga, for callers that pick what to evict.
     */
    public List<OfflineMangaRecord> getOfflineManga() {
        return repository.getAllManga();
    }

    public PerformanceMetrics getMetricsSnapshot() {
        return metrics.getMetrics();
    }

    public void resetMetrics() {
        metrics.reset();
    }

    private QueuedDownload requireQueueItem(long queueId) {
        return repository.getQueueItem(queueId).orElseThrow(() -> new QueueItemNotFoundException(queueId));
    }

    private static void deleteDirectory(Path dir) {
        try {
            FileSystemUtils.deleteDir(dir);
        } catch (IOException e) {
            throw new RepositoryException("Failed to delete " + dir, e);
        }
    }

    private static long dirSize(Path path) {
        try {
            return FileSystemUtils.dirSize(path);
        } catch (IOException e) {
            OfflineStorageManager.log.warn("Failed to measure {}: {}", path, e.getMessage());
            return 0;
        }
    }

    @Override
    public void close() {
        stop();
        worker.close();
        syncExecutor.shutdownNow();
        scheduler.shutdownNow();
        events.clear();
    }

}
