package ca.purps.offlinestorage.downloader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import org.mockito.Mockito;
import org.slf4j.LoggerFactory;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

import ca.purps.offlinestorage.catalog.CatalogSource;
import ca.purps.offlinestorage.catalog.ChapterSummary;
import ca.purps.offlinestorage.catalog.MangaDetails;
import ca.purps.offlinestorage.catalog.PageInfo;
import ca.purps.offlinestorage.config.DownloadOptions;
import ca.purps.offlinestorage.event.EventType;
import ca.purps.offlinestorage.event.OfflineStorageEvent;
import ca.purps.offlinestorage.exception.ChapterAlreadyDownloadedException;
import ca.purps.offlinestorage.exception.HttpStatusException;
import ca.purps.offlinestorage.exception.InvalidQueueStateException;
import ca.purps.offlinestorage.exception.OfflineContentNotFoundException;
import ca.purps.offlinestorage.exception.QueueItemNotFoundException;
import ca.purps.offlinestorage.model.DownloadStatus;
import ca.purps.offlinestorage.model.OfflineChapterPages;
import ca.purps.offlinestorage.model.OfflineMangaMetadata;
import ca.purps.offlinestorage.model.QueuedDownload;
import ca.purps.offlinestorage.model.StorageStats;
import ca.purps.offlinestorage.repository.JsonOfflineRepository;
import ca.purps.offlinestorage.utility.FileSystemUtils;
import ca.purps.offlinestorage.utility.OfflinePaths;

public class OfflineStorageManagerTest {

    private static final String TEMP_PREFIX = OfflineStorageManagerTest.class.getSimpleName() + "_";
    private static final String EXT = "ext";
    private static final String MANGA = "m1";
    private static final byte[] IMAGE = new byte[] { 1, 2, 3, 4, 5, 6, 7, 8 };

    private Path dataDir;
    private JsonOfflineRepository repository;
    private CatalogSource catalogSource;
    private PageFetcher fetcher;
    private OfflineStorageManager manager;
    private List<OfflineStorageEvent> events;

    @BeforeMethod
    public void beforeMethod() throws IOException {
        dataDir = Files.createTempDirectory(TEMP_PREFIX);
        repository = new JsonOfflineRepository(dataDir.resolve("offline.json"));

        catalogSource = Mockito.mock(CatalogSource.class);
        Mockito.when(catalogSource.fetchManga(EXT, MANGA)).thenReturn(MangaDetails.builder()
                .id(MANGA)
                .slug("Test Manga")
                .title("Test Manga")
                .coverUrl("https://cdn.example.com/cover.jpg")
                .chapter(ChapterSummary.builder().id("c1").number("1").title("Start").build())
                .chapter(ChapterSummary.builder().id("c2").number("2").build())
                .build());
        for (String chapterId : List.of("c1", "c2")) {
            Mockito.when(catalogSource.fetchChapterPages(EXT, MANGA, chapterId)).thenReturn(List.of(
                    PageInfo.builder().index(0).url("https://cdn.example.com/" + chapterId + "/0.jpg").build(),
                    PageInfo.builder().index(1).url("https://cdn.example.com/" + chapterId + "/1.jpg").build()));
        }

        fetcher = Mockito.mock(PageFetcher.class);
        Mockito.when(fetcher.fetch(Mockito.anyString(), Mockito.anyLong())).thenReturn(new FetchedImage(IMAGE, "image/jpeg"));

        manager = buildManager(repository, 3);
    }

    private OfflineStorageManager buildManager(JsonOfflineRepository repo, int chapterConcurrency) {
        OfflineStorageManager built = OfflineStorageManager.builder()
                .dataDir(dataDir)
                .repository(repo)
                .catalogSource(catalogSource)
                .pageFetcher(fetcher)
                .options(DownloadOptions.builder()
                        .pollingIntervalMs(20)
                        .retryAttempts(1)
                        .chapterConcurrency(chapterConcurrency)
                        .progressFlushIntervalMs(50)
                        .build())
                .build();
        events = new CopyOnWriteArrayList<>();
        built.on(events::add);
        return built;
    }

    @AfterMethod
    public void afterMethod() throws IOException {
        manager.close();
        FileSystemUtils.deleteDir(dataDir);
    }

    private static void waitFor(BooleanSupplier condition, String description) throws InterruptedException {
        long deadline = System.currentTimeMillis() + TimeUnit.SECONDS.toMillis(10);
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("Timed out waiting for " + description);
            }
            Thread.sleep(10);
        }
    }

    private boolean hasEvent(EventType type) {
        return events.stream().anyMatch(event -> event.getType() == type);
    }

    private long downloadChapter(String chapterId) throws InterruptedException {
        manager.start();
        long queueId = manager.queueChapter(EXT, MANGA, chapterId, 0);
        waitFor(() -> events.stream().anyMatch(event -> event.getType() == EventType.DOWNLOAD_COMPLETED
                && event.getQueueId() == queueId), "chapter " + chapterId + " to complete");
        return queueId;
    }

    @Test
    public void queuedChapterIsDownloadedToDisk() throws Exception {
        long queueId = downloadChapter("c1");

        assert manager.isChapterDownloaded(EXT, MANGA, "c1");
        assert manager.getQueuedDownloads().isEmpty() : "Completed items leave the queue";
        assert manager.getDownloadHistory(null).get(0).getStatus() == DownloadStatus.COMPLETED;

        Path pages = OfflinePaths.buildChapterPaths(dataDir, EXT, "test-manga", "chapter-0001").getPagesDir();
        assert Files.exists(pages.resolve("page-0000.jpg"));
        assert Files.exists(pages.resolve("page-0001.jpg"));
        assert Files.exists(OfflinePaths.buildMangaPaths(dataDir, EXT, "test-manga").getCoverFile());

        OfflineChapterPages chapterPages = manager.getChapterPages(EXT, MANGA, "c1").orElseThrow();
        assert chapterPages.getPages().size() == 2;
        assert manager.getPagePath(EXT, MANGA, "c1", "page-0001.jpg").isPresent();
        assert manager.getPagePath(null, MANGA, "c1", "page-0001.jpg").isPresent();
        assert manager.getPagePath(EXT, MANGA, "c1", "../metadata.json").isEmpty();

        OfflineMangaMetadata metadata = manager.getMangaMetadata(EXT, MANGA).orElseThrow();
        assert metadata.getChapters().size() == 1;
        assert metadata.getCatalogChapterCount() == 2;

        assert hasEvent(EventType.DOWNLOAD_QUEUED);
        assert events.stream().anyMatch(event -> event.getType() == EventType.DOWNLOAD_STARTED
                && event.getQueueId() == queueId);
    }

    @Test
    public void storageStatsCountDownloadedContent() throws Exception {
        downloadChapter("c1");

        StorageStats stats = manager.getStorageStats();

        assert stats.getMangaCount() == 1;
        assert stats.getChapterCount() == 1;
        assert stats.getPageCount() == 2;
        assert stats.getTotalBytes() >= 2L * IMAGE.length;
        assert stats.getByExtension().containsKey(EXT);
        assert stats.getByManga().get(0).getChapterCount() == 1;
    }

    @Test(expectedExceptions = ChapterAlreadyDownloadedException.class)
    public void queueingDownloadedChapterFails() throws Exception {
        downloadChapter("c1");
        manager.queueChapter(EXT, MANGA, "c1", 0);
    }

    @Test
    public void queueMangaSkipsDownloadedChapters() throws Exception {
        downloadChapter("c1");
        manager.stop();

        List<Long> ids = manager.queueManga(EXT, MANGA, null, 0);

        assert ids.size() == 1;
        assert "c2".equals(manager.getQueuedDownloads().get(0).getChapterId());
    }

    @Test
    public void queueMangaLogsOnlyChaptersItFilteredOut() throws Exception {
        downloadChapter("c1");
        manager.stop();
        Logger logger = (Logger) LoggerFactory.getLogger(OfflineStorageManager.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            manager.queueManga(EXT, MANGA, List.of("c2"), 0);
        } finally {
            logger.detachAppender(appender);
        }

        assert appender.list.stream()
                .map(ILoggingEvent::getFormattedMessage)
                .anyMatch("Queued 1 chapters of m1 (skipped 0 already downloaded)"::equals) : "Logged " + appender.list;
    }

    @Test
    public void cancelMarksFailedAndRetryRequeues() {
        long queueId = manager.queueChapter(EXT, MANGA, "c2", 0);

        manager.cancelDownload(queueId);
        QueuedDownload cancelled = repository.getQueueItem(queueId).orElseThrow();
        assert cancelled.getStatus() == DownloadStatus.FAILED;
        assert "Cancelled by user".equals(cancelled.getErrorMessage());
        assert manager.getDownloadProgress(queueId).orElseThrow().getStatus() == DownloadStatus.FAILED;

        // cancelling again changes nothing
        manager.cancelDownload(queueId);

        manager.retryDownload(queueId);
        assert repository.getQueueItem(queueId).orElseThrow().getStatus() == DownloadStatus.QUEUED;
        assert hasEvent(EventType.DOWNLOAD_RETRIED);
    }

    @Test(expectedExceptions = InvalidQueueStateException.class)
    public void onlyFailedItemsCanBeRetried() {
        long queueId = manager.queueChapter(EXT, MANGA, "c2", 0);
        manager.retryDownload(queueId);
    }

    @Test(expectedExceptions = QueueItemNotFoundException.class)
    public void cancellingUnknownItemFails() {
        manager.cancelDownload(404);
    }

    @Test
    public void orphanedDownloadingItemIsRequeued() {
        long queueId = manager.queueChapter(EXT, MANGA, "c2", 0);
        // as left behind by a worker that crashed mid-transfer
        repository.updateQueueStatus(queueId, DownloadStatus.DOWNLOADING, null);

        List<Long> retried = manager.retryFrozenDownloads();

        assert retried.equals(List.of(queueId)) : "Unexpected " + retried;
        assert repository.getQueueItem(queueId).orElseThrow().getStatus() == DownloadStatus.QUEUED;
        assert manager.retryFrozenDownloads().isEmpty() : "Queued items are not frozen";
    }

    @Test
    public void itemBeingStartedIsNotMistakenForFrozen() throws Exception {
        AtomicReference<OfflineStorageManager> current = new AtomicReference<>();
        List<Long> requeued = new CopyOnWriteArrayList<>();
        // runs the frozen sweep right after the worker flips an item to downloading
        JsonOfflineRepository racing = new JsonOfflineRepository(dataDir.resolve("racing.json")) {
            @Override
            public void updateQueueStatus(long queueId, DownloadStatus status, String errorMessage) {
                super.updateQueueStatus(queueId, status, errorMessage);
                if (status == DownloadStatus.DOWNLOADING) {
                    requeued.addAll(current.get().retryFrozenDownloads());
                }
            }
        };
        manager.close();
        manager = buildManager(racing, 3);
        current.set(manager);

        long queueId = downloadChapter("c1");

        assert requeued.isEmpty() : "Requeued " + requeued;
        assert !hasEvent(EventType.DOWNLOAD_RETRIED);
        assert racing.getQueueItem(queueId).isEmpty() : "Completed item should be in history";
        Mockito.verify(fetcher, Mockito.times(1)).fetch(Mockito.eq("https://cdn.example.com/c1/0.jpg"), Mockito.anyLong());
    }

    @Test
    public void cancellingStopsPagesAndRemovesPartialChapter() throws Exception {
        manager.close();
        manager = buildManager(repository, 1);
        CountDownLatch fetching = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Mockito.when(fetcher.fetch(Mockito.eq("https://cdn.example.com/c1/0.jpg"), Mockito.anyLong())).thenAnswer(invocation -> {
            fetching.countDown();
            release.await(10, TimeUnit.SECONDS);
            return new FetchedImage(IMAGE, "image/jpeg");
        });
        Path chapterDir = OfflinePaths.buildChapterPaths(dataDir, EXT, "test-manga", "chapter-0001").getChapterDir();
        manager.start();

        long queueId = manager.queueChapter(EXT, MANGA, "c1", 0);
        assert fetching.await(10, TimeUnit.SECONDS) : "First page was never requested";
        assert Files.exists(chapterDir);
        manager.cancelDownload(queueId);
        release.countDown();

        waitFor(() -> !Files.exists(chapterDir), "partial chapter to be removed");
        Thread.sleep(100);
        Mockito.verify(fetcher, Mockito.never()).fetch(Mockito.eq("https://cdn.example.com/c1/1.jpg"), Mockito.anyLong());
        assert !Files.exists(chapterDir) : "Chapter folder came back after cancel";
        assert !manager.isChapterDownloaded(EXT, MANGA, "c1");
        assert repository.getQueueItem(queueId).orElseThrow().getStatus() == DownloadStatus.FAILED;
        assert !hasEvent(EventType.DOWNLOAD_COMPLETED);
    }

    @Test
    public void failedPageFailsTheItem() throws Exception {
        Mockito.when(fetcher.fetch(Mockito.contains("/c2/"), Mockito.anyLong()))
                .thenThrow(new HttpStatusException(404, "https://cdn.example.com/c2/0.jpg"));
        manager.start();

        long queueId = manager.queueChapter(EXT, MANGA, "c2", 0);
        waitFor(() -> hasEvent(EventType.DOWNLOAD_FAILED), "failure event");

        QueuedDownload failed = repository.getQueueItem(queueId).orElseThrow();
        assert failed.getStatus() == DownloadStatus.FAILED;
        assert failed.getErrorMessage().contains("HTTP 404") : failed.getErrorMessage();
        assert !manager.isChapterDownloaded(EXT, MANGA, "c2");
    }

    @Test
    public void deletingLastChapterRemovesTheManga() throws Exception {
        downloadChapter("c1");
        Path mangaDir = OfflinePaths.buildMangaPaths(dataDir, EXT, "test-manga").getMangaDir();

        manager.deleteChapter(EXT, MANGA, "c1");

        assert !manager.isChapterDownloaded(EXT, MANGA, "c1");
        assert manager.getMangaMetadata(EXT, MANGA).isEmpty();
        assert !Files.exists(mangaDir);
        assert hasEvent(EventType.CHAPTER_DELETED);
        assert hasEvent(EventType.MANGA_DELETED);
    }

    @Test(expectedExceptions = OfflineContentNotFoundException.class)
    public void deletingUnknownMangaFails() {
        manager.deleteManga(EXT, "missing");
    }

    @Test
    public void nukeRemovesEverything() throws Exception {
        downloadChapter("c1");
        manager.stop();
        manager.queueChapter(EXT, MANGA, "c2", 0);

        manager.nukeOfflineData();

        assert manager.getDownloadedManga().isEmpty();
        assert manager.getQueuedDownloads().isEmpty();
        assert manager.getDownloadHistory(null).isEmpty();
        assert Files.isDirectory(OfflinePaths.offlineRoot(dataDir)) : "Offline root should be recreated";
        assert !Files.exists(OfflinePaths.buildMangaPaths(dataDir, EXT, "test-manga").getMangaDir());
    }

    @Test
    public void missingMetadataIsRebuiltFromRepository() throws Exception {
        downloadChapter("c1");
        Files.delete(OfflinePaths.buildMangaPaths(dataDir, EXT, "test-manga").getMetadataFile());

        assert manager.validateMangaChapterCount(EXT, MANGA).isRebuilt();
        assert manager.validateMangaChapterCount(EXT, MANGA).isValid() : "Rebuilt document should now match";
        assert manager.getMangaMetadata(EXT, MANGA).orElseThrow().getChapters().size() == 1;
    }

}
