package ca.purps.offlinestorage.worker;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.mockito.Mockito;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import ca.purps.offlinestorage.MutableClock;
import ca.purps.offlinestorage.cleanup.CleanupResult;
import ca.purps.offlinestorage.cleanup.StorageCleaner;
import ca.purps.offlinestorage.cleanup.StorageSettings;
import ca.purps.offlinestorage.downloader.OfflineStorageManager;
import ca.purps.offlinestorage.exception.ProtocolException;
import ca.purps.offlinestorage.protocol.CommandType;
import ca.purps.offlinestorage.protocol.MessageCodec;
import ca.purps.offlinestorage.protocol.payload.BackgroundSyncPayload;
import ca.purps.offlinestorage.protocol.payload.ChapterRef;
import ca.purps.offlinestorage.protocol.payload.HistoryQuery;
import ca.purps.offlinestorage.protocol.payload.MangaRef;
import ca.purps.offlinestorage.protocol.payload.PagePathPayload;
import ca.purps.offlinestorage.protocol.payload.PingResult;
import ca.purps.offlinestorage.protocol.payload.QueueChapterPayload;
import ca.purps.offlinestorage.protocol.payload.QueueIdPayload;

public class CommandDispatcherTest {

    private OfflineStorageManager manager;
    private StorageCleaner cleaner;
    private CommandDispatcher dispatcher;

    @BeforeMethod
    public void beforeMethod() {
        manager = Mockito.mock(OfflineStorageManager.class);
        cleaner = Mockito.mock(StorageCleaner.class);
        dispatcher = new CommandDispatcher(manager, cleaner, new MutableClock(1234));
    }

    private Object execute(CommandType type, Object payload) {
        return dispatcher.execute(MessageCodec.command(type, 1, payload));
    }

    @Test
    public void queueChapterPassesPayloadThrough() {
        Mockito.when(manager.queueChapter("ext", "m1", "c1", 4)).thenReturn(17L);

        Object result = execute(CommandType.QUEUE_CHAPTER, QueueChapterPayload.builder()
                .extensionId("ext")
                .mangaId("m1")
                .chapterId("c1")
                .priority(4)
                .build());

        assert Long.valueOf(17).equals(result);
    }

    @Test
    public void startAndStopDriveTheQueue() {
        assert execute(CommandType.START, null) == null;
        assert execute(CommandType.STOP, null) == null;

        Mockito.verify(manager).start();
        Mockito.verify(manager).stop();
    }

    @Test
    public void absentOptionalBecomesNull() {
        Mockito.when(manager.getMangaMetadata("ext", "m1")).thenReturn(Optional.empty());
        Mockito.when(manager.getPagePath("ext", "m1", "c1", "page-0001.jpg"))
                .thenReturn(Optional.of(Path.of("/data/offline/ext/manga/chapters/chapter-0001/pages/page-0001.jpg")));

        assert execute(CommandType.GET_MANGA_METADATA, new MangaRef("ext", "m1")) == null;
        Object path = execute(CommandType.GET_PAGE_PATH, PagePathPayload.builder()
                .extensionId("ext")
                .mangaId("m1")
                .chapterId("c1")
                .filename("page-0001.jpg")
                .build());
        assert path instanceof String && ((String) path).endsWith("page-0001.jpg");
    }

    @Test
    public void historyLimitIsOptional() {
        execute(CommandType.GET_DOWNLOAD_HISTORY, null);
        execute(CommandType.GET_DOWNLOAD_HISTORY, new HistoryQuery(5));

        Mockito.verify(manager).getDownloadHistory(null);
        Mockito.verify(manager).getDownloadHistory(5);
    }

    @Test
    public void deleteAndCancelAreForwarded() {
        execute(CommandType.DELETE_CHAPTER, new ChapterRef("ext", "m1", "c1"));
        execute(CommandType.CANCEL_DOWNLOAD, new QueueIdPayload(9));

        Mockito.verify(manager).deleteChapter("ext", "m1", "c1");
        Mockito.verify(manager).cancelDownload(9);
    }

    @Test
    public void backgroundSyncAnswersBeforeItFinishes() {
        CompletableFuture<Void> sync = new CompletableFuture<>();
        Mockito.when(manager.startBackgroundSync(1000, 2, 50)).thenReturn(sync);

        Object result = execute(CommandType.START_BACKGROUND_SYNC, BackgroundSyncPayload.builder()
                .ttlMs(1000)
                .concurrency(2)
                .delayMs(50)
                .build());

        assert result == null;
        assert !sync.isDone();
        sync.completeExceptionally(new IllegalStateException("catalog offline"));
    }

    @Test
    public void pingAndCleanupAreAnsweredLocally() {
        CleanupResult cleanup = CleanupResult.builder().success(true).itemsRemoved(2).build();
        Mockito.when(cleaner.performCleanup(Mockito.any(StorageSettings.class))).thenReturn(cleanup);

        Object ping = execute(CommandType.PING, null);
        Object result = execute(CommandType.PERFORM_CLEANUP, StorageSettings.builder().maxStorageBytes(100).build());

        assert ((PingResult) ping).getTimestamp() == 1234;
        assert result == cleanup;
    }

    @Test(expectedExceptions = ProtocolException.class)
    public void missingPayloadIsRejected() {
        execute(CommandType.RETRY_DOWNLOAD, null);
    }

    @Test(expectedExceptions = IllegalStateException.class, expectedExceptionsMessageRegExp = "boom")
    public void managerFailuresPropagate() {
        Mockito.when(manager.getQueuedDownloads()).thenThrow(new IllegalStateException("boom"));
        execute(CommandType.GET_QUEUED_DOWNLOADS, null);
    }

    @Test
    public void listResultsAreReturnedAsIs() {
        Mockito.when(manager.retryFrozenDownloads()).thenReturn(List.of(3L, 4L));

        assert List.of(3L, 4L).equals(execute(CommandType.RETRY_FROZEN_DOWNLOADS, null));
    }

}
