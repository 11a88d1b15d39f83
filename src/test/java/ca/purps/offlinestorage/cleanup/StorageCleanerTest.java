package ca.purps.offlinestorage.cleanup;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.mockito.Mockito;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import ca.purps.offlinestorage.downloader.OfflineStorageManager;
import ca.purps.offlinestorage.event.EventEmitter;
import ca.purps.offlinestorage.event.EventType;
import ca.purps.offlinestorage.event.OfflineStorageEvent;
import ca.purps.offlinestorage.exception.OfflineStorageException;
import ca.purps.offlinestorage.model.MangaStorageInfo;
import ca.purps.offlinestorage.model.StorageStats;
import ca.purps.offlinestorage.repository.OfflineMangaRecord;

public class StorageCleanerTest {

    private OfflineStorageManager manager;
    private EventEmitter events;
    private List<OfflineStorageEvent> emitted;
    private StorageCleaner cleaner;

    @BeforeMethod
    public void beforeMethod() {
        manager = Mockito.mock(OfflineStorageManager.class);
        events = new EventEmitter();
        emitted = new ArrayList<>();
        events.on(emitted::add);
        Mockito.when(manager.getEvents()).thenReturn(events);
        cleaner = new StorageCleaner(manager);

        // a: oldest, mid size, most recently read; b: newest, largest; c: middle age, smallest, never read
        List<OfflineMangaRecord> library = List.of(
                record("a", 100, 400, 900),
                record("b", 300, 700, 500),
                record("c", 200, 100, 0));
        Mockito.when(manager.getOfflineManga()).thenReturn(library);
        Mockito.when(manager.getStorageStats()).thenReturn(StorageStats.builder()
                .totalBytes(1200)
                .byExtension(Map.of("ext", 1200L))
                .byManga(List.of(info("a", 2), info("b", 5), info("c", 1)))
                .build());
        for (OfflineMangaRecord manga : library) {
            Mockito.when(manager.deleteManga("ext", manga.getMangaId())).thenReturn(manga.getTotalSizeBytes());
        }
    }

    private static OfflineMangaRecord record(String mangaId, long downloadedAt, long size, long lastAccessedAt) {
        return OfflineMangaRecord.builder()
                .extensionId("ext")
                .mangaId(mangaId)
                .mangaSlug(mangaId)
                .downloadedAt(downloadedAt)
                .totalSizeBytes(size)
                .lastAccessedAt(lastAccessedAt)
                .build();
    }

    private static MangaStorageInfo info(String mangaId, int chapters) {
        return MangaStorageInfo.builder().extensionId("ext").mangaId(mangaId).chapterCount(chapters).build();
    }

    private static StorageSettings settings(CleanupStrategy strategy, long max, long targetFree) {
        return StorageSettings.builder()
                .autoCleanupEnabled(true)
                .strategy(strategy)
                .maxStorageBytes(max)
                .targetFreeBytes(targetFree)
                .build();
    }

    @Test
    public void oldestStrategyDeletesEarliestDownloadsFirst() {
        // 1200 used, must get down to 1000 - 200 = 800
        CleanupResult result = cleaner.performCleanup(settings(CleanupStrategy.OLDEST, 1000, 200));

        assert result.isSuccess();
        assert result.getItemsRemoved() == 1;
        assert result.getFreedBytes() == 400;
        Mockito.verify(manager).deleteManga("ext", "a");
        Mockito.verify(manager, Mockito.never()).deleteManga("ext", "b");
        Mockito.verify(manager, Mockito.never()).deleteManga("ext", "c");

        assert emitted.size() == 1;
        assert emitted.get(0).getType() == EventType.CLEANUP_PERFORMED;
        assert emitted.get(0).getDeletedBytes() == 400L;
        assert emitted.get(0).getDeletedChapters() == 2;
    }

    @Test
    public void largestStrategyDeletesBiggestFirst() {
        CleanupResult result = cleaner.performCleanup(settings(CleanupStrategy.LARGEST, 1000, 200));

        assert result.getItemsRemoved() == 1;
        Mockito.verify(manager).deleteManga("ext", "b");
        Mockito.verify(manager, Mockito.never()).deleteManga("ext", "a");
    }

    @Test
    public void leastAccessedStrategyKeepsDeletingUntilTargetIsMet() {
        // must free 1200 - (1000 - 500) = 700: c (100) then b (700)
        CleanupResult result = cleaner.performCleanup(settings(CleanupStrategy.LEAST_ACCESSED, 1000, 500));

        assert result.getItemsRemoved() == 2;
        assert result.getFreedBytes() == 800;
        Mockito.verify(manager).deleteManga("ext", "c");
        Mockito.verify(manager).deleteManga("ext", "b");
        Mockito.verify(manager, Mockito.never()).deleteManga("ext", "a");
    }

    @Test
    public void nothingToDoUnderTheLimit() {
        CleanupResult result = cleaner.performCleanup(settings(CleanupStrategy.OLDEST, 10_000, 100));

        assert result.isSuccess();
        assert result.getItemsRemoved() == 0;
        Mockito.verify(manager, Mockito.never()).deleteManga(Mockito.anyString(), Mockito.anyString());
        assert emitted.isEmpty();
    }

    @Test
    public void failedDeletionIsReportedAndSkipped() {
        Mockito.when(manager.deleteManga("ext", "a")).thenThrow(new OfflineStorageException("disk busy"));

        CleanupResult result = cleaner.performCleanup(settings(CleanupStrategy.OLDEST, 1000, 200));

        assert !result.isSuccess();
        assert result.getErrors().size() == 1;
        assert result.getErrors().get(0).contains("disk busy");
        Mockito.verify(manager).deleteManga("ext", "c");
        Mockito.verify(manager).deleteManga("ext", "b");
        assert result.getItemsRemoved() == 2;
    }

    @Test
    public void thresholdDecidesWhetherCleanupIsDue() {
        StorageSettings settings = settings(CleanupStrategy.OLDEST, 1300, 0).toBuilder().thresholdPercent(90).build();
        assert cleaner.shouldCleanup(settings) : "1200 of 1300 is above 90%";

        assert !cleaner.shouldCleanup(settings.toBuilder().maxStorageBytes(2000).build());
        assert !cleaner.shouldCleanup(settings.toBuilder().autoCleanupEnabled(false).build());
    }

}
