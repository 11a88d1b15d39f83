package ca.purps.offlinestorage.cleanup;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import ca.purps.offlinestorage.downloader.OfflineStorageManager;
import ca.purps.offlinestorage.event.OfflineStorageEvent;
import ca.purps.offlinestorage.exception.OfflineStorageException;
import ca.purps.offlinestorage.model.MangaStorageInfo;
import ca.purps.offlinestorage.repository.OfflineMangaRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Enforces a storage limit by deleting whole manga in the order the {@link CleanupStrategy} picks.
 */
@Slf4j
@RequiredArgsConstructor
public class StorageCleaner {

    private final OfflineStorageManager manager;

    public boolean shouldCleanup(StorageSettings settings) {
        if (!settings.isAutoCleanupEnabled() || settings.getMaxStorageBytes() <= 0) {
            return false;
        }
        long used = manager.getStorageStats().getTotalBytes();
        return used * 100.0 / settings.getMaxStorageBytes() >= settings.getThresholdPercent();
    }

    /**
     * Deletes manga until usage is {@code targetFreeBytes} below the limit. A manga that cannot be
     * deleted is recorded in the result and skipped.
     */
    public CleanupResult performCleanup(StorageSettings settings) {
        Map<String, MangaStorageInfo> info = manager.getStorageStats().getByManga().stream()
                .collect(Collectors.toMap(manga -> key(manga.getExtensionId(), manga.getMangaId()), Function.identity(), (a, b) -> a));

        List<OfflineMangaRecord> candidates = new ArrayList<>(manager.getOfflineManga());
        candidates.sort(order(settings.getStrategy()));

        long used = candidates.stream().mapToLong(OfflineMangaRecord::getTotalSizeBytes).sum();
        long needToFree = used - (settings.getMaxStorageBytes() - settings.getTargetFreeBytes());

        if (needToFree <= 0) {
            return CleanupResult.builder().success(true).build();
        }

        StorageCleaner.log.info("Need to free {} bytes ({} strategy)", needToFree, settings.getStrategy().getWireName());

        long freed = 0;
        int removed = 0;
        int deletedChapters = 0;
        List<String> errors = new ArrayList<>();
        for (OfflineMangaRecord manga : candidates) {
            if (freed >= needToFree) {
                break;
            }

            try {
                MangaStorageInfo stats = info.get(key(manga.getExtensionId(), manga.getMangaId()));
                long size = manager.deleteManga(manga.getExtensionId(), manga.getMangaId());
                freed += Math.max(size, manga.getTotalSizeBytes());
                removed++;
                deletedChapters += stats != null ? stats.getChapterCount() : 0;
            } catch (OfflineStorageException e) {
                String message = String.format("Failed to delete %s/%s: %s", manga.getExtensionId(), manga.getMangaId(), e.getMessage());
                StorageCleaner.log.error(message, e);
                errors.add(message);
            }
        }

        if (removed > 0) {
            manager.getEvents().emit(OfflineStorageEvent.cleanupPerformed(freed, deletedChapters));
        }

        StorageCleaner.log.info("Cleanup removed {} manga, freed {} bytes", removed, freed);
        return CleanupResult.builder()
                .success(errors.isEmpty())
                .errors(errors)
                .freedBytes(freed)
                .itemsRemoved(removed)
                .build();
    }

    private static Comparator<OfflineMangaRecord> order(CleanupStrategy strategy) {
        return switch (strategy) {
            case LARGEST -> Comparator.comparingLong(OfflineMangaRecord::getTotalSizeBytes).reversed();
            case LEAST_ACCESSED -> Comparator.comparingLong(OfflineMangaRecord::getLastAccessedAt);
            case OLDEST -> Comparator.comparingLong(OfflineMangaRecord::getDownloadedAt);
        };
    }

    private static String key(String extensionId, String mangaId) {
        return extensionId + ":" + mangaId;
    }

}
