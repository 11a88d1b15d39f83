package ca.purps.offlinestorage.catalog;

import java.util.List;
import java.util.Optional;

import ca.purps.offlinestorage.cache.MetadataCache;
import ca.purps.offlinestorage.metrics.PerformanceMetricsTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Serves repeated lookups from the {@link MetadataCache}; every miss counts as a network request.
 */
@Slf4j
@RequiredArgsConstructor
public class CachingCatalogSource implements CatalogSource {

    private final CatalogSource delegate;
    private final MetadataCache cache;
    private final PerformanceMetricsTracker metrics;

    @Override
    public MangaDetails fetchManga(String extensionId, String mangaId) {
        Optional<MangaDetails> cached = cache.getManga(extensionId, mangaId);
        if (cached.isPresent()) {
            metrics.cacheHit();
            return cached.get();
        }

        metrics.networkRequest();
        MangaDetails details = delegate.fetchManga(extensionId, mangaId);
        cache.setManga(extensionId, mangaId, details);
        CachingCatalogSource.log.debug("Cached manga details {}:{}", extensionId, mangaId);
        return details;
    }

    @Override
    public List<PageInfo> fetchChapterPages(String extensionId, String mangaId, String chapterId) {
        Optional<List<PageInfo>> cached = cache.getChapterPages(extensionId, mangaId, chapterId);
        if (cached.isPresent()) {
            metrics.cacheHit();
            return cached.get();
        }

        metrics.networkRequest();
        List<PageInfo> pages = delegate.fetchChapterPages(extensionId, mangaId, chapterId);
        cache.setChapterPages(extensionId, mangaId, chapterId, pages);
        return pages;
    }

    /**
     * Bypasses the cache, used when metadata is refreshed on purpose.
     */
    public MangaDetails refreshManga(String extensionId, String mangaId) {
        cache.invalidateManga(extensionId, mangaId);
        return fetchManga(extensionId, mangaId);
    }

}
