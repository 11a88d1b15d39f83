package ca.purps.offlinestorage.cache;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import ca.purps.offlinestorage.catalog.MangaDetails;
import ca.purps.offlinestorage.catalog.PageInfo;
import ca.purps.offlinestorage.config.DownloadOptions;
import lombok.Value;

/**
 * Keeps manga details and chapter page lists around for the length of a bulk download so the
 * same manga is not fetched again for every chapter.
 */
public class MetadataCache {

    @Value
    public static class Stats {
        private final int mangaCacheSize;
        private final int chapterPagesCacheSize;
    }

    private final ExpiringCache<MangaDetails> mangaCache;
    private final ExpiringCache<List<PageInfo>> chapterPagesCache;

    public MetadataCache(int maxSize, long ttlMs, Clock clock) {
        this.mangaCache = new ExpiringCache<>(maxSize, ttlMs, clock);
        this.chapterPagesCache = new ExpiringCache<>(maxSize, ttlMs, clock);
    }

    public MetadataCache(DownloadOptions options) {
        this(options.getCacheMaxSize(), options.getCacheTtlMs(), Clock.systemUTC());
    }

    public Optional<MangaDetails> getManga(String extensionId, String mangaId) {
        return mangaCache.get(mangaKey(extensionId, mangaId));
    }

    public void setManga(String extensionId, String mangaId, MangaDetails manga) {
        mangaCache.put(mangaKey(extensionId, mangaId), manga);
    }

    public Optional<List<PageInfo>> getChapterPages(String extensionId, String mangaId, String chapterId) {
        return chapterPagesCache.get(chapterPagesKey(extensionId, mangaId, chapterId));
    }

    public void setChapterPages(String extensionId, String mangaId, String chapterId, List<PageInfo> pages) {
        chapterPagesCache.put(chapterPagesKey(extensionId, mangaId, chapterId), List.copyOf(pages));
    }

    public void invalidateManga(String extensionId, String mangaId) {
        mangaCache.remove(mangaKey(extensionId, mangaId));
    }

    public void clear() {
        mangaCache.clear();
        chapterPagesCache.clear();
    }

    public Stats getStats() {
        return new Stats(mangaCache.size(), chapterPagesCache.size());
    }

    private static String mangaKey(String extensionId, String mangaId) {
        return extensionId + ":" + mangaId;
    }

    private static String chapterPagesKey(String extensionId, String mangaId, String chapterId) {
        return extensionId + ":" + mangaId + ":" + chapterId;
    }

}
