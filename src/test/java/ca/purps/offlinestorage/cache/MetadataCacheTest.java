package ca.purps.offlinestorage.cache;

import java.util.List;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import ca.purps.offlinestorage.MutableClock;
import ca.purps.offlinestorage.catalog.MangaDetails;
import ca.purps.offlinestorage.catalog.PageInfo;

public class MetadataCacheTest {

    private MutableClock clock;

    @BeforeMethod
    public void beforeMethod() {
        clock = new MutableClock(1_000_000);
    }

    @Test
    public void evictsOldestInsertedEntry() {
        ExpiringCache<String> cache = new ExpiringCache<>(3, 60_000, clock);
        cache.put("a", "1");
        cache.put("b", "2");
        cache.put("c", "3");

        // reading does not refresh insertion order
        cache.get("a");
        cache.put("d", "4");

        assert cache.size() == 3 : "Cache should stay at capacity";
        assert !cache.containsKey("a") : "Oldest inserted entry should be evicted";
        assert cache.containsKey("b") && cache.containsKey("c") && cache.containsKey("d");
    }

    @Test
    public void replacingKeyDoesNotEvict() {
        ExpiringCache<String> cache = new ExpiringCache<>(2, 60_000, clock);
        cache.put("a", "1");
        cache.put("b", "2");
        cache.put("a", "3");

        assert cache.size() == 2;
        assert "3".equals(cache.get("a").orElse(null));
        assert cache.containsKey("b");
    }

    @Test
    public void expiredEntryIsRemovedOnRead() {
        ExpiringCache<String> cache = new ExpiringCache<>(10, 1000, clock);
        cache.put("a", "1");

        clock.advance(1000);
        assert cache.get("a").isPresent() : "Entry should live for exactly the TTL";

        clock.advance(1);
        assert cache.get("a").isEmpty() : "Entry should be expired";
        assert cache.size() == 0 : "Expired entry should be removed by the read";
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void rejectsNonPositiveSize() {
        new ExpiringCache<String>(0, 1000, clock);
    }

    @Test
    public void mangaAndPagesAreCachedSeparately() {
        MetadataCache cache = new MetadataCache(10, 60_000, clock);
        MangaDetails manga = MangaDetails.builder().id("m1").title("One Piece").build();
        List<PageInfo> pages = List.of(PageInfo.builder().index(0).url("https://cdn.example/1.jpg").build());

        cache.setManga("ext", "m1", manga);
        cache.setChapterPages("ext", "m1", "c1", pages);

        assert cache.getManga("ext", "m1").orElseThrow() == manga;
        assert cache.getManga("other", "m1").isEmpty() : "Keys should include the extension";
        assert cache.getChapterPages("ext", "m1", "c1").orElseThrow().equals(pages);

        MetadataCache.Stats stats = cache.getStats();
        assert stats.getMangaCacheSize() == 1 && stats.getChapterPagesCacheSize() == 1;

        cache.invalidateManga("ext", "m1");
        assert cache.getManga("ext", "m1").isEmpty();
        assert cache.getChapterPages("ext", "m1", "c1").isPresent() : "Invalidating manga keeps page lists";

        cache.clear();
        assert cache.getStats().getChapterPagesCacheSize() == 0;
    }

}
