package ca.purps.offlinestorage.catalog;

import java.util.List;

import org.mockito.Mockito;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import ca.purps.offlinestorage.MutableClock;
import ca.purps.offlinestorage.cache.MetadataCache;
import ca.purps.offlinestorage.metrics.PerformanceMetrics;
import ca.purps.offlinestorage.metrics.PerformanceMetricsTracker;

public class CachingCatalogSourceTest {

    private CatalogSource delegate;
    private PerformanceMetricsTracker metrics;
    private CachingCatalogSource source;

    @BeforeMethod
    public void beforeMethod() {
        MutableClock clock = new MutableClock(1_000);
        delegate = Mockito.mock(CatalogSource.class);
        metrics = new PerformanceMetricsTracker(clock);
        source = new CachingCatalogSource(delegate, new MetadataCache(10, 60_000, clock), metrics);

        Mockito.when(delegate.fetchManga("ext", "m1"))
                .thenReturn(MangaDetails.builder().id("m1").title("One").build());
        Mockito.when(delegate.fetchChapterPages("ext", "m1", "c1"))
                .thenReturn(List.of(PageInfo.builder().index(0).url("http://img/1.jpg").build()));
    }

    @Test
    public void repeatedLookupsHitTheCache() {
        source.fetchManga("ext", "m1");
        source.fetchManga("ext", "m1");
        source.fetchChapterPages("ext", "m1", "c1");
        source.fetchChapterPages("ext", "m1", "c1");

        Mockito.verify(delegate, Mockito.times(1)).fetchManga("ext", "m1");
        Mockito.verify(delegate, Mockito.times(1)).fetchChapterPages("ext", "m1", "c1");

        PerformanceMetrics snapshot = metrics.getMetrics();
        assert snapshot.getNetworkRequests() == 2;
        assert snapshot.getCachedRequests() == 2;
        assert snapshot.getCacheHitRate() == 50.0;
    }

    @Test
    public void refreshBypassesTheCache() {
        source.fetchManga("ext", "m1");
        source.refreshManga("ext", "m1");

        Mockito.verify(delegate, Mockito.times(2)).fetchManga("ext", "m1");
    }

}
