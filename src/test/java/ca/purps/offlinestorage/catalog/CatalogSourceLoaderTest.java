package ca.purps.offlinestorage.catalog;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.testng.annotations.Test;

import ca.purps.offlinestorage.config.DownloadOptions;
import ca.purps.offlinestorage.exception.CatalogException;
import ca.purps.offlinestorage.utility.FileSystemUtils;

public class CatalogSourceLoaderTest {

    @Test
    public void findsProviderById() {
        CatalogSource source = CatalogSourceLoader.load(null, StubCatalogSourceProvider.ID, DownloadOptions.builder().build());

        assert "Stub m1".equals(source.fetchManga("stub", "m1").getTitle());
    }

    @Test
    public void unknownIdFallsBackToFirstProvider() {
        CatalogSource source = CatalogSourceLoader.load("", "somewhere-else", DownloadOptions.builder().build());

        assert source.fetchChapterPages("somewhere-else", "m1", "c9").size() == 1;
    }

    @Test(expectedExceptions = CatalogException.class, expectedExceptionsMessageRegExp = "Extension not found: .*")
    public void missingExtensionPathFails() {
        CatalogSourceLoader.load("/does/not/exist/extension.jar", "stub", DownloadOptions.builder().build());
    }

    @Test
    public void extensionDirectoryStillSeesParentProviders() throws IOException {
        Path dir = Files.createTempDirectory(CatalogSourceLoaderTest.class.getSimpleName() + "_");
        try {
            CatalogSource source = CatalogSourceLoader.load(dir.toString(), "stub", DownloadOptions.builder().build());
            assert source != null;
        } finally {
            FileSystemUtils.deleteDir(dir);
        }
    }

}
