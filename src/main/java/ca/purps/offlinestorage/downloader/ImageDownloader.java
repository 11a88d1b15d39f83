package ca.purps.offlinestorage.downloader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.function.Function;

import ca.purps.offlinestorage.config.DownloadOptions;
import ca.purps.offlinestorage.exception.DownloadException;
import ca.purps.offlinestorage.exception.HttpStatusException;
import ca.purps.offlinestorage.metrics.PerformanceMetricsTracker;
import ca.purps.offlinestorage.utility.FileSystemUtils;
import ca.purps.offlinestorage.utility.OfflinePaths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Downloads one image to disk, retrying failed attempts with exponential backoff. Client errors
 * (4xx) are not retried.
 */
@Slf4j
@RequiredArgsConstructor
public class ImageDownloader {

    private final PageFetcher fetcher;
    private final DownloadOptions options;
    private final PerformanceMetricsTracker metrics;

    /**
     * Saves the page as {@code page-NNNN.<ext>} inside {@code pagesDir}; the extension follows the response type.
     */
    public DownloadedImage downloadPage(String url, Path pagesDir, int pageIndex) {
        return download(url, extension -> pagesDir.resolve(OfflinePaths.generatePageFilename(pageIndex, extension)));
    }

    /**
     * Saves the image to exactly {@code target}, whatever its type.
     */
    public DownloadedImage downloadTo(String url, Path target) {
        return download(url, extension -> target);
    }

    private DownloadedImage download(String url, Function<String, Path> target) {
        int maxAttempts = Math.max(1, options.getRetryAttempts());
        Exception lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return attemptDownload(url, target);
            } catch (HttpStatusException e) {
                if (e.isClientError()) {
                    throw new DownloadException(e.getMessage(), e);
                }
                lastError = e;
            } catch (IOException e) {
                lastError = e;
            }

            if (attempt < maxAttempts) {
                long delay = options.getRetryDelayMs() * (1L << (attempt - 1));
                ImageDownloader.log.debug("Retrying {} in {}ms (attempt {}/{}): {}",
                        url, delay, attempt, maxAttempts, lastError.getMessage());
                sleep(delay);
            }
        }

        throw new DownloadException(String.format("Failed to download image after %d attempts: %s",
                maxAttempts, lastError.getMessage()), lastError);
    }

    private DownloadedImage attemptDownload(String url, Function<String, Path> target) throws IOException {
        metrics.networkRequest();
        FetchedImage image = fetcher.fetch(url, options.getPageTimeoutMs());

        Path path = target.apply(OfflinePaths.getImageExtension(url, image.getMimeType()));
        FileSystemUtils.ensureDir(path.getParent());
        Files.write(path, image.getData(), StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);

        metrics.bytesDownloaded(image.getData().length);
        return new DownloadedImage(path, path.getFileName().toString(), image.getData().length, image.getMimeType());
    }

    private void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DownloadException("Download interrupted", e);
        }
    }

}
