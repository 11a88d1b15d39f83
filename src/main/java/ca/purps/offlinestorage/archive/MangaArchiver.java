package ca.purps.offlinestorage.archive;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.zip.Deflater;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import ca.purps.offlinestorage.exception.OfflineContentNotFoundException;
import ca.purps.offlinestorage.model.OfflineChapterMetadata;
import ca.purps.offlinestorage.model.OfflineMangaMetadata;
import ca.purps.offlinestorage.utility.FileSystemUtils;
import ca.purps.offlinestorage.utility.OfflinePaths;
import ca.purps.offlinestorage.utility.OfflinePaths.ChapterPaths;
import ca.purps.offlinestorage.utility.OfflinePaths.MangaPaths;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Exports downloaded chapters and manga to ZIP files whose layout mirrors the offline directory.
 * Failures never escape: each call returns an {@link ArchiveResult}.
 */
@Slf4j
@RequiredArgsConstructor
public class MangaArchiver {

    private static final double COMPRESSION_RATIO = 0.97;

    private final Path dataDir;

    /**
     * Writes {@code metadata.json} and {@code pages/*} of one chapter.
     */
    public ArchiveResult archiveChapter(String extensionId, String mangaSlug, OfflineChapterMetadata chapter, Path outputPath,
            ArchiveOptions options) {
        try {
            ChapterPaths chapterPaths = OfflinePaths.buildChapterPaths(dataDir, extensionId, mangaSlug, chapter.getFolderName());
            List<Entry> entries = new ArrayList<>();

            if (options.isIncludeMetadata() && Files.exists(chapterPaths.getMetadataFile())) {
                entries.add(new Entry(chapterPaths.getMetadataFile(), OfflinePaths.METADATA_FILE));
            }
            addPages(entries, chapterPaths, OfflinePaths.PAGES_DIR + "/");

            return write(outputPath, entries, options);
        } catch (IOException | RuntimeException e) {
            return fail(outputPath, e);
        }
    }

    /**
     * Writes the manga document, the cover and every chapter under {@code chapters/<folder>/}.
     */
    public ArchiveResult archiveManga(String extensionId, OfflineMangaMetadata manga, Path outputPath, ArchiveOptions options) {
        try {
            MangaPaths mangaPaths = OfflinePaths.buildMangaPaths(dataDir, extensionId, manga.getSlug());
            if (!Files.isDirectory(mangaPaths.getMangaDir())) {
                throw new OfflineContentNotFoundException("Manga directory not found: " + mangaPaths.getMangaDir());
            }

            List<Entry> entries = new ArrayList<>();
            if (options.isIncludeMetadata() && Files.exists(mangaPaths.getMetadataFile())) {
                entries.add(new Entry(mangaPaths.getMetadataFile(), OfflinePaths.METADATA_FILE));
            }

            if (options.isIncludeCover()) {
                Path cover = mangaPaths.getMangaDir().resolve(manga.getCoverPath());
                if (Files.isRegularFile(cover)) {
                    entries.add(new Entry(cover, "cover" + extensionOf(cover)));
                }
            }

            for (OfflineChapterMetadata chapter : manga.getChapters()) {
                ChapterPaths chapterPaths = OfflinePaths.buildChapterPaths(dataDir, extensionId, manga.getSlug(), chapter.getFolderName());
                String prefix = OfflinePaths.CHAPTERS_DIR + "/" + chapter.getFolderName() + "/";

                if (options.isIncludeMetadata() && Files.exists(chapterPaths.getMetadataFile())) {
                    entries.add(new Entry(chapterPaths.getMetadataFile(), prefix + OfflinePaths.METADATA_FILE));
                }
                addPages(entries, chapterPaths, prefix + OfflinePaths.PAGES_DIR + "/");
            }

            return write(outputPath, entries, options);
        } catch (IOException | RuntimeException e) {
            return fail(outputPath, e);
        }
    }

    /**
     * Archives the items one after the other into {@code <outputDir>/<title>.zip}. Always returns one
     * result per item; progress is reported as an overall 0-100 percentage.
     */
    public List<ArchiveResult> archiveBulk(List<ArchiveItem> items, Path outputDir, ArchiveOptions options) {
        List<ArchiveResult> results = new ArrayList<>();

        try {
            FileSystemUtils.ensureDir(outputDir);
        } catch (IOException e) {
            MangaArchiver.log.error("Failed to create output directory {}", outputDir, e);
            for (ArchiveItem item : items) {
                results.add(ArchiveResult.failure(outputPath(outputDir, item), e.getMessage()));
            }
            return results;
        }

        ArchiveProgressListener overall = options.getProgressListener();
        Set<String> taken = new HashSet<>();
        for (int i = 0; i < items.size(); i++) {
            ArchiveItem item = items.get(i);
            int completed = i;

            ArchiveOptions itemOptions = options.toBuilder()
                    .progressListener((current, total) -> {
                        double itemProgress = total > 0 ? (double) current / total : 1;
                        overall.onProgress((int) Math.floor((completed + itemProgress) / items.size() * 100), 100);
                    })
                    .build();

            ArchiveResult result = archiveManga(item.getExtensionId(), item.getMangaMetadata(),
                    uniqueOutputPath(outputDir, item, taken), itemOptions);
            if (!result.isSuccess()) {
                MangaArchiver.log.warn("Failed to archive {}: {}", item.getMangaMetadata().getTitle(), result.getError());
            }
            results.add(result);
        }

        overall.onProgress(100, 100);
        return results;
    }

    /**
     * Chapter sizes plus their metadata documents, times a fixed ratio. Nothing is compressed.
     */
    public long estimateArchiveSize(String extensionId, String mangaSlug, List<OfflineChapterMetadata> chapters) {
        long total = 0;
        for (OfflineChapterMetadata chapter : chapters) {
            total += chapter.getSizeBytes();
            Path metadataFile = OfflinePaths.buildChapterPaths(dataDir, extensionId, mangaSlug, chapter.getFolderName()).getMetadataFile();
            if (Files.exists(metadataFile)) {
                total += FileSystemUtils.fileSize(metadataFile);
            }
        }
        return (long) Math.floor(total * COMPRESSION_RATIO);
    }

    public static String safeFileName(String title) {
        return title.replaceAll("[<>:\"/\\\\|?*\\x00-\\x1F]", "_");
    }

    private static Path outputPath(Path outputDir, ArchiveItem item) {
        return outputDir.resolve(safeFileName(item.getMangaMetadata().getTitle()) + ".zip");
    }

    /**
     * {@code <title>.zip}, or {@code <title> (n).zip} when an earlier item of the run already took the name.
     */
    private static Path uniqueOutputPath(Path outputDir, ArchiveItem item, Set<String> taken) {
        String base = safeFileName(item.getMangaMetadata().getTitle());
        String name = base + ".zip";
        for (int n = 2; !taken.add(name.toLowerCase(Locale.ROOT)); n++) {
            name = String.format("%s (%d).zip", base, n);
        }
        return outputDir.resolve(name);
    }

    private static void addPages(List<Entry> entries, ChapterPaths chapterPaths, String prefix) throws IOException {
        if (!Files.isDirectory(chapterPaths.getPagesDir())) {
            MangaArchiver.log.warn("Skipping chapter without pages: {}", chapterPaths.getChapterDir());
            return;
        }
        for (String file : FileSystemUtils.listFiles(chapterPaths.getPagesDir())) {
            if (file.toLowerCase(Locale.ROOT).matches(".*\\.(jpg|jpeg|png|webp|gif|avif)$")) {
                entries.add(new Entry(chapterPaths.getPagesDir().resolve(file), prefix + file));
            }
        }
    }

    private ArchiveResult write(Path outputPath, List<Entry> entries, ArchiveOptions options) throws IOException {
        FileSystemUtils.ensureDir(outputPath.toAbsolutePath().getParent());

        int processed = 0;
        try (ZipOutputStream zos = new ZipOutputStream(Files.newOutputStream(outputPath))) {
            zos.setLevel(Math.max(Deflater.NO_COMPRESSION, Math.min(Deflater.BEST_COMPRESSION, options.getCompressionLevel())));
            for (Entry entry : entries) {
                zos.putNextEntry(new ZipEntry(entry.getName()));
                Files.copy(entry.getSource(), zos);
                zos.closeEntry();
                options.getProgressListener().onProgress(++processed, entries.size());
            }
        }

        long size = Files.size(outputPath);
        MangaArchiver.log.debug("Created archive: {} ({} entries, {} bytes)", outputPath, entries.size(), size);
        return ArchiveResult.success(outputPath, size);
    }

    private static ArchiveResult fail(Path outputPath, Exception error) {
        try {
            Files.deleteIfExists(outputPath);
        } catch (IOException e) {
            MangaArchiver.log.warn("Failed to delete partial archive {}", outputPath, e);
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return ArchiveResult.failure(outputPath, message);
    }

    private static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot) : ".jpg";
    }

    @Value
    private static class Entry {
        private final Path source;
        private final String name;
    }

}
