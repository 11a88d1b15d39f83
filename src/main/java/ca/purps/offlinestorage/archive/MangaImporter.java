package ca.purps.offlinestorage.archive;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

import ca.purps.offlinestorage.exception.InvalidArchiveException;
import ca.purps.offlinestorage.model.OfflineChapterMetadata;
import ca.purps.offlinestorage.model.OfflineChapterPages;
import ca.purps.offlinestorage.model.OfflineMangaMetadata;
import ca.purps.offlinestorage.repository.MetadataStore;
import ca.purps.offlinestorage.repository.OfflineChapterRecord;
import ca.purps.offlinestorage.repository.OfflineMangaRecord;
import ca.purps.offlinestorage.repository.OfflineRepository;
import ca.purps.offlinestorage.utility.FileSystemUtils;
import ca.purps.offlinestorage.utility.Json;
import ca.purps.offlinestorage.utility.OfflinePaths;
import ca.purps.offlinestorage.utility.OfflinePaths.ChapterPaths;
import ca.purps.offlinestorage.utility.OfflinePaths.MangaPaths;
import lombok.extern.slf4j.Slf4j;

/**
 * Brings manga exported by {@link MangaArchiver} back into the library. The archive is extracted
 * into a scratch directory under {@code <dataDir>/.temp} first, so a broken archive never leaves
 * half a manga behind. Like the archiver, failures are returned, not thrown.
 */
@Slf4j
public class MangaImporter {

    public static final String TEMP_DIR = ".temp";

    private static final Pattern IMAGE_FILE = Pattern.compile(".*\\.(jpg|jpeg|png|webp|gif|avif)$", Pattern.CASE_INSENSITIVE);
    private static final List<String> COVER_EXTENSIONS = List.of("jpg", "png", "jpeg", "webp");

    private final Path dataDir;
    private final OfflineRepository repository;
    private final MetadataStore store;
    private final Clock clock;

    public MangaImporter(Path dataDir, OfflineRepository repository) {
        this(dataDir, repository, Clock.systemUTC());
    }

    public MangaImporter(Path dataDir, OfflineRepository repository, Clock clock) {
        this.dataDir = dataDir;
        this.repository = repository;
        this.store = new MetadataStore(dataDir);
        this.clock = clock;
    }

    /**
     * Extracts and checks the archive without touching the library.
     */
    public ArchiveValidation validateArchive(Path archive) {
        Path scratch = null;
        try {
            scratch = createScratchDir("validate-");
            extract(archive, scratch);
            return validate(scratch);
        } catch (IOException | RuntimeException e) {
            return ArchiveValidation.builder()
                    .valid(false)
                    .error("Failed to extract archive: " + messageOf(e))
                    .build();
        } finally {
            cleanup(scratch);
        }
    }

    public ImportResult importArchive(Path archive, ImportOptions options) {
        ImportProgressListener progress = options.getProgressListener();
        Path scratch = null;
        try {
            scratch = createScratchDir("import-");

            progress.onProgress(0, 100, "Extracting archive");
            extract(archive, scratch);

            if (options.isValidate()) {
                progress.onProgress(10, 100, "Validating archive");
                ArchiveValidation validation = validate(scratch);
                if (!validation.isValid()) {
                    return ImportResult.failure("Archive validation failed: " + String.join(", ", validation.getErrors()));
                }
            }

            OfflineMangaMetadata manga = Json.read(scratch.resolve(OfflinePaths.METADATA_FILE), OfflineMangaMetadata.class);
            if (isInLibrary(manga)) {
                switch (options.getConflictResolution()) {
                    case SKIP -> {
                        MangaImporter.log.info("Skipping import of {}: already in the library", manga.getTitle());
                        return ImportResult.builder()
                                .success(true)
                                .skipped(true)
                                .extensionId(manga.getExtensionId())
                                .mangaId(manga.getMangaId())
                                .mangaSlug(manga.getSlug())
                                .build();
                    }
                    case OVERWRITE -> removeExisting(manga);
                    case RENAME -> manga = renamed(manga);
                }
            }

            int imported = copyIntoLibrary(scratch, manga, progress);
            progress.onProgress(100, 100, "Import complete");
            MangaImporter.log.info("Imported {} ({} chapters) from {}", manga.getTitle(), imported, archive);

            return ImportResult.builder()
                    .success(true)
                    .extensionId(manga.getExtensionId())
                    .mangaId(manga.getMangaId())
                    .mangaSlug(manga.getSlug())
                    .chaptersImported(imported)
                    .build();
        } catch (IOException | RuntimeException e) {
            MangaImporter.log.warn("Failed to import {}: {}", archive, messageOf(e));
            return ImportResult.failure(messageOf(e));
        } finally {
            cleanup(scratch);
        }
    }

    private boolean isInLibrary(OfflineMangaMetadata manga) {
        Path mangaDir = OfflinePaths.buildMangaPaths(dataDir, manga.getExtensionId(), manga.getSlug()).getMangaDir();
        return Files.exists(mangaDir) || repository.getManga(manga.getExtensionId(), manga.getMangaId()).isPresent();
    }

    private void removeExisting(OfflineMangaMetadata manga) throws IOException {
        MangaImporter.log.info("Overwriting {} ({}/{})", manga.getTitle(), manga.getExtensionId(), manga.getSlug());
        Optional<OfflineMangaRecord> existing = repository.getManga(manga.getExtensionId(), manga.getMangaId());
        if (existing.isPresent()) {
            FileSystemUtils.deleteDir(OfflinePaths.buildMangaPaths(dataDir, manga.getExtensionId(), existing.get().getMangaSlug()).getMangaDir());
            repository.deleteManga(manga.getExtensionId(), manga.getMangaId());
        }
        FileSystemUtils.deleteDir(OfflinePaths.buildMangaPaths(dataDir, manga.getExtensionId(), manga.getSlug()).getMangaDir());
    }

    private OfflineMangaMetadata renamed(OfflineMangaMetadata manga) {
        String suffix = "-" + clock.millis();
        MangaImporter.log.info("Importing {} as {}{}", manga.getTitle(), manga.getSlug(), suffix);
        return manga.toBuilder()
                .slug(manga.getSlug() + suffix)
                .mangaId(manga.getMangaId() + suffix)
                .build();
    }

    private int copyIntoLibrary(Path scratch, OfflineMangaMetadata manga, ImportProgressListener progress) throws IOException {
        long now = clock.millis();
        String extensionId = manga.getExtensionId();
        MangaPaths mangaPaths = OfflinePaths.buildMangaPaths(dataDir, extensionId, manga.getSlug());
        FileSystemUtils.ensureDir(mangaPaths.getMangaDir());

        progress.onProgress(20, 100, "Importing manga metadata");
        String coverPath = copyCover(scratch, mangaPaths).orElse(manga.getCoverPath());

        List<String> folders = FileSystemUtils.listDirs(scratch.resolve(OfflinePaths.CHAPTERS_DIR));
        List<OfflineChapterMetadata> chapters = new ArrayList<>();
        for (int i = 0; i < folders.size(); i++) {
            progress.onProgress(20 + (int) Math.floor((double) i / folders.size() * 70), 100,
                    String.format("Importing chapter %d/%d", i + 1, folders.size()));

            Path source = scratch.resolve(OfflinePaths.CHAPTERS_DIR).resolve(folders.get(i));
            copyChapter(source, manga, now).ifPresent(chapters::add);
        }

        store.writeManga(manga.toBuilder()
                .coverPath(coverPath)
                .lastUpdatedAt(now)
                .clearChapters()
                .chapters(chapters)
                .build());

        repository.saveManga(OfflineMangaRecord.builder()
                .extensionId(extensionId)
                .mangaId(manga.getMangaId())
                .mangaSlug(manga.getSlug())
                .title(manga.getTitle())
                .downloadPath(mangaPaths.getMangaDir().toString())
                .downloadedAt(manga.getDownloadedAt() > 0 ? manga.getDownloadedAt() : now)
                .lastUpdatedAt(now)
                .lastAccessedAt(now)
                .totalSizeBytes(FileSystemUtils.dirSize(mangaPaths.getMangaDir()))
                .build());

        return chapters.size();
    }

    private Optional<OfflineChapterMetadata> copyChapter(Path source, OfflineMangaMetadata manga, long now) throws IOException {
        Path documentFile = source.resolve(OfflinePaths.METADATA_FILE);
        Path sourcePages = source.resolve(OfflinePaths.PAGES_DIR);
        if (!Files.isRegularFile(documentFile) || !Files.isDirectory(sourcePages)) {
            MangaImporter.log.warn("Leaving out {}: metadata or pages missing", source.getFileName());
            return Optional.empty();
        }

        OfflineChapterPages document = Json.read(documentFile, OfflineChapterPages.class).toBuilder()
                .mangaId(manga.getMangaId())
                .build();
        ChapterPaths chapterPaths = OfflinePaths.buildChapterPaths(dataDir, manga.getExtensionId(), manga.getSlug(), document.getFolderName());
        FileSystemUtils.ensureDir(chapterPaths.getPagesDir());

        int pages = 0;
        for (String file : FileSystemUtils.listFiles(sourcePages)) {
            Path target = OfflinePaths.resolvePage(chapterPaths, file)
                    .orElseThrow(() -> new InvalidArchiveException("Invalid page file name: " + file));
            Files.copy(sourcePages.resolve(file), target, StandardCopyOption.REPLACE_EXISTING);
            pages++;
        }
        store.writeChapterPages(manga.getExtensionId(), manga.getSlug(), document);

        long sizeBytes = FileSystemUtils.dirSize(chapterPaths.getPagesDir());
        OfflineChapterMetadata chapter = manga.getChapters().stream()
                .filter(entry -> entry.getChapterId().equals(document.getChapterId()))
                .findFirst()
                .orElseGet(() -> OfflineChapterMetadata.builder()
                        .chapterId(document.getChapterId())
                        .slug(document.getFolderName())
                        .displayTitle("Chapter " + document.getChapterId())
                        .folderName(document.getFolderName())
                        .downloadedAt(document.getDownloadedAt())
                        .build())
                .toBuilder()
                .folderName(document.getFolderName())
                .totalPages(pages)
                .sizeBytes(sizeBytes)
                .build();

        repository.saveChapter(OfflineChapterRecord.builder()
                .extensionId(manga.getExtensionId())
                .mangaId(manga.getMangaId())
                .chapterId(chapter.getChapterId())
                .chapterNumber(chapter.getNumber())
                .chapterTitle(chapter.getTitle())
                .folderName(chapter.getFolderName())
                .totalPages(pages)
                .downloadedAt(chapter.getDownloadedAt() > 0 ? chapter.getDownloadedAt() : now)
                .sizeBytes(sizeBytes)
                .build());
        return Optional.of(chapter);
    }

    /**
     * @return the cover's path relative to the manga directory, if the archive has one
     */
    private static Optional<String> copyCover(Path scratch, MangaPaths mangaPaths) throws IOException {
        for (String extension : COVER_EXTENSIONS) {
            Path cover = scratch.resolve("cover." + extension);
            if (Files.isRegularFile(cover)) {
                String name = "cover." + extension;
                Files.copy(cover, mangaPaths.getMangaDir().resolve(name), StandardCopyOption.REPLACE_EXISTING);
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }

    private static ArchiveValidation validate(Path extracted) throws IOException {
        ArchiveValidation.ArchiveValidationBuilder result = ArchiveValidation.builder();

        Path metadataFile = extracted.resolve(OfflinePaths.METADATA_FILE);
        if (!Files.isRegularFile(metadataFile)) {
            return result.valid(false).error("Missing metadata.json file").build();
        }

        OfflineMangaMetadata manga;
        try {
            manga = Json.read(metadataFile, OfflineMangaMetadata.class);
        } catch (IOException e) {
            return result.valid(false).error("Invalid metadata.json: " + messageOf(e)).build();
        }
        result.title(manga.getTitle()).extensionId(manga.getExtensionId());

        Path chaptersDir = extracted.resolve(OfflinePaths.CHAPTERS_DIR);
        int validChapters = 0;
        for (String folder : FileSystemUtils.listDirs(chaptersDir)) {
            Path chapterDir = chaptersDir.resolve(folder);
            if (!Files.isRegularFile(chapterDir.resolve(OfflinePaths.METADATA_FILE))) {
                result.warning(String.format("Chapter %s: missing metadata.json", folder));
            } else if (!Files.isDirectory(chapterDir.resolve(OfflinePaths.PAGES_DIR))) {
                result.warning(String.format("Chapter %s: missing pages directory", folder));
            } else if (FileSystemUtils.listFiles(chapterDir.resolve(OfflinePaths.PAGES_DIR)).stream()
                    .noneMatch(file -> IMAGE_FILE.matcher(file).matches())) {
                result.warning(String.format("Chapter %s: no image files found", folder));
            } else {
                validChapters++;
            }
        }

        if (!Files.isDirectory(chaptersDir)) {
            result.warning("No chapters directory found");
            return result.valid(true).chapterCount(0).build();
        }
        if (validChapters == 0) {
            return result.valid(false).error("No valid chapters found in archive").build();
        }
        return result.valid(true).chapterCount(validChapters).build();
    }

    /**
     * Unpacks every entry below {@code target}, refusing entries whose names would land outside it.
     */
    private static void extract(Path archive, Path target) throws IOException {
        Path root = target.toAbsolutePath().normalize();
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            for (ZipEntry entry : Collections.list(zip.entries())) {
                Path destination = root.resolve(entry.getName()).normalize();
                if (!destination.startsWith(root) || destination.equals(root)) {
                    throw new InvalidArchiveException("Archive entry escapes the import directory: " + entry.getName());
                }

                if (entry.isDirectory()) {
                    FileSystemUtils.ensureDir(destination);
                    continue;
                }
                FileSystemUtils.ensureDir(destination.getParent());
                try (InputStream in = zip.getInputStream(entry)) {
                    Files.copy(in, destination, StandardCopyOption.REPLACE_EXISTING);
                }
            }
        }
    }

    private Path createScratchDir(String prefix) throws IOException {
        return Files.createTempDirectory(FileSystemUtils.ensureDir(dataDir.resolve(TEMP_DIR)), prefix);
    }

    private static void cleanup(Path scratch) {
        if (scratch == null) {
            return;
        }
        try {
            FileSystemUtils.deleteDir(scratch);
        } catch (IOException e) {
            MangaImporter.log.warn("Failed to clean up {}", scratch, e);
        }
    }

    private static String messageOf(Exception error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

}
