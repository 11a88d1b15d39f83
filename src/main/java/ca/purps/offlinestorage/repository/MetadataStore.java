package ca.purps.offlinestorage.repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

import ca.purps.offlinestorage.exception.RepositoryException;
import ca.purps.offlinestorage.model.OfflineChapterMetadata;
import ca.purps.offlinestorage.model.OfflineChapterPages;
import ca.purps.offlinestorage.model.OfflineMangaMetadata;
import ca.purps.offlinestorage.utility.Json;
import ca.purps.offlinestorage.utility.OfflinePaths;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.Synchronized;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads and writes the {@code metadata.json} documents kept beside the downloaded files. Updates of
 * the manga document are serialized so concurrent chapter downloads of one manga do not lose entries.
 */
@Slf4j
@RequiredArgsConstructor
public class MetadataStore {

    @Getter
    private final Path dataDir;

    @Synchronized
    public Optional<OfflineMangaMetadata> readManga(String extensionId, String mangaSlug) {
        Path file = OfflinePaths.buildMangaPaths(dataDir, extensionId, mangaSlug).getMetadataFile();
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Json.read(file, OfflineMangaMetadata.class));
        } catch (IOException e) {
            MetadataStore.log.warn("Unreadable manga metadata {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    @Synchronized
    public void writeManga(OfflineMangaMetadata metadata) {
        Path file = OfflinePaths.buildMangaPaths(dataDir, metadata.getExtensionId(), metadata.getSlug()).getMetadataFile();
        write(file, sorted(metadata));
    }

    /**
     * Applies {@code change} to the stored document, if there is one.
     */
    @Synchronized
    public Optional<OfflineMangaMetadata> updateManga(String extensionId, String mangaSlug, UnaryOperator<OfflineMangaMetadata> change) {
        Optional<OfflineMangaMetadata> updated = readManga(extensionId, mangaSlug).map(change);
        updated.ifPresent(this::writeManga);
        return updated;
    }

    /**
     * Adds the chapter entry, replacing an existing entry with the same chapter id.
     */
    @Synchronized
    public Optional<OfflineMangaMetadata> upsertChapter(String extensionId, String mangaSlug, OfflineChapterMetadata chapter, long now) {
        return updateManga(extensionId, mangaSlug, metadata -> {
            List<OfflineChapterMetadata> chapters = new ArrayList<>(metadata.getChapters());
            chapters.removeIf(existing -> existing.getChapterId().equals(chapter.getChapterId()));
            chapters.add(chapter);
            return metadata.toBuilder()
                    .clearChapters()
                    .chapters(chapters)
                    .lastUpdatedAt(now)
                    .build();
        });
    }

    @Synchronized
    public Optional<OfflineMangaMetadata> removeChapter(String extensionId, String mangaSlug, String chapterId, long now) {
        return updateManga(extensionId, mangaSlug, metadata -> {
            List<OfflineChapterMetadata> chapters = new ArrayList<>(metadata.getChapters());
            chapters.removeIf(existing -> existing.getChapterId().equals(chapterId));
            return metadata.toBuilder()
                    .clearChapters()
                    .chapters(chapters)
                    .lastUpdatedAt(now)
                    .build();
        });
    }

    public Optional<OfflineChapterPages> readChapterPages(String extensionId, String mangaSlug, String folderName) {
        Path file = OfflinePaths.buildChapterPaths(dataDir, extensionId, mangaSlug, folderName).getMetadataFile();
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Json.read(file, OfflineChapterPages.class));
        } catch (IOException e) {
            MetadataStore.log.warn("Unreadable chapter metadata {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    public void writeChapterPages(String extensionId, String mangaSlug, OfflineChapterPages pages) {
        write(OfflinePaths.buildChapterPaths(dataDir, extensionId, mangaSlug, pages.getFolderName()).getMetadataFile(), pages);
    }

    private static OfflineMangaMetadata sorted(OfflineMangaMetadata metadata) {
        List<OfflineChapterMetadata> chapters = new ArrayList<>(metadata.getChapters());
        chapters.sort(Comparator.comparing(OfflineChapterMetadata::getFolderName));
        return metadata.toBuilder().clearChapters().chapters(chapters).build();
    }

    private static void write(Path file, Object document) {
        try {
            Json.write(file, document);
        } catch (IOException e) {
            throw new RepositoryException(String.format("Failed to write %s", file), e);
        }
    }

}
