package ca.purps.offlinestorage.utility;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import ca.purps.offlinestorage.exception.InvalidSlugException;
import lombok.Value;
import lombok.experimental.UtilityClass;

/**
 * Canonical on-disk layout:
 *
 * <pre>
 * &lt;dataDir&gt;/offline/&lt;extensionId&gt;/&lt;mangaSlug&gt;/
 *     metadata.json
 *     cover.jpg
 *     chapters/chapter-0001/
 *         metadata.json
 *         pages/page-0001.jpg
 * </pre>
 */
@UtilityClass
public class OfflinePaths {

    public static final String OFFLINE_DIR = "offline";
    public static final String CHAPTERS_DIR = "chapters";
    public static final String PAGES_DIR = "pages";
    public static final String METADATA_FILE = "metadata.json";
    public static final String COVER_FILE = "cover.jpg";

    public static final int MAX_SLUG_LENGTH = 200;

    private static final Pattern TRAVERSAL = Pattern.compile("\\.\\.|[/\\\\]|\\u0000");
    private static final Pattern CHAPTER_NUMBER = Pattern.compile("^\\s*(\\d+)(?:\\.(\\d+))?");

    @Value
    public static class MangaPaths {
        private final Path offlineDir;
        private final Path extensionDir;
        private final Path mangaDir;
        private final Path chaptersDir;
        private final Path metadataFile;
        private final Path coverFile;
    }

    @Value
    public static class ChapterPaths {
        private final Path chapterDir;
        private final Path pagesDir;
        private final Path metadataFile;
    }

    public Path offlineRoot(Path dataDir) {
        return dataDir.resolve(OFFLINE_DIR);
    }

    public MangaPaths buildMangaPaths(Path dataDir, String extensionId, String mangaSlug) {
        Path offlineDir = offlineRoot(dataDir);
        Path extensionDir = offlineDir.resolve(requireSegment(extensionId));
        Path mangaDir = extensionDir.resolve(requireSegment(mangaSlug));

        return new MangaPaths(
                offlineDir,
                extensionDir,
                mangaDir,
                mangaDir.resolve(CHAPTERS_DIR),
                mangaDir.resolve(METADATA_FILE),
                mangaDir.resolve(COVER_FILE));
    }

    public ChapterPaths buildChapterPaths(Path dataDir, String extensionId, String mangaSlug, String chapterFolderName) {
        Path chapterDir = buildMangaPaths(dataDir, extensionId, mangaSlug)
                .getChaptersDir()
                .resolve(requireSegment(chapterFolderName));

        return new ChapterPaths(chapterDir, chapterDir.resolve(PAGES_DIR), chapterDir.resolve(METADATA_FILE));
    }

    public Path buildPagePath(Path dataDir, String extensionId, String mangaSlug, String chapterFolderName, String pageFilename) {
        return resolvePage(buildChapterPaths(dataDir, extensionId, mangaSlug, chapterFolderName), pageFilename)
                .orElseThrow(() -> new InvalidSlugException("Invalid page filename: " + pageFilename));
    }

    /**
     * Resolves a page file inside the chapter's pages directory; empty if the name would escape it.
     */
    public Optional<Path> resolvePage(ChapterPaths chapterPaths, String filename) {
        if (filename == null || filename.isBlank() || TRAVERSAL.matcher(filename).find()) {
            return Optional.empty();
        }
        Path pagesDir = chapterPaths.getPagesDir().normalize();
        Path resolved = pagesDir.resolve(filename).normalize();
        return resolved.getParent() != null && resolved.getParent().equals(pagesDir)
                ? Optional.of(resolved)
                : Optional.empty();
    }

    /**
     * Lossy, filesystem-safe transform: lowercase, anything outside {@code [a-z0-9-]} becomes a hyphen,
     * runs of hyphens collapse, leading/trailing hyphens are trimmed and the result is capped at
     * {@value #MAX_SLUG_LENGTH} characters.
     *
     * @throws InvalidSlugException if the input contains path separators or {@code ..}, or nothing is left
     */
    public String sanitizeSlug(String slug) {
        if (slug == null) {
            throw new InvalidSlugException("Slug must not be null");
        }
        if (TRAVERSAL.matcher(slug).find()) {
            throw new InvalidSlugException(String.format("Slug contains path traversal sequences: '%s'", slug));
        }

        String sanitized = slug.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9-]", "-")
                .replaceAll("-+", "-")
                .replaceAll("^-|-$", "");

        if (sanitized.length() > MAX_SLUG_LENGTH) {
            sanitized = sanitized.substring(0, MAX_SLUG_LENGTH).replaceAll("-+$", "");
        }

        if (sanitized.isEmpty()) {
            throw new InvalidSlugException(String.format("Slug is empty after sanitization: '%s'", slug));
        }

        return sanitized;
    }

    /**
     * {@code "1"} becomes {@code chapter-0001}, {@code "12.5"} becomes {@code chapter-0012-5}; anything
     * that does not start with a number is slugged after the {@code chapter-} prefix.
     */
    public String generateChapterFolderName(String chapterNumber) {
        Matcher matcher = CHAPTER_NUMBER.matcher(chapterNumber == null ? "" : chapterNumber);
        if (!matcher.find()) {
            return "chapter-" + sanitizeSlug(chapterNumber == null ? "" : chapterNumber);
        }

        String digits = matcher.group(1).replaceFirst("^0+(?=\\d)", "");
        String folderName = "chapter-" + "0".repeat(Math.max(0, 4 - digits.length())) + digits;
        String fraction = matcher.group(2) != null ? matcher.group(2).replaceAll("0+$", "") : "";
        return fraction.isEmpty() ? folderName : folderName + "-" + fraction;
    }

    public String generatePageFilename(int pageIndex, String extension) {
        return String.format("page-%04d.%s", pageIndex, extension == null || extension.isBlank() ? "jpg" : extension);
    }

    /**
     * Mime type first, URL path second, {@code jpg} last.
     */
    public String getImageExtension(String url, String mimeType) {
        if (mimeType != null) {
            String mime = mimeType.toLowerCase(Locale.ROOT);
            if (mime.contains("png")) {
                return "png";
            } else if (mime.contains("webp")) {
                return "webp";
            } else if (mime.contains("gif")) {
                return "gif";
            } else if (mime.contains("jpeg") || mime.contains("jpg")) {
                return "jpg";
            }
        }

        if (url != null) {
            String urlPath = url.split("[?#]")[0];
            int slash = urlPath.lastIndexOf('/');
            int dot = urlPath.lastIndexOf('.');
            if (dot > slash && dot < urlPath.length() - 1) {
                String extension = urlPath.substring(dot + 1).toLowerCase(Locale.ROOT);
                if (extension.matches("[a-z0-9]{1,5}")) {
                    return extension.equals("jpeg") ? "jpg" : extension;
                }
            }
        }

        return "jpg";
    }

    private String requireSegment(String segment) {
        if (segment == null || segment.isBlank() || TRAVERSAL.matcher(segment).find()) {
            throw new InvalidSlugException(String.format("Invalid path segment: '%s'", segment));
        }
        return segment;
    }

}
