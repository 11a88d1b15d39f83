package ca.purps.offlinestorage.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Chapter entry inside the manga-level metadata document.
 */
@Value
@Jacksonized
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class OfflineChapterMetadata {
    @NonNull
    private final String chapterId;
    @NonNull
    private final String slug;
    private final String number;
    private final String title;
    @NonNull
    private final String displayTitle;
    private final String volume;
    private final String publishedAt;
    private final String languageCode;
    private final List<String> scanlators;

    /** e.g. {@code chapter-0001} */
    @NonNull
    private final String folderName;
    private final int totalPages;
    private final long downloadedAt;
    private final long sizeBytes;
}
