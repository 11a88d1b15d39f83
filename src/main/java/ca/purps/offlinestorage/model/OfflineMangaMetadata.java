package ca.purps.offlinestorage.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Stored at {@code <mangaSlug>/metadata.json}; enough to render the manga details page offline.
 * Readers ignore properties they do not know so newer documents stay readable.
 */
@Value
@Jacksonized
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class OfflineMangaMetadata {

    public static final int SCHEMA_VERSION = 1;

    @Builder.Default
    private final int version = SCHEMA_VERSION;
    private final long downloadedAt;
    private final long lastUpdatedAt;

    @NonNull
    private final String mangaId;
    @NonNull
    private final String slug;
    @NonNull
    private final String extensionId;

    @NonNull
    private final String title;
    private final String description;
    private final String coverUrl;
    /** Relative to the manga directory, e.g. {@code cover.jpg}. */
    @NonNull
    private final String coverPath;
    private final List<String> authors;
    private final List<String> artists;
    private final List<String> genres;
    private final List<String> tags;
    private final Double rating;
    private final Integer year;
    private final String status;
    private final String demographic;
    private final List<String> altTitles;
    /** Chapters the catalog listed at the last refresh; used to notice new releases. */
    private final Integer catalogChapterCount;

    @Singular
    private final List<OfflineChapterMetadata> chapters;
}
