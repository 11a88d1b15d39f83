package ca.purps.offlinestorage.catalog;

import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Jacksonized
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class MangaDetails {
    @NonNull
    private final String id;
    private final String slug;
    @NonNull
    private final String title;
    private final String description;
    private final String coverUrl;
    private final List<String> authors;
    private final List<String> artists;
    private final List<String> genres;
    private final List<String> tags;
    private final Double rating;
    private final Integer year;
    private final String status;
    private final String demographic;
    private final List<String> altTitles;
    @Singular
    private final List<ChapterSummary> chapters;

    public Optional<ChapterSummary> findChapter(String chapterId) {
        return chapters.stream()
                .filter(chapter -> chapter.getId().equals(chapterId))
                .findFirst();
    }

    /**
     * Source for the directory name: the catalog slug when present, the title otherwise.
     */
    public String slugSource() {
        return slug != null && !slug.isBlank() ? slug : title;
    }
}
