package ca.purps.offlinestorage.catalog;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Jacksonized
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChapterSummary {
    @NonNull
    private final String id;
    private final String number;
    private final String title;
    private final String volume;
    private final String publishedAt;
    private final String languageCode;
    private final List<String> scanlators;

    /**
     * "Chapter 1 - Into the Fray!", "Chapter 1", the bare title, or "Chapter &lt;id&gt;".
     */
    public String displayTitle() {
        boolean hasTitle = title != null && !title.isBlank();
        boolean hasNumber = number != null && !number.isBlank();

        if (hasTitle && hasNumber) {
            return String.format("Chapter %s - %s", number, title);
        } else if (hasTitle) {
            return title;
        } else if (hasNumber) {
            return "Chapter " + number;
        }
        return "Chapter " + id;
    }
}
