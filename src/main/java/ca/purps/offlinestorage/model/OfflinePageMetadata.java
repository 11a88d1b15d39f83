package ca.purps.offlinestorage.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class OfflinePageMetadata {
    /** 0-based position inside the chapter. */
    private final int index;
    @NonNull
    private final String originalUrl;
    /** e.g. {@code page-0001.jpg} */
    @NonNull
    private final String filename;
    private final Integer width;
    private final Integer height;
    private final long sizeBytes;
    @NonNull
    private final String mimeType;
}
