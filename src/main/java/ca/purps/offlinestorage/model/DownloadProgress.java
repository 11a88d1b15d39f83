package ca.purps.offlinestorage.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class DownloadProgress {
    private final long queueId;
    private final String mangaTitle;
    private final String chapterTitle;
    private final DownloadStatus status;
    private final int progressCurrent;
    private final int progressTotal;
    /** 0-100 */
    private final int progressPercent;
    private final String errorMessage;
}
