package ca.purps.offlinestorage.event;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum EventType {
    DOWNLOAD_QUEUED("download-queued"),
    DOWNLOAD_STARTED("download-started"),
    DOWNLOAD_PROGRESS("download-progress"),
    DOWNLOAD_COMPLETED("download-completed"),
    DOWNLOAD_FAILED("download-failed"),
    DOWNLOAD_RETRIED("download-retried"),
    CHAPTER_DELETED("chapter-deleted"),
    MANGA_DELETED("manga-deleted"),
    NEW_CHAPTERS_AVAILABLE("new-chapters-available"),
    CLEANUP_PERFORMED("cleanup-performed");

    @JsonValue
    private final String wireName;

    @JsonCreator
    public static EventType fromWireName(String value) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown event type: " + value));
    }
}
