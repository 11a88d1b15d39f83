package ca.purps.offlinestorage.model;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum DownloadStatus {
    QUEUED("queued"),
    DOWNLOADING("downloading"),
    COMPLETED("completed"),
    FAILED("failed"),
    PAUSED("paused");

    @JsonValue
    private final String wireName;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonCreator
    public static DownloadStatus fromWireName(String value) {
        return Arrays.stream(values())
                .filter(status -> status.wireName.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown download status: " + value));
    }
}
