package ca.purps.offlinestorage.cleanup;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum CleanupStrategy {
    /** Earliest download first. */
    OLDEST("oldest"),
    LARGEST("largest"),
    LEAST_ACCESSED("least-accessed");

    @JsonValue
    private final String wireName;

    @JsonCreator
    public static CleanupStrategy fromWireName(String value) {
        return Arrays.stream(values())
                .filter(strategy -> strategy.wireName.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown cleanup strategy: " + value));
    }
}
