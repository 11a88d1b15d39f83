package ca.purps.offlinestorage.cleanup;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Jacksonized
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class CleanupResult {
    private final boolean success;
    private final long freedBytes;
    private final int itemsRemoved;
    @Singular
    private final List<String> errors;
}
