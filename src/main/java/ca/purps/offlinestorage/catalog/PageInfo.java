package ca.purps.offlinestorage.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Jacksonized
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class PageInfo {
    private final int index;
    @NonNull
    private final String url;
    private final Integer width;
    private final Integer height;
}
