package ca.purps.offlinestorage.protocol.payload;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PagePathPayload {
    /** Optional; the first downloaded manga with {@code mangaId} when absent. */
    private final String extensionId;
    private final String mangaId;
    private final String chapterId;
    private final String filename;
}
