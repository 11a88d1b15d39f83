package ca.purps.offlinestorage.protocol.payload;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueueMangaPayload {
    private final String extensionId;
    private final String mangaId;
    /** Only these chapters; every chapter when absent. */
    private final List<String> chapterIds;
    private final int priority;
}
