package ca.purps.offlinestorage.protocol.payload;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Jacksonized
@Builder
public class QueueChapterPayload {
    private final String extensionId;
    private final String mangaId;
    private final String chapterId;
    private final int priority;
}
