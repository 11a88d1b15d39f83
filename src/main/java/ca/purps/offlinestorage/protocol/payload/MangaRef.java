package ca.purps.offlinestorage.protocol.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Jacksonized
@Builder
@AllArgsConstructor
public class MangaRef {
    private final String extensionId;
    private final String mangaId;
}
