package ca.purps.offlinestorage.protocol.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Jacksonized
@Builder
@AllArgsConstructor
public class QueueIdPayload {
    private final long queueId;
}
