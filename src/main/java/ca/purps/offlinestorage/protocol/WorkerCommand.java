package ca.purps.offlinestorage.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code {"type": "<command>", "requestId": n, "payload": {...}}}. Answered by exactly one
 * {@link WorkerMessage.Result} or {@link WorkerMessage.Error} carrying the same request id.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkerCommand implements HostMessage {
    @NonNull
    private final CommandType type;
    private final long requestId;
    private final JsonNode payload;
}
