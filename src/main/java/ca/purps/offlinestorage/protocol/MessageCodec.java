package ca.purps.offlinestorage.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import ca.purps.offlinestorage.exception.ProtocolException;
import ca.purps.offlinestorage.utility.Json;
import lombok.experimental.UtilityClass;

/**
 * Newline-delimited JSON framing of the host/worker protocol. Each encoded message is a single line.
 */
@UtilityClass
public class MessageCodec {

    private static final ObjectMapper MAPPER = Json.MAPPER;
    private static final ObjectWriter WORKER_MESSAGE_WRITER = MAPPER.writerFor(WorkerMessage.class);

    public String encode(WorkerMessage message) {
        try {
            return WORKER_MESSAGE_WRITER.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Failed to encode " + message.getClass().getSimpleName(), e);
        }
    }

    public String encode(HostMessage message) {
        try {
            return MAPPER.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Failed to encode " + message.getClass().getSimpleName(), e);
        }
    }

    /**
     * @throws ProtocolException if the line is not JSON or not a known worker message
     */
    public WorkerMessage decodeWorkerMessage(String line) {
        try {
            return MAPPER.readValue(line, WorkerMessage.class);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Invalid worker message: " + abbreviate(line), e);
        }
    }

    /**
     * @throws ProtocolException if the line is not JSON, has no {@code type} or names an unknown command
     */
    public HostMessage decodeHostMessage(String line) {
        JsonNode tree;
        try {
            tree = MAPPER.readTree(line);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Invalid host message: " + abbreviate(line), e);
        }

        if (tree == null || !tree.isObject() || !tree.path("type").isTextual()) {
            throw new ProtocolException("Host message without type: " + abbreviate(line));
        }

        String type = tree.get("type").asText();
        if (InitMessage.TYPE.equals(type)) {
            return new InitMessage(convert(tree.path("config"), WorkerInitConfig.class));
        }

        if (!tree.path("requestId").canConvertToLong()) {
            throw new ProtocolException("Command without requestId: " + abbreviate(line));
        }
        JsonNode payload = tree.get("payload");
        return new WorkerCommand(CommandType.fromWireName(type), tree.get("requestId").asLong(),
                payload == null || payload.isNull() ? null : payload);
    }

    /**
     * The requestId of a line that may not decode as a host message, or null when it carries none.
     */
    public Long requestIdOf(String line) {
        JsonNode requestId;
        try {
            requestId = MAPPER.readTree(line).path("requestId");
        } catch (JsonProcessingException e) {
            // not JSON at all, nothing to correlate
            return null;
        }
        return requestId.canConvertToLong() ? requestId.asLong() : null;
    }

    public WorkerCommand command(CommandType type, long requestId, Object payload) {
        return new WorkerCommand(type, requestId, payload == null ? null : MAPPER.valueToTree(payload));
    }

    /**
     * Payload of the command as the type its command declares.
     */
    public <T> T payload(WorkerCommand command, Class<T> type) {
        if (command.getPayload() == null) {
            throw new ProtocolException(String.format("Command %s requires a payload", command.getType().getWireName()));
        }
        return convert(command.getPayload(), type);
    }

    public JsonNode toTree(Object value) {
        return value == null ? null : MAPPER.valueToTree(value);
    }

    /**
     * Result of the command as the type its command declares; null stays null.
     */
    public <T> T result(CommandType type, JsonNode result) {
        if (result == null || result.isNull() || type.getResultType().getRawClass() == Void.class) {
            return null;
        }
        try {
            return MAPPER.convertValue(result, type.getResultType());
        } catch (IllegalArgumentException e) {
            throw new ProtocolException(String.format("Invalid result for %s", type.getWireName()), e);
        }
    }

    private <T> T convert(JsonNode node, Class<T> type) {
        try {
            return MAPPER.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ProtocolException(String.format("Invalid %s", type.getSimpleName()), e);
        }
    }

    private String abbreviate(String line) {
        return line.length() > 200 ? line.substring(0, 200) + "..." : line;
    }

}
