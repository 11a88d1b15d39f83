package ca.purps.offlinestorage.worker;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import ca.purps.offlinestorage.utility.Json;
import lombok.Getter;
import lombok.Setter;

/**
 * In-memory worker. Answers init with ready and any command that has a canned reply; everything
 * else waits for the test to answer.
 */
public class FakeWorkerLauncher implements WorkerLauncher {

    @Getter
    private final List<FakeChannel> channels = new CopyOnWriteArrayList<>();
    private final Map<String, String> replies = new ConcurrentHashMap<>();
    @Setter
    private volatile String initReply = "{\"type\":\"ready\"}";

    /**
     * @param resultJson raw JSON of the result, e.g. {@code "null"} or {@code "[1,2]"}
     */
    public void reply(String command, String resultJson) {
        replies.put(command, resultJson);
    }

    public FakeChannel last() {
        return channels.get(channels.size() - 1);
    }

    @Override
    public WorkerChannel launch(WorkerChannel.Listener listener) {
        FakeChannel channel = new FakeChannel(listener);
        channels.add(channel);
        return channel;
    }

    public class FakeChannel implements WorkerChannel {

        private final WorkerChannel.Listener listener;
        @Getter
        private final List<String> sent = new CopyOnWriteArrayList<>();
        private volatile boolean alive = true;

        FakeChannel(WorkerChannel.Listener listener) {
            this.listener = listener;
        }

        @Override
        public void send(String line) throws IOException {
            if (!alive) {
                throw new IOException("Stream closed");
            }
            sent.add(line);

            JsonNode message = Json.MAPPER.readTree(line);
            String type = message.path("type").asText();
            if ("init".equals(type)) {
                String reply = initReply;
                if (reply != null) {
                    listener.onLine(reply);
                }
                return;
            }
            String result = replies.get(type);
            if (result != null) {
                respond(message.get("requestId").asLong(), result);
            }
        }

        public void respond(long requestId, String resultJson) {
            listener.onLine(String.format("{\"type\":\"result\",\"requestId\":%d,\"result\":%s}", requestId, resultJson));
        }

        public void respondError(long requestId, String error) {
            listener.onLine(String.format("{\"type\":\"error\",\"requestId\":%d,\"error\":\"%s\",\"stack\":\"remote stack\"}",
                    requestId, error));
        }

        public void emit(String line) {
            listener.onLine(line);
        }

        public void crash(int exitCode) {
            alive = false;
            listener.onExit(exitCode);
        }

        /**
         * Request id of the most recent command of the given type.
         */
        public long requestIdOf(String command) throws JsonProcessingException {
            for (int i = sent.size() - 1; i >= 0; i--) {
                JsonNode message = Json.MAPPER.readTree(sent.get(i));
                if (command.equals(message.path("type").asText())) {
                    return message.get("requestId").asLong();
                }
            }
            throw new AssertionError("No " + command + " was sent");
        }

        @Override
        public boolean isAlive() {
            return alive;
        }

        @Override
        public void terminate(long graceMs) {
            if (!alive) {
                return;
            }
            alive = false;
            listener.onExit(143);
        }

    }

}
