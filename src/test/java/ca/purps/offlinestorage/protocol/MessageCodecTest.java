package ca.purps.offlinestorage.protocol;

import java.util.List;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import com.fasterxml.jackson.databind.JsonNode;

import ca.purps.offlinestorage.event.EventType;
import ca.purps.offlinestorage.event.OfflineStorageEvent;
import ca.purps.offlinestorage.exception.ProtocolException;
import ca.purps.offlinestorage.protocol.payload.PingResult;
import ca.purps.offlinestorage.protocol.payload.QueueChapterPayload;

public class MessageCodecTest {

    @Test
    public void decodesInitMessage() {
        HostMessage message = MessageCodec.decodeHostMessage(
                "{\"type\":\"init\",\"config\":{\"dataDir\":\"/data\",\"dbPath\":\"/data/offline.json\",\"extensionId\":\"ext\"}}");

        assert message instanceof InitMessage : "Expected init, got " + message;
        WorkerInitConfig config = ((InitMessage) message).getConfig();
        assert "/data".equals(config.getDataDir());
        assert "/data/offline.json".equals(config.getDbPath());
        assert config.getWorkerOptions() != null : "Worker options should default";
    }

    @Test
    public void decodesCommandWithPayload() {
        HostMessage message = MessageCodec.decodeHostMessage(
                "{\"type\":\"queue-chapter\",\"requestId\":7,\"payload\":{\"extensionId\":\"ext\",\"mangaId\":\"m\",\"chapterId\":\"c\",\"priority\":3}}");

        assert message instanceof WorkerCommand;
        WorkerCommand command = (WorkerCommand) message;
        assert command.getType() == CommandType.QUEUE_CHAPTER;
        assert command.getRequestId() == 7;

        QueueChapterPayload payload = MessageCodec.payload(command, QueueChapterPayload.class);
        assert "c".equals(payload.getChapterId());
        assert payload.getPriority() == 3;
    }

    @Test
    public void nullPayloadIsAbsent() {
        WorkerCommand command = (WorkerCommand) MessageCodec.decodeHostMessage("{\"type\":\"start\",\"requestId\":1,\"payload\":null}");
        assert command.getPayload() == null;
    }

    @Test(expectedExceptions = ProtocolException.class, expectedExceptionsMessageRegExp = ".*requires a payload")
    public void missingRequiredPayloadFails() {
        WorkerCommand command = MessageCodec.command(CommandType.DELETE_MANGA, 1, null);
        MessageCodec.payload(command, Object.class);
    }

    @DataProvider
    public Object[][] invalidHostLines() {
        return new Object[][] {
                { "not json" },
                { "[1,2]" },
                { "{\"requestId\":1}" },
                { "{\"type\":\"start\"}" },
                { "{\"type\":\"launch-missiles\",\"requestId\":1}" },
        };
    }

    @Test(dataProvider = "invalidHostLines", expectedExceptions = ProtocolException.class)
    public void rejectsInvalidHostMessages(String line) {
        MessageCodec.decodeHostMessage(line);
    }

    @Test
    public void encodedMessagesAreSingleLines() {
        String command = MessageCodec.encode(MessageCodec.command(CommandType.QUEUE_MANGA, 3,
                QueueChapterPayload.builder().extensionId("ext").mangaId("m").chapterId("line\nbreak").build()));
        String error = MessageCodec.encode(WorkerMessage.Error.builder()
                .requestId(3L)
                .error("failed")
                .stack("at one\nat two")
                .build());

        assert !command.contains("\n") : command;
        assert !error.contains("\n") : error;
        assert command.contains("\"type\":\"queue-manga\"");
        assert command.contains("\"requestId\":3");
    }

    @Test
    public void workerMessagesCarryTheirType() {
        assert MessageCodec.encode(new WorkerMessage.Ready()).contains("\"type\":\"ready\"");
        assert MessageCodec.encode(WorkerMessage.FatalError.builder().error("x").build()).contains("\"type\":\"fatal-error\"");

        WorkerMessage decoded = MessageCodec.decodeWorkerMessage("{\"type\":\"stopped\"}");
        assert decoded instanceof WorkerMessage.Stopped;
    }

    @Test
    public void errorWithoutRequestIdDecodes() {
        WorkerMessage decoded = MessageCodec.decodeWorkerMessage("{\"type\":\"error\",\"error\":\"bad line\"}");

        assert decoded instanceof WorkerMessage.Error;
        WorkerMessage.Error error = (WorkerMessage.Error) decoded;
        assert error.getRequestId() == null;
        assert "bad line".equals(error.getError());
    }

    @Test
    public void eventSurvivesTheWire() {
        String line = MessageCodec.encode(WorkerMessage.Event.builder()
                .event(OfflineStorageEvent.queued(List.of(4L, 5L), "m1", null))
                .build());

        assert line.contains("\"download-queued\"") : line;
        WorkerMessage decoded = MessageCodec.decodeWorkerMessage(line);
        OfflineStorageEvent event = ((WorkerMessage.Event) decoded).getEvent();
        assert event.getType() == EventType.DOWNLOAD_QUEUED;
        assert event.getQueueIds().equals(List.of(4L, 5L));
        assert event.getChapterId() == null;
    }

    @Test(expectedExceptions = ProtocolException.class)
    public void unknownWorkerMessageFails() {
        MessageCodec.decodeWorkerMessage("{\"type\":\"hello\"}");
    }

    @Test
    public void resultIsConvertedToTheDeclaredType() {
        JsonNode ids = MessageCodec.toTree(List.of(1, 2, 3));
        Object queued = MessageCodec.result(CommandType.QUEUE_MANGA, ids);
        assert List.of(1L, 2L, 3L).equals(queued) : "Unexpected " + queued;

        Object ping = MessageCodec.result(CommandType.PING, MessageCodec.toTree(new PingResult(42)));
        assert ping instanceof PingResult && ((PingResult) ping).getTimestamp() == 42;

        assert MessageCodec.result(CommandType.START, MessageCodec.toTree("ignored")) == null : "Void results are dropped";
        assert MessageCodec.result(CommandType.GET_MANGA_METADATA, null) == null;
    }

}
