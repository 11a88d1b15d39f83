package ca.purps.offlinestorage.worker;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import org.mockito.Mockito;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import ca.purps.offlinestorage.downloader.OfflineStorageManager;
import ca.purps.offlinestorage.exception.ChapterAlreadyDownloadedException;
import ca.purps.offlinestorage.protocol.MessageCodec;
import ca.purps.offlinestorage.protocol.WorkerInitConfig;
import ca.purps.offlinestorage.protocol.WorkerMessage;

public class WorkerProcessTest {

    private static final String INIT = "{\"type\":\"init\",\"config\":{\"dataDir\":\"/data\",\"dbPath\":\"/data/offline.json\"}}";

    private OfflineStorageManager manager;
    private AtomicInteger fatalCalls;

    @BeforeMethod
    public void beforeMethod() {
        manager = Mockito.mock(OfflineStorageManager.class);
        fatalCalls = new AtomicInteger();
    }

    /**
     * Feeds the lines to a worker, waits for it to drain and returns what it wrote.
     */
    private List<WorkerMessage> run(Function<WorkerInitConfig, OfflineStorageManager> factory, int expectedExitCode, String... lines) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream output = new PrintStream(bytes, true, StandardCharsets.UTF_8);
        BufferedReader input = new BufferedReader(new StringReader(String.join("\n", lines) + "\n"));

        WorkerProcess process = new WorkerProcess(input, output, factory, fatalCalls::incrementAndGet);
        int exitCode = process.run();
        assert exitCode == expectedExitCode : "Unexpected exit code " + exitCode;

        List<WorkerMessage> messages = new ArrayList<>();
        for (String line : bytes.toString(StandardCharsets.UTF_8).split("\n")) {
            if (!line.isBlank()) {
                messages.add(MessageCodec.decodeWorkerMessage(line));
            }
        }
        return messages;
    }

    private List<WorkerMessage> run(String... lines) {
        return run(config -> manager, 0, lines);
    }

    @Test
    public void answersCommandsAfterInit() {
        Mockito.when(manager.isActive()).thenReturn(true);

        List<WorkerMessage> messages = run(INIT, "{\"type\":\"is-active\",\"requestId\":4}");

        assert messages.size() == 2 : "Unexpected " + messages;
        assert messages.get(0) instanceof WorkerMessage.Ready;
        WorkerMessage.Result result = (WorkerMessage.Result) messages.get(1);
        assert result.getRequestId() == 4;
        assert result.getResult().asBoolean();
        Mockito.verify(manager).close();
    }

    @Test
    public void startIsFollowedByStarted() {
        List<WorkerMessage> messages = run(INIT, "{\"type\":\"start\",\"requestId\":1}", "{\"type\":\"stop\",\"requestId\":2}");

        assert messages.size() == 5 : "Unexpected " + messages;
        assert messages.get(1) instanceof WorkerMessage.Result;
        assert messages.get(2) instanceof WorkerMessage.Started;
        assert messages.get(3) instanceof WorkerMessage.Result;
        assert messages.get(4) instanceof WorkerMessage.Stopped;
    }

    @Test
    public void failedCommandAnswersWithError() {
        Mockito.when(manager.queueChapter("ext", "m1", "c1", 0))
                .thenThrow(new ChapterAlreadyDownloadedException("Chapter c1 of m1 is already downloaded"));

        List<WorkerMessage> messages = run(INIT,
                "{\"type\":\"queue-chapter\",\"requestId\":9,\"payload\":{\"extensionId\":\"ext\",\"mangaId\":\"m1\",\"chapterId\":\"c1\"}}");

        WorkerMessage.Error error = (WorkerMessage.Error) messages.get(1);
        assert error.getRequestId() == 9L;
        assert error.getError().contains("already downloaded");
        assert error.getStack() != null && error.getStack().contains("ChapterAlreadyDownloadedException");
    }

    @Test
    public void commandBeforeInitIsRejected() {
        List<WorkerMessage> messages = run("{\"type\":\"ping\",\"requestId\":1}");

        WorkerMessage.Error error = (WorkerMessage.Error) messages.get(0);
        assert error.getRequestId() == 1L;
        assert error.getError().contains("not initialised");
    }

    @Test
    public void invalidLineIsReportedWithoutRequestId() {
        List<WorkerMessage> messages = run(INIT, "{not json", "{\"type\":\"ping\"}");

        long errors = messages.stream()
                .filter(message -> message instanceof WorkerMessage.Error error && error.getRequestId() == null)
                .count();
        assert errors == 2 : "Unexpected " + messages;
    }

    @Test
    public void unknownCommandIsAnsweredWithItsRequestId() {
        List<WorkerMessage> messages = run(INIT, "{\"type\":\"launch\",\"requestId\":9}");

        assert messages.size() == 2 : "Unexpected " + messages;
        WorkerMessage.Error error = (WorkerMessage.Error) messages.get(1);
        assert error.getRequestId() == 9L : "Unexpected " + error;
        assert error.getError().contains("launch") : error.getError();
    }

    @Test
    public void failingInitIsFatal() {
        List<WorkerMessage> messages = run(config -> {
            throw new IllegalStateException("No catalog source provider for ext");
        }, 1, INIT, "{\"type\":\"ping\",\"requestId\":1}");

        assert messages.get(0) instanceof WorkerMessage.FatalError : "Unexpected " + messages;
        assert ((WorkerMessage.FatalError) messages.get(0)).getError().contains("No catalog source");
        assert fatalCalls.get() == 1;
    }

    @Test
    public void repeatedInitIsIgnored() {
        List<WorkerMessage> messages = run(INIT, INIT);

        assert messages.size() == 1;
        assert messages.get(0) instanceof WorkerMessage.Ready;
    }

}
