package ca.purps.offlinestorage.worker;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import ca.purps.offlinestorage.catalog.CatalogSourceLoader;
import ca.purps.offlinestorage.config.DownloadOptions;
import ca.purps.offlinestorage.downloader.OfflineStorageManager;
import ca.purps.offlinestorage.downloader.OkHttpPageFetcher;
import ca.purps.offlinestorage.exception.ProtocolException;
import ca.purps.offlinestorage.protocol.CommandType;
import ca.purps.offlinestorage.protocol.HostMessage;
import ca.purps.offlinestorage.protocol.InitMessage;
import ca.purps.offlinestorage.protocol.MessageCodec;
import ca.purps.offlinestorage.protocol.WorkerCommand;
import ca.purps.offlinestorage.protocol.WorkerInitConfig;
import ca.purps.offlinestorage.protocol.WorkerMessage;
import ca.purps.offlinestorage.repository.JsonOfflineRepository;
import lombok.extern.slf4j.Slf4j;

/**
 * Worker side of the protocol: reads host messages line by line, builds the offline storage
 * manager on init and answers every command in arrival order. {@link #run()} returns when the
 * host closes the input stream.
 */
@Slf4j
public class WorkerProcess implements AutoCloseable {

    private final BufferedReader input;
    private final PrintStream output;
    private final Function<WorkerInitConfig, OfflineStorageManager> managerFactory;
    /** Runs once after a fatal error was reported. */
    private final Runnable onFatal;
    private final ExecutorService commands = Executors.newSingleThreadExecutor(runnable -> new Thread(runnable, "worker-commands"));

    private volatile OfflineStorageManager manager;
    private volatile CommandDispatcher dispatcher;
    private volatile boolean fatal;

    public WorkerProcess(BufferedReader input, PrintStream output, Runnable onFatal) {
        this(input, output, WorkerProcess::createManager, onFatal);
    }

    public WorkerProcess(
            BufferedReader input,
            PrintStream output,
            Function<WorkerInitConfig, OfflineStorageManager> managerFactory,
            Runnable onFatal) {
        this.input = input;
        this.output = output;
        this.managerFactory = managerFactory;
        this.onFatal = onFatal;
    }

    static OfflineStorageManager createManager(WorkerInitConfig config) {
        DownloadOptions options = config.getWorkerOptions() != null ? config.getWorkerOptions() : DownloadOptions.defaults();
        return OfflineStorageManager.builder()
                .dataDir(Path.of(config.getDataDir()))
                .repository(new JsonOfflineRepository(Path.of(config.getDbPath())))
                .catalogSource(CatalogSourceLoader.load(config.getExtensionPath(), config.getExtensionId(), options))
                .pageFetcher(new OkHttpPageFetcher(options))
                .options(options)
                .build();
    }

    /**
     * @return process exit code: 0 after the host disconnected, 1 after a fatal error
     */
    public int run() {
        WorkerProcess.log.info("Waiting for initial configuration...");
        try {
            String line;
            while (!fatal && (line = input.readLine()) != null) {
                if (!line.isBlank()) {
                    handleLine(line);
                }
            }
        } catch (IOException e) {
            WorkerProcess.log.error("Failed reading from host", e);
        }

        if (!fatal) {
            WorkerProcess.log.info("Parent disconnected, shutting down...");
        }
        close();
        return fatal ? 1 : 0;
    }

    void handleLine(String line) {
        HostMessage message;
        try {
            message = MessageCodec.decodeHostMessage(line);
        } catch (ProtocolException e) {
            WorkerProcess.log.warn("Received invalid host message: {}", e.getMessage());
            send(WorkerMessage.Error.builder()
                    .requestId(MessageCodec.requestIdOf(line))
                    .error(e.getMessage())
                    .build());
            return;
        }

        if (message instanceof InitMessage init) {
            commands.execute(() -> initialize(init.getConfig()));
        } else if (message instanceof WorkerCommand command) {
            commands.execute(() -> handleCommand(command));
        }
    }

    private void initialize(WorkerInitConfig config) {
        if (manager != null) {
            WorkerProcess.log.warn("Ignoring repeated init");
            return;
        }

        try {
            OfflineStorageManager created = managerFactory.apply(config);
            created.on(event -> send(WorkerMessage.Event.builder().event(event).build()));
            manager = created;
            dispatcher = new CommandDispatcher(created);
            send(new WorkerMessage.Ready());
            WorkerProcess.log.info("Initialised successfully (data dir {})", config.getDataDir());
        } catch (RuntimeException e) {
            WorkerProcess.log.error("Initialization failed", e);
            sendFatalError(e);
        }
    }

    private void handleCommand(WorkerCommand command) {
        CommandType type = command.getType();
        try {
            if (dispatcher == null) {
                throw new IllegalStateException("Offline storage manager not initialised");
            }
            Object result = dispatcher.execute(command);
            send(WorkerMessage.Result.builder()
                    .requestId(command.getRequestId())
                    .result(MessageCodec.toTree(result))
                    .build());

            if (type == CommandType.START) {
                send(new WorkerMessage.Started());
            } else if (type == CommandType.STOP) {
                send(new WorkerMessage.Stopped());
            }
        } catch (RuntimeException e) {
            WorkerProcess.log.error("Command {} failed", type.getWireName(), e);
            send(WorkerMessage.Error.builder()
                    .requestId(command.getRequestId())
                    .error(messageOf(e))
                    .stack(stackTraceOf(e))
                    .build());
        }
    }

    /**
     * Reports an error the worker cannot recover from and ends the read loop.
     */
    public void sendFatalError(Throwable error) {
        boolean first = !fatal;
        fatal = true;
        send(WorkerMessage.FatalError.builder()
                .error(messageOf(error))
                .stack(stackTraceOf(error))
                .build());
        if (first) {
            onFatal.run();
        }
    }

    public boolean isFatal() {
        return fatal;
    }

    void send(WorkerMessage message) {
        String line;
        try {
            line = MessageCodec.encode(message);
        } catch (ProtocolException e) {
            WorkerProcess.log.error("Failed to encode {}", message.getClass().getSimpleName(), e);
            return;
        }
        synchronized (output) {
            output.println(line);
            output.flush();
        }
        if (output.checkError()) {
            WorkerProcess.log.error("Failed to send {} to host", message.getClass().getSimpleName());
        }
    }

    @Override
    public void close() {
        WorkerProcess.log.info("Cleaning up...");
        commands.shutdown();
        try {
            if (!commands.awaitTermination(5, TimeUnit.SECONDS)) {
                commands.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            commands.shutdownNow();
        }

        OfflineStorageManager current = manager;
        manager = null;
        dispatcher = null;
        if (current != null) {
            current.close();
        }
    }

    private static String messageOf(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getName();
    }

    private static String stackTraceOf(Throwable error) {
        StringWriter writer = new StringWriter();
        error.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }

}
