package ca.purps.offlinestorage.cli;

import java.io.BufferedReader;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

import ca.purps.offlinestorage.worker.WorkerProcess;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.Command;

@Slf4j
@Command(name = "worker", description = "Run the download worker; the host talks to it over standard input/output")
public class WorkerSubcommand implements Callable<Integer> {

    private static final long FATAL_EXIT_DELAY_MS = 100;

    @Override
    public Integer call() {
        PrintStream protocol = new PrintStream(new FileOutputStream(FileDescriptor.out), false, StandardCharsets.UTF_8);
        // anything printed by library code lands in the log stream instead of the protocol
        System.setOut(System.err);

        BufferedReader input = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        WorkerProcess process = new WorkerProcess(input, protocol, WorkerSubcommand::exitLater);

        Runtime.getRuntime().addShutdownHook(new Thread(process::close, "worker-shutdown"));
        Thread.setDefaultUncaughtExceptionHandler((thread, error) -> {
            WorkerSubcommand.log.error("Uncaught exception in {}", thread.getName(), error);
            process.sendFatalError(error);
        });

        WorkerSubcommand.log.info("Process starting...");
        return process.run();
    }

    // gives the host time to read the fatal-error line
    private static void exitLater() {
        Thread exit = new Thread(() -> {
            try {
                Thread.sleep(FATAL_EXIT_DELAY_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            System.exit(1);
        }, "worker-exit");
        exit.setDaemon(true);
        exit.start();
    }

}
