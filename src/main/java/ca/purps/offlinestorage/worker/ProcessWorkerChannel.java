package ca.purps.offlinestorage.worker;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ca.purps.offlinestorage.utility.ProcessHelper;
import lombok.extern.slf4j.Slf4j;

/**
 * Worker running as a child JVM. Protocol lines travel over its standard input and output while
 * its standard error is relayed into the {@code worker} logger.
 */
@Slf4j
public class ProcessWorkerChannel implements WorkerChannel {

    private static final Logger WORKER_LOG = LoggerFactory.getLogger("worker");

    private final Process process;
    private final BufferedWriter stdin;

    ProcessWorkerChannel(Process process, Listener listener) {
        this.process = process;
        this.stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));

        Thread stdout = new Thread(() -> readOutput(listener), "worker-stdout-" + process.pid());
        stdout.setDaemon(true);
        stdout.start();

        Thread stderr = new Thread(this::relayErrors, "worker-stderr-" + process.pid());
        stderr.setDaemon(true);
        stderr.start();
    }

    @Override
    public synchronized void send(String line) throws IOException {
        stdin.write(line);
        stdin.newLine();
        stdin.flush();
    }

    @Override
    public boolean isAlive() {
        return process.isAlive();
    }

    @Override
    public void terminate(long graceMs) {
        Integer exitCode = ProcessHelper.terminate(process, graceMs);
        ProcessWorkerChannel.log.debug("Worker {} terminated with exit code {}", process.pid(), exitCode);
    }

    public long pid() {
        return process.pid();
    }

    private void readOutput(Listener listener) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    listener.onLine(line);
                }
            }
        } catch (IOException e) {
            ProcessWorkerChannel.log.debug("Worker {} output closed: {}", process.pid(), e.getMessage());
        }

        Integer exitCode;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            exitCode = null;
        }
        listener.onExit(exitCode);
    }

    private void relayErrors() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                WORKER_LOG.info(line);
            }
        } catch (IOException e) {
            ProcessWorkerChannel.log.debug("Worker {} error stream closed: {}", process.pid(), e.getMessage());
        }
    }

}
