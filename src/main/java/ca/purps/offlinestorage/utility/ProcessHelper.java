package ca.purps.offlinestorage.utility;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import ca.purps.offlinestorage.config.SupervisorOptions;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@UtilityClass
public class ProcessHelper {

    public static final String WORKER_MAIN_CLASS = "ca.purps.offlinestorage.Main";
    public static final String WORKER_SUBCOMMAND = "worker";

    /**
     * Command line starting a JVM that runs the worker subcommand on the given classpath.
     */
    public List<String> workerCommand(SupervisorOptions options) {
        List<String> command = new ArrayList<>();
        command.add(options.getJavaExecutable().toString());
        command.addAll(options.getJvmArguments());
        if (options.getClasspath() != null && !options.getClasspath().isBlank()) {
            command.add("-cp");
            command.add(options.getClasspath());
        }
        command.add(WORKER_MAIN_CLASS);
        command.add(WORKER_SUBCOMMAND);
        return command;
    }

    public Process start(List<String> command) throws IOException {
        ProcessBuilder processBuilder = new ProcessBuilder(command);
        ProcessHelper.log.debug("Executing Command: {}", String.join(" ", processBuilder.command()));
        return processBuilder.start();
    }

    /**
     * Asks the process to terminate and kills it when it is still alive after the grace period.
     *
     * @return exit code, or null when the process could not be reaped
     */
    public Integer terminate(Process process, long graceMs) {
        if (!process.isAlive()) {
            return process.exitValue();
        }

        process.destroy();
        try {
            return process.onExit().get(graceMs, TimeUnit.MILLISECONDS).exitValue();
        } catch (TimeoutException e) {
            ProcessHelper.log.warn("Process {} did not exit within {} ms, killing it", process.pid(), graceMs);
        } catch (ExecutionException e) {
            ProcessHelper.log.warn("Failed waiting for process {}", process.pid(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ProcessHelper.log.warn("Interrupted while waiting for process {}, killing it", process.pid());
        }

        process.destroyForcibly();
        try {
            return process.waitFor(graceMs, TimeUnit.MILLISECONDS) ? process.exitValue() : null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

}
