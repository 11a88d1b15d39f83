package ca.purps.offlinestorage.config;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Settings of the host side: restart policy, timeouts and how the worker JVM is launched.
 */
@Value
@Builder(toBuilder = true)
public class SupervisorOptions {

    @Builder.Default
    private boolean autoRestart = true;

    /** Restarts allowed inside one {@link #restartWindowMs}. */
    @Builder.Default
    private int maxRestarts = 5;

    @Builder.Default
    private long restartWindowMs = 60_000;

    @Builder.Default
    private long restartDelayMs = 1000;

    /** Time between the terminate signal and the hard kill. */
    @Builder.Default
    private long killGraceMs = 5000;

    @Builder.Default
    private IpcTimeouts timeouts = IpcTimeouts.defaults();

    @Builder.Default
    private Path javaExecutable = Path.of(System.getProperty("java.home"), "bin", "java");

    @Builder.Default
    private String classpath = System.getProperty("java.class.path");

    @Singular
    private List<String> jvmArguments;

    public static SupervisorOptions defaults() {
        return SupervisorOptions.builder().build();
    }

}
