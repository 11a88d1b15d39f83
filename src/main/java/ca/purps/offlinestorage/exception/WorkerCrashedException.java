package ca.purps.offlinestorage.exception;

import lombok.Getter;

@Getter
public class WorkerCrashedException extends WorkerException {

    private final Integer exitCode;

    public WorkerCrashedException(Integer exitCode) {
        super("Worker process exited" + (exitCode != null ? " with code " + exitCode : ""));
        this.exitCode = exitCode;
    }

}
