package ca.purps.offlinestorage.exception;

import lombok.Getter;

@Getter
public class WorkerTimeoutException extends WorkerException {

    private final String command;
    private final long timeoutMs;

    public WorkerTimeoutException(String command, long timeoutMs) {
        super(String.format("Worker command timeout: %s (no response within %d ms)", command, timeoutMs));
        this.command = command;
        this.timeoutMs = timeoutMs;
    }

}
