package ca.purps.offlinestorage.exception;

import lombok.Getter;

/**
 * Error reported by the worker for one specific request.
 */
@Getter
public class WorkerCommandException extends WorkerException {

    private final String command;
    private final String remoteStack;

    public WorkerCommandException(String command, String message, String remoteStack) {
        super(message);
        this.command = command;
        this.remoteStack = remoteStack;
    }

}
