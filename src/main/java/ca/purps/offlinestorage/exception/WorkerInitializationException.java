package ca.purps.offlinestorage.exception;

public class WorkerInitializationException extends WorkerException {

    public WorkerInitializationException(String message) {
        super(message);
    }

    public WorkerInitializationException(String message, Throwable cause) {
        super(message, cause);
    }

}
