package ca.purps.offlinestorage.exception;

public class WorkerDestroyedException extends WorkerException {

    public WorkerDestroyedException(String message) {
        super(message);
    }

    public WorkerDestroyedException(String message, Throwable cause) {
        super(message, cause);
    }

}
