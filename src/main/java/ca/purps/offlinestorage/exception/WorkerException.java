package ca.purps.offlinestorage.exception;

public class WorkerException extends OfflineStorageException {

    public WorkerException(String message) {
        super(message);
    }

    public WorkerException(String message, Throwable cause) {
        super(message, cause);
    }

}
