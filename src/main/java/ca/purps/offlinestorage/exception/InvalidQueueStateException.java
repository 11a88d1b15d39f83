package ca.purps.offlinestorage.exception;

public class InvalidQueueStateException extends OfflineStorageException {

    public InvalidQueueStateException(String message) {
        super(message);
    }

    public InvalidQueueStateException(String message, Throwable cause) {
        super(message, cause);
    }

}
