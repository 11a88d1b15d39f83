package ca.purps.offlinestorage.exception;

public class InvalidArchiveException extends OfflineStorageException {

    public InvalidArchiveException(String message) {
        super(message);
    }

    public InvalidArchiveException(String message, Throwable cause) {
        super(message, cause);
    }

}
