package ca.purps.offlinestorage.exception;

public class OfflineStorageException extends RuntimeException {

    public OfflineStorageException(String message) {
        super(message);
    }

    public OfflineStorageException(String message, Throwable cause) {
        super(message, cause);
    }

}
