package ca.purps.offlinestorage.exception;

public class OfflineContentNotFoundException extends OfflineStorageException {

    public OfflineContentNotFoundException(String message) {
        super(message);
    }

    public OfflineContentNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

}
