package ca.purps.offlinestorage.exception;

public class RepositoryException extends OfflineStorageException {

    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }

}
