package ca.purps.offlinestorage.exception;

public class CatalogException extends OfflineStorageException {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }

}
