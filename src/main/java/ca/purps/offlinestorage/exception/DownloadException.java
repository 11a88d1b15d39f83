package ca.purps.offlinestorage.exception;

public class DownloadException extends OfflineStorageException {

    public DownloadException(String message) {
        super(message);
    }

    public DownloadException(String message, Throwable cause) {
        super(message, cause);
    }

}
