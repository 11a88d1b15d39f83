package ca.purps.offlinestorage.exception;

public class ChapterAlreadyDownloadedException extends OfflineStorageException {

    public ChapterAlreadyDownloadedException(String message) {
        super(message);
    }

    public ChapterAlreadyDownloadedException(String message, Throwable cause) {
        super(message, cause);
    }

}
