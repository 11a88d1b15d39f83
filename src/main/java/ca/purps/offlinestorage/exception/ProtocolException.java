package ca.purps.offlinestorage.exception;

public class ProtocolException extends OfflineStorageException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }

}
