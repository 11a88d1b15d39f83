package ca.purps.offlinestorage.exception;

/**
 * Raised when a slug cannot be turned into a safe single path segment.
 */
public class InvalidSlugException extends IllegalArgumentException {

    public InvalidSlugException(String message) {
        super(message);
    }

}
