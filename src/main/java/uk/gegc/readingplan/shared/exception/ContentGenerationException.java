package uk.gegc.readingplan.shared.exception;

/**
 * Exception thrown when the content generator fails or returns unusable content
 */
public class ContentGenerationException extends RuntimeException {

    public ContentGenerationException(String message) {
        super(message);
    }

    public ContentGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
