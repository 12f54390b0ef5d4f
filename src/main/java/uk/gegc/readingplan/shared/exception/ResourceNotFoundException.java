package uk.gegc.readingplan.shared.exception;

import uk.gegc.readingplan.shared.api.problem.ErrorCode;

/**
 * Thrown when a plan, student or day does not exist or is not visible to the caller.
 * Both cases use the same response so existence is never leaked to non-owners.
 */
public class ResourceNotFoundException extends RuntimeException {

    private final ErrorCode errorCode;

    public ResourceNotFoundException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
