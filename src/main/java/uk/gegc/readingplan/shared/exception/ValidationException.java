package uk.gegc.readingplan.shared.exception;

import uk.gegc.readingplan.shared.api.problem.ErrorCode;

public class ValidationException extends RuntimeException {

    private final ErrorCode errorCode;

    public ValidationException(String message) {
        this(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
