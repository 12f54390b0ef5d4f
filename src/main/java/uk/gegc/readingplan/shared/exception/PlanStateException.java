package uk.gegc.readingplan.shared.exception;

import uk.gegc.readingplan.shared.api.problem.ErrorCode;

/**
 * Thrown when a request conflicts with the current state of a plan day,
 * e.g. reading a locked day or completing a day twice.
 */
public class PlanStateException extends RuntimeException {

    private final ErrorCode errorCode;

    public PlanStateException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
