package uk.gegc.readingplan.shared.api.problem;

import org.springframework.http.HttpStatus;

import java.net.URI;

/**
 * Machine-readable error codes exposed in the {@code error} property of every problem response.
 */
public enum ErrorCode {

    VALIDATION_ERROR(HttpStatus.BAD_REQUEST, ErrorTypes.VALIDATION_FAILED, "Validation Failed"),
    INVALID_ANSWERS(HttpStatus.BAD_REQUEST, ErrorTypes.VALIDATION_FAILED, "Invalid Answers"),
    STUDENT_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorTypes.STUDENT_NOT_FOUND, "Student Not Found"),
    PLAN_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorTypes.PLAN_NOT_FOUND, "Plan Not Found"),
    DAY_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorTypes.DAY_NOT_FOUND, "Day Not Found"),
    DAY_LOCKED(HttpStatus.BAD_REQUEST, ErrorTypes.DAY_LOCKED, "Day Locked"),
    DAY_ALREADY_COMPLETE(HttpStatus.BAD_REQUEST, ErrorTypes.DAY_ALREADY_COMPLETE, "Day Already Complete"),
    ACTIVITIES_INCOMPLETE(HttpStatus.BAD_REQUEST, ErrorTypes.ACTIVITIES_INCOMPLETE, "Activities Incomplete"),
    CONCURRENT_UPDATE(HttpStatus.CONFLICT, ErrorTypes.CONCURRENT_UPDATE, "Concurrent Update"),
    CONTENT_GENERATION_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, ErrorTypes.CONTENT_GENERATION_UNAVAILABLE, "Content Generation Unavailable"),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, ErrorTypes.UNAUTHORIZED, "Unauthorized"),
    ACCESS_DENIED(HttpStatus.FORBIDDEN, ErrorTypes.ACCESS_DENIED, "Access Denied"),
    PERSISTENCE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, ErrorTypes.PERSISTENCE_ERROR, "Persistence Error"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, ErrorTypes.INTERNAL_SERVER_ERROR, "Internal Server Error");

    private final HttpStatus status;
    private final URI type;
    private final String title;

    ErrorCode(HttpStatus status, URI type, String title) {
        this.status = status;
        this.type = type;
        this.title = title;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public URI getType() {
        return type;
    }

    public String getTitle() {
        return title;
    }
}
