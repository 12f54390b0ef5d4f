package uk.gegc.readingplan.shared.api.problem;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 * Each constant should point to documentation describing the error.
 *
 * @see ProblemDetailBuilder
 * @see ErrorCode
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://readingplan.gegc.uk/docs/errors";

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");

    // ==================== Resource Errors ====================
    public static final URI PLAN_NOT_FOUND = URI.create(BASE_URL + "/plan-not-found");
    public static final URI STUDENT_NOT_FOUND = URI.create(BASE_URL + "/student-not-found");
    public static final URI DAY_NOT_FOUND = URI.create(BASE_URL + "/day-not-found");

    // ==================== Plan State Errors ====================
    public static final URI DAY_LOCKED = URI.create(BASE_URL + "/day-locked");
    public static final URI DAY_ALREADY_COMPLETE = URI.create(BASE_URL + "/day-already-complete");
    public static final URI ACTIVITIES_INCOMPLETE = URI.create(BASE_URL + "/activities-incomplete");
    public static final URI CONCURRENT_UPDATE = URI.create(BASE_URL + "/concurrent-update");

    // ==================== Upstream Errors ====================
    public static final URI CONTENT_GENERATION_UNAVAILABLE = URI.create(BASE_URL + "/content-generation-unavailable");

    // ==================== Security Errors ====================
    public static final URI UNAUTHORIZED = URI.create(BASE_URL + "/unauthorized");
    public static final URI ACCESS_DENIED = URI.create(BASE_URL + "/access-denied");

    // ==================== Server Errors ====================
    public static final URI PERSISTENCE_ERROR = URI.create(BASE_URL + "/persistence-error");
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
