package uk.gegc.readingplan.shared.api.problem;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ProblemDetail;
import org.springframework.web.context.request.WebRequest;

import java.net.URI;
import java.time.Instant;
import java.util.Map;

/**
 * Helper functions for building RFC 7807 {@link ProblemDetail} instances in a consistent way.
 * Every problem carries the {@code message}, {@code error} and {@code timestamp} properties
 * that clients rely on.
 */
public final class ProblemDetailBuilder {

    private ProblemDetailBuilder() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Creates a {@link ProblemDetail} using the provided HTTP request to populate the {@code instance} field.
     */
    public static ProblemDetail create(ErrorCode code, String message, HttpServletRequest request) {
        ProblemDetail problem = base(code, message);
        if (request != null) {
            problem.setInstance(URI.create(request.getRequestURI()));
        }
        return problem;
    }

    /**
     * Creates a {@link ProblemDetail} using Spring's {@link WebRequest} to populate the instance field.
     * Useful inside Spring MVC override methods where an {@link HttpServletRequest} is not available.
     */
    public static ProblemDetail create(ErrorCode code, String message, WebRequest request) {
        ProblemDetail problem = base(code, message);
        if (request != null) {
            String description = request.getDescription(false);
            if (description != null) {
                String uri = description.startsWith("uri=") ? description.substring(4) : description;
                problem.setInstance(URI.create(uri));
            }
        }
        return problem;
    }

    /**
     * Creates a {@link ProblemDetail} and applies the supplied custom properties in a single call.
     */
    public static ProblemDetail createWithProperties(
            ErrorCode code,
            String message,
            HttpServletRequest request,
            Map<String, Object> properties
    ) {
        ProblemDetail problem = create(code, message, request);
        if (properties != null) {
            properties.forEach(problem::setProperty);
        }
        return problem;
    }

    private static ProblemDetail base(ErrorCode code, String message) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(code.getStatus(), message);
        problem.setType(code.getType());
        problem.setTitle(code.getTitle());
        problem.setProperty("message", message);
        problem.setProperty("error", code.name());
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }
}
