package uk.gegc.readingplan.shared.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import uk.gegc.readingplan.shared.api.problem.ErrorCode;
import uk.gegc.readingplan.shared.api.problem.ProblemDetailBuilder;
import uk.gegc.readingplan.shared.exception.ActivitiesIncompleteException;
import uk.gegc.readingplan.shared.exception.ContentGenerationException;
import uk.gegc.readingplan.shared.exception.PlanStateException;
import uk.gegc.readingplan.shared.exception.ResourceNotFoundException;
import uk.gegc.readingplan.shared.exception.ValidationException;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final int MAX_STACK_FRAMES = 15;

    @Value("${app.errors.include-details:false}")
    private boolean includeDetails;

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleResourceNotFound(ResourceNotFoundException ex, HttpServletRequest request) {
        return respond(ProblemDetailBuilder.create(ex.getErrorCode(), ex.getMessage(), request), ex);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ProblemDetail> handleValidation(ValidationException ex, HttpServletRequest request) {
        return respond(ProblemDetailBuilder.create(ex.getErrorCode(), ex.getMessage(), request), ex);
    }

    @ExceptionHandler(PlanStateException.class)
    public ResponseEntity<ProblemDetail> handlePlanState(PlanStateException ex, HttpServletRequest request) {
        return respond(ProblemDetailBuilder.create(ex.getErrorCode(), ex.getMessage(), request), ex);
    }

    @ExceptionHandler(ActivitiesIncompleteException.class)
    public ResponseEntity<ProblemDetail> handleActivitiesIncomplete(ActivitiesIncompleteException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.createWithProperties(
                ErrorCode.ACTIVITIES_INCOMPLETE,
                ex.getMessage(),
                request,
                Map.of("failedActivities", ex.getFailedActivities())
        );
        return respond(problem, ex);
    }

    @ExceptionHandler(ContentGenerationException.class)
    public ResponseEntity<ProblemDetail> handleContentGeneration(ContentGenerationException ex, HttpServletRequest request) {
        logger.warn("Content generation unavailable: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                ErrorCode.CONTENT_GENERATION_UNAVAILABLE,
                "Content generation is temporarily unavailable. Please try again in a few minutes.",
                request
        );
        return respond(problem, ex);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ProblemDetail> handleConstraintViolation(ConstraintViolationException ex, HttpServletRequest request) {
        String detail = ex.getConstraintViolations().stream()
                .map(ConstraintViolation::getMessage)
                .collect(Collectors.joining("; "));
        return respond(ProblemDetailBuilder.create(ErrorCode.VALIDATION_ERROR, detail, request), ex);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String detail = "Invalid value '" + ex.getValue() + "' for parameter '" + ex.getName() + "'";
        return respond(ProblemDetailBuilder.create(ErrorCode.VALIDATION_ERROR, detail, request), ex);
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ProblemDetail> handleOptimisticLock(OptimisticLockingFailureException ex, HttpServletRequest request) {
        logger.info("Concurrent update rejected: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                ErrorCode.CONCURRENT_UPDATE,
                "The day was modified by another request. Please refresh and try again.",
                request
        );
        return respond(problem, ex);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ProblemDetail> handleDataAccess(DataAccessException ex, HttpServletRequest request) {
        logger.error("Persistence failure: {}", ex.getMessage(), ex);
        ProblemDetail problem = ProblemDetailBuilder.create(
                ErrorCode.PERSISTENCE_ERROR,
                "A storage error occurred. Please try again later.",
                request
        );
        return respond(problem, ex);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request
    ) {
        String msg = ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage();
        ProblemDetail problem = ProblemDetailBuilder.create(
                ErrorCode.VALIDATION_ERROR,
                "Request body is malformed or cannot be read",
                request
        );
        problem.setProperty("parseError", msg);
        appendDetails(problem, ex);
        return new ResponseEntity<>(problem, headers, ErrorCode.VALIDATION_ERROR.getStatus());
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(
            @NonNull MethodArgumentNotValidException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request
    ) {
        List<FieldValidationError> fieldErrors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> new FieldValidationError(error.getField(), error.getDefaultMessage()))
                .toList();
        String detail = fieldErrors.stream()
                .map(error -> error.field() + ": " + error.message())
                .collect(Collectors.joining("; "));
        ProblemDetail problem = ProblemDetailBuilder.create(ErrorCode.VALIDATION_ERROR, detail, request);
        problem.setProperty("fieldErrors", fieldErrors);
        return new ResponseEntity<>(problem, headers, ErrorCode.VALIDATION_ERROR.getStatus());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleAllOthers(Exception ex, HttpServletRequest request) {
        logger.error("Unhandled exception: {}", ex.getMessage(), ex);
        ProblemDetail problem = ProblemDetailBuilder.create(
                ErrorCode.INTERNAL_ERROR,
                "An unexpected error occurred",
                request
        );
        return respond(problem, ex);
    }

    private ResponseEntity<ProblemDetail> respond(ProblemDetail problem, Exception ex) {
        appendDetails(problem, ex);
        return ResponseEntity.status(problem.getStatus()).body(problem);
    }

    private void appendDetails(ProblemDetail problem, Exception ex) {
        if (!includeDetails) {
            return;
        }
        problem.setProperty("details", ex.getClass().getName() + ": " + ex.getMessage());
        problem.setProperty("stack", Arrays.stream(ex.getStackTrace())
                .limit(MAX_STACK_FRAMES)
                .map(StackTraceElement::toString)
                .toList());
    }

    public record FieldValidationError(String field, String message) {
    }
}
