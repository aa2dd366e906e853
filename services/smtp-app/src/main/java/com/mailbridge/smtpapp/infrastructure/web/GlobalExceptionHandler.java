package com.mailbridge.smtpapp.infrastructure.web;

import com.mailbridge.observability.CorrelationContextHolder;
import com.mailbridge.smtpapp.pipeline.ProcedureFailure;
import com.mailbridge.smtpapp.pipeline.ProcedureRejectedException;
import com.mailbridge.smtpapp.registration.RegistrationRejectedException;
import com.mailbridge.smtpapp.smtp.ConfigurationNotFoundException;
import com.mailbridge.tenantapi.TenantApiException;
import java.net.URI;
import java.time.Instant;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses carrying a timestamp and the
 * correlation id.
 *
 * <pre>
 * {
 *   "type": "https://mailbridge.dev/errors/authorization-denied",
 *   "title": "Forbidden",
 *   "status": 403,
 *   "detail": "JWT verification failed",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Token rejections keep one opaque detail; the specific reason is only in the logs.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String ERROR_TYPE_BASE = "https://mailbridge.dev/errors/";

    @ExceptionHandler(ProcedureRejectedException.class)
    public ProblemDetail handleProcedureRejected(ProcedureRejectedException ex) {
        ProcedureFailure failure = ex.failure();
        HttpStatus status = switch (failure.kind()) {
            case BAD_REQUEST -> HttpStatus.BAD_REQUEST;
            case UNAUTHENTICATED -> HttpStatus.UNAUTHORIZED;
            case AUTHORIZATION_DENIED -> HttpStatus.FORBIDDEN;
            case KEY_SET_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        if (status.is5xxServerError()) {
            log.error("Procedure refused: {}", failure);
        } else {
            log.info("Procedure refused: {}", failure);
        }
        String type = failure.kind().name().toLowerCase(Locale.ROOT).replace('_', '-');
        return problem(status, failure.message(), type);
    }

    @ExceptionHandler(RegistrationRejectedException.class)
    public ProblemDetail handleRegistrationRejected(RegistrationRejectedException ex) {
        log.warn("Installation refused: {}", ex.getMessage());
        return problem(ex.status(), ex.getMessage(), "registration-rejected");
    }

    @ExceptionHandler(ConfigurationNotFoundException.class)
    public ProblemDetail handleNotFound(ConfigurationNotFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, ex.getMessage(), "not-found");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "bad-request");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, detail, "validation");
        problem.setTitle("Validation Error");
        return problem;
    }

    @ExceptionHandler(TenantApiException.class)
    public ProblemDetail handleTenantApi(TenantApiException ex) {
        log.error("Tenant API call failed (status {}, errors {}): {}",
                ex.status().orElse(null), ex.errors(), ex.getMessage());
        return problem(HttpStatus.BAD_GATEWAY, "The tenant API call failed", "tenant-api");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", "internal");
    }

    private static ProblemDetail problem(HttpStatus status, String detail, String type) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(status.getReasonPhrase());
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }
}
