package com.keystone.gateway.infrastructure.web;

import static com.keystone.observability.SensitiveDataRedactor.scrub;

import com.keystone.crypto.EnvelopeException;
import com.keystone.gateway.domain.ProfileNotFoundException;
import com.keystone.observability.CorrelationContextHolder;
import com.keystone.observability.MetricFactory;
import com.keystone.security.access.AccessDeniedException;
import com.keystone.security.access.RoleLookupException;
import com.keystone.security.token.TokenVerificationException;
import com.keystone.sharing.InvalidRequestTransitionException;
import com.keystone.sharing.SharingRequestNotFoundException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <p>Authentication and authorization failures are collapsed: every token problem is the same
 * 401 and every denial the same 403, whatever the underlying reason. The reason is only logged
 * and counted in {@code keystone.auth.failures}.
 *
 * <pre>
 * {
 *   "type": "https://keystone.dev/errors/unauthorized",
 *   "title": "Unauthorized",
 *   "status": 401,
 *   "detail": "Authentication required",
 *   "timestamp": "2025-03-01T12:00:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String ERROR_BASE = "https://keystone.dev/errors/";

    private final MetricFactory metrics;

    public GlobalExceptionHandler(MetricFactory metrics) {
        this.metrics = metrics;
    }

    @ExceptionHandler(TokenVerificationException.class)
    public ResponseEntity<ProblemDetail> handleTokenVerification(TokenVerificationException ex) {
        log.warn("Authentication failed ({}): {}", ex.reason(), scrub(ex.getMessage()));
        metrics.recordAuthFailure(ex.reason().name());
        return unauthorized();
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ProblemDetail> handleAccessDenied(AccessDeniedException ex) {
        log.warn("Access denied ({}) for level {}", ex.reason(), ex.requiredLevel());
        metrics.recordAuthFailure(ex.reason().name());
        if (ex.reason() == AccessDeniedException.Reason.UNAUTHENTICATED) {
            return unauthorized();
        }
        ProblemDetail problem = problem(HttpStatus.FORBIDDEN, "Forbidden", "Access denied", "forbidden");
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problem);
    }

    @ExceptionHandler(EnvelopeException.class)
    public ProblemDetail handleEnvelope(EnvelopeException ex) {
        log.warn("Decryption failed ({}): {}", ex.reason(), ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "Payload could not be decrypted", "decryption");
    }

    @ExceptionHandler(SharingRequestNotFoundException.class)
    public ProblemDetail handleSharingRequestNotFound(SharingRequestNotFoundException ex) {
        log.info("Unknown sharing request {}", ex.requestId());
        return problem(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), "not-found");
    }

    @ExceptionHandler(ProfileNotFoundException.class)
    public ProblemDetail handleProfileNotFound(ProfileNotFoundException ex) {
        log.info("No profile for {}", ex.customerId());
        return problem(HttpStatus.NOT_FOUND, "Not Found", "No profile stored", "not-found");
    }

    @ExceptionHandler(InvalidRequestTransitionException.class)
    public ProblemDetail handleInvalidTransition(InvalidRequestTransitionException ex) {
        log.warn("Rejected sharing request action: {}", ex.getMessage());
        ProblemDetail problem =
                problem(
                        HttpStatus.CONFLICT,
                        "Conflict",
                        "Sharing request is %s; action not allowed".formatted(ex.currentStatus()),
                        "invalid-transition");
        problem.setProperty("reason", ex.reason().name());
        return problem;
    }

    @ExceptionHandler(RoleLookupException.class)
    public ProblemDetail handleRoleLookup(RoleLookupException ex) {
        log.error("Role lookup failed: {}", ex.getMessage());
        return problem(HttpStatus.BAD_GATEWAY, "Bad Gateway", "Role lookup unavailable", "upstream");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        String detail = scrub(ex.getMessage());
        log.warn("Bad request: {}", detail);
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", detail, "bad-request");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", scrub(ex.getMessage()));
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", detail, "validation");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse framework) {
            // unknown routes, unsupported methods, unreadable bodies
            ProblemDetail problem = framework.getBody();
            enrichWithCorrelation(problem);
            return ResponseEntity.status(framework.getStatusCode()).body(problem);
        }
        log.error("Internal server error", ex);
        ProblemDetail problem =
                problem(
                        HttpStatus.INTERNAL_SERVER_ERROR,
                        "Internal Server Error",
                        "An unexpected error occurred",
                        "internal");
        return ResponseEntity.internalServerError().body(problem);
    }

    private ResponseEntity<ProblemDetail> unauthorized() {
        ProblemDetail problem =
                problem(HttpStatus.UNAUTHORIZED, "Unauthorized", "Authentication required", "unauthorized");
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
                .body(problem);
    }

    private static ProblemDetail problem(HttpStatus status, String title, String detail, String type) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_BASE + type));
        enrichWithCorrelation(problem);
        return problem;
    }

    private static void enrichWithCorrelation(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }
}
