package com.warden.authservice.infrastructure.web;

import com.warden.observability.CorrelationContextHolder;
import com.warden.security.InsufficientPermissionsException;
import com.warden.security.InvalidCredentialsException;
import com.warden.security.ResourceNotFoundException;
import com.warden.security.TenantMismatchException;
import com.warden.security.TokenExpiredException;
import com.warden.security.password.PasswordPolicyViolationException;
import com.warden.security.user.DuplicateUserException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "https://warden.dev/errors/unauthorized",
 *   "title": "Unauthorized",
 *   "status": 401,
 *   "detail": "Invalid credentials",
 *   "timestamp": "2024-01-01T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Authentication failures always carry the generic message. A tenant mismatch is reported the
 * same way as bad credentials; only an expired token is distinguishable, through the
 * {@code expired} property.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final String TYPE_BASE = "https://warden.dev/errors/";

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler(TenantResolutionException.class)
    public ProblemDetail handleTenantResolution(TenantResolutionException ex) {
        log.warn("Tenant not resolved: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "tenant-required", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", detail);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ProblemDetail handleMethodValidation(HandlerMethodValidationException ex) {
        log.warn("Parameter validation failed: {}", ex.getMessage());
        String detail = ex.getAllValidationResults().stream()
                .flatMap(result -> result.getResolvableErrors().stream()
                        .map(error -> result.getMethodParameter().getParameterName() + ": " + error.getDefaultMessage()))
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", detail);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ProblemDetail handleUnreadable(Exception ex) {
        log.warn("Unreadable request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", "Malformed request");
    }

    @ExceptionHandler(PasswordPolicyViolationException.class)
    public ProblemDetail handlePasswordPolicy(PasswordPolicyViolationException ex) {
        log.info("Password rejected by policy: {} violation(s)", ex.violations().size());
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "Password Policy Violation", "password-policy",
                "Password does not meet the policy");
        problem.setProperty("violations", ex.violations());
        return problem;
    }

    @ExceptionHandler(DuplicateUserException.class)
    public ProblemDetail handleDuplicate(DuplicateUserException ex) {
        log.info("Duplicate user rejected");
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "duplicate-user",
                "A user with this email already exists");
    }

    @ExceptionHandler(InvalidCredentialsException.class)
    public ProblemDetail handleInvalidCredentials(InvalidCredentialsException ex) {
        return unauthorized();
    }

    @ExceptionHandler(TenantMismatchException.class)
    public ProblemDetail handleTenantMismatch(TenantMismatchException ex) {
        log.warn("Token of tenant {} presented to tenant {}", ex.principalTenantId(), ex.requestTenantId());
        return unauthorized();
    }

    @ExceptionHandler(TokenExpiredException.class)
    public ProblemDetail handleExpired(TokenExpiredException ex) {
        ProblemDetail problem = problem(HttpStatus.UNAUTHORIZED, "Unauthorized", "token-expired", ex.getMessage());
        problem.setProperty("expired", true);
        return problem;
    }

    @ExceptionHandler(InsufficientPermissionsException.class)
    public ProblemDetail handleForbidden(InsufficientPermissionsException ex) {
        log.info("Forbidden: {}", ex.getMessage());
        return problem(HttpStatus.FORBIDDEN, "Forbidden", "forbidden", ex.getMessage());
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ProblemDetail handleNotFound(ResourceNotFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", "Resource not found");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            // MVC errors such as an unknown path keep their own status
            log.debug("Request rejected by MVC: {}", ex.getMessage());
            ProblemDetail problem = errorResponse.getBody();
            enrich(problem);
            return problem;
        }
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
                "An unexpected error occurred");
    }

    private ProblemDetail unauthorized() {
        return problem(HttpStatus.UNAUTHORIZED, "Unauthorized", "unauthorized",
                InvalidCredentialsException.GENERIC_MESSAGE);
    }

    private ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(TYPE_BASE + type));
        enrich(problem);
        return problem;
    }

    private void enrich(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }
}
