package com.linkdeck.linkservice.infrastructure.web;

import com.linkdeck.observability.LogRedactor;
import com.linkdeck.security.DomainException;
import com.linkdeck.security.ErrorCode;
import com.linkdeck.security.PermissionDeniedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps exceptions to {@link ErrorPayload} responses.
 *
 * <pre>
 * {
 *   "error": "Forbidden",
 *   "code": "PERMISSION_DENIED",
 *   "message": "You do not have permission to perform this action (required: members.write)",
 *   "permission": "members.write"
 * }
 * </pre>
 *
 * <p>Domain errors carry their own status. Anything unexpected becomes a 500 with a generic
 * message; the correlation ID in the {@code X-Correlation-ID} response header ties it to the log.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(DomainException.class)
    public ResponseEntity<ErrorPayload> handleDomain(DomainException ex) {
        ErrorCode code = ex.code();
        if (code.httpStatus() >= 500) {
            log.error("Request failed: {}", LogRedactor.maskEmails(ex.getMessage()), ex);
        } else {
            log.debug("Request rejected with {}: {}", code, LogRedactor.maskEmails(ex.getMessage()));
        }
        String permission = ex instanceof PermissionDeniedException denied ? denied.permission() : null;
        return ResponseEntity.status(code.httpStatus())
                .body(new ErrorPayload(code.error(), code.name(), ex.getMessage(), permission));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorPayload> handleValidation(MethodArgumentNotValidException ex) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        log.debug("Validation failed: {}", detail);
        return badRequest(detail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorPayload> handleUnreadable(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return badRequest("Request body is missing or malformed");
    }

    @ExceptionHandler({
        NoResourceFoundException.class,
        HttpRequestMethodNotSupportedException.class,
        MissingServletRequestParameterException.class
    })
    public ResponseEntity<ErrorPayload> handleFramework(Exception ex) {
        int status = ((ErrorResponse) ex).getStatusCode().value();
        return ResponseEntity.status(status)
                .body(new ErrorPayload(ErrorCode.INVALID_REQUEST.error(), ErrorCode.INVALID_REQUEST.name(),
                        ex.getMessage(), null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorPayload> handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return ResponseEntity.status(ErrorCode.INTERNAL_ERROR.httpStatus())
                .body(ErrorPayload.of(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred"));
    }

    private static ResponseEntity<ErrorPayload> badRequest(String message) {
        return ResponseEntity.status(ErrorCode.INVALID_REQUEST.httpStatus())
                .body(ErrorPayload.of(ErrorCode.INVALID_REQUEST, message));
    }
}
