package com.linkdeck.security;

/**
 * Base for every error that maps onto an {@link ErrorCode} and the standard
 * {@code {error, code, message}} payload.
 * <p>
 * Unchecked: callers on the request path let these propagate to the web layer, which
 * renders them; nothing in between is expected to recover.
 */
public class DomainException extends RuntimeException {

    private final ErrorCode code;

    public DomainException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public DomainException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }
}
