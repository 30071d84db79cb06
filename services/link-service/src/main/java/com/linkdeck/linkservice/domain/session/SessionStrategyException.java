package com.linkdeck.linkservice.domain.session;

/**
 * A session strategy could not decide: provider unreachable, unexpected response, unreadable
 * session cookie. Always collapses to an invalid session.
 */
public class SessionStrategyException extends RuntimeException {

    public SessionStrategyException(String message) {
        super(message);
    }

    public SessionStrategyException(String message, Throwable cause) {
        super(message, cause);
    }
}
