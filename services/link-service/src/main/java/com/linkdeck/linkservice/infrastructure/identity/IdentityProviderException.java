package com.linkdeck.linkservice.infrastructure.identity;

import com.linkdeck.linkservice.domain.session.SessionStrategyException;

/** The identity provider could not be asked, or its answer could not be read. */
public class IdentityProviderException extends SessionStrategyException {

    public IdentityProviderException(String message) {
        super(message);
    }

    public IdentityProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
