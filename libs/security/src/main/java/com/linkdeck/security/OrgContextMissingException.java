package com.linkdeck.security;

/**
 * Thrown when an org-scoped endpoint is called without a resolvable, active organization.
 */
public class OrgContextMissingException extends DomainException {

    public OrgContextMissingException() {
        super(ErrorCode.ORG_CONTEXT_MISSING,
                "Provide X-Organization-UUID header or ?orgUuid= query parameter");
    }
}
