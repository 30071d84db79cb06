package com.linkdeck.linkservice.domain.audit;

/** Outcome recorded for an authentication or authorization attempt. */
public enum AuditStatus {
    SUCCESS,
    INVALID,
    ERROR,
    DENIED
}
