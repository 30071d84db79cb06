package com.linkdeck.security;

/**
 * Machine-readable error codes carried in the {@code code} field of every error payload.
 * <p>
 * Each code fixes the HTTP status it maps to and the short {@code error} text shown next to it.
 */
public enum ErrorCode {

    UNAUTHORIZED(401, "Unauthorized"),
    ORG_CONTEXT_MISSING(400, "Organization context required"),
    PERMISSION_DENIED(403, "Forbidden"),
    LAST_ADMIN_PROTECTION(409, "Last admin protection"),
    DUPLICATE_MEMBER(409, "User is already a member of this organization"),
    MEMBER_NOT_FOUND(404, "Member not found"),
    USER_NOT_FOUND(404, "User not found"),
    ROLE_NOT_FOUND(404, "Role not found"),
    ORG_NOT_FOUND(404, "Organization not found"),
    INVALID_ROLE(400, "Invalid role"),
    MISSING_IDENTIFIER(400, "Either email or userId is required"),
    SLUG_CONFLICT(409, "Slug already exists"),
    INVALID_REQUEST(400, "Bad request"),
    INTERNAL_ERROR(500, "Internal server error");

    private final int httpStatus;
    private final String error;

    ErrorCode(int httpStatus, String error) {
        this.httpStatus = httpStatus;
        this.error = error;
    }

    public int httpStatus() {
        return httpStatus;
    }

    /** Short human-readable error text for the payload's {@code error} field. */
    public String error() {
        return error;
    }
}
