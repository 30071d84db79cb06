package com.linkdeck.linkservice.domain.user;

/** Where a user stands in the access-approval workflow. */
public enum AccessStatus {

    PENDING("pending"),
    ACTIVE("active"),
    REVOKED("revoked");

    private final String id;

    AccessStatus(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /** Unknown or missing ids read as {@link #PENDING}. */
    public static AccessStatus fromId(String id) {
        for (AccessStatus status : values()) {
            if (status.id.equals(id)) {
                return status;
            }
        }
        return PENDING;
    }
}
