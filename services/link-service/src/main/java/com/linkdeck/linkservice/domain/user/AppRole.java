package com.linkdeck.linkservice.domain.user;

import com.linkdeck.security.InvalidRoleException;

/** A user's application-wide role, independent of any organization membership. */
public enum AppRole {

    NONE("none"),
    USER("user"),
    ADMIN("admin");

    private final String id;

    AppRole(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /** Unknown or missing ids read as {@link #NONE}. */
    public static AppRole fromId(String id) {
        for (AppRole role : values()) {
            if (role.id.equals(id)) {
                return role;
            }
        }
        return NONE;
    }

    /**
     * Parses a role a super-admin may hand out.
     *
     * @throws InvalidRoleException unless the id is {@code user} or {@code admin}
     */
    public static AppRole grantable(String id) {
        if (USER.id.equals(id)) {
            return USER;
        }
        if (ADMIN.id.equals(id)) {
            return ADMIN;
        }
        throw new InvalidRoleException("Role must be: user or admin");
    }
}
