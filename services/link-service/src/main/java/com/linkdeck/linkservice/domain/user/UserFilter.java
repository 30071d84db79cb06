package com.linkdeck.linkservice.domain.user;

import java.util.Locale;

/** Which users the administration listing returns. */
public enum UserFilter {

    ALL,
    PENDING,
    ACTIVE;

    /** Missing or unrecognized values list everyone. */
    public static UserFilter parse(String value) {
        if (value == null) {
            return ALL;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "pending" -> PENDING;
            case "active" -> ACTIVE;
            default -> ALL;
        };
    }
}
