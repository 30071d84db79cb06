package com.linkdeck.security;

import java.util.Set;

/**
 * Permission strings checked by the org-permission middleware.
 * <p>
 * Names follow {@code <resource>.<action>}. The set is closed: custom roles may only
 * grant permissions listed in {@link #ALL}.
 */
public final class Permissions {

    public static final String ORG_READ = "org.read";
    public static final String ORG_WRITE = "org.write";
    public static final String ORG_DELETE = "org.delete";
    public static final String CARDS_READ = "cards.read";
    public static final String CARDS_WRITE = "cards.write";
    public static final String CARDS_DELETE = "cards.delete";
    public static final String MEMBERS_READ = "members.read";
    public static final String MEMBERS_WRITE = "members.write";

    /** Every permission the system knows about. */
    public static final Set<String> ALL = Set.of(
            ORG_READ, ORG_WRITE, ORG_DELETE,
            CARDS_READ, CARDS_WRITE, CARDS_DELETE,
            MEMBERS_READ, MEMBERS_WRITE
    );

    private Permissions() {
        // constants
    }

    /**
     * Checks whether a string names a known permission.
     */
    public static boolean isKnown(String permission) {
        return permission != null && ALL.contains(permission);
    }
}
