package com.linkdeck.security;

/**
 * Receives a {@link PermissionCheck} after every evaluation. Exceptions thrown here are
 * caught by the engine and never alter a decision.
 */
@FunctionalInterface
public interface PermissionCheckListener {

    PermissionCheckListener NONE = check -> { };

    void onCheck(PermissionCheck check);
}
