package com.linkdeck.linkservice.infrastructure.identity;

/** The provider's two session endpoints. */
public enum SessionEndpoint {
    PUBLIC("public"),
    ADMIN("admin");

    private final String label;

    SessionEndpoint(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
