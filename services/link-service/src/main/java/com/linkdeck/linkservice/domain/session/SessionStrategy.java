package com.linkdeck.linkservice.domain.session;

import com.linkdeck.security.SessionVerdict;

/**
 * Decides whether inbound credentials carry a valid identity-provider session.
 *
 * <p>Exactly one strategy is active per process. Implementations return a rejected verdict for a
 * session they can read and find invalid, and throw {@link SessionStrategyException} when they
 * cannot reach a decision at all.
 */
public interface SessionStrategy {

    SessionVerdict evaluate(SessionRequest request);

    /** Short name used in logs and metrics. */
    String name();
}
