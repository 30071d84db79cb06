package com.linkdeck.linkservice.domain.audit;

import java.util.List;

/** Append-only storage for {@link AuditEvent}s. */
public interface AuditEventStore {

    void append(AuditEvent event);

    /** Most recent events first. */
    List<AuditEvent> findRecent(int limit);
}
