package com.linkdeck.linkservice.domain.audit;

import com.linkdeck.observability.LogRedactor;
import com.linkdeck.observability.MetricFactory;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes audit events off the request thread.
 *
 * <p>{@link #record(AuditEvent)} hands the event to a bounded executor and returns immediately.
 * A full queue drops the event; a failing write is logged. Neither ever reaches the caller, so
 * audit trouble cannot change an authentication or authorization outcome.
 */
public class AuditRecorder {

    private static final Logger log = LoggerFactory.getLogger(AuditRecorder.class);

    static final String DROPPED_METRIC = "linkdeck.audit.dropped";

    private final AuditEventStore store;
    private final Executor executor;
    private final MetricFactory metrics;

    public AuditRecorder(AuditEventStore store, Executor executor, MetricFactory metrics) {
        this.store = store;
        this.executor = executor;
        this.metrics = metrics;
    }

    public void record(AuditEvent event) {
        try {
            executor.execute(() -> write(event));
        } catch (RejectedExecutionException e) {
            metrics.increment(DROPPED_METRIC, "Audit events dropped because the queue was full",
                    "status", event.status().name());
            log.warn("Audit queue full; dropped {} event for user={}",
                    event.status(), LogRedactor.truncate(event.userId()));
        }
    }

    private void write(AuditEvent event) {
        try {
            store.append(event);
        } catch (RuntimeException e) {
            log.warn("Failed to record {} audit event for user={}: {}",
                    event.status(), LogRedactor.truncate(event.userId()), e.getMessage());
        }
    }
}
