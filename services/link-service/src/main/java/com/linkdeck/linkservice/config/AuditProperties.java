package com.linkdeck.linkservice.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Audit executor sizing, bound from {@code linkdeck.audit.*}.
 *
 * @param queueCapacity pending audit writes kept before new ones are dropped (default 1 000)
 * @param threads writer threads (default 1)
 */
@ConfigurationProperties(prefix = "linkdeck.audit")
@Validated
public record AuditProperties(int queueCapacity, int threads) {

    public AuditProperties {
        if (queueCapacity <= 0) {
            queueCapacity = 1_000;
        }
        if (threads <= 0) {
            threads = 1;
        }
    }
}
