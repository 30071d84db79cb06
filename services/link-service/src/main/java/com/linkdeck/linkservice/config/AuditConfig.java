package com.linkdeck.linkservice.config;

import com.linkdeck.linkservice.domain.audit.AuditEventStore;
import com.linkdeck.linkservice.domain.audit.AuditRecorder;
import com.linkdeck.observability.CorrelationContext;
import com.linkdeck.observability.CorrelationContextHolder;
import com.linkdeck.observability.MetricFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded executor for audit writes. A full queue rejects new events instead of blocking the
 * request thread. The submitting request's correlation context is carried onto the writer thread.
 */
@Configuration(proxyBeanMethods = false)
public class AuditConfig {

    static final String AUDIT_EXECUTOR = "auditExecutor";

    @Bean(name = AUDIT_EXECUTOR)
    ThreadPoolTaskExecutor auditExecutor(AuditProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.threads());
        executor.setMaxPoolSize(properties.threads());
        executor.setQueueCapacity(properties.queueCapacity());
        executor.setThreadNamePrefix("audit-");
        executor.setTaskDecorator(correlationPropagation());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        return executor;
    }

    @Bean
    AuditRecorder auditRecorder(AuditEventStore store,
                                @Qualifier(AUDIT_EXECUTOR) ThreadPoolTaskExecutor executor,
                                MetricFactory metrics) {
        return new AuditRecorder(store, executor, metrics);
    }

    static TaskDecorator correlationPropagation() {
        return task -> {
            CorrelationContext context = CorrelationContextHolder.get().orElse(null);
            return () -> CorrelationContextHolder.runWithContext(context, task);
        };
    }
}
