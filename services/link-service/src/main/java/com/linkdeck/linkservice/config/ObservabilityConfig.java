package com.linkdeck.linkservice.config;

import com.linkdeck.observability.MetricFactory;
import com.linkdeck.observability.SpanHelper;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Clock, metrics and tracing beans shared by the rest of the service.
 *
 * <p>Spans go through {@link GlobalOpenTelemetry}; without an agent or SDK installed they are
 * no-ops.
 */
@Configuration(proxyBeanMethods = false)
public class ObservabilityConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    MetricFactory metricFactory(MeterRegistry registry, LinkServiceProperties properties) {
        return new MetricFactory(registry, properties.name());
    }

    @Bean
    SpanHelper spanHelper(LinkServiceProperties properties) {
        return new SpanHelper(GlobalOpenTelemetry.getTracer(properties.name()));
    }
}
