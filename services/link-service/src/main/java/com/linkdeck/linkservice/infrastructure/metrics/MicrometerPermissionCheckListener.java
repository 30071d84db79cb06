package com.linkdeck.linkservice.infrastructure.metrics;

import com.linkdeck.observability.MetricFactory;
import com.linkdeck.security.PermissionCheck;
import com.linkdeck.security.PermissionCheckListener;

/**
 * Publishes permission checks to Micrometer.
 *
 * <ul>
 *   <li>{@code linkdeck.permission.checks}: counter tagged {@code result} and {@code memo}
 *   <li>{@code linkdeck.permission.check.duration}: timer tagged {@code result}
 *   <li>{@code linkdeck.permission.slow.checks}: counter of checks over the slow threshold
 * </ul>
 */
public class MicrometerPermissionCheckListener implements PermissionCheckListener {

    static final String CHECKS = "linkdeck.permission.checks";
    static final String DURATION = "linkdeck.permission.check.duration";
    static final String SLOW = "linkdeck.permission.slow.checks";

    private final MetricFactory metrics;

    public MicrometerPermissionCheckListener(MetricFactory metrics) {
        this.metrics = metrics;
    }

    @Override
    public void onCheck(PermissionCheck check) {
        String result = check.granted() ? "granted" : "denied";
        metrics.increment(CHECKS, "Permission checks", "result", result, "memo", check.memoHit() ? "hit" : "miss");
        metrics.record(DURATION, "Permission check latency", check.duration(), "result", result);
        if (check.slow()) {
            metrics.increment(SLOW, "Permission checks over the slow threshold");
        }
    }
}
