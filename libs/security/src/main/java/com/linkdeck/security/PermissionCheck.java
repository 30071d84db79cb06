package com.linkdeck.security;

import java.time.Duration;

/**
 * Telemetry sample for one permission evaluation.
 *
 * @param permission the permission that was checked
 * @param granted    the decision
 * @param memoHit    whether membership came from the per-request memo (false for super-admin bypass)
 * @param duration   wall time of the evaluation
 * @param slow       whether the duration crossed the slow-check threshold
 */
public record PermissionCheck(String permission, boolean granted, boolean memoHit, Duration duration, boolean slow) {
}
