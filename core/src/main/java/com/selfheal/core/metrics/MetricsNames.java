package com.selfheal.core.metrics;

/**
 * Micrometer metric names used by the remediator.
 * <p>
 * <b>Naming convention:</b> {@code selfheal.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Remediation requests handled.
     * <p>
     * Tags: action, status (success/failure/unauthorized/invalid)
     * </p>
     */
    public static final String REMEDIATION_REQUESTS_TOTAL = "selfheal.remediation.requests.total";

    /**
     * Timer: Time from authenticated request to terminal outcome.
     * <p>
     * Tags: action
     * </p>
     */
    public static final String REMEDIATION_LATENCY = "selfheal.remediation.latency";

    /**
     * Counter: Attempts repeated after a conflict or transient failure.
     * <p>
     * Tags: action, reason (conflict/transient)
     * </p>
     */
    public static final String REMEDIATION_RETRIES_TOTAL = "selfheal.remediation.retries.total";

    /**
     * Counter: Ownership resolutions by outcome.
     * <p>
     * Tags: outcome
     * </p>
     */
    public static final String RESOLUTION_TOTAL = "selfheal.resolution.total";
}
