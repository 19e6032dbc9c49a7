package com.selfheal.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for node identifier.
     */
    public static final String NODE_ID = "node_id";

    /**
     * Tag key for the remediation action (increment_memory/scale).
     */
    public static final String ACTION = "action";

    /**
     * Tag key for terminal request status.
     */
    public static final String STATUS = "status";

    /**
     * Tag key for retry reason.
     */
    public static final String REASON = "reason";

    /**
     * Tag key for ownership resolution outcome.
     */
    public static final String OUTCOME = "outcome";
}
