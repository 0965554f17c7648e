package com.guildhub.core.metrics;

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
     * Tag key for publish scope (all/user/server/...).
     */
    public static final String SCOPE = "scope";

    /**
     * Tag key for failure/close reason.
     */
    public static final String REASON = "reason";

}
