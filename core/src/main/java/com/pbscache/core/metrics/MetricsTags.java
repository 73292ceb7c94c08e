package com.pbscache.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    public static final String SITE = "site";

    public static final String OUTCOME = "outcome";

    public static final String SOURCE = "source";

    public static final String TYPE = "type";

    public static final String DESTINATION = "destination";

    public static final String ROUTE = "route";
}
