package com.pbscache.core.metrics;

/**
 * Micrometer metric names used across the system.
 * <p>
 * <b>Naming convention:</b> {@code pbs.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Collection passes finished.
     * <p>
     * Tags: site, outcome (published/ingestion_failed/publication_failed/failed)
     * </p>
     */
    public static final String COLLECTOR_PASSES_TOTAL = "pbs.collector.passes.total";

    /**
     * Timer: Duration of one collection pass, fetch to publish.
     */
    public static final String COLLECTOR_PASS_LATENCY = "pbs.collector.pass.latency";

    /**
     * Counter: Lines dropped while repairing scheduler output.
     * <p>
     * Tags: source (server/queue/node/job)
     * </p>
     */
    public static final String COLLECTOR_SANITIZED_LINES_TOTAL = "pbs.collector.sanitized.lines.total";

    /**
     * Counter: Node and job records skipped during aggregation.
     * <p>
     * Tags: site, type (node/job)
     * </p>
     */
    public static final String COLLECTOR_SKIPPED_RECORDS_TOTAL = "pbs.collector.skipped.records.total";

    /**
     * Counter: Failed document writes.
     * <p>
     * Tags: destination
     * </p>
     */
    public static final String COLLECTOR_PUBLICATION_FAILURES_TOTAL = "pbs.collector.publication.failures.total";

    /**
     * Gauge: Epoch seconds of the last successfully published document.
     */
    public static final String COLLECTOR_LAST_PUBLISHED = "pbs.collector.last.published";

    /**
     * Counter: API requests served.
     * <p>
     * Tags: route, outcome (ok/failed/unauthorized/error)
     * </p>
     */
    public static final String API_REQUESTS_TOTAL = "pbs.api.requests.total";
}
