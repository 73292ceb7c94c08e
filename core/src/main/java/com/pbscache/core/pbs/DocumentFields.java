package com.pbscache.core.pbs;

/**
 * Field names of the published scheduler document.
 * <p>
 * Section names follow the scheduler's own JSON output ({@code qstat}/{@code pbsnodes}).
 * </p>
 */
public final class DocumentFields {
    private DocumentFields() {
    }

    public static final String SERVER = "Server";
    public static final String QUEUE = "Queue";
    public static final String NODES = "nodes";
    public static final String JOBS = "Jobs";

    /**
     * Epoch seconds at which the document was assembled.
     */
    public static final String TIMESTAMP = "timestamp";

    public static final String STATISTICS = "statistics";

    /**
     * Original, unsanitized identifier of a node or job record.
     */
    public static final String ID = "id";

    public static final String PBS_SERVER = "pbs_server";
    public static final String PBS_VERSION = "pbs_version";
}
