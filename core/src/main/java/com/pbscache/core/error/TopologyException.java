package com.pbscache.core.error;

import lombok.Getter;

/**
 * A node or job references a queue that is not present in the queue catalogue.
 * <p>
 * Never aborts a pass: the offending record is logged and skipped.
 * </p>
 */
@Getter
public class TopologyException extends PbsCacheException {

    private final String recordId;
    private final String queue;

    public TopologyException(String recordId, String queue) {
        super("record " + recordId + " references undeclared queue " + queue);
        this.recordId = recordId;
        this.queue = queue;
    }
}
