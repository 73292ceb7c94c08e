package com.pbscache.collector.aggregate;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pbscache.core.stats.ClusterCounters;
import com.pbscache.core.stats.QueueCounters;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Outcome of one aggregation: the assembled document plus the counters it was built from.
 */
@Value
@Builder
public class AggregationResult {
    ObjectNode document;
    ClusterCounters cluster;
    Map<String, QueueCounters> queues;

    /**
     * Malformed lines dropped per query label.
     */
    Map<String, Integer> droppedLines;

    int skippedNodes;
    int skippedJobs;
}
