package com.pbscache.collector.source;

import lombok.Builder;
import lombok.Value;

/**
 * Raw output of the four scheduler queries of one pass.
 */
@Value
@Builder(toBuilder = true)
public class RawSchedulerData {
    String server;
    String queue;
    String node;
    String job;
}
