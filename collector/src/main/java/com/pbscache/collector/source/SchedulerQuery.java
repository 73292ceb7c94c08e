package com.pbscache.collector.source;

import java.util.List;

/**
 * The four scheduler introspection queries of one collection pass.
 */
public enum SchedulerQuery {
    SERVER("server", "qstat", List.of("-Bf", "-F", "json")),
    QUEUE("queue", "qstat", List.of("-Qf", "-F", "json")),
    NODE("node", "pbsnodes", List.of("-avj", "-F", "json")),
    JOB("job", "qstat", List.of("-f", "-F", "json"));

    private final String label;
    private final String binary;
    private final List<String> arguments;

    SchedulerQuery(String label, String binary, List<String> arguments) {
        this.label = label;
        this.binary = binary;
        this.arguments = arguments;
    }

    public String label() {
        return label;
    }

    public String binary() {
        return binary;
    }

    public List<String> arguments() {
        return arguments;
    }
}
