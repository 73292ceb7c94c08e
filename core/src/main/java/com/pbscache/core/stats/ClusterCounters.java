package com.pbscache.core.stats;

import com.pbscache.core.model.DevicePath;
import com.pbscache.core.model.ResourcePair;
import lombok.Getter;

import java.util.Map;

/**
 * Server-wide counters; every compute node is recorded once regardless of queue membership.
 */
@Getter
public class ClusterCounters extends ResourceCounters {

    private int totalCores;
    private int totalGpus;

    @Override
    public void addNode(ResourcePair all, ResourcePair assigned, boolean offline, boolean exclusive, DevicePath path) {
        super.addNode(all, assigned, offline, exclusive, path);
        totalCores += all.getCores();
        totalGpus += all.getGpus();
    }

    @Override
    protected void exportScope(Map<String, Object> out) {
        out.put("total_cores", totalCores);
        out.put("total_gpus", totalGpus);
    }
}
