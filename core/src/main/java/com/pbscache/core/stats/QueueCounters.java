package com.pbscache.core.stats;

import com.pbscache.core.model.DeviceKind;
import com.pbscache.core.model.DeviceNode;
import com.pbscache.core.model.DevicePath;
import com.pbscache.core.model.Resource;
import com.pbscache.core.model.ResourcePair;
import lombok.Getter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Counters of one queue plus its tree of allocatable leaves.
 * <p>
 * {@code min} capacity counts nodes owned by this queue alone, {@code max} capacity also
 * counts nodes shared with other queues.
 * </p>
 */
@Getter
public class QueueCounters extends ResourceCounters {

    private final String queue;
    private final Map<DeviceKind, ResourcePair> capacities;
    private final DeviceNode tree;

    private int minCores;
    private int maxCores;
    private int minGpus;
    private int maxGpus;

    /**
     * @param queue      queue name, also used as the name of the tree root
     * @param capacities per-kind unit capacity derived from the queue's declared resource density
     */
    public QueueCounters(String queue, Map<DeviceKind, ResourcePair> capacities) {
        this.queue = queue;
        this.capacities = capacities.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(capacities));
        this.tree = DeviceNode.root(queue);
    }

    @Override
    protected void recordCapacity(ResourcePair contribution, boolean exclusive) {
        maxCores += contribution.getCores();
        maxGpus += contribution.getGpus();
        if (exclusive) {
            minCores += contribution.getCores();
            minGpus += contribution.getGpus();
        }
    }

    @Override
    protected void recordFree(DevicePath path, ResourcePair free) {
        tree.insert(path, capacities, free);
    }

    public List<Integer> freeCoresGroup() {
        return tree.freeBlockSizes(Resource.CORES);
    }

    public List<Integer> freeGpusGroup() {
        return tree.freeBlockSizes(Resource.GPUS);
    }

    @Override
    protected void exportScope(Map<String, Object> out) {
        out.put("min_cores", minCores);
        out.put("max_cores", maxCores);
        out.put("min_gpus", minGpus);
        out.put("max_gpus", maxGpus);
        out.put("free_cores_group", freeCoresGroup());
        out.put("free_gpus_group", freeGpusGroup());
    }
}
