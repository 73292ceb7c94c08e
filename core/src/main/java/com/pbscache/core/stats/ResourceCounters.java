package com.pbscache.core.stats;

import com.pbscache.core.model.DevicePath;
import com.pbscache.core.model.ResourcePair;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-pass accumulator of core/gpu usage and job counts for one scope (cluster or queue).
 * <p>
 * Counters only grow during a pass; a fresh instance is created for every pass and scope.
 * Free and offline amounts come from compute nodes ({@link #addNode}), using and waiting
 * amounts come from jobs ({@link #addRunningJob}, {@link #addQueuedJob}).
 * </p>
 */
@Getter
public abstract class ResourceCounters {

    private int waitingCores;
    private int usingCores;
    private int freeCores;
    private int offlineCores;
    private int waitingGpus;
    private int usingGpus;
    private int freeGpus;
    private int offlineGpus;
    private int runningJobs;
    private int waitingJobs;

    private final Set<String> users = new LinkedHashSet<>();
    private final List<Integer> jobSizes = new ArrayList<>();

    /**
     * Records one compute node (vnode) in this scope.
     *
     * @param all       resources available on the node
     * @param assigned  resources currently assigned to jobs
     * @param offline   whether the node is out of service
     * @param exclusive whether the node belongs to exactly one queue
     * @param path      topology location of the node
     */
    public void addNode(ResourcePair all, ResourcePair assigned, boolean offline, boolean exclusive, DevicePath path) {
        if (offline) {
            offlineCores += all.getCores();
            offlineGpus += all.getGpus();
            recordCapacity(assigned, exclusive);
            return;
        }
        recordCapacity(all, exclusive);
        ResourcePair free = all.minus(assigned);
        freeCores += free.getCores();
        freeGpus += free.getGpus();
        if (free.getCores() == 0) {
            return;
        }
        recordFree(path, free);
    }

    /**
     * Hook for scopes that track effective capacity.
     */
    protected void recordCapacity(ResourcePair contribution, boolean exclusive) {
    }

    /**
     * Hook for scopes that keep a resource tree of allocatable leaves.
     */
    protected void recordFree(DevicePath path, ResourcePair free) {
    }

    public void addRunningJob(String user, ResourcePair requested) {
        usingCores += requested.getCores();
        usingGpus += requested.getGpus();
        runningJobs++;
        if (user != null) {
            users.add(user);
        }
        jobSizes.add(requested.getCores());
    }

    public void addQueuedJob(ResourcePair requested) {
        waitingCores += requested.getCores();
        waitingGpus += requested.getGpus();
        waitingJobs++;
    }

    public Set<String> getUsers() {
        return Collections.unmodifiableSet(users);
    }

    public List<Integer> getJobSizes() {
        return Collections.unmodifiableList(jobSizes);
    }

    /**
     * Demand over supply: {@code (using + waiting) / (using + free)}, rounded to two decimals.
     */
    public double load() {
        int supply = usingCores + freeCores;
        if (supply == 0) {
            return 0.0;
        }
        return Rounding.twoDecimals((double) (usingCores + waitingCores) / supply);
    }

    public double jobSizeAvg() {
        if (jobSizes.isEmpty()) {
            return 0.0;
        }
        long total = 0;
        for (int size : jobSizes) {
            total += size;
        }
        return Rounding.twoDecimals((double) total / jobSizes.size());
    }

    /**
     * Flattened statistics for the published document.
     */
    public Map<String, Object> export() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("waiting_cores", waitingCores);
        out.put("using_cores", usingCores);
        out.put("free_cores", freeCores);
        out.put("offline_cores", offlineCores);
        out.put("waiting_gpus", waitingGpus);
        out.put("using_gpus", usingGpus);
        out.put("free_gpus", freeGpus);
        out.put("offline_gpus", offlineGpus);
        out.put("running_jobs", runningJobs);
        out.put("waiting_jobs", waitingJobs);
        out.put("user_count", users.size());
        out.put("job_size_avg", jobSizeAvg());
        out.put("load", load());
        exportScope(out);
        return out;
    }

    protected abstract void exportScope(Map<String, Object> out);
}
