package com.pbscache.core.stats;

import com.pbscache.core.model.DeviceKind;
import com.pbscache.core.model.DevicePath;
import com.pbscache.core.model.ResourcePair;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResourceCountersTest {

    private static final Map<DeviceKind, ResourcePair> CAPS = Map.of(
            DeviceKind.HOST, ResourcePair.of(16, 0),
            DeviceKind.LEAF_NODE, ResourcePair.of(16, 0));

    @Test
    void loadIsZeroWithoutSupply() {
        QueueCounters counters = new QueueCounters("workq", CAPS);
        counters.addQueuedJob(ResourcePair.of(8, 0));

        assertEquals(0.0, counters.load());
    }

    @Test
    void loadIsRoundedRatioOfDemandOverSupply() {
        ClusterCounters counters = new ClusterCounters();
        // free = 2
        counters.addNode(ResourcePair.of(2, 0), ResourcePair.ZERO, false, true, host("h1"));
        // using = 5
        counters.addRunningJob("alice", ResourcePair.of(5, 0));
        // waiting = 3
        counters.addQueuedJob(ResourcePair.of(3, 0));

        assertEquals(1.14, counters.load());
    }

    @Test
    void jobSizeAverage() {
        ClusterCounters counters = new ClusterCounters();
        assertEquals(0.0, counters.jobSizeAvg());

        counters.addRunningJob("alice", ResourcePair.of(4, 0));
        counters.addRunningJob("bob", ResourcePair.of(8, 0));
        counters.addRunningJob("alice", ResourcePair.of(12, 0));

        assertEquals(8.0, counters.jobSizeAvg());
        assertEquals(2, counters.getUsers().size());
        assertEquals(3, counters.getRunningJobs());
        assertEquals(24, counters.getUsingCores());
    }

    @Test
    void jobSizeAverageIsRoundedToTwoDecimals() {
        ClusterCounters counters = new ClusterCounters();
        counters.addRunningJob("alice", ResourcePair.of(1, 0));
        counters.addRunningJob("alice", ResourcePair.of(1, 0));
        counters.addRunningJob("alice", ResourcePair.of(2, 0));

        assertEquals(1.33, counters.jobSizeAvg());
    }

    @Test
    void offlineNodeCountsOfflineAndOnlyAssignedCapacity() {
        QueueCounters counters = new QueueCounters("workq", CAPS);
        counters.addNode(ResourcePair.of(16, 1), ResourcePair.of(4, 0), true, true, host("h1"));

        assertEquals(16, counters.getOfflineCores());
        assertEquals(1, counters.getOfflineGpus());
        assertEquals(4, counters.getMaxCores());
        assertEquals(4, counters.getMinCores());
        assertEquals(0, counters.getFreeCores());
        assertTrue(counters.getTree().getChildren().isEmpty());
    }

    @Test
    void sharedNodeOnlyRaisesMaxCapacity() {
        QueueCounters counters = new QueueCounters("workq", CAPS);
        counters.addNode(ResourcePair.of(16, 2), ResourcePair.ZERO, false, false, host("h1"));
        counters.addNode(ResourcePair.of(16, 0), ResourcePair.ZERO, false, true, host("h2"));

        assertEquals(32, counters.getMaxCores());
        assertEquals(16, counters.getMinCores());
        assertEquals(2, counters.getMaxGpus());
        assertEquals(0, counters.getMinGpus());
    }

    @Test
    void busyNodeIsNotInsertedIntoTree() {
        QueueCounters counters = new QueueCounters("workq", CAPS);
        counters.addNode(ResourcePair.of(16, 0), ResourcePair.of(16, 0), false, true, host("h1"));

        assertEquals(0, counters.getFreeCores());
        assertEquals(0, counters.getUsingCores(), "using is driven by jobs, not node assignment");
        assertTrue(counters.getTree().getChildren().isEmpty());
        assertEquals(List.of(), counters.freeCoresGroup());
    }

    @Test
    void queueExportCarriesScopeFields() {
        QueueCounters counters = new QueueCounters("workq", CAPS);
        counters.addNode(ResourcePair.of(16, 0), ResourcePair.ZERO, false, true, host("h1"));
        counters.addNode(ResourcePair.of(16, 0), ResourcePair.of(16, 0), false, true, host("h2"));
        counters.addQueuedJob(ResourcePair.of(8, 0));

        Map<String, Object> export = counters.export();

        assertEquals(List.of(16), export.get("free_cores_group"));
        assertEquals(List.of(), export.get("free_gpus_group"));
        assertEquals(8, export.get("waiting_cores"));
        assertEquals(1, export.get("waiting_jobs"));
        assertEquals(0.5, export.get("load"));
        assertEquals(32, export.get("max_cores"));
        assertEquals(0, export.get("user_count"));
        assertEquals(0.0, export.get("job_size_avg"));
        assertFalse(export.containsKey("total_cores"));
    }

    @Test
    void clusterExportCarriesTotals() {
        ClusterCounters counters = new ClusterCounters();
        counters.addNode(ResourcePair.of(16, 2), ResourcePair.ZERO, false, true, host("h1"));
        counters.addNode(ResourcePair.of(16, 0), ResourcePair.ZERO, true, true, host("h2"));

        Map<String, Object> export = counters.export();

        assertEquals(32, export.get("total_cores"));
        assertEquals(2, export.get("total_gpus"));
        assertEquals(16, export.get("free_cores"));
        assertEquals(16, export.get("offline_cores"));
        assertFalse(export.containsKey("free_cores_group"));
    }

    private static DevicePath host(String name) {
        return DevicePath.builder().host(name).leaf(name).build();
    }
}
