package com.pbscache.collector.aggregate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pbscache.collector.Fixtures;
import com.pbscache.collector.source.RawSchedulerData;
import com.pbscache.core.error.IngestionException;
import com.pbscache.core.stats.QueueCounters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AggregationPipelineTest {

    private static final Instant NOW = Instant.ofEpochSecond(1700000042L);

    private AggregationPipeline pipeline;

    @BeforeEach
    void setUp() {
        pipeline = new AggregationPipeline();
    }

    @Test
    @DisplayName("Idle host forms one free block, queued demand drives load")
    void queueStatisticsFromCapturedOutput() {
        AggregationResult result = pipeline.aggregate(Fixtures.schedulerData(), NOW);

        QueueCounters workq = result.getQueues().get("workq");
        assertNotNull(workq);
        assertEquals(List.of(16), workq.freeCoresGroup());
        assertEquals(8, workq.getWaitingCores());
        assertEquals(1, workq.getWaitingJobs());
        assertEquals(0, workq.getRunningJobs());
        assertEquals(16, workq.getFreeCores());
        assertEquals(32, workq.getMaxCores());
        assertEquals(32, workq.getMinCores());
        assertEquals(0.5, workq.load());

        JsonNode statistics = result.getDocument().path("Queue").path("workq").path("statistics");
        assertEquals(0.5, statistics.path("load").asDouble());
        assertEquals(16, statistics.path("free_cores_group").get(0).asInt());
    }

    @Test
    void skipsRecordsReferencingUndeclaredQueues() {
        AggregationResult result = pipeline.aggregate(Fixtures.schedulerData(), NOW);

        // n3 serves an undeclared queue, n4 has no membership at all
        assertEquals(2, result.getSkippedNodes());
        // 102 is queued in an undeclared queue; the held job is kept but not counted
        assertEquals(1, result.getSkippedJobs());
        assertEquals(8, result.getCluster().getWaitingCores());
        assertEquals(32, result.getCluster().getTotalCores());
    }

    @Test
    void attachesClusterStatisticsToServerRecords() {
        ObjectNode document = pipeline.aggregate(Fixtures.schedulerData(), NOW).getDocument();

        JsonNode statistics = document.path("Server").path("srv01").path("statistics");
        assertEquals(16, statistics.path("free_cores").asInt());
        assertEquals(32, statistics.path("total_cores").asInt());
        assertEquals("Active", document.path("Server").path("srv01").path("server_state").asText());
        assertEquals("2022.1.1", document.path("pbs_version").asText());
        assertEquals("srv01", document.path("pbs_server").asText());
    }

    @Test
    void rekeysNodesAndJobsKeepingOriginalIdentifier() {
        ObjectNode document = pipeline.aggregate(Fixtures.schedulerData(), NOW).getDocument();

        JsonNode jobs = document.path("Jobs");
        assertTrue(jobs.has("100_srv01"));
        assertTrue(jobs.has("101__srv01"));
        assertEquals("101[].srv01", jobs.path("101__srv01").path("id").asText());

        JsonNode nodes = document.path("nodes");
        assertTrue(nodes.has("n1_cluster"));
        assertFalse(nodes.has("n1.cluster"));
        assertEquals("n1.cluster", nodes.path("n1_cluster").path("id").asText());
    }

    @Test
    void stampsAssemblyTime() {
        ObjectNode document = pipeline.aggregate(Fixtures.schedulerData(), NOW).getDocument();

        assertEquals(1700000042L, document.path("timestamp").asLong());
    }

    @Test
    void repairsMalformedNodeLine() {
        AggregationResult result = pipeline.aggregate(Fixtures.schedulerData(), NOW);

        assertEquals(1, result.getDroppedLines().get("node"));
        assertEquals(0, result.getDroppedLines().get("job"));
        assertFalse(result.getDocument().path("nodes").path("n1_cluster").has("comment"));
    }

    @Test
    void missingJobsSectionMeansNoJobs() {
        RawSchedulerData raw = Fixtures.schedulerData().toBuilder()
            .job("{\"timestamp\":1700000000,\"pbs_server\":\"srv01\"}")
            .build();

        AggregationResult result = pipeline.aggregate(raw, NOW);

        assertEquals(0, result.getQueues().get("workq").getWaitingJobs());
        assertEquals(0, result.getDocument().path("Jobs").size());
    }

    @Test
    void unparseableOutputFailsTheAggregation() {
        RawSchedulerData raw = Fixtures.schedulerData().toBuilder()
            .queue("qstat: cannot connect to server srv01 (errno=15010)")
            .build();

        assertThrows(IngestionException.class, () -> pipeline.aggregate(raw, NOW));
    }
}
