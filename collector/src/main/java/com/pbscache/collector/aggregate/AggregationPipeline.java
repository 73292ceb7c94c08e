package com.pbscache.collector.aggregate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pbscache.collector.source.RawSchedulerData;
import com.pbscache.collector.source.SchedulerQuery;
import com.pbscache.core.error.IngestionException;
import com.pbscache.core.error.TopologyException;
import com.pbscache.core.pbs.DocumentFields;
import com.pbscache.core.pbs.KeySanitizer;
import com.pbscache.core.stats.ClusterCounters;
import com.pbscache.core.stats.QueueCounters;
import com.pbscache.core.util.JsonSanitizer;
import com.pbscache.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the raw output of one pass into the published scheduler document.
 * <p>
 * Steps:
 * <ol>
 *   <li>sanitize and parse server, queue, node and job output</li>
 *   <li>create one {@link QueueCounters} per declared queue, with capacities from the queue's resource density</li>
 *   <li>record every node in each queue it serves and once in the cluster counters</li>
 *   <li>classify running and queued jobs into their queue and the cluster</li>
 *   <li>attach statistics to queue and server records</li>
 *   <li>re-key nodes and jobs with path-safe identifiers, keeping the original in {@code id}</li>
 * </ol>
 * Records with missing or inconsistent data are skipped and logged; only unparseable
 * output fails the aggregation. Stateless; every call builds fresh counters.
 * </p>
 */
public class AggregationPipeline {
    private static final Logger log = LoggerFactory.getLogger(AggregationPipeline.class);

    /**
     * @param raw output of the four scheduler queries
     * @param now assembly time, stored as the document timestamp
     * @throws IngestionException if any output cannot be parsed
     */
    public AggregationResult aggregate(RawSchedulerData raw, Instant now) {
        Map<String, Integer> dropped = new LinkedHashMap<>();
        ObjectNode serverDoc = parse(SchedulerQuery.SERVER, raw.getServer(), dropped);
        ObjectNode queueDoc = parse(SchedulerQuery.QUEUE, raw.getQueue(), dropped);
        ObjectNode nodeDoc = parse(SchedulerQuery.NODE, raw.getNode(), dropped);
        ObjectNode jobDoc = parse(SchedulerQuery.JOB, raw.getJob(), dropped);

        ObjectNode servers = section(serverDoc, DocumentFields.SERVER);
        ObjectNode queueSection = section(queueDoc, DocumentFields.QUEUE);
        ObjectNode nodes = section(nodeDoc, DocumentFields.NODES);
        ObjectNode jobs = section(jobDoc, DocumentFields.JOBS);

        ClusterCounters cluster = new ClusterCounters();
        Map<String, QueueCounters> queues = new LinkedHashMap<>();
        queueSection.fields().forEachRemaining(e ->
            queues.put(e.getKey(), new QueueCounters(e.getKey(), CapacityProfile.fromQueue(e.getValue()))));

        int skippedNodes = 0;
        for (Iterator<Map.Entry<String, JsonNode>> it = nodes.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            if (!addNode(NodeRecord.from(e.getKey(), e.getValue()), cluster, queues)) {
                skippedNodes++;
            }
        }

        int skippedJobs = 0;
        for (Iterator<Map.Entry<String, JsonNode>> it = jobs.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            if (!addJob(JobRecord.from(e.getKey(), e.getValue()), cluster, queues)) {
                skippedJobs++;
            }
        }

        Map<String, Object> clusterStatistics = cluster.export();
        servers.elements().forEachRemaining(server -> attachStatistics(server, clusterStatistics));
        queues.forEach((name, counters) -> attachStatistics(queueSection.path(name), counters.export()));

        ObjectNode document = JsonUtils.newObject();
        copyText(serverDoc, document, DocumentFields.PBS_VERSION);
        copyText(serverDoc, document, DocumentFields.PBS_SERVER);
        document.set(DocumentFields.SERVER, servers);
        document.set(DocumentFields.QUEUE, queueSection);
        document.set(DocumentFields.NODES, rekey(nodes, "node"));
        document.set(DocumentFields.JOBS, rekey(jobs, "job"));
        document.put(DocumentFields.TIMESTAMP, now.getEpochSecond());

        log.info("Aggregated {} queues, {} nodes ({} skipped), {} jobs ({} skipped)",
            queues.size(), nodes.size(), skippedNodes, jobs.size(), skippedJobs);

        return AggregationResult.builder()
            .document(document)
            .cluster(cluster)
            .queues(queues)
            .droppedLines(dropped)
            .skippedNodes(skippedNodes)
            .skippedJobs(skippedJobs)
            .build();
    }

    private static ObjectNode parse(SchedulerQuery query, String text, Map<String, Integer> dropped) {
        JsonSanitizer.Result result = JsonSanitizer.repair(query.label(), text);
        dropped.put(query.label(), result.getDroppedLines());
        return result.getDocument();
    }

    /**
     * The scheduler omits a section entirely when it is empty (e.g. no jobs).
     */
    private static ObjectNode section(ObjectNode doc, String name) {
        JsonNode section = doc.get(name);
        if (section == null || section.isNull()) {
            return JsonUtils.newObject();
        }
        if (!section.isObject()) {
            throw new IngestionException("unexpected " + name + " section type " + section.getNodeType());
        }
        return (ObjectNode) section;
    }

    /**
     * @return {@code false} when the node was skipped
     */
    private boolean addNode(NodeRecord node, ClusterCounters cluster, Map<String, QueueCounters> queues) {
        if (node.getQueues().isEmpty()) {
            log.debug("Skipping node {}: no queue membership", node.getId());
            return false;
        }
        List<QueueCounters> members = new ArrayList<>(node.getQueues().size());
        for (String queue : node.getQueues()) {
            try {
                members.add(resolve(queues, node.getId(), queue));
            } catch (TopologyException e) {
                log.warn("Ignoring node membership: {}", e.getMessage());
            }
        }
        if (members.isEmpty()) {
            log.warn("Skipping node {}: none of its queues {} is declared", node.getId(), node.getQueues());
            return false;
        }
        for (QueueCounters queue : members) {
            queue.addNode(node.getAvailable(), node.getAssigned(), node.isOffline(), node.isExclusive(), node.getPath());
        }
        cluster.addNode(node.getAvailable(), node.getAssigned(), node.isOffline(), node.isExclusive(), node.getPath());
        return true;
    }

    /**
     * @return {@code false} when the job was skipped
     */
    private boolean addJob(JobRecord job, ClusterCounters cluster, Map<String, QueueCounters> queues) {
        QueueCounters queue;
        try {
            queue = resolve(queues, job.getId(), job.getQueue());
        } catch (TopologyException e) {
            log.warn("Skipping job: {}", e.getMessage());
            return false;
        }
        switch (job.getState()) {
            case RUNNING:
                queue.addRunningJob(job.getOwner(), job.getRequested());
                cluster.addRunningJob(job.getOwner(), job.getRequested());
                break;
            case QUEUED:
                queue.addQueuedJob(job.getRequested());
                cluster.addQueuedJob(job.getRequested());
                break;
            case OTHER:
                log.trace("Job {} in state {} is not counted", job.getId(), job.getRawState());
                break;
        }
        return true;
    }

    private static QueueCounters resolve(Map<String, QueueCounters> queues, String recordId, String queue) {
        QueueCounters counters = queue == null ? null : queues.get(queue);
        if (counters == null) {
            throw new TopologyException(recordId, queue);
        }
        return counters;
    }

    private static void attachStatistics(JsonNode record, Map<String, Object> statistics) {
        if (record.isObject()) {
            ((ObjectNode) record).set(DocumentFields.STATISTICS, JsonUtils.mapper().valueToTree(statistics));
        }
    }

    private static ObjectNode rekey(ObjectNode section, String type) {
        ObjectNode out = JsonUtils.newObject();
        section.fields().forEachRemaining(e -> {
            String key = KeySanitizer.sanitize(e.getKey());
            JsonNode record = e.getValue();
            if (record.isObject() && !record.has(DocumentFields.ID)) {
                ((ObjectNode) record).put(DocumentFields.ID, e.getKey());
            }
            if (out.has(key)) {
                log.warn("Duplicate {} key {} after sanitizing {}; keeping the last record", type, key, e.getKey());
            }
            out.set(key, record);
        });
        return out;
    }

    private static void copyText(ObjectNode from, ObjectNode to, String field) {
        JsonNode value = from.get(field);
        if (value != null && value.isValueNode()) {
            to.set(field, value);
        }
    }
}
