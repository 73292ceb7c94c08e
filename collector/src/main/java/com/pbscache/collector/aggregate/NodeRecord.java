package com.pbscache.collector.aggregate;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Splitter;
import com.pbscache.core.model.DevicePath;
import com.pbscache.core.model.ResourcePair;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Locale;

/**
 * Typed view of one {@code pbsnodes} vnode record.
 */
@Value
@Builder
public class NodeRecord {
    private static final Splitter QUEUE_LIST = Splitter.on(',').trimResults().omitEmptyStrings();
    private static final List<String> OFFLINE_STATES = List.of("offline", "down", "unknown", "stale");

    String id;
    ResourcePair available;
    ResourcePair assigned;
    boolean offline;

    /**
     * Queues the node serves; empty when the node carries no membership tag.
     */
    List<String> queues;

    DevicePath path;

    /**
     * Node owned by exactly one queue.
     */
    public boolean isExclusive() {
        return queues.size() == 1;
    }

    public static NodeRecord from(String id, JsonNode record) {
        return NodeRecord.builder()
            .id(id)
            .available(ResourcePair.of(
                PbsAttributes.intValue(record, "resources_available", "ncpus"),
                PbsAttributes.intValue(record, "resources_available", "ngpus")))
            .assigned(ResourcePair.of(
                PbsAttributes.intValue(record, "resources_assigned", "ncpus"),
                PbsAttributes.intValue(record, "resources_assigned", "ngpus")))
            .offline(isOffline(PbsAttributes.text(record, null, "state")))
            .queues(queues(record))
            .path(path(id, record))
            .build();
    }

    static boolean isOffline(String state) {
        if (state == null) {
            return false;
        }
        String lower = state.toLowerCase(Locale.ROOT);
        for (String marker : OFFLINE_STATES) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    /**
     * The explicit {@code queue} tag wins over the comma separated {@code resources_available.Qlist}.
     */
    private static List<String> queues(JsonNode record) {
        String queue = PbsAttributes.text(record, null, "queue");
        if (queue != null) {
            return List.of(queue);
        }
        String qlist = PbsAttributes.text(record, "resources_available", "Qlist");
        return qlist == null ? List.of() : QUEUE_LIST.splitToList(qlist);
    }

    private static DevicePath path(String id, JsonNode record) {
        String host = PbsAttributes.text(record, "resources_available", "host");
        String vnode = PbsAttributes.text(record, "resources_available", "vnode");
        return DevicePath.builder()
            .switchDomain(PbsAttributes.text(record, "resources_available", "switch"))
            .host(host != null ? host : PbsAttributes.text(record, null, "Mom"))
            .socket(PbsAttributes.text(record, "resources_available", "socket"))
            .leaf(vnode != null ? vnode : id)
            .build();
    }
}
