package com.pbscache.collector.aggregate;

import com.fasterxml.jackson.databind.JsonNode;
import com.pbscache.core.model.DeviceKind;
import com.pbscache.core.model.ResourcePair;

import java.util.EnumMap;
import java.util.Map;

/**
 * Derives per-level unit capacities from a queue's declared resource density.
 * <p>
 * Recognised queue resources, looked up in {@code resources_available} then
 * {@code resources_default}: {@code ncpus_per_switch}, {@code ncpus_per_host},
 * {@code ncpus_per_socket}, {@code ncpus_per_vnode} and their {@code ngpus_per_*} counterparts.
 * Levels without either declaration have no known capacity.
 * </p>
 */
public final class CapacityProfile {
    private CapacityProfile() {
    }

    private static final Map<DeviceKind, String> SUFFIXES = new EnumMap<>(Map.of(
        DeviceKind.SWITCH_DOMAIN, "switch",
        DeviceKind.HOST, "host",
        DeviceKind.SOCKET, "socket",
        DeviceKind.LEAF_NODE, "vnode"));

    public static Map<DeviceKind, ResourcePair> fromQueue(JsonNode queueRecord) {
        Map<DeviceKind, ResourcePair> capacities = new EnumMap<>(DeviceKind.class);
        SUFFIXES.forEach((kind, suffix) -> {
            String cpus = "ncpus_per_" + suffix;
            String gpus = "ngpus_per_" + suffix;
            if (declared(queueRecord, cpus) || declared(queueRecord, gpus)) {
                capacities.put(kind, ResourcePair.of(value(queueRecord, cpus), value(queueRecord, gpus)));
            }
        });
        return capacities;
    }

    private static boolean declared(JsonNode queueRecord, String name) {
        return PbsAttributes.has(queueRecord, "resources_available", name)
            || PbsAttributes.has(queueRecord, "resources_default", name);
    }

    private static int value(JsonNode queueRecord, String name) {
        if (PbsAttributes.has(queueRecord, "resources_available", name)) {
            return PbsAttributes.intValue(queueRecord, "resources_available", name);
        }
        return PbsAttributes.intValue(queueRecord, "resources_default", name);
    }
}
