package com.pbscache.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Location of a leaf node in the topology: switch domain, host, socket and vnode.
 * <p>
 * Any level may be absent; absent levels are skipped when walking the tree.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class DevicePath {
    String switchDomain;
    String host;
    String socket;
    String leaf;

    /**
     * Present levels in walking order, outermost first.
     */
    public List<Level> levels() {
        List<Level> levels = new ArrayList<>(4);
        addIfPresent(levels, DeviceKind.SWITCH_DOMAIN, switchDomain);
        addIfPresent(levels, DeviceKind.HOST, host);
        addIfPresent(levels, DeviceKind.SOCKET, socket);
        addIfPresent(levels, DeviceKind.LEAF_NODE, leaf);
        return Collections.unmodifiableList(levels);
    }

    private static void addIfPresent(List<Level> levels, DeviceKind kind, String name) {
        if (name != null && !name.isEmpty()) {
            levels.add(new Level(kind, name));
        }
    }

    /**
     * One step of a device path.
     */
    @Value
    public static class Level {
        DeviceKind kind;
        String name;
    }
}
