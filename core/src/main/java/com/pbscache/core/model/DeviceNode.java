package com.pbscache.core.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Node of a per-queue resource tree (cluster root, switch domain, host, socket, leaf node).
 * <p>
 * Each node owns its children exclusively; children are created lazily the first time a
 * device path visits them. Trees are built fresh on every collection pass.
 * </p>
 */
@Getter
public class DeviceNode {

    private final DeviceKind kind;
    private final String name;

    /**
     * Total capacity of this unit, or {@code null} when the queue does not declare one for this kind.
     */
    private final ResourcePair capacity;

    private ResourcePair free = ResourcePair.ZERO;

    private final Map<String, DeviceNode> children = new LinkedHashMap<>();

    public DeviceNode(DeviceKind kind, String name, ResourcePair capacity) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.name = Objects.requireNonNull(name, "name");
        this.capacity = capacity;
    }

    public static DeviceNode root(String name) {
        return new DeviceNode(DeviceKind.CLUSTER_ROOT, name, null);
    }

    public Map<String, DeviceNode> getChildren() {
        return Collections.unmodifiableMap(children);
    }

    public boolean isRoot() {
        return kind == DeviceKind.CLUSTER_ROOT;
    }

    /**
     * Walks {@code path} from this node, creating missing children with capacities taken from
     * {@code capacities}, and stamps {@code free} on the terminal node.
     *
     * @param path       device path, absent levels skipped
     * @param capacities per-kind capacity map of the owning queue
     * @param free       unassigned resources of the leaf
     * @return the terminal node, or this node when the path has no levels
     */
    public DeviceNode insert(DevicePath path, Map<DeviceKind, ResourcePair> capacities, ResourcePair free) {
        DeviceNode current = this;
        for (DevicePath.Level level : path.levels()) {
            current = current.child(level.getKind(), level.getName(), capacities.get(level.getKind()));
        }
        if (current != this) {
            current.free = free;
        }
        return current;
    }

    private DeviceNode child(DeviceKind childKind, String childName, ResourcePair childCapacity) {
        return children.computeIfAbsent(childName, n -> new DeviceNode(childKind, n, childCapacity));
    }

    /**
     * Maximal indivisible free blocks of {@code resource} below this node, largest first.
     * <p>
     * A leaf reports its own free amount, or nothing when none is free. An inner node merges all children
     * that are entirely free into one block, except at the cluster root where top-level units
     * stay separate because they cannot be allocated jointly. Children that are partially used
     * contribute their own blocks unchanged. Zero blocks are never reported.
     * </p>
     */
    public List<Integer> freeBlockSizes(Resource resource) {
        if (kind == DeviceKind.LEAF_NODE) {
            int amount = resource.of(free);
            return amount == 0 ? List.of() : List.of(amount);
        }
        int merged = 0;
        List<Integer> fragments = new ArrayList<>();
        for (DeviceNode child : children.values()) {
            List<Integer> childBlocks = child.freeBlockSizes(resource);
            if (!isRoot() && child.isFullyFree(resource, childBlocks)) {
                merged += resource.of(child.capacity);
            } else {
                fragments.addAll(childBlocks);
            }
        }
        List<Integer> result = new ArrayList<>(fragments.size() + 1);
        result.add(merged);
        result.addAll(fragments);
        result.removeIf(size -> size == 0);
        result.sort(Comparator.reverseOrder());
        return result;
    }

    private boolean isFullyFree(Resource resource, List<Integer> blocks) {
        if (capacity == null) {
            return false;
        }
        int sum = 0;
        for (int block : blocks) {
            sum += block;
        }
        return sum == resource.of(capacity);
    }

    @Override
    public String toString() {
        return kind + ":" + name + (children.isEmpty() ? "" : children.values().toString());
    }
}
