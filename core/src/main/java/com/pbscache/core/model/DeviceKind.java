package com.pbscache.core.model;

/**
 * Levels of the per-queue resource tree, outermost first.
 */
public enum DeviceKind {
    CLUSTER_ROOT,
    SWITCH_DOMAIN,
    HOST,
    SOCKET,
    LEAF_NODE
}
