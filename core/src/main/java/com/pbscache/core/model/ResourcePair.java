package com.pbscache.core.model;

import lombok.Value;

/**
 * Immutable (cores, gpus) amount.
 */
@Value
public class ResourcePair {
    public static final ResourcePair ZERO = new ResourcePair(0, 0);

    int cores;
    int gpus;

    public static ResourcePair of(int cores, int gpus) {
        return cores == 0 && gpus == 0 ? ZERO : new ResourcePair(cores, gpus);
    }

    /**
     * Subtracts {@code other}, clamping each component at zero.
     */
    public ResourcePair minus(ResourcePair other) {
        return of(Math.max(0, cores - other.cores), Math.max(0, gpus - other.gpus));
    }
}
