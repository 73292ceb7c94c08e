package com.pbscache.core.model;

/**
 * Selects one component of a {@link ResourcePair}.
 */
public enum Resource {
    CORES {
        @Override
        public int of(ResourcePair pair) {
            return pair.getCores();
        }
    },
    GPUS {
        @Override
        public int of(ResourcePair pair) {
            return pair.getGpus();
        }
    };

    public abstract int of(ResourcePair pair);
}
