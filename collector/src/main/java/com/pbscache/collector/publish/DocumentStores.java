package com.pbscache.collector.publish;

import com.pbscache.collector.config.CollectorConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the configured destinations in publication order: Redis URLs first, then the local directory.
 */
public final class DocumentStores {
    private DocumentStores() {
    }

    public static List<IDocumentStore> fromConfig(CollectorConfig config) {
        List<IDocumentStore> stores = new ArrayList<>();
        for (String url : config.getRedisUrls()) {
            stores.add(new RedisDocumentStore(url));
        }
        if (config.getOutputDir() != null) {
            stores.add(new FileDocumentStore(config.getOutputDir()));
        }
        return stores;
    }
}
