package com.pbscache.collector.publish;

import reactor.core.publisher.Mono;

/**
 * Destination of published documents (Dependency Inversion Principle).
 * <p>
 * Implementations must replace the value under a key atomically: readers either see
 * the previous document or the new one, never a partial write.
 * </p>
 */
public interface IDocumentStore {

    /**
     * Human-readable destination name for logs and metrics.
     */
    String name();

    Mono<Void> replace(String key, String json);

    void close();
}
