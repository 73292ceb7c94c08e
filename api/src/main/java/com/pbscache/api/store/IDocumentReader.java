package com.pbscache.api.store;

import reactor.core.publisher.Mono;

/**
 * Read access to published documents (Dependency Inversion Principle).
 */
public interface IDocumentReader {

    /**
     * @return the stored JSON, or an empty Mono when the key does not exist
     */
    Mono<String> get(String key);

    void close();
}
