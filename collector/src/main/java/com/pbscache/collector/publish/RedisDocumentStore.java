package com.pbscache.collector.publish;

import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.api.StatefulRedisConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Stores documents as Redis strings; {@code SET} replaces the previous value atomically.
 * <p>
 * The connection is opened on first use and reopened after a failure, so an unreachable
 * server only fails the writes aimed at it.
 * </p>
 */
public class RedisDocumentStore implements IDocumentStore {
    private static final Logger log = LoggerFactory.getLogger(RedisDocumentStore.class);

    private final String name;
    private final RedisClient client;
    private StatefulRedisConnection<String, String> connection;

    public RedisDocumentStore(String redisUrl) {
        RedisURI uri = RedisURI.create(redisUrl);
        this.name = "redis://" + uri.getHost() + ":" + uri.getPort() + "/" + uri.getDatabase();
        this.client = RedisClient.create(uri);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Mono<Void> replace(String key, String json) {
        return Mono.fromCallable(this::connection)
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(conn -> conn.reactive().set(key, json))
            .doOnSuccess(reply -> log.debug("Stored {} ({} bytes) in {}", key, json.length(), name))
            .then();
    }

    private synchronized StatefulRedisConnection<String, String> connection() {
        if (connection == null || !connection.isOpen()) {
            connection = client.connect();
            log.info("Connected to Redis: {}", name);
        }
        return connection;
    }

    @Override
    public synchronized void close() {
        if (connection != null) {
            connection.close();
        }
        client.shutdown();
        log.info("Redis client closed: {}", name);
    }
}
