package com.pbscache.api.store;

import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Reads documents stored as Redis strings by the collector.
 */
public class RedisDocumentReader implements IDocumentReader {
    private static final Logger log = LoggerFactory.getLogger(RedisDocumentReader.class);

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisReactiveCommands<String, String> commands;

    public RedisDocumentReader(String redisUrl) {
        this.client = RedisClient.create(redisUrl);
        this.connection = client.connect();
        this.commands = connection.reactive();
        log.info("Connected to Redis: {}", redisUrl);
    }

    @Override
    public Mono<String> get(String key) {
        return commands.get(key);
    }

    @Override
    public void close() {
        connection.close();
        client.shutdown();
        log.info("Redis connection closed");
    }
}
