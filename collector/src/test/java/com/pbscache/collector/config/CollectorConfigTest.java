package com.pbscache.collector.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CollectorConfigTest {

    @Test
    void splitsDestinationListInOrder() {
        assertEquals(List.of("redis://a:6379", "redis://b:6379/2"),
            CollectorConfig.splitList(" redis://a:6379 ,, redis://b:6379/2,"));
        assertTrue(CollectorConfig.splitList("").isEmpty());
    }

    @Test
    void defaultsFromEnvironment() {
        CollectorConfig config = CollectorConfig.fromEnv();

        assertNotNull(config.getSite());
        assertFalse(config.getRedisUrls().isEmpty());
        assertTrue(config.getInterval().toSeconds() > 0);
    }
}
