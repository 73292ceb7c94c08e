package com.pbscache.collector.config;

import com.google.common.base.Splitter;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Configuration for the collector, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class CollectorConfig {

    /**
     * Site (location) name; the document is published under {@code pbs_<site>}.
     */
    String site;

    /**
     * Redis destinations in publication order; the first one is the primary.
     */
    List<String> redisUrls;

    /**
     * Optional directory receiving a local copy of every document, {@code null} to disable.
     */
    Path outputDir;

    String pbsBinDir;
    Duration commandTimeout;
    Duration publishTimeout;

    // Pass scheduling
    Duration interval;
    boolean oneShot;

    int httpPort;

    // Application registry loader
    Path appPath;
    boolean appTestMode;

    public static CollectorConfig fromEnv() {
        String outputDir = getEnv("OUTPUT_DIR", "");
        return CollectorConfig.builder()
            .site(getEnv("LOCATION", "default"))
            .redisUrls(splitList(getEnv("REDIS_URLS", "redis://localhost:6379")))
            .outputDir(outputDir.isEmpty() ? null : Path.of(outputDir))
            .pbsBinDir(getEnv("PBS_BIN_DIR", "/opt/pbs/bin"))
            .commandTimeout(Duration.ofSeconds(Integer.parseInt(getEnv("COMMAND_TIMEOUT_SEC", "60"))))
            .publishTimeout(Duration.ofSeconds(Integer.parseInt(getEnv("PUBLISH_TIMEOUT_SEC", "10"))))
            .interval(Duration.ofSeconds(Integer.parseInt(getEnv("INTERVAL_SEC", "30"))))
            .oneShot(Boolean.parseBoolean(getEnv("ONE_SHOT", "false")))
            .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "9102")))
            .appPath(Path.of(getEnv("APP_PATH", "/etc/app.d/")))
            .appTestMode(Boolean.parseBoolean(getEnv("APP_TEST_MODE", "false")))
            .build();
    }

    static List<String> splitList(String value) {
        return Splitter.on(',').trimResults().omitEmptyStrings().splitToList(value);
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
