package com.pbscache.api.config;

import com.google.common.base.Splitter;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Configuration for the query API, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class ApiConfig {

    int httpPort;
    String redisUrl;

    /**
     * Sites served by this API, in listing order.
     */
    List<String> sites;

    // Basic auth credentials
    String apiUser;
    @ToString.Exclude
    String apiPassword;

    Duration maxAge;

    public static ApiConfig fromEnv() {
        return ApiConfig.builder()
            .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8080")))
            .redisUrl(getEnv("REDIS_URL", "redis://localhost:6379"))
            .sites(Splitter.on(',').trimResults().omitEmptyStrings().splitToList(getEnv("SITES", "default")))
            .apiUser(getEnv("API_USER", "admin"))
            .apiPassword(getEnv("API_PASSWORD", ""))
            .maxAge(Duration.ofSeconds(Integer.parseInt(getEnv("MAX_AGE_SEC", "120"))))
            .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
