package com.pbscache.api;

import com.pbscache.api.config.ApiConfig;
import com.pbscache.api.http.HttpServer;
import com.pbscache.api.service.PbsQueryService;
import com.pbscache.api.store.IDocumentReader;
import com.pbscache.api.store.RedisDocumentReader;
import com.pbscache.core.metrics.PrometheusMetricsExporter;
import com.pbscache.core.query.DocumentFreshness;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.DisposableServer;

import java.time.Clock;

public class ApiApp {
    private static final Logger log = LoggerFactory.getLogger(ApiApp.class);

    public static void main(String[] args) {
        ApiConfig config = ApiConfig.fromEnv();

        log.info("Starting PBS query API");
        log.info("  Sites: {}", config.getSites());
        log.info("  Max document age: {}s", config.getMaxAge().toSeconds());

        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter("pbs-cache-api");
        RedisDocumentReader reader = new RedisDocumentReader(config.getRedisUrl());
        PbsQueryService queryService = new PbsQueryService(
            config.getSites(),
            reader,
            new DocumentFreshness(config.getMaxAge()),
            Clock.systemUTC()
        );

        HttpServer httpServer = new HttpServer(config, queryService, metricsExporter);
        DisposableServer disposableServer = httpServer.start();

        log.info("PBS query API is ready");

        handleShutDown(httpServer, reader);

        disposableServer.onDispose().block();
    }

    private static void handleShutDown(HttpServer httpServer, IDocumentReader reader) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");

            httpServer.stop();

            reader.close();

            log.info("Shutdown complete");
        }));
    }
}
