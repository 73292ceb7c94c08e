package com.pbscache.collector.http;

import com.pbscache.collector.service.CollectorService;
import com.pbscache.core.metrics.PrometheusMetricsExporter;
import com.pbscache.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;
import reactor.netty.http.server.HttpServerRoutes;

import java.time.Duration;
import java.util.Map;

/**
 * HTTP endpoints for probing the collector: liveness, last publication and Prometheus metrics.
 */
public class StatusServer {
    private static final Logger log = LoggerFactory.getLogger(StatusServer.class);

    private final int port;
    private final CollectorService collectorService;
    private final PrometheusMetricsExporter metricsExporter;

    private DisposableServer server;

    public StatusServer(int port, CollectorService collectorService, PrometheusMetricsExporter metricsExporter) {
        this.port = port;
        this.collectorService = collectorService;
        this.metricsExporter = metricsExporter;
    }

    public DisposableServer start() {
        server = HttpServer.create()
            .port(port)
            .route(this::configureRoutes)
            .bind()
            .doOnNext(s -> log.info("Status server started on port {}", s.port()))
            .doOnError(err -> log.error("Failed to start status server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(20));
        }
    }

    private void configureRoutes(HttpServerRoutes routes) {
        routes
            .get("/healthz", (req, res) ->
                res.status(200).sendString(Mono.just("OK"))
            )
            .get("/status", (req, res) ->
                res.header("Content-Type", "application/json")
                    .sendString(Mono.fromCallable(() -> JsonUtils.writeValueAsString(
                        Map.of("lastPublished", collectorService.getLastPublishedEpochSec()))))
            )
            .get("/metrics", (req, res) ->
                res.addHeader("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                    .sendString(Mono.just(metricsExporter.scrape()))
                    .then()
            );
    }
}
