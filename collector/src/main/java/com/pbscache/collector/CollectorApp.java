package com.pbscache.collector;

import com.pbscache.collector.aggregate.AggregationPipeline;
import com.pbscache.collector.config.CollectorConfig;
import com.pbscache.collector.http.StatusServer;
import com.pbscache.collector.publish.DocumentPublisher;
import com.pbscache.collector.publish.DocumentStores;
import com.pbscache.collector.service.CollectorService;
import com.pbscache.collector.service.PassOutcome;
import com.pbscache.collector.source.PbsCommandSource;
import com.pbscache.core.metrics.MetricsTags;
import com.pbscache.core.metrics.PrometheusMetricsExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.netty.DisposableServer;

import java.time.Clock;

public class CollectorApp {
    private static final Logger log = LoggerFactory.getLogger(CollectorApp.class);

    public static void main(String[] args) {
        CollectorConfig config = CollectorConfig.fromEnv();

        log.info("Starting PBS collector");
        log.info("  Site: {}", config.getSite());
        log.info("  Destinations: {}{}", config.getRedisUrls(),
            config.getOutputDir() != null ? " + " + config.getOutputDir() : "");
        log.info("  Interval: {}s (one-shot: {})", config.getInterval().toSeconds(), config.isOneShot());

        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter("pbs-cache-collector", MetricsTags.SITE, config.getSite());
        DocumentPublisher publisher = new DocumentPublisher(
            DocumentStores.fromConfig(config),
            config.getPublishTimeout(),
            metricsExporter.getRegistry()
        );
        CollectorService collectorService = new CollectorService(
            config.getSite(),
            new PbsCommandSource(config),
            new AggregationPipeline(),
            publisher,
            Clock.systemUTC(),
            metricsExporter.getRegistry()
        );

        if (config.isOneShot()) {
            PassOutcome outcome = collectorService.runPass().block();
            publisher.close();
            log.info("Single pass finished: {}", outcome);
            System.exit(outcome == PassOutcome.PUBLISHED ? 0 : 1);
            return;
        }

        StatusServer statusServer = new StatusServer(config.getHttpPort(), collectorService, metricsExporter);
        DisposableServer disposableServer = statusServer.start();

        Disposable passes = collectorService.start(config.getInterval());

        log.info("PBS collector is ready");

        handleShutDown(passes, statusServer, publisher);

        disposableServer.onDispose().block();
    }

    private static void handleShutDown(Disposable passes, StatusServer statusServer, DocumentPublisher publisher) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");

            passes.dispose();

            statusServer.stop();

            publisher.close();

            log.info("Shutdown complete");
        }));
    }
}
