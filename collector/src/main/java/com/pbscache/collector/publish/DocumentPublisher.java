package com.pbscache.collector.publish;

import com.google.common.base.Preconditions;
import com.pbscache.core.error.PublicationException;
import com.pbscache.core.metrics.MetricsNames;
import com.pbscache.core.metrics.MetricsTags;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Writes a document to every configured destination, one after another.
 * <p>
 * A failing destination is logged and reported but never prevents the remaining
 * destinations from being attempted.
 * </p>
 */
public class DocumentPublisher {
    private static final Logger log = LoggerFactory.getLogger(DocumentPublisher.class);

    private final List<IDocumentStore> stores;
    private final Duration timeout;
    private final MeterRegistry meterRegistry;

    public DocumentPublisher(List<IDocumentStore> stores, Duration timeout, MeterRegistry meterRegistry) {
        Preconditions.checkArgument(!stores.isEmpty(), "at least one destination is required");
        this.stores = List.copyOf(stores);
        this.timeout = timeout;
        this.meterRegistry = meterRegistry;
    }

    public Mono<PublicationReport> publish(String key, String json) {
        return Flux.fromIterable(stores)
            .concatMap(store -> publishTo(store, key, json))
            .collectList()
            .map(PublicationReport::new)
            .doOnNext(report -> {
                if (report.isPublished()) {
                    log.info("Published {} to {}/{} destinations", key,
                        stores.size() - report.failures().size(), stores.size());
                } else {
                    log.error("Primary destination {} rejected {}", stores.get(0).name(), key);
                }
            });
    }

    private Mono<PublicationReport.DestinationResult> publishTo(IDocumentStore store, String key, String json) {
        return Mono.defer(() -> store.replace(key, json))
            .timeout(timeout)
            .then(Mono.fromCallable(() -> PublicationReport.DestinationResult.ok(store.name())))
            .onErrorResume(err -> {
                PublicationException failure = new PublicationException(store.name(), err);
                log.error("Failed to publish {}: {}", key, failure.getMessage(), err);
                failureCounter(store).increment();
                return Mono.just(PublicationReport.DestinationResult.failed(failure));
            });
    }

    private Counter failureCounter(IDocumentStore store) {
        return Counter.builder(MetricsNames.COLLECTOR_PUBLICATION_FAILURES_TOTAL)
            .tag(MetricsTags.DESTINATION, store.name())
            .register(meterRegistry);
    }

    public void close() {
        stores.forEach(IDocumentStore::close);
    }
}
