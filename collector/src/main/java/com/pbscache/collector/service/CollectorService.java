package com.pbscache.collector.service;

import com.pbscache.collector.aggregate.AggregationPipeline;
import com.pbscache.collector.aggregate.AggregationResult;
import com.pbscache.collector.publish.DocumentPublisher;
import com.pbscache.collector.source.ISchedulerSource;
import com.pbscache.collector.source.RawSchedulerData;
import com.pbscache.collector.source.SchedulerQuery;
import com.pbscache.core.error.IngestionException;
import com.pbscache.core.metrics.MetricsNames;
import com.pbscache.core.metrics.MetricsTags;
import com.pbscache.core.pbs.DocumentFields;
import com.pbscache.core.pbs.Keys;
import com.pbscache.core.util.JsonUtils;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs collection passes: fetch, sanitize, aggregate, publish.
 * <p>
 * The four scheduler queries run concurrently and must all succeed before aggregation
 * starts. A failed pass leaves the previously published document untouched; the next
 * scheduled pass is the only retry. Passes never overlap: the next one is scheduled
 * {@code interval} after the previous one finished.
 * </p>
 */
public class CollectorService {
    private static final Logger log = LoggerFactory.getLogger(CollectorService.class);

    private final String site;
    private final ISchedulerSource source;
    private final AggregationPipeline pipeline;
    private final DocumentPublisher publisher;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final Timer passLatency;
    private final AtomicLong lastPublishedEpochSec = new AtomicLong();

    public CollectorService(
        String site,
        ISchedulerSource source,
        AggregationPipeline pipeline,
        DocumentPublisher publisher,
        Clock clock,
        MeterRegistry meterRegistry
    ) {
        this.site = site;
        this.source = source;
        this.pipeline = pipeline;
        this.publisher = publisher;
        this.clock = clock;
        this.meterRegistry = meterRegistry;

        this.passLatency = Timer.builder(MetricsNames.COLLECTOR_PASS_LATENCY)
            .tag(MetricsTags.SITE, site)
            .register(meterRegistry);
        Gauge.builder(MetricsNames.COLLECTOR_LAST_PUBLISHED, lastPublishedEpochSec, AtomicLong::get)
            .tag(MetricsTags.SITE, site)
            .register(meterRegistry);
    }

    /**
     * Runs one pass. Never errors: failures are logged and reported as an outcome.
     */
    public Mono<PassOutcome> runPass() {
        return Mono.defer(() -> {
            long start = System.nanoTime();
            return fetch()
                .map(raw -> pipeline.aggregate(raw, clock.instant()))
                .flatMap(this::publish)
                .onErrorResume(IngestionException.class, err -> {
                    log.error("Pass aborted, keeping previous document: {}", err.getMessage(), err);
                    return Mono.just(PassOutcome.INGESTION_FAILED);
                })
                .onErrorResume(err -> {
                    log.error("Pass failed unexpectedly", err);
                    return Mono.just(PassOutcome.FAILED);
                })
                .doOnNext(outcome -> {
                    passLatency.record(Duration.ofNanos(System.nanoTime() - start));
                    passCounter(outcome).increment();
                });
        });
    }

    /**
     * Starts the wait-then-repeat pass loop.
     */
    public Disposable start(Duration interval) {
        log.info("Collecting site {} every {}s", site, interval.toSeconds());
        return runPass()
            .then(Mono.delay(interval))
            .repeat()
            .subscribe(
                tick -> { },
                err -> log.error("Collector loop terminated", err));
    }

    public long getLastPublishedEpochSec() {
        return lastPublishedEpochSec.get();
    }

    private Mono<RawSchedulerData> fetch() {
        return Mono.zip(
                query(SchedulerQuery.SERVER),
                query(SchedulerQuery.QUEUE),
                query(SchedulerQuery.NODE),
                query(SchedulerQuery.JOB))
            .map(t -> RawSchedulerData.builder()
                .server(t.getT1())
                .queue(t.getT2())
                .node(t.getT3())
                .job(t.getT4())
                .build());
    }

    private Mono<String> query(SchedulerQuery query) {
        return Mono.fromCallable(() -> source.fetch(query))
            .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<PassOutcome> publish(AggregationResult result) {
        result.getDroppedLines().forEach((label, count) -> {
            if (count > 0) {
                Counter.builder(MetricsNames.COLLECTOR_SANITIZED_LINES_TOTAL)
                    .tag(MetricsTags.SOURCE, label)
                    .register(meterRegistry)
                    .increment(count);
            }
        });
        skippedCounter("node").increment(result.getSkippedNodes());
        skippedCounter("job").increment(result.getSkippedJobs());

        long timestamp = result.getDocument().path(DocumentFields.TIMESTAMP).asLong();
        String json = JsonUtils.writeValueAsString(result.getDocument());
        return publisher.publish(Keys.site(site), json)
            .map(report -> {
                if (!report.isPublished()) {
                    return PassOutcome.PUBLICATION_FAILED;
                }
                lastPublishedEpochSec.set(timestamp);
                return PassOutcome.PUBLISHED;
            });
    }

    private Counter passCounter(PassOutcome outcome) {
        return Counter.builder(MetricsNames.COLLECTOR_PASSES_TOTAL)
            .tag(MetricsTags.SITE, site)
            .tag(MetricsTags.OUTCOME, outcome.tag())
            .register(meterRegistry);
    }

    private Counter skippedCounter(String type) {
        return Counter.builder(MetricsNames.COLLECTOR_SKIPPED_RECORDS_TOTAL)
            .tag(MetricsTags.SITE, site)
            .tag(MetricsTags.TYPE, type)
            .register(meterRegistry);
    }
}
