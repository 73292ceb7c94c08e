package com.pbscache.api.http;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pbscache.api.config.ApiConfig;
import com.pbscache.api.service.PbsQueryService;
import com.pbscache.core.metrics.MetricsNames;
import com.pbscache.core.metrics.MetricsTags;
import com.pbscache.core.metrics.PrometheusMetricsExporter;
import com.pbscache.core.util.JsonUtils;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.server.HttpServerRoutes;

import java.time.Duration;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * HTTP server for the scheduler query endpoints.
 * <p>
 * Every route except {@code /healthz} requires basic authentication.
 * </p>
 */
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final ApiConfig config;
    private final PbsQueryService queryService;
    private final BasicAuth auth;
    private final PrometheusMetricsExporter metricsExporter;
    private final MeterRegistry meterRegistry;

    private DisposableServer server;

    public HttpServer(ApiConfig config, PbsQueryService queryService, PrometheusMetricsExporter metricsExporter) {
        this.config = config;
        this.queryService = queryService;
        this.auth = new BasicAuth(config.getApiUser(), config.getApiPassword());
        this.metricsExporter = metricsExporter;
        this.meterRegistry = metricsExporter.getRegistry();
    }

    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .route(this::configureRoutes)
            .bind()
            .doOnNext(s -> log.info("HTTP server started on port {}", s.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
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
            // Health check
            .get("/healthz", (req, res) ->
                res.status(200).sendString(Mono.just("OK"))
            )
            // Metrics endpoint
            .get("/metrics", authenticated("metrics", (req, res) ->
                res.addHeader("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                    .sendString(Mono.just(metricsExporter.scrape()))
                    .then()
            ))
            // Site documents
            .get("/pbs", secured("sites", req -> queryService.sites()))
            .get("/pbs/{site}", secured("site", req ->
                queryService.site(param(req, "site"))))
            .get("/pbs/{site}/{subject}", secured("subject", req ->
                queryService.subject(param(req, "site"), param(req, "subject"))))
            .get("/pbs/{site}/{subject}/{name}", secured("detail", req ->
                queryService.detail(param(req, "site"), param(req, "subject"), param(req, "name"), items(req))))
            // Users
            .get("/user/{username}/jobs", secured("user_jobs", req ->
                queryService.userJobs(param(req, "username"))))
            // Application registry
            .get("/app", secured("apps", req -> queryService.apps()))
            .get("/app/{name}", secured("app", req ->
                queryService.app(param(req, "name"))));
    }

    private BiFunction<HttpServerRequest, HttpServerResponse, Publisher<Void>> authenticated(
        String route,
        BiFunction<HttpServerRequest, HttpServerResponse, Publisher<Void>> handler
    ) {
        return (req, res) -> {
            if (!auth.isAuthorized(req.requestHeaders().get(HttpHeaderNames.AUTHORIZATION))) {
                requestCounter(route, "unauthorized").increment();
                return res.status(HttpResponseStatus.UNAUTHORIZED)
                    .header(HttpHeaderNames.WWW_AUTHENTICATE, "Basic")
                    .header("Content-Type", "application/json")
                    .sendString(Mono.just("{\"detail\":\"Incorrect username or password\"}"));
            }
            return handler.apply(req, res);
        };
    }

    private BiFunction<HttpServerRequest, HttpServerResponse, Publisher<Void>> secured(
        String route,
        Function<HttpServerRequest, Mono<ObjectNode>> handler
    ) {
        return authenticated(route, (req, res) -> handler.apply(req)
            .doOnNext(answer -> requestCounter(route, answer.path("result").asBoolean() ? "ok" : "failed").increment())
            .map(JsonUtils::writeValueAsString)
            .flatMap(json ->
                res.header("Content-Type", "application/json")
                    .sendString(Mono.just(json)).then()
            )
            .onErrorResume(err -> {
                log.error("Failed to answer {}", req.uri(), err);
                requestCounter(route, "error").increment();
                return res.status(HttpResponseStatus.INTERNAL_SERVER_ERROR)
                    .sendString(Mono.just("{\"result\":false,\"msg\":\"internal error\"}")).then();
            }));
    }

    private Counter requestCounter(String route, String outcome) {
        return Counter.builder(MetricsNames.API_REQUESTS_TOTAL)
            .tag(MetricsTags.ROUTE, route)
            .tag(MetricsTags.OUTCOME, outcome)
            .register(meterRegistry);
    }

    private static String param(HttpServerRequest req, String name) {
        String value = req.param(name);
        return value == null ? null : QueryStringDecoder.decodeComponent(value);
    }

    private static List<String> items(HttpServerRequest req) {
        return new QueryStringDecoder(req.uri()).parameters().getOrDefault("item", List.of());
    }
}
