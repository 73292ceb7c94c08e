package com.pbscache.api.http;

import com.pbscache.api.config.ApiConfig;
import com.pbscache.api.service.PbsQueryService;
import com.pbscache.api.store.IDocumentReader;
import com.fasterxml.jackson.databind.JsonNode;
import com.pbscache.core.metrics.PrometheusMetricsExporter;
import com.pbscache.core.query.DocumentFreshness;
import com.pbscache.core.util.JsonUtils;
import io.netty.handler.codec.http.HttpHeaderNames;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.client.HttpClient;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HttpServerTest {

    private static final String CREDENTIALS = "hpc:s3cret";

    private PrometheusMetricsExporter metrics;
    private HttpServer server;
    private DisposableServer bound;

    @BeforeEach
    void setUp() {
        ApiConfig config = ApiConfig.builder()
            .httpPort(0)
            .redisUrl("redis://localhost:6379")
            .sites(List.of("east"))
            .apiUser("hpc")
            .apiPassword("s3cret")
            .maxAge(DocumentFreshness.DEFAULT_MAX_AGE)
            .build();
        IDocumentReader emptyReader = new IDocumentReader() {
            @Override
            public Mono<String> get(String key) {
                return Mono.empty();
            }

            @Override
            public void close() {
            }
        };
        metrics = new PrometheusMetricsExporter("pbs-cache-api-test");
        PbsQueryService queryService = new PbsQueryService(
            config.getSites(), emptyReader, new DocumentFreshness(config.getMaxAge()), Clock.systemUTC());
        server = new HttpServer(config, queryService, metrics);
        bound = server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop();
        metrics.close();
    }

    @Test
    void healthCheckNeedsNoCredentials() {
        assertEquals(200, status(client(), "/healthz"));
    }

    @Test
    void metricsRequireCredentials() {
        assertEquals(401, status(client(), "/metrics"));
        assertEquals(200, status(authorizedClient(), "/metrics"));
    }

    @Test
    void queryRoutesRequireCredentials() {
        assertEquals(401, status(client(), "/pbs"));

        String body = authorizedClient().get().uri("/pbs")
            .responseContent().aggregate().asString()
            .block(Duration.ofSeconds(10));
        JsonNode answer = JsonUtils.readTree(body);
        assertTrue(answer.path("result").asBoolean());
        assertEquals("east", answer.path("data").path(0).asText());
    }

    private HttpClient client() {
        return HttpClient.create().port(bound.port());
    }

    private HttpClient authorizedClient() {
        String token = Base64.getEncoder().encodeToString(CREDENTIALS.getBytes(StandardCharsets.UTF_8));
        return client().headers(h -> h.set(HttpHeaderNames.AUTHORIZATION, "Basic " + token));
    }

    private static int status(HttpClient client, String uri) {
        Integer code = client.get().uri(uri)
            .responseSingle((res, content) -> Mono.just(res.status().code()))
            .block(Duration.ofSeconds(10));
        assertNotNull(code);
        return code;
    }
}
