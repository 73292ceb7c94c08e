package com.pbscache.api.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pbscache.api.store.IDocumentReader;
import com.pbscache.core.error.StaleDataException;
import com.pbscache.core.pbs.DocumentFields;
import com.pbscache.core.pbs.KeySanitizer;
import com.pbscache.core.pbs.Keys;
import com.pbscache.core.query.DocumentFreshness;
import com.pbscache.core.query.DocumentPath;
import com.pbscache.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Answers read queries over published site documents and the application registry.
 * <p>
 * Every answer is a JSON object with a boolean {@code result}. Successful answers carry
 * {@code data} (and {@code count} for listings); failed answers carry {@code msg}.
 * Site documents older than the freshness threshold are never served.
 * </p>
 */
public class PbsQueryService {
    private static final Logger log = LoggerFactory.getLogger(PbsQueryService.class);

    private static final DocumentPath APP_NAMES = DocumentPath.compile("$.*.Name");

    private final List<String> sites;
    private final IDocumentReader reader;
    private final DocumentFreshness freshness;
    private final Clock clock;

    public PbsQueryService(List<String> sites, IDocumentReader reader, DocumentFreshness freshness, Clock clock) {
        this.sites = List.copyOf(sites);
        this.reader = reader;
        this.freshness = freshness;
        this.clock = clock;
    }

    public Mono<ObjectNode> sites() {
        return Mono.just(ok(JsonUtils.mapper().valueToTree(sites)));
    }

    public Mono<ObjectNode> site(String site) {
        return respond(loadSite(site).map(PbsQueryService::ok));
    }

    /**
     * Summary listing of one subject: job ids, node hosts, queue names or the server record.
     */
    public Mono<ObjectNode> subject(String site, String subjectName) {
        Subject subject = Subject.fromPath(subjectName);
        if (subject == null) {
            return Mono.just(failure("invalid subject " + subjectName));
        }
        return respond(loadSite(site).map(doc -> summarize(subject, doc.path(subject.field()))));
    }

    /**
     * Detail lookup of one record (or all records with {@code *}), optionally narrowed to {@code items}.
     * <p>
     * Nodes are looked up by their {@code Mom} host. Other records are looked up by their sanitized key.
     * </p>
     */
    public Mono<ObjectNode> detail(String site, String subjectName, String name, List<String> items) {
        Subject subject = Subject.fromPath(subjectName);
        if (subject == null) {
            return Mono.just(failure("invalid subject " + subjectName));
        }
        String unusable = Stream.concat(Stream.of(name), items.stream())
            .filter(value -> !isQuotable(value))
            .findFirst()
            .orElse(null);
        if (unusable != null) {
            return Mono.just(failure("invalid name " + unusable));
        }
        return respond(loadSite(site).map(doc -> {
            String key = KeySanitizer.sanitize(name);
            boolean listResult = subject == Subject.NODES || "*".equals(key) || !items.isEmpty();
            String expression = detailExpression(subject, name, key, items);
            log.debug("Evaluating {} on site {}", expression, site);

            List<JsonNode> matches = DocumentPath.compile(expression).select(doc);
            if (listResult) {
                return ok(toArray(matches));
            }
            if (matches.isEmpty()) {
                throw new IllegalArgumentException("Path '" + expression + "' does not exist");
            }
            return ok(matches.get(0));
        }));
    }

    /**
     * Ids of the jobs run by {@code username} across every configured site.
     * Fails as a whole when any site document is missing or stale.
     */
    public Mono<ObjectNode> userJobs(String username) {
        if (!isQuotable(username)) {
            return Mono.just(failure("invalid username " + username));
        }
        Mono<ObjectNode> answer = Mono.defer(() -> {
            DocumentPath path = DocumentPath.compile("$.Jobs[?(@.euser==" + quote(username) + ")].id");
            return Flux.fromIterable(sites)
                .concatMap(this::loadSite)
                .concatMapIterable(path::select)
                .collectList();
        }).map(jobs -> {
            ObjectNode data = JsonUtils.newObject();
            data.set("jobs", toArray(jobs));
            return ok(data);
        });
        return respond(answer);
    }

    public Mono<ObjectNode> apps() {
        return respond(loadApps().map(doc -> ok(toArray(doc.map(APP_NAMES::select).orElse(List.of())))));
    }

    public Mono<ObjectNode> app(String name) {
        if (!isQuotable(name)) {
            return Mono.just(failure("invalid name " + name));
        }
        return respond(loadApps().map(doc -> {
            DocumentPath path = DocumentPath.compile("$[" + quote(name) + "]");
            return ok(toArray(doc.map(path::select).orElse(List.of())));
        }));
    }

    private Mono<JsonNode> loadSite(String site) {
        if (!sites.contains(site)) {
            return Mono.error(new StaleDataException("invalid site " + site));
        }
        return reader.get(Keys.site(site))
            .map(json -> Optional.of(JsonUtils.readTree(json)))
            .defaultIfEmpty(Optional.empty())
            .map(doc -> {
                JsonNode document = doc.orElse(null);
                freshness.check(site, document, clock.instant());
                return document;
            });
    }

    private Mono<Optional<JsonNode>> loadApps() {
        return reader.get(Keys.apps())
            .map(json -> Optional.of(JsonUtils.readTree(json)))
            .defaultIfEmpty(Optional.empty());
    }

    private static String detailExpression(Subject subject, String name, String key, List<String> items) {
        StringBuilder expression = new StringBuilder("$.").append(subject.field());
        if (subject == Subject.NODES) {
            expression.append("[?(@.Mom==").append(quote(name)).append(")]");
        } else if ("*".equals(key)) {
            expression.append(".*");
        } else {
            expression.append('[').append(quote(key)).append(']');
        }
        if (!items.isEmpty()) {
            expression.append(".[")
                .append(items.stream().map(PbsQueryService::quote).collect(Collectors.joining(",")))
                .append(']');
        }
        return expression.toString();
    }

    private static ObjectNode summarize(Subject subject, JsonNode section) {
        switch (subject) {
            case JOBS: {
                ArrayNode ids = JsonUtils.mapper().createArrayNode();
                section.fields().forEachRemaining(e -> ids.add(e.getValue().path(DocumentFields.ID).asText(e.getKey())));
                return ok(ids).put("count", ids.size());
            }
            case NODES: {
                Set<String> hosts = new LinkedHashSet<>();
                section.fields().forEachRemaining(e -> hosts.add(e.getValue().path("Mom").asText(e.getKey())));
                return ok(JsonUtils.mapper().valueToTree(hosts)).put("count", section.size());
            }
            case QUEUE: {
                ArrayNode names = JsonUtils.mapper().createArrayNode();
                section.fieldNames().forEachRemaining(names::add);
                return ok(names).put("count", names.size());
            }
            default: {
                Iterator<JsonNode> servers = section.elements();
                return ok(servers.hasNext() ? servers.next() : null);
            }
        }
    }

    private static Mono<ObjectNode> respond(Mono<ObjectNode> answer) {
        return answer
            .onErrorResume(StaleDataException.class, e -> Mono.just(failure(e.getMessage())))
            .onErrorResume(e -> {
                log.warn("Query failed: {}", e.getMessage());
                return Mono.just(failure("backend failure, " + e.getMessage()));
            });
    }

    static ObjectNode ok(JsonNode data) {
        ObjectNode out = JsonUtils.newObject();
        out.put("result", true);
        out.set("data", data);
        return out;
    }

    static ObjectNode failure(String message) {
        ObjectNode out = JsonUtils.newObject();
        out.put("result", false);
        out.put("msg", message);
        return out;
    }

    private static ArrayNode toArray(List<JsonNode> nodes) {
        ArrayNode array = JsonUtils.mapper().createArrayNode();
        array.addAll(nodes);
        return array;
    }

    /**
     * Path literals have no escapes, so a value is quoted with whichever quote character it lacks.
     */
    private static boolean isQuotable(String value) {
        return value.indexOf('"') < 0 || value.indexOf('\'') < 0;
    }

    private static String quote(String value) {
        return value.indexOf('"') < 0 ? "\"" + value + "\"" : "'" + value + "'";
    }
}
