package com.pbscache.core.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.pbscache.core.error.StaleDataException;
import com.pbscache.core.pbs.DocumentFields;

import java.time.Duration;
import java.time.Instant;

/**
 * Consumer-side staleness check for published scheduler documents.
 */
public final class DocumentFreshness {

    public static final Duration DEFAULT_MAX_AGE = Duration.ofSeconds(120);

    private final Duration maxAge;

    public DocumentFreshness(Duration maxAge) {
        this.maxAge = maxAge;
    }

    /**
     * @param site     site the document belongs to, used in error messages
     * @param document published document, {@code null} when the key does not exist
     * @param now      evaluation time
     * @throws StaleDataException if the document is missing, has no timestamp or is older than the threshold
     */
    public void check(String site, JsonNode document, Instant now) {
        JsonNode timestamp = document == null ? null : document.get(DocumentFields.TIMESTAMP);
        if (timestamp == null || !timestamp.isNumber()) {
            throw new StaleDataException("invalid site " + site);
        }
        Instant producedAt = Instant.ofEpochMilli(Math.round(timestamp.asDouble() * 1000));
        if (Duration.between(producedAt, now).compareTo(maxAge) > 0) {
            throw new StaleDataException("pbs info too old");
        }
    }

    public boolean isFresh(String site, JsonNode document, Instant now) {
        try {
            check(site, document, now);
            return true;
        } catch (StaleDataException e) {
            return false;
        }
    }
}
