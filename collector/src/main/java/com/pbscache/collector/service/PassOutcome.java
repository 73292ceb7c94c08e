package com.pbscache.collector.service;

/**
 * Result of one collection pass.
 */
public enum PassOutcome {
    /**
     * The primary destination holds the new document.
     */
    PUBLISHED,
    /**
     * Fetching or parsing scheduler output failed; nothing was written.
     */
    INGESTION_FAILED,
    /**
     * The document was assembled but the primary destination rejected it.
     */
    PUBLICATION_FAILED,
    /**
     * Unexpected error.
     */
    FAILED;

    public String tag() {
        return name().toLowerCase();
    }
}
