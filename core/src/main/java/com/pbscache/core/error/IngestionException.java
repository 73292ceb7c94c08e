package com.pbscache.core.error;

/**
 * A scheduler query failed or its output stayed unparseable after bounded repair.
 * <p>
 * Aborts the whole collection pass; the previously published document is left in place.
 * </p>
 */
public class IngestionException extends PbsCacheException {

    public IngestionException(String message) {
        super(message);
    }

    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
