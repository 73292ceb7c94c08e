package com.pbscache.core.error;

/**
 * A published document is missing or older than the freshness threshold.
 */
public class StaleDataException extends PbsCacheException {

    public StaleDataException(String message) {
        super(message);
    }
}
