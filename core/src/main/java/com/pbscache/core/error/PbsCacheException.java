package com.pbscache.core.error;

/**
 * Base type for failures raised while collecting, publishing or serving scheduler state.
 */
public class PbsCacheException extends RuntimeException {

    public PbsCacheException(String message) {
        super(message);
    }

    public PbsCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
