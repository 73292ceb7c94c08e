package com.pbscache.core.error;

import lombok.Getter;

/**
 * Writing the assembled document to one destination failed.
 */
@Getter
public class PublicationException extends PbsCacheException {

    private final String destination;

    public PublicationException(String destination, Throwable cause) {
        super("failed to publish to " + destination + ": " + cause.getMessage(), cause);
        this.destination = destination;
    }
}
