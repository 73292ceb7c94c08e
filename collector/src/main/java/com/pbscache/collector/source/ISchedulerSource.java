package com.pbscache.collector.source;

import com.pbscache.core.error.IngestionException;

/**
 * Produces raw scheduler output (Dependency Inversion Principle).
 * <p>
 * Enables testing with canned output instead of invoking PBS binaries.
 * </p>
 */
public interface ISchedulerSource {

    /**
     * Runs one query and returns its raw, possibly malformed, JSON text. Blocking.
     *
     * @throws IngestionException if the query could not be executed
     */
    String fetch(SchedulerQuery query);
}
