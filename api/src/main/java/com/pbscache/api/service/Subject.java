package com.pbscache.api.service;

import com.pbscache.core.pbs.DocumentFields;

/**
 * Top-level sections of a site document that can be listed and queried.
 */
public enum Subject {
    SERVER(DocumentFields.SERVER),
    QUEUE(DocumentFields.QUEUE),
    JOBS(DocumentFields.JOBS),
    NODES(DocumentFields.NODES);

    private final String field;

    Subject(String field) {
        this.field = field;
    }

    /**
     * Document field and URL path segment of this subject.
     */
    public String field() {
        return field;
    }

    /**
     * @return the subject for a path segment, or {@code null} if there is none
     */
    public static Subject fromPath(String segment) {
        for (Subject subject : values()) {
            if (subject.field.equals(segment)) {
                return subject;
            }
        }
        return null;
    }
}
