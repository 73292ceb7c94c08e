package com.pbscache.collector;

import com.pbscache.collector.source.RawSchedulerData;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Captured scheduler output used across collector tests.
 */
public final class Fixtures {
    private Fixtures() {
    }

    public static String read(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/pbs/" + name)) {
            if (in == null) {
                throw new IllegalStateException("missing fixture " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static RawSchedulerData schedulerData() {
        return RawSchedulerData.builder()
            .server(read("server.json"))
            .queue(read("queue.json"))
            .node(read("node.json"))
            .job(read("job.json"))
            .build();
    }
}
