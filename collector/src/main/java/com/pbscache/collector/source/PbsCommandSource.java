package com.pbscache.collector.source;

import com.pbscache.collector.config.CollectorConfig;
import com.pbscache.core.error.IngestionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the PBS command line tools and captures their JSON output.
 * <p>
 * stderr is merged into stdout: diagnostics the tools print between JSON lines are
 * dropped later by the JSON sanitizer.
 * </p>
 */
public class PbsCommandSource implements ISchedulerSource {
    private static final Logger log = LoggerFactory.getLogger(PbsCommandSource.class);

    private final Path binDir;
    private final Duration timeout;

    public PbsCommandSource(CollectorConfig config) {
        this(Path.of(config.getPbsBinDir()), config.getCommandTimeout());
    }

    public PbsCommandSource(Path binDir, Duration timeout) {
        this.binDir = binDir;
        this.timeout = timeout;
    }

    @Override
    public String fetch(SchedulerQuery query) {
        List<String> command = command(query);
        log.debug("Running {}", command);
        long start = System.nanoTime();

        Process process;
        try {
            process = new ProcessBuilder(command).redirectErrorStream(true).start();
        } catch (IOException e) {
            throw new IngestionException("failed to start " + String.join(" ", command), e);
        }

        CompletableFuture<String> output = Mono.fromCallable(() -> readAll(process.getInputStream()))
            .subscribeOn(Schedulers.boundedElastic())
            .toFuture();
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new IngestionException(query.label() + " query timed out after " + timeout.toSeconds() + "s");
            }
            String text = output.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            int exit = process.exitValue();
            if (exit != 0) {
                throw new IngestionException(query.label() + " query exited with " + exit + ": " + tail(text));
            }
            log.debug("{} query finished in {}ms ({} bytes)",
                query.label(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start), text.length());
            return text;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IngestionException(query.label() + " query interrupted", e);
        } catch (ExecutionException | TimeoutException e) {
            process.destroyForcibly();
            throw new IngestionException("failed to read " + query.label() + " query output", e);
        }
    }

    List<String> command(SchedulerQuery query) {
        List<String> command = new ArrayList<>();
        command.add(binDir.resolve(query.binary()).toString());
        command.addAll(query.arguments());
        return command;
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String tail(String text) {
        String trimmed = text.strip();
        return trimmed.length() <= 300 ? trimmed : "..." + trimmed.substring(trimmed.length() - 300);
    }
}
