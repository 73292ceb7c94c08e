package com.pbscache.collector.publish;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Stores documents as {@code <dir>/<key>.json}, written to a temporary file and moved into place.
 */
public class FileDocumentStore implements IDocumentStore {
    private static final Logger log = LoggerFactory.getLogger(FileDocumentStore.class);

    private final Path directory;

    public FileDocumentStore(Path directory) {
        this.directory = directory;
    }

    @Override
    public String name() {
        return "file:" + directory;
    }

    @Override
    public Mono<Void> replace(String key, String json) {
        return Mono.fromCallable(() -> write(key, json))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnNext(target -> log.debug("Stored {} in {}", key, target))
            .then();
    }

    public Path pathOf(String key) {
        return directory.resolve(key + ".json");
    }

    private Path write(String key, String json) throws IOException {
        Files.createDirectories(directory);
        Path target = pathOf(key);
        Path tmp = Files.createTempFile(directory, key + ".", ".tmp");
        try {
            Files.writeString(tmp, json, StandardCharsets.UTF_8);
            return Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    @Override
    public void close() {
    }
}
