package com.pbscache.collector.apps;

import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.pbscache.core.model.AppDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads application descriptors from a directory of TOML files.
 * <p>
 * Each {@code <name>.toml} becomes one registry entry keyed by the file name up to its first dot.
 * Unknown keys or a missing {@code Name} fail the whole load.
 * </p>
 */
public class AppRegistryLoader {
    private static final Logger log = LoggerFactory.getLogger(AppRegistryLoader.class);

    private final TomlMapper mapper = new TomlMapper();

    public Map<String, AppDescriptor> load(Path directory) throws IOException {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*.toml")) {
            stream.forEach(files::add);
        }
        files.sort(null);

        Map<String, AppDescriptor> registry = new LinkedHashMap<>();
        for (Path file : files) {
            String fileName = file.getFileName().toString();
            String key = fileName.substring(0, fileName.indexOf('.'));
            AppDescriptor app;
            try {
                app = mapper.readValue(file.toFile(), AppDescriptor.class);
            } catch (IOException e) {
                throw new IOException("invalid application config " + file + ": " + e.getMessage(), e);
            }
            if (app.getName() == null) {
                throw new IOException("invalid application config " + file + ": missing Name");
            }
            registry.put(key, app);
            log.debug("Loaded application {} from {}", app.getName(), file);
        }
        log.info("Loaded {} application descriptors from {}", registry.size(), directory);
        return registry;
    }
}
