package com.pbscache.collector;

import com.pbscache.collector.apps.AppRegistryLoader;
import com.pbscache.collector.config.CollectorConfig;
import com.pbscache.collector.publish.DocumentPublisher;
import com.pbscache.collector.publish.DocumentStores;
import com.pbscache.collector.publish.PublicationReport;
import com.pbscache.core.model.AppDescriptor;
import com.pbscache.core.pbs.Keys;
import com.pbscache.core.util.JsonUtils;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;

/**
 * Publishes the application registry once and exits.
 * <p>
 * With {@code APP_TEST_MODE=true} the registry is printed instead of published.
 * </p>
 */
public class AppLoaderApp {
    private static final Logger log = LoggerFactory.getLogger(AppLoaderApp.class);

    public static void main(String[] args) {
        CollectorConfig config = CollectorConfig.fromEnv();

        Map<String, AppDescriptor> registry;
        try {
            registry = new AppRegistryLoader().load(config.getAppPath());
        } catch (IOException e) {
            log.error("Failed to load application registry from {}", config.getAppPath(), e);
            System.exit(1);
            return;
        }

        String json = JsonUtils.writeValueAsString(registry);
        if (config.isAppTestMode()) {
            System.out.println(JsonUtils.writePrettyString(registry));
            return;
        }

        DocumentPublisher publisher = new DocumentPublisher(
            DocumentStores.fromConfig(config),
            config.getPublishTimeout(),
            new SimpleMeterRegistry()
        );
        PublicationReport report;
        try {
            report = publisher.publish(Keys.apps(), json).block();
        } finally {
            publisher.close();
        }
        System.exit(report != null && report.isPublished() ? 0 : 1);
    }
}
