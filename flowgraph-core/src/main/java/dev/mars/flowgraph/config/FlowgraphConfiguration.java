/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.flowgraph.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Settings of the Flowgraph engine, resolved in layers. Later layers win:
 * <ol>
 *   <li>built-in defaults</li>
 *   <li>the first readable {@code flowgraph.properties} in the working directory, {@code config/},
 *       {@code ~/.flowgraph/} or {@code /etc/flowgraph/}, else the one on the classpath</li>
 *   <li>system properties whose name starts with {@code flowgraph.}</li>
 * </ol>
 * The {@link #FlowgraphConfiguration(Properties)} constructor skips the file and system layers.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class FlowgraphConfiguration {
    private static final Logger logger = Logger.getLogger(FlowgraphConfiguration.class.getName());

    private static final String PREFIX = "flowgraph.";
    private static final String CONFIG_FILE = "flowgraph.properties";

    public static final String SCHEDULER_THREADS = "flowgraph.engine.scheduler.threads";
    public static final String RETRY_MAX_ATTEMPTS = "flowgraph.retry.default.max.attempts";
    public static final String RETRY_INITIAL_DELAY_MS = "flowgraph.retry.default.initial.delay.ms";
    public static final String RETRY_MAX_DELAY_MS = "flowgraph.retry.default.max.delay.ms";
    public static final String SERVICE_TIMEOUT_MS = "flowgraph.service.default.timeout.ms";
    public static final String STORE_MAX_AGE_MS = "flowgraph.store.max.age.ms";
    public static final String STORE_PURGE_INTERVAL_MS = "flowgraph.store.purge.interval.ms";
    public static final String METRICS_ENABLED = "flowgraph.monitoring.metrics.enabled";

    private static final Properties DEFAULTS = new Properties();

    static {
        DEFAULTS.setProperty(SCHEDULER_THREADS, "2");
        DEFAULTS.setProperty(RETRY_MAX_ATTEMPTS, "1");
        DEFAULTS.setProperty(RETRY_INITIAL_DELAY_MS, "1000");
        DEFAULTS.setProperty(RETRY_MAX_DELAY_MS, "300000"); // 5 minutes
        DEFAULTS.setProperty(SERVICE_TIMEOUT_MS, "30000");
        DEFAULTS.setProperty(STORE_MAX_AGE_MS, "86400000"); // 24 hours
        DEFAULTS.setProperty(STORE_PURGE_INTERVAL_MS, "60000");
        DEFAULTS.setProperty(METRICS_ENABLED, "true");
    }

    private final Properties properties = new Properties();

    public FlowgraphConfiguration() {
        properties.putAll(DEFAULTS);
        loadPropertiesFile();
        applySystemOverrides();
    }

    public FlowgraphConfiguration(Properties overrides) {
        properties.putAll(DEFAULTS);
        if (overrides != null) {
            properties.putAll(overrides);
        }
    }

    // Engine

    public int getSchedulerThreads() {
        return Math.max(1, numeric(SCHEDULER_THREADS, Integer::valueOf));
    }

    public long getServiceTimeoutMs() {
        return numeric(SERVICE_TIMEOUT_MS, Long::valueOf);
    }

    // Retry defaults, used for nodes without their own policy

    public int getDefaultMaxAttempts() {
        return Math.max(1, numeric(RETRY_MAX_ATTEMPTS, Integer::valueOf));
    }

    public long getDefaultRetryInitialDelayMs() {
        return numeric(RETRY_INITIAL_DELAY_MS, Long::valueOf);
    }

    public long getDefaultRetryMaxDelayMs() {
        return numeric(RETRY_MAX_DELAY_MS, Long::valueOf);
    }

    // Execution store

    public long getStoreMaxAgeMs() {
        return numeric(STORE_MAX_AGE_MS, Long::valueOf);
    }

    public long getStorePurgeIntervalMs() {
        return numeric(STORE_PURGE_INTERVAL_MS, Long::valueOf);
    }

    // Monitoring

    public boolean isMetricsEnabled() {
        return Boolean.parseBoolean(properties.getProperty(METRICS_ENABLED).trim());
    }

    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    /**
     * Parses a numeric setting, falling back to the built-in default when the configured value is malformed.
     */
    private <T extends Number> T numeric(String key, Function<String, T> parser) {
        String value = properties.getProperty(key, DEFAULTS.getProperty(key));
        try {
            return parser.apply(value.trim());
        } catch (NumberFormatException e) {
            String fallback = DEFAULTS.getProperty(key);
            logger.warning("Ignoring non-numeric value '" + value + "' for " + key + "; using " + fallback);
            return parser.apply(fallback);
        }
    }

    private void loadPropertiesFile() {
        List<Path> candidates = List.of(
                Paths.get(CONFIG_FILE),
                Paths.get("config", CONFIG_FILE),
                Paths.get(System.getProperty("user.home"), ".flowgraph", CONFIG_FILE),
                Paths.get("/etc/flowgraph", CONFIG_FILE));

        Optional<Path> file = candidates.stream()
                .filter(path -> Files.isRegularFile(path) && Files.isReadable(path))
                .findFirst();
        if (file.isPresent()) {
            try (InputStream input = Files.newInputStream(file.get())) {
                properties.load(input);
                logger.info("Loaded Flowgraph configuration from " + file.get().toAbsolutePath());
                return;
            } catch (IOException e) {
                logger.warning("Could not read " + file.get() + ": " + e.getMessage());
            }
        }

        try (InputStream input = FlowgraphConfiguration.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded Flowgraph configuration from classpath resource " + CONFIG_FILE);
            }
        } catch (IOException e) {
            logger.warning("Could not read classpath resource " + CONFIG_FILE + ": " + e.getMessage());
        }
    }

    private void applySystemOverrides() {
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(PREFIX)) {
                properties.setProperty(name, System.getProperty(name));
                logger.fine("System property override: " + name + "=" + System.getProperty(name));
            }
        }
    }

    @Override
    public String toString() {
        return "FlowgraphConfiguration{" +
                "schedulerThreads=" + getSchedulerThreads() +
                ", defaultMaxAttempts=" + getDefaultMaxAttempts() +
                ", serviceTimeoutMs=" + getServiceTimeoutMs() +
                ", storeMaxAgeMs=" + getStoreMaxAgeMs() +
                ", storePurgeIntervalMs=" + getStorePurgeIntervalMs() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
