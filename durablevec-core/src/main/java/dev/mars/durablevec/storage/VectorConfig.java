/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
package dev.mars.durablevec.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;
import java.util.function.Function;

/**
 * Configuration for a {@link FileDurableVector}.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Ddurablevec.dataDir=/path})</li>
 *   <li>Environment variables (e.g., {@code DURABLEVEC_DATA_DIR})</li>
 *   <li>Properties file ({@code durablevec.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>dataDir</td><td>durablevec.dataDir</td><td>DURABLEVEC_DATA_DIR</td><td>~/.durablevec/data</td></tr>
 *   <tr><td>syncEnabled</td><td>durablevec.syncEnabled</td><td>DURABLEVEC_SYNC_ENABLED</td><td>true</td></tr>
 *   <tr><td>syncPeriodMs</td><td>durablevec.syncPeriodMs</td><td>DURABLEVEC_SYNC_PERIOD_MS</td><td>1000</td></tr>
 *   <tr><td>batchWakeCount</td><td>durablevec.batchWakeCount</td><td>DURABLEVEC_BATCH_WAKE_COUNT</td><td>256</td></tr>
 *   <tr><td>idRecycling</td><td>durablevec.idRecycling</td><td>DURABLEVEC_ID_RECYCLING</td><td>true</td></tr>
 * </table>
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # durablevec.properties
 * durablevec.dataDir=/var/lib/durablevec
 * durablevec.syncPeriodMs=500
 * durablevec.batchWakeCount=0
 * </pre>
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * VectorConfig config = VectorConfig.builder()
 *     .dataDir(Path.of("/var/lib/durablevec"))
 *     .syncPeriod(Duration.ofMillis(200))
 *     .batchWakeCount(1024)
 *     .build();
 *
 * try (FileDurableVector vector = FileDurableVector.open(config)) {
 *     vector.pushBack("hello".getBytes(StandardCharsets.UTF_8));
 * }
 * </pre>
 */
public final class VectorConfig {

    private static final Logger LOG = LoggerFactory.getLogger(VectorConfig.class);

    private static final String PROPERTIES_FILE = "durablevec.properties";

    // Property keys
    private static final String PROP_DATA_DIR = "durablevec.dataDir";
    private static final String PROP_SYNC_ENABLED = "durablevec.syncEnabled";
    private static final String PROP_SYNC_PERIOD_MS = "durablevec.syncPeriodMs";
    private static final String PROP_BATCH_WAKE_COUNT = "durablevec.batchWakeCount";
    private static final String PROP_ID_RECYCLING = "durablevec.idRecycling";

    // Environment variable keys
    private static final String ENV_DATA_DIR = "DURABLEVEC_DATA_DIR";
    private static final String ENV_SYNC_ENABLED = "DURABLEVEC_SYNC_ENABLED";
    private static final String ENV_SYNC_PERIOD_MS = "DURABLEVEC_SYNC_PERIOD_MS";
    private static final String ENV_BATCH_WAKE_COUNT = "DURABLEVEC_BATCH_WAKE_COUNT";
    private static final String ENV_ID_RECYCLING = "DURABLEVEC_ID_RECYCLING";

    // Defaults
    private static final Path DEFAULT_DATA_DIR = Path.of(System.getProperty("user.home"), ".durablevec", "data");
    private static final boolean DEFAULT_SYNC_ENABLED = true;
    private static final long DEFAULT_SYNC_PERIOD_MS = 1000;
    private static final int DEFAULT_BATCH_WAKE_COUNT = 256;
    private static final boolean DEFAULT_ID_RECYCLING = true;

    private final Path dataDir;
    private final boolean syncEnabled;
    private final Duration syncPeriod;
    private final int batchWakeCount;
    private final boolean idRecycling;

    private VectorConfig(Builder builder) {
        this.dataDir = builder.dataDir;
        this.syncEnabled = builder.syncEnabled;
        this.syncPeriod = builder.syncPeriod;
        this.batchWakeCount = builder.batchWakeCount;
        this.idRecycling = builder.idRecycling;
    }

    /** Directory holding the vector log. */
    public Path dataDir() {
        return dataDir;
    }

    /** Whether the daemon forces the log to disk (should be true in production). */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** Longest time appended data may wait before the daemon syncs it. */
    public Duration syncPeriod() {
        return syncPeriod;
    }

    /** Mutations between early daemon wake-ups; 0 disables them. */
    public int batchWakeCount() {
        return batchWakeCount;
    }

    /** Whether ids of erased items are handed out again. */
    public boolean idRecycling() {
        return idRecycling;
    }

    /**
     * Returns a builder seeded with every value of this configuration.
     */
    public Builder toBuilder() {
        return new Builder()
                .dataDir(dataDir)
                .syncEnabled(syncEnabled)
                .syncPeriod(syncPeriod)
                .batchWakeCount(batchWakeCount)
                .idRecycling(idRecycling);
    }

    @Override
    public String toString() {
        return "VectorConfig{" +
                "dataDir=" + dataDir +
                ", syncEnabled=" + syncEnabled +
                ", syncPeriod=" + syncPeriod.toMillis() + "ms" +
                ", batchWakeCount=" + batchWakeCount +
                ", idRecycling=" + idRecycling +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code VectorConfig.builder().build()}.
     */
    public static VectorConfig load() {
        return builder().build();
    }

    /** Accepts only "true" or "false" (any case); anything else is invalid. */
    private static Boolean parseBoolean(String value) {
        if ("true".equalsIgnoreCase(value)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(value)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("expected true or false");
    }

    /**
     * Builder for {@link VectorConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Path dataDir;
        private Boolean syncEnabled;
        private Duration syncPeriod;
        private Integer batchWakeCount;
        private Boolean idRecycling;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        /** Sets the data directory. */
        public Builder dataDir(Path dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        /** Sets the data directory from a string path. */
        public Builder dataDir(String dataDir) {
            this.dataDir = Path.of(dataDir);
            return this;
        }

        /** Enables or disables fsync (default: true). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        /** Sets the daemon's sync period (default: 1 second). */
        public Builder syncPeriod(Duration syncPeriod) {
            this.syncPeriod = syncPeriod;
            return this;
        }

        /** Wakes the daemon after every {@code count} mutations; 0 disables (default: 256). */
        public Builder batchWakeCount(int count) {
            this.batchWakeCount = count;
            return this;
        }

        /** Enables or disables id recycling (default: true). */
        public Builder idRecycling(boolean idRecycling) {
            this.idRecycling = idRecycling;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         *
         * @throws IllegalArgumentException if the sync period is not positive or
         *                                  the batch wake count is negative
         */
        public VectorConfig build() {
            if (dataDir == null) {
                dataDir = resolve(PROP_DATA_DIR, ENV_DATA_DIR, s -> Path.of(s), DEFAULT_DATA_DIR);
            }
            if (syncEnabled == null) {
                syncEnabled = resolve(PROP_SYNC_ENABLED, ENV_SYNC_ENABLED, VectorConfig::parseBoolean, DEFAULT_SYNC_ENABLED);
            }
            if (syncPeriod == null) {
                long millis = resolve(PROP_SYNC_PERIOD_MS, ENV_SYNC_PERIOD_MS, Long::parseLong, DEFAULT_SYNC_PERIOD_MS);
                syncPeriod = Duration.ofMillis(millis);
            }
            if (batchWakeCount == null) {
                batchWakeCount = resolve(PROP_BATCH_WAKE_COUNT, ENV_BATCH_WAKE_COUNT, Integer::parseInt,
                        DEFAULT_BATCH_WAKE_COUNT);
            }
            if (idRecycling == null) {
                idRecycling = resolve(PROP_ID_RECYCLING, ENV_ID_RECYCLING, VectorConfig::parseBoolean, DEFAULT_ID_RECYCLING);
            }

            if (syncPeriod.isZero() || syncPeriod.isNegative()) {
                throw new IllegalArgumentException("syncPeriod must be positive: " + syncPeriod);
            }
            if (batchWakeCount < 0) {
                throw new IllegalArgumentException("batchWakeCount must not be negative: " + batchWakeCount);
            }
            return new VectorConfig(this);
        }

        private <T> T resolve(String sysProp, String envVar, Function<String, T> parser, T defaultValue) {
            // 1. System property
            T value = parse(sysProp, System.getProperty(sysProp), parser);
            if (value != null) {
                return value;
            }

            // 2. Environment variable
            value = parse(envVar, System.getenv(envVar), parser);
            if (value != null) {
                return value;
            }

            // 3. Properties file
            value = parse(PROPERTIES_FILE + ":" + sysProp, fileProperties.getProperty(sysProp), parser);
            if (value != null) {
                return value;
            }

            // 4. Default
            return defaultValue;
        }

        private static <T> T parse(String source, String raw, Function<String, T> parser) {
            if (raw == null || raw.isBlank()) {
                return null;
            }
            try {
                return parser.apply(raw.trim());
            } catch (RuntimeException e) {
                LOG.warn("Ignoring invalid value '{}' from {}: {}", raw, source, e.getMessage());
                return null;
            }
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = VectorConfig.class.getClassLoader().getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException e) {
                LOG.warn("Could not read {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
            }

            // Try working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException e) {
                    LOG.warn("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
                }
            }

            return props;
        }
    }
}
