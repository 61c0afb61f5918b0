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
package dev.mars.fspec.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Configuration for the locked file manager.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dfspec.lock.staleMs=20000})</li>
 *   <li>Environment variables (e.g., {@code FSPEC_LOCK_STALE_MS})</li>
 *   <li>Properties file ({@code fspec-lock.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>staleMs</td><td>fspec.lock.staleMs</td><td>FSPEC_LOCK_STALE_MS</td><td>10000</td></tr>
 *   <tr><td>retries</td><td>fspec.lock.retries</td><td>FSPEC_LOCK_RETRIES</td><td>10</td></tr>
 *   <tr><td>minRetryMs</td><td>fspec.lock.minRetryMs</td><td>FSPEC_LOCK_MIN_RETRY_MS</td><td>50</td></tr>
 *   <tr><td>maxRetryMs</td><td>fspec.lock.maxRetryMs</td><td>FSPEC_LOCK_MAX_RETRY_MS</td><td>500</td></tr>
 *   <tr><td>retryFactor</td><td>fspec.lock.retryFactor</td><td>FSPEC_LOCK_RETRY_FACTOR</td><td>2.0</td></tr>
 *   <tr><td>syncEnabled</td><td>fspec.lock.syncEnabled</td><td>FSPEC_LOCK_SYNC_ENABLED</td><td>false</td></tr>
 *   <tr><td>debugLocks</td><td>fspec.debugLocks</td><td>FSPEC_DEBUG_LOCKS</td><td>false</td></tr>
 *   <tr><td>workerThreads</td><td>fspec.lock.workerThreads</td><td>FSPEC_LOCK_WORKER_THREADS</td><td>4</td></tr>
 * </table>
 * <p>
 * {@code FSPEC_DEBUG_LOCKS} enables lock metrics when set to any non-empty value.
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # fspec-lock.properties
 * fspec.lock.staleMs=10000
 * fspec.lock.retries=10
 * fspec.lock.minRetryMs=50
 * fspec.lock.maxRetryMs=500
 * fspec.debugLocks=true
 * </pre>
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * LockConfig config = LockConfig.builder()
 *     .staleMs(5_000)
 *     .retries(20)
 *     .debugLocks(true)
 *     .build();
 *
 * LockedFileManager files = new JsonLockedFileManager(config);
 * </pre>
 */
public final class LockConfig {

    private static final Logger LOG = LoggerFactory.getLogger(LockConfig.class);

    private static final String PROPERTIES_FILE = "fspec-lock.properties";

    // Property keys
    private static final String PROP_STALE_MS = "fspec.lock.staleMs";
    private static final String PROP_RETRIES = "fspec.lock.retries";
    private static final String PROP_MIN_RETRY_MS = "fspec.lock.minRetryMs";
    private static final String PROP_MAX_RETRY_MS = "fspec.lock.maxRetryMs";
    private static final String PROP_RETRY_FACTOR = "fspec.lock.retryFactor";
    private static final String PROP_SYNC_ENABLED = "fspec.lock.syncEnabled";
    private static final String PROP_DEBUG_LOCKS = "fspec.debugLocks";
    private static final String PROP_WORKER_THREADS = "fspec.lock.workerThreads";

    // Environment variable keys
    private static final String ENV_STALE_MS = "FSPEC_LOCK_STALE_MS";
    private static final String ENV_RETRIES = "FSPEC_LOCK_RETRIES";
    private static final String ENV_MIN_RETRY_MS = "FSPEC_LOCK_MIN_RETRY_MS";
    private static final String ENV_MAX_RETRY_MS = "FSPEC_LOCK_MAX_RETRY_MS";
    private static final String ENV_RETRY_FACTOR = "FSPEC_LOCK_RETRY_FACTOR";
    private static final String ENV_SYNC_ENABLED = "FSPEC_LOCK_SYNC_ENABLED";
    private static final String ENV_DEBUG_LOCKS = "FSPEC_DEBUG_LOCKS";
    private static final String ENV_WORKER_THREADS = "FSPEC_LOCK_WORKER_THREADS";

    // Defaults
    private static final long DEFAULT_STALE_MS = 10_000;
    private static final int DEFAULT_RETRIES = 10;
    private static final long DEFAULT_MIN_RETRY_MS = 50;
    private static final long DEFAULT_MAX_RETRY_MS = 500;
    private static final double DEFAULT_RETRY_FACTOR = 2.0;
    private static final boolean DEFAULT_SYNC_ENABLED = false;
    private static final boolean DEFAULT_DEBUG_LOCKS = false;
    private static final int DEFAULT_WORKER_THREADS = 4;

    private final long staleMs;
    private final int retries;
    private final long minRetryMs;
    private final long maxRetryMs;
    private final double retryFactor;
    private final boolean syncEnabled;
    private final boolean debugLocks;
    private final int workerThreads;

    private LockConfig(Builder builder) {
        this.staleMs = builder.staleMs;
        this.retries = builder.retries;
        this.minRetryMs = builder.minRetryMs;
        this.maxRetryMs = builder.maxRetryMs;
        this.retryFactor = builder.retryFactor;
        this.syncEnabled = builder.syncEnabled;
        this.debugLocks = builder.debugLocks;
        this.workerThreads = builder.workerThreads;
    }

    /** Age in milliseconds after which an unrefreshed lock file is considered abandoned. */
    public long staleMs() {
        return staleMs;
    }

    /** Number of retries after the first failed acquisition attempt. */
    public int retries() {
        return retries;
    }

    /** Backoff before the first retry. */
    public long minRetryMs() {
        return minRetryMs;
    }

    /** Upper bound for a single backoff sleep. */
    public long maxRetryMs() {
        return maxRetryMs;
    }

    /** Multiplier applied to the backoff after every failed attempt. */
    public double retryFactor() {
        return retryFactor;
    }

    /** Whether written files and their directory are fsynced before returning. */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** Whether lock metrics are logged at DEBUG. */
    public boolean debugLocks() {
        return debugLocks;
    }

    /** Size of the pool running asynchronous operations. */
    public int workerThreads() {
        return workerThreads;
    }

    /** Interval at which a held lock file's modification time is refreshed. */
    public long heartbeatMs() {
        return Math.max(1, staleMs / 2);
    }

    /**
     * Backoff before retry number {@code retry} (zero-based).
     */
    public long backoffMs(int retry) {
        double delay = minRetryMs * Math.pow(retryFactor, retry);
        return (long) Math.min(delay, maxRetryMs);
    }

    @Override
    public String toString() {
        return "LockConfig{" +
                "staleMs=" + staleMs +
                ", retries=" + retries +
                ", minRetryMs=" + minRetryMs +
                ", maxRetryMs=" + maxRetryMs +
                ", retryFactor=" + retryFactor +
                ", syncEnabled=" + syncEnabled +
                ", debugLocks=" + debugLocks +
                ", workerThreads=" + workerThreads +
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
     * Shorthand for {@code LockConfig.builder().build()}.
     */
    public static LockConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link LockConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Long staleMs;
        private Integer retries;
        private Long minRetryMs;
        private Long maxRetryMs;
        private Double retryFactor;
        private Boolean syncEnabled;
        private Boolean debugLocks;
        private Integer workerThreads;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        /** Sets the staleness threshold in milliseconds (default: 10000). */
        public Builder staleMs(long staleMs) {
            this.staleMs = staleMs;
            return this;
        }

        /** Sets the number of retries after the first attempt (default: 10). */
        public Builder retries(int retries) {
            this.retries = retries;
            return this;
        }

        /** Sets the first backoff in milliseconds (default: 50). */
        public Builder minRetryMs(long minRetryMs) {
            this.minRetryMs = minRetryMs;
            return this;
        }

        /** Sets the backoff ceiling in milliseconds (default: 500). */
        public Builder maxRetryMs(long maxRetryMs) {
            this.maxRetryMs = maxRetryMs;
            return this;
        }

        /** Sets the backoff multiplier (default: 2.0). */
        public Builder retryFactor(double retryFactor) {
            this.retryFactor = retryFactor;
            return this;
        }

        /** Enables or disables fsync of written files (default: false). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        /** Enables or disables lock metrics logging (default: false). */
        public Builder debugLocks(boolean debugLocks) {
            this.debugLocks = debugLocks;
            return this;
        }

        /** Sets the async worker pool size (default: 4). */
        public Builder workerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         *
         * @throws IllegalArgumentException if the resolved values are inconsistent
         */
        public LockConfig build() {
            if (staleMs == null) {
                staleMs = resolveLong(PROP_STALE_MS, ENV_STALE_MS, DEFAULT_STALE_MS);
            }
            if (retries == null) {
                retries = resolveInt(PROP_RETRIES, ENV_RETRIES, DEFAULT_RETRIES);
            }
            if (minRetryMs == null) {
                minRetryMs = resolveLong(PROP_MIN_RETRY_MS, ENV_MIN_RETRY_MS, DEFAULT_MIN_RETRY_MS);
            }
            if (maxRetryMs == null) {
                maxRetryMs = resolveLong(PROP_MAX_RETRY_MS, ENV_MAX_RETRY_MS, DEFAULT_MAX_RETRY_MS);
            }
            if (retryFactor == null) {
                retryFactor = resolveDouble(PROP_RETRY_FACTOR, ENV_RETRY_FACTOR, DEFAULT_RETRY_FACTOR);
            }
            if (syncEnabled == null) {
                syncEnabled = resolveBoolean(PROP_SYNC_ENABLED, ENV_SYNC_ENABLED, DEFAULT_SYNC_ENABLED);
            }
            if (debugLocks == null) {
                debugLocks = resolveDebugFlag();
            }
            if (workerThreads == null) {
                workerThreads = resolveInt(PROP_WORKER_THREADS, ENV_WORKER_THREADS, DEFAULT_WORKER_THREADS);
            }

            validate();
            return new LockConfig(this);
        }

        private void validate() {
            if (staleMs <= 0) {
                throw new IllegalArgumentException("staleMs must be positive: " + staleMs);
            }
            if (retries < 0) {
                throw new IllegalArgumentException("retries must not be negative: " + retries);
            }
            if (minRetryMs < 0 || maxRetryMs < minRetryMs) {
                throw new IllegalArgumentException(
                        "Invalid backoff range: minRetryMs=" + minRetryMs + ", maxRetryMs=" + maxRetryMs);
            }
            if (retryFactor < 1.0) {
                throw new IllegalArgumentException("retryFactor must be at least 1.0: " + retryFactor);
            }
            if (workerThreads < 1) {
                throw new IllegalArgumentException("workerThreads must be at least 1: " + workerThreads);
            }
        }

        private String lookup(String sysProp, String envVar) {
            // 1. System property
            String value = System.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }

            // 2. Environment variable
            value = System.getenv(envVar);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }

            // 3. Properties file
            value = fileProperties.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }

            return null;
        }

        private long resolveLong(String sysProp, String envVar, long defaultValue) {
            String value = lookup(sysProp, envVar);
            if (value != null) {
                try {
                    return Long.parseLong(value);
                } catch (NumberFormatException e) {
                    LOG.warn("Ignoring invalid value for {}: '{}', using default {}", sysProp, value, defaultValue);
                }
            }
            return defaultValue;
        }

        private int resolveInt(String sysProp, String envVar, int defaultValue) {
            String value = lookup(sysProp, envVar);
            if (value != null) {
                try {
                    return Integer.parseInt(value);
                } catch (NumberFormatException e) {
                    LOG.warn("Ignoring invalid value for {}: '{}', using default {}", sysProp, value, defaultValue);
                }
            }
            return defaultValue;
        }

        private double resolveDouble(String sysProp, String envVar, double defaultValue) {
            String value = lookup(sysProp, envVar);
            if (value != null) {
                try {
                    return Double.parseDouble(value);
                } catch (NumberFormatException e) {
                    LOG.warn("Ignoring invalid value for {}: '{}', using default {}", sysProp, value, defaultValue);
                }
            }
            return defaultValue;
        }

        private boolean resolveBoolean(String sysProp, String envVar, boolean defaultValue) {
            String value = lookup(sysProp, envVar);
            return value != null ? Boolean.parseBoolean(value) : defaultValue;
        }

        /**
         * The debug switch is an on/off environment flag: any non-empty
         * {@code FSPEC_DEBUG_LOCKS} turns it on. The system property and the
         * properties file take ordinary boolean values.
         */
        private boolean resolveDebugFlag() {
            String value = System.getProperty(PROP_DEBUG_LOCKS);
            if (value != null && !value.isBlank()) {
                return Boolean.parseBoolean(value.trim());
            }
            value = System.getenv(ENV_DEBUG_LOCKS);
            if (value != null && !value.isEmpty()) {
                return true;
            }
            value = fileProperties.getProperty(PROP_DEBUG_LOCKS);
            if (value != null && !value.isBlank()) {
                return Boolean.parseBoolean(value.trim());
            }
            return DEFAULT_DEBUG_LOCKS;
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = LockConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
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
