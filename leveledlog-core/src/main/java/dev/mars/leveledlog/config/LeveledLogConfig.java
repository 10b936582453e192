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
package dev.mars.leveledlog.config;

import dev.mars.leveledlog.core.Level;
import dev.mars.leveledlog.core.LineFormatter;
import dev.mars.leveledlog.logger.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Library-wide logging settings.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dleveledlog.defaultLevel=INFO})</li>
 *   <li>Environment variables (e.g., {@code LEVELEDLOG_DEFAULT_LEVEL})</li>
 *   <li>Properties file ({@code leveledlog.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>defaultLevel</td><td>leveledlog.defaultLevel</td><td>LEVELEDLOG_DEFAULT_LEVEL</td><td>DEBUG</td></tr>
 *   <tr><td>asyncByDefault</td><td>leveledlog.asyncByDefault</td><td>LEVELEDLOG_ASYNC_BY_DEFAULT</td><td>true</td></tr>
 *   <tr><td>httpTimeoutSeconds</td><td>leveledlog.httpTimeoutSeconds</td><td>LEVELEDLOG_HTTP_TIMEOUT_SECONDS</td><td>2</td></tr>
 *   <tr><td>filePermissions</td><td>leveledlog.filePermissions</td><td>LEVELEDLOG_FILE_PERMISSIONS</td><td>rw-rw-rw-</td></tr>
 *   <tr><td>color</td><td>leveledlog.color</td><td>LEVELEDLOG_COLOR</td><td>false</td></tr>
 * </table>
 * Module thresholds are read from keys {@code leveledlog.level.<module>} in system
 * properties and the properties file; system properties win.
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # leveledlog.properties
 * leveledlog.defaultLevel=INFO
 * leveledlog.asyncByDefault=true
 * leveledlog.level.svc.api=WARNING
 * leveledlog.level.svc.db=D
 * </pre>
 */
public final class LeveledLogConfig {

    private static final Logger LOG = LoggerFactory.getLogger(LeveledLogConfig.class);

    private static final String PROPERTIES_FILE = "leveledlog.properties";

    // Property keys
    private static final String PROP_DEFAULT_LEVEL = "leveledlog.defaultLevel";
    private static final String PROP_ASYNC_BY_DEFAULT = "leveledlog.asyncByDefault";
    private static final String PROP_HTTP_TIMEOUT_SECONDS = "leveledlog.httpTimeoutSeconds";
    private static final String PROP_FILE_PERMISSIONS = "leveledlog.filePermissions";
    private static final String PROP_COLOR = "leveledlog.color";
    private static final String PROP_MODULE_LEVEL_PREFIX = "leveledlog.level.";

    // Environment variable keys
    private static final String ENV_DEFAULT_LEVEL = "LEVELEDLOG_DEFAULT_LEVEL";
    private static final String ENV_ASYNC_BY_DEFAULT = "LEVELEDLOG_ASYNC_BY_DEFAULT";
    private static final String ENV_HTTP_TIMEOUT_SECONDS = "LEVELEDLOG_HTTP_TIMEOUT_SECONDS";
    private static final String ENV_FILE_PERMISSIONS = "LEVELEDLOG_FILE_PERMISSIONS";
    private static final String ENV_COLOR = "LEVELEDLOG_COLOR";

    // Defaults
    private static final Level DEFAULT_LEVEL = Level.DEBUG;
    private static final boolean DEFAULT_ASYNC_BY_DEFAULT = true;
    private static final int DEFAULT_HTTP_TIMEOUT_SECONDS = 2;
    private static final String DEFAULT_FILE_PERMISSIONS = "rw-rw-rw-";
    private static final boolean DEFAULT_COLOR = false;

    private final Level defaultLevel;
    private final boolean asyncByDefault;
    private final int httpTimeoutSeconds;
    private final String filePermissions;
    private final boolean color;
    private final Map<String, Level> moduleLevels;

    private LeveledLogConfig(Builder builder) {
        this.defaultLevel = builder.defaultLevel;
        this.asyncByDefault = builder.asyncByDefault;
        this.httpTimeoutSeconds = builder.httpTimeoutSeconds;
        this.filePermissions = builder.filePermissions;
        this.color = builder.color;
        this.moduleLevels = Collections.unmodifiableMap(new LinkedHashMap<>(builder.moduleLevels));
    }

    /** Threshold of the {@code ""} entry. */
    public Level defaultLevel() {
        return defaultLevel;
    }

    /** Whether configured sinks deliver in the background unless their options say otherwise. */
    public boolean asyncByDefault() {
        return asyncByDefault;
    }

    /** Per-request timeout of HTTP sinks whose options set none. */
    public int httpTimeoutSeconds() {
        return httpTimeoutSeconds;
    }

    /** POSIX permissions of newly created log files whose options set none. */
    public String filePermissions() {
        return filePermissions;
    }

    /** Whether the default formatter colors lines. */
    public boolean color() {
        return color;
    }

    /** Thresholds by module name. */
    public Map<String, Level> moduleLevels() {
        return moduleLevels;
    }

    /**
     * Returns a context builder carrying this configuration's levels and formatter.
     */
    public LoggingContext.Builder contextBuilder() {
        LoggingContext.Builder builder = LoggingContext.builder()
                .defaultLevel(defaultLevel)
                .formatter(LineFormatter.builder().color(color).build());
        moduleLevels.forEach(builder::moduleLevel);
        return builder;
    }

    @Override
    public String toString() {
        return "LeveledLogConfig{" +
                "defaultLevel=" + defaultLevel +
                ", asyncByDefault=" + asyncByDefault +
                ", httpTimeoutSeconds=" + httpTimeoutSeconds +
                ", filePermissions=" + filePermissions +
                ", color=" + color +
                ", moduleLevels=" + moduleLevels +
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
     * Shorthand for {@code LeveledLogConfig.builder().build()}.
     */
    public static LeveledLogConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link LeveledLogConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Level defaultLevel;
        private Boolean asyncByDefault;
        private Integer httpTimeoutSeconds;
        private String filePermissions;
        private Boolean color;
        private final Map<String, Level> moduleLevels = new LinkedHashMap<>();

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        /** Sets the default threshold. */
        public Builder defaultLevel(Level defaultLevel) {
            this.defaultLevel = defaultLevel;
            return this;
        }

        /** Sets whether configured sinks are async unless told otherwise (default: true). */
        public Builder asyncByDefault(boolean asyncByDefault) {
            this.asyncByDefault = asyncByDefault;
            return this;
        }

        /** Sets the default HTTP timeout in seconds (default: 2). */
        public Builder httpTimeoutSeconds(int httpTimeoutSeconds) {
            this.httpTimeoutSeconds = httpTimeoutSeconds;
            return this;
        }

        /** Sets default POSIX permissions for new log files (default: rw-rw-rw-). */
        public Builder filePermissions(String filePermissions) {
            this.filePermissions = filePermissions;
            return this;
        }

        /** Enables or disables ANSI colors in the default formatter (default: false). */
        public Builder color(boolean color) {
            this.color = color;
            return this;
        }

        /** Sets the threshold for one module; overrides resolved values for it. */
        public Builder moduleLevel(String module, Level level) {
            this.moduleLevels.put(module, level);
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         */
        public LeveledLogConfig build() {
            if (defaultLevel == null) {
                defaultLevel = resolveLevel(PROP_DEFAULT_LEVEL, ENV_DEFAULT_LEVEL, DEFAULT_LEVEL);
            }
            if (asyncByDefault == null) {
                asyncByDefault = resolveBoolean(PROP_ASYNC_BY_DEFAULT, ENV_ASYNC_BY_DEFAULT, DEFAULT_ASYNC_BY_DEFAULT);
            }
            if (httpTimeoutSeconds == null) {
                httpTimeoutSeconds = resolveInt(PROP_HTTP_TIMEOUT_SECONDS, ENV_HTTP_TIMEOUT_SECONDS, DEFAULT_HTTP_TIMEOUT_SECONDS);
            }
            if (filePermissions == null) {
                filePermissions = resolveString(PROP_FILE_PERMISSIONS, ENV_FILE_PERMISSIONS, DEFAULT_FILE_PERMISSIONS);
            }
            if (color == null) {
                color = resolveBoolean(PROP_COLOR, ENV_COLOR, DEFAULT_COLOR);
            }
            resolveModuleLevels();

            return new LeveledLogConfig(this);
        }

        /**
         * File entries first, then system properties, then programmatic values on top.
         */
        private void resolveModuleLevels() {
            Map<String, Level> resolved = new LinkedHashMap<>();
            collectModuleLevels(fileProperties, resolved);
            collectModuleLevels(System.getProperties(), resolved);
            resolved.putAll(moduleLevels);
            moduleLevels.clear();
            moduleLevels.putAll(resolved);
        }

        private static void collectModuleLevels(Properties props, Map<String, Level> into) {
            for (String key : props.stringPropertyNames()) {
                if (!key.startsWith(PROP_MODULE_LEVEL_PREFIX)) {
                    continue;
                }
                String module = key.substring(PROP_MODULE_LEVEL_PREFIX.length());
                String value = props.getProperty(key);
                LevelNames.lookup(value).ifPresentOrElse(
                        level -> into.put(module, level),
                        () -> LOG.warn("Ignoring unknown level '{}' for module '{}'", value, module));
            }
        }

        private String resolveRaw(String sysProp, String envVar) {
            // 1. System property
            String value = System.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value;
            }

            // 2. Environment variable
            value = System.getenv(envVar);
            if (value != null && !value.isBlank()) {
                return value;
            }

            // 3. Properties file
            value = fileProperties.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value;
            }
            return null;
        }

        private String resolveString(String sysProp, String envVar, String defaultValue) {
            String value = resolveRaw(sysProp, envVar);
            return value != null ? value.strip() : defaultValue;
        }

        private Level resolveLevel(String sysProp, String envVar, Level defaultValue) {
            String value = resolveRaw(sysProp, envVar);
            if (value == null) {
                return defaultValue;
            }
            return LevelNames.lookup(value).orElseGet(() -> {
                LOG.warn("Unknown level '{}' for {}, using {}", value, sysProp, defaultValue);
                return defaultValue;
            });
        }

        private boolean resolveBoolean(String sysProp, String envVar, boolean defaultValue) {
            String value = resolveRaw(sysProp, envVar);
            return value != null ? Boolean.parseBoolean(value.strip()) : defaultValue;
        }

        private int resolveInt(String sysProp, String envVar, int defaultValue) {
            String value = resolveRaw(sysProp, envVar);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value.strip());
            } catch (NumberFormatException e) {
                LOG.warn("Invalid integer '{}' for {}, using {}", value, sysProp, defaultValue);
                return defaultValue;
            }
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = LeveledLogConfig.class.getClassLoader()
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
