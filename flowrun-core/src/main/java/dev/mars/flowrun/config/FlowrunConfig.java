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

package dev.mars.flowrun.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Centralized configuration loader for Flowrun.
 *
 * <p>Loads configuration from {@code flowrun.properties} with environment variable and system
 * property override support. Instances built with {@link #fromProperties(Properties)} read only
 * the given properties, which keeps tests independent of the environment.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 */
public final class FlowrunConfig {

    private static final Logger logger = LoggerFactory.getLogger(FlowrunConfig.class);
    private static final String CONFIG_FILE = "flowrun.properties";

    public static final String STORAGE_DIRECTORY = "flowrun.storage.directory";
    public static final String ENTRY_NODE_TYPES = "flowrun.workflow.entry-node-types";
    public static final String CREDENTIALS_OVERWRITE_DATA = "flowrun.credentials.overwrite-data";
    public static final String HOOK_CLASSES = "flowrun.hooks.classes";
    public static final String TYPES_RESOURCE = "flowrun.types.resource";
    public static final String ENGINE_THREADS = "flowrun.engine.threads";
    public static final String INIT_THREADS = "flowrun.init.threads";
    public static final String EXIT_CODES = "flowrun.cli.exit-codes";

    public static final String DEFAULT_ENTRY_NODE_TYPE = "n8n-nodes-base.start";

    private final Properties properties;
    private final boolean layered;

    private FlowrunConfig(Properties properties, boolean layered) {
        this.properties = properties;
        this.layered = layered;
    }

    /**
     * Loads the configuration from the classpath file, system properties and the environment.
     */
    public static FlowrunConfig load() {
        Properties properties = new Properties();
        try (InputStream input = FlowrunConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.debug("Loaded configuration from {}", CONFIG_FILE);
            } else {
                logger.debug("Configuration file {} not found, using defaults and environment variables", CONFIG_FILE);
            }
        } catch (IOException e) {
            logger.error("Error loading configuration file: {}", e.getMessage());
            logger.debug("Stack trace", e);
        }
        return new FlowrunConfig(properties, true);
    }

    public static FlowrunConfig fromProperties(Properties properties) {
        Properties copy = new Properties();
        if (properties != null) {
            copy.putAll(properties);
        }
        return new FlowrunConfig(copy, false);
    }

    // ==================== Storage ====================

    public Path getStorageDirectory() {
        String defaultDirectory = Paths.get(System.getProperty("user.home"), ".flowrun", "workflows").toString();
        return Paths.get(getString(STORAGE_DIRECTORY, defaultDirectory));
    }

    // ==================== Workflow ====================

    public List<String> getEntryNodeTypes() {
        return splitList(getString(ENTRY_NODE_TYPES, DEFAULT_ENTRY_NODE_TYPE));
    }

    // ==================== Credentials and Hooks ====================

    /**
     * JSON object mapping credential type to the values that overwrite empty credential fields.
     */
    public String getCredentialsOverwriteData() {
        return getString(CREDENTIALS_OVERWRITE_DATA, "");
    }

    public List<String> getHookClasses() {
        return splitList(getString(HOOK_CLASSES, ""));
    }

    public String getTypesResource() {
        return getString(TYPES_RESOURCE, "flowrun-types.json");
    }

    // ==================== Threads ====================

    public int getEngineThreads() {
        return getInt(ENGINE_THREADS, 2);
    }

    public int getInitThreads() {
        return getInt(INIT_THREADS, 4);
    }

    // ==================== CLI ====================

    public ExitCodePolicy getExitCodePolicy() {
        return ExitCodePolicy.fromString(getString(EXIT_CODES, "strict"));
    }

    // ==================== Core Property Accessors ====================

    /**
     * Gets a string property with layered resolution.
     *
     * <p>Resolution order (highest to lowest priority):
     * <ol>
     *   <li>Environment variable (e.g., FLOWRUN_STORAGE_DIRECTORY)</li>
     *   <li>System property (e.g., -Dflowrun.storage.directory=...)</li>
     *   <li>Properties file (flowrun.properties)</li>
     *   <li>Default value</li>
     * </ol>
     * Only the properties file and the default apply to instances created from explicit properties.
     */
    public String getString(String key, String defaultValue) {
        if (layered) {
            String envKey = key.toUpperCase().replace('.', '_').replace('-', '_');
            String envValue = System.getenv(envKey);
            if (envValue != null && !envValue.isEmpty()) {
                return envValue;
            }

            String sysProp = System.getProperty(key);
            if (sysProp != null && !sysProp.isEmpty()) {
                return sysProp;
            }
        }

        return properties.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    /**
     * Validates that configuration values are sensible. Called at startup to fail fast on
     * misconfiguration.
     *
     * @throws IllegalStateException if a value is invalid
     */
    public void validate() {
        if (getEngineThreads() <= 0) {
            throw new IllegalStateException("Engine threads must be positive, got: " + getEngineThreads());
        }
        if (getInitThreads() <= 0) {
            throw new IllegalStateException("Init threads must be positive, got: " + getInitThreads());
        }
        if (getEntryNodeTypes().isEmpty()) {
            throw new IllegalStateException("At least one entry node type must be configured (" + ENTRY_NODE_TYPES + ")");
        }
        Objects.requireNonNull(getExitCodePolicy());

        logger.debug("Flowrun configuration validated successfully");
    }

    private static List<String> splitList(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableList());
    }

    @Override
    public String toString() {
        return "FlowrunConfig{" +
               "storageDirectory=" + getStorageDirectory() +
               ", entryNodeTypes=" + getEntryNodeTypes() +
               ", hookClasses=" + getHookClasses() +
               ", engineThreads=" + getEngineThreads() +
               ", exitCodes=" + getString(EXIT_CODES, "strict") +
               '}';
    }
}
