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

package dev.mars.stratus.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration management for Stratus.
 * Layers built-in defaults, the first readable {@code stratus.properties} and
 * {@code stratus.*} system properties, in that order.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class StratusConfiguration {
    private static final Logger logger = Logger.getLogger(StratusConfiguration.class.getName());

    public static final String MAX_CONCURRENCY = "stratus.workflow.max.concurrency";
    public static final String WORKFLOW_TIMEOUT_MS = "stratus.workflow.timeout.ms";
    public static final String CHECKPOINT_DIR = "stratus.checkpoint.dir";
    public static final String RETRY_MAX_ATTEMPTS = "stratus.retry.max.attempts";
    public static final String RETRY_DELAY_MS = "stratus.retry.delay.ms";
    public static final String RETRY_MAX_DELAY_MS = "stratus.retry.max.delay.ms";
    public static final String INTERVENTION_MAX = "stratus.intervention.max";
    public static final String INTERVENTION_TIMEOUT_MS = "stratus.intervention.timeout.ms";
    public static final String ROLLBACK_MAX_ATTEMPTS = "stratus.rollback.max.attempts";
    public static final String METRICS_ENABLED = "stratus.monitoring.metrics.enabled";

    // Default configuration values
    private static final int DEFAULT_MAX_CONCURRENCY = 4;
    private static final long DEFAULT_WORKFLOW_TIMEOUT_MS = 0;
    private static final String DEFAULT_CHECKPOINT_DIR = ".stratus/checkpoints";
    private static final int DEFAULT_RETRY_MAX_ATTEMPTS = 1;
    private static final long DEFAULT_RETRY_DELAY_MS = 1000;
    private static final long DEFAULT_RETRY_MAX_DELAY_MS = 30000;
    private static final int DEFAULT_INTERVENTION_MAX = 3;
    private static final long DEFAULT_INTERVENTION_TIMEOUT_MS = 300000; // 5 minutes
    private static final int DEFAULT_ROLLBACK_MAX_ATTEMPTS = 1;

    private final Properties properties;

    public StratusConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public StratusConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Workflow Configuration
    public int getMaxConcurrency() {
        int value = getIntProperty(MAX_CONCURRENCY, DEFAULT_MAX_CONCURRENCY);
        if (value < 1) {
            logger.warning("Property " + MAX_CONCURRENCY + " must be at least 1, was " + value +
                         ". Using default: " + DEFAULT_MAX_CONCURRENCY);
            return DEFAULT_MAX_CONCURRENCY;
        }
        return value;
    }

    public long getWorkflowTimeoutMs() {
        return getLongProperty(WORKFLOW_TIMEOUT_MS, DEFAULT_WORKFLOW_TIMEOUT_MS);
    }

    public Path getCheckpointDirectory() {
        return Paths.get(getStringProperty(CHECKPOINT_DIR, DEFAULT_CHECKPOINT_DIR));
    }

    // Retry Configuration
    public int getRetryMaxAttempts() {
        return Math.max(1, getIntProperty(RETRY_MAX_ATTEMPTS, DEFAULT_RETRY_MAX_ATTEMPTS));
    }

    public long getRetryDelayMs() {
        return getLongProperty(RETRY_DELAY_MS, DEFAULT_RETRY_DELAY_MS);
    }

    public long getRetryMaxDelayMs() {
        return getLongProperty(RETRY_MAX_DELAY_MS, DEFAULT_RETRY_MAX_DELAY_MS);
    }

    // Intervention Configuration
    public int getMaxManualInterventions() {
        return getIntProperty(INTERVENTION_MAX, DEFAULT_INTERVENTION_MAX);
    }

    public long getInterventionTimeoutMs() {
        return getLongProperty(INTERVENTION_TIMEOUT_MS, DEFAULT_INTERVENTION_TIMEOUT_MS);
    }

    // Rollback Configuration
    public int getRollbackMaxAttempts() {
        return Math.max(1, getIntProperty(ROLLBACK_MAX_ATTEMPTS, DEFAULT_ROLLBACK_MAX_ATTEMPTS));
    }

    // Monitoring Configuration
    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED, true);
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    // Utility methods for type conversion
    private String getStringProperty(String key, String defaultValue) {
        String value = properties.getProperty(key);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid integer value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid long value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(MAX_CONCURRENCY, String.valueOf(DEFAULT_MAX_CONCURRENCY));
        properties.setProperty(WORKFLOW_TIMEOUT_MS, String.valueOf(DEFAULT_WORKFLOW_TIMEOUT_MS));
        properties.setProperty(CHECKPOINT_DIR, DEFAULT_CHECKPOINT_DIR);
        properties.setProperty(RETRY_MAX_ATTEMPTS, String.valueOf(DEFAULT_RETRY_MAX_ATTEMPTS));
        properties.setProperty(RETRY_DELAY_MS, String.valueOf(DEFAULT_RETRY_DELAY_MS));
        properties.setProperty(RETRY_MAX_DELAY_MS, String.valueOf(DEFAULT_RETRY_MAX_DELAY_MS));
        properties.setProperty(INTERVENTION_MAX, String.valueOf(DEFAULT_INTERVENTION_MAX));
        properties.setProperty(INTERVENTION_TIMEOUT_MS, String.valueOf(DEFAULT_INTERVENTION_TIMEOUT_MS));
        properties.setProperty(ROLLBACK_MAX_ATTEMPTS, String.valueOf(DEFAULT_ROLLBACK_MAX_ATTEMPTS));
        properties.setProperty(METRICS_ENABLED, "true");
    }

    private void loadConfigurationFromFile() {
        // Try to load from various locations
        String[] configFiles = {
                "stratus.properties",
                "config/stratus.properties",
                System.getProperty("user.home") + "/.stratus/stratus.properties",
                "/etc/stratus/stratus.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: " + configPath);
                    return;
                } catch (IOException e) {
                    logger.warning("Failed to load configuration from " + configPath + ": " + e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("stratus.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warning("Failed to load configuration from classpath: " + e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("stratus."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.fine("Override from system property: " + entry.getKey() + "=" + entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "StratusConfiguration{" +
                "maxConcurrency=" + getMaxConcurrency() +
                ", checkpointDirectory='" + getCheckpointDirectory() + '\'' +
                ", retryMaxAttempts=" + getRetryMaxAttempts() +
                ", maxManualInterventions=" + getMaxManualInterventions() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
