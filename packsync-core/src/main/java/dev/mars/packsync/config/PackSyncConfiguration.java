package dev.mars.packsync.config;

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

import dev.mars.packsync.transfer.chain.CleanupPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Properties;

/**
 * Configuration for the PackSync transfer engine.
 *
 * <p>Values are layered: built-in defaults, then the first readable {@code packsync.properties}
 * (working directory, {@code config/}, {@code ~/.packsync/}, {@code /etc/packsync/}, then the
 * classpath), then {@code packsync.*} system properties.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-03
 * @version 1.0
 */
public class PackSyncConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(PackSyncConfiguration.class);

    public static final String RATE_WINDOW_SIZE = "packsync.rate.window.size";
    public static final String RATE_SMOOTHING_ALPHA = "packsync.rate.smoothing.alpha";
    public static final String CHAIN_CLEANUP_POLICY = "packsync.chain.cleanup.policy";
    public static final String METRICS_ENABLED = "packsync.monitoring.metrics.enabled";

    private static final int DEFAULT_RATE_WINDOW_SIZE = 5;
    private static final double DEFAULT_RATE_SMOOTHING_ALPHA = 0.3;
    private static final CleanupPolicy DEFAULT_CLEANUP_POLICY = CleanupPolicy.REQUIRE_SUCCESS;

    private final Properties properties;

    public PackSyncConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public PackSyncConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    /**
     * Built-in defaults only; no file or system property lookup.
     */
    public static PackSyncConfiguration defaults() {
        return new PackSyncConfiguration(null);
    }

    // Rate estimation

    public int getRateWindowSize() {
        int size = getIntProperty(RATE_WINDOW_SIZE, DEFAULT_RATE_WINDOW_SIZE);
        if (size < 2) {
            logger.warn("Rate window size {} is below the minimum of 2. Using default: {}",
                    size, DEFAULT_RATE_WINDOW_SIZE);
            return DEFAULT_RATE_WINDOW_SIZE;
        }
        return size;
    }

    public double getRateSmoothingAlpha() {
        double alpha = getDoubleProperty(RATE_SMOOTHING_ALPHA, DEFAULT_RATE_SMOOTHING_ALPHA);
        if (alpha <= 0.0 || alpha > 1.0) {
            logger.warn("Smoothing alpha {} is outside (0, 1]. Using default: {}",
                    alpha, DEFAULT_RATE_SMOOTHING_ALPHA);
            return DEFAULT_RATE_SMOOTHING_ALPHA;
        }
        return alpha;
    }

    // Phase chain

    public CleanupPolicy getCleanupPolicy() {
        String value = properties.getProperty(CHAIN_CLEANUP_POLICY);
        if (value != null) {
            try {
                return CleanupPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                logger.warn("Invalid cleanup policy for property {}: {}. Using default: {}",
                        CHAIN_CLEANUP_POLICY, value, DEFAULT_CLEANUP_POLICY);
            }
        }
        return DEFAULT_CLEANUP_POLICY;
    }

    // Monitoring

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

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}",
                        key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private double getDoubleProperty(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid decimal value for property {}: {}. Using default: {}",
                        key, value, defaultValue);
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
        properties.setProperty(RATE_WINDOW_SIZE, String.valueOf(DEFAULT_RATE_WINDOW_SIZE));
        properties.setProperty(RATE_SMOOTHING_ALPHA, String.valueOf(DEFAULT_RATE_SMOOTHING_ALPHA));
        properties.setProperty(CHAIN_CLEANUP_POLICY, DEFAULT_CLEANUP_POLICY.name());
        properties.setProperty(METRICS_ENABLED, "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "packsync.properties",
                "config/packsync.properties",
                System.getProperty("user.home") + "/.packsync/packsync.properties",
                "/etc/packsync/packsync.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                    return;
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("packsync.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("packsync."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "PackSyncConfiguration{" +
                "rateWindowSize=" + getRateWindowSize() +
                ", rateSmoothingAlpha=" + getRateSmoothingAlpha() +
                ", cleanupPolicy=" + getCleanupPolicy() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
