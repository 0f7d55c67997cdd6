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

package dev.mars.pimflow.config;

import dev.mars.pimflow.core.Role;
import dev.mars.pimflow.core.RoleCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Configuration management for Pimflow.
 * <p>
 * Values are layered: built-in defaults, then the first {@code pimflow.properties}
 * found on disk or the classpath, then {@code pimflow.*} system properties.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-04
 * @version 1.0
 */
public class PimflowConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(PimflowConfiguration.class);

    public static final String ROLES = "pimflow.roles";
    public static final String BUILTIN_WORKFLOWS = "pimflow.workflow.builtin";
    public static final String DEFINITIONS_DIR = "pimflow.workflow.definitions.dir";
    public static final String STORE_TYPE = "pimflow.store.type";
    public static final String STORE_DIR = "pimflow.store.dir";
    public static final String TASK_TIMEOUT_MS = "pimflow.task.timeout.ms";
    public static final String TASK_SWEEP_INTERVAL_MS = "pimflow.task.sweep.interval.ms";
    public static final String NOTIFICATION_ASYNC = "pimflow.notification.async";
    public static final String NOTIFICATION_THREADS = "pimflow.notification.threads";
    public static final String METRICS_ENABLED = "pimflow.metrics.enabled";

    private static final String DEFAULT_ROLES = "DataSteward,Marketing,Admin,ComplianceOfficer";
    private static final String DEFAULT_BUILTIN_WORKFLOWS =
            "workflows/import-review.yaml,workflows/asset-approval.yaml";
    private static final String DEFAULT_STORE_TYPE = "memory";
    private static final String DEFAULT_STORE_DIR =
            Paths.get(System.getProperty("java.io.tmpdir"), "pimflow").toString();
    private static final long DEFAULT_TASK_TIMEOUT_MS = 0;
    private static final long DEFAULT_TASK_SWEEP_INTERVAL_MS = 60_000;
    private static final int DEFAULT_NOTIFICATION_THREADS = 2;

    private final Properties properties;

    public PimflowConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public PimflowConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Roles
    public RoleCatalog getRoleCatalog() {
        List<Role> roles = getListProperty(ROLES).stream()
                .map(Role::of)
                .collect(Collectors.toList());
        if (roles.isEmpty()) {
            logger.warn("No roles configured in {}. Using defaults", ROLES);
            return RoleCatalog.defaults();
        }
        return new RoleCatalog(roles);
    }

    // Workflow definitions
    public List<String> getBuiltinWorkflows() {
        return getListProperty(BUILTIN_WORKFLOWS);
    }

    public Path getDefinitionsDirectory() {
        String dir = properties.getProperty(DEFINITIONS_DIR);
        return dir == null || dir.trim().isEmpty() ? null : Paths.get(dir.trim());
    }

    // Storage
    public String getStoreType() {
        return getStringProperty(STORE_TYPE, DEFAULT_STORE_TYPE).trim().toLowerCase();
    }

    public Path getStoreDirectory() {
        return Paths.get(getStringProperty(STORE_DIR, DEFAULT_STORE_DIR).trim());
    }

    // Tasks
    public long getTaskTimeoutMs() {
        return getLongProperty(TASK_TIMEOUT_MS, DEFAULT_TASK_TIMEOUT_MS);
    }

    public long getTaskSweepIntervalMs() {
        return getLongProperty(TASK_SWEEP_INTERVAL_MS, DEFAULT_TASK_SWEEP_INTERVAL_MS);
    }

    // Notification
    public boolean isNotificationAsync() {
        return getBooleanProperty(NOTIFICATION_ASYNC, true);
    }

    public int getNotificationThreads() {
        return Math.max(1, getIntProperty(NOTIFICATION_THREADS, DEFAULT_NOTIFICATION_THREADS));
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

    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private List<String> getListProperty(String key) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return List.of();
        }
        List<String> items = new ArrayList<>();
        Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(item -> !item.isEmpty())
                .forEach(items::add);
        return List.copyOf(items);
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

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid long value for property {}: {}. Using default: {}",
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
        properties.setProperty(ROLES, DEFAULT_ROLES);
        properties.setProperty(BUILTIN_WORKFLOWS, DEFAULT_BUILTIN_WORKFLOWS);
        properties.setProperty(STORE_TYPE, DEFAULT_STORE_TYPE);
        properties.setProperty(STORE_DIR, DEFAULT_STORE_DIR);
        properties.setProperty(TASK_TIMEOUT_MS, String.valueOf(DEFAULT_TASK_TIMEOUT_MS));
        properties.setProperty(TASK_SWEEP_INTERVAL_MS, String.valueOf(DEFAULT_TASK_SWEEP_INTERVAL_MS));
        properties.setProperty(NOTIFICATION_ASYNC, "true");
        properties.setProperty(NOTIFICATION_THREADS, String.valueOf(DEFAULT_NOTIFICATION_THREADS));
        properties.setProperty(METRICS_ENABLED, "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "pimflow.properties",
                "config/pimflow.properties",
                System.getProperty("user.home") + "/.pimflow/pimflow.properties",
                "/etc/pimflow/pimflow.properties"
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

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("pimflow.properties")) {
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
                .filter(entry -> entry.getKey().toString().startsWith("pimflow."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "PimflowConfiguration{" +
                "storeType='" + getStoreType() + '\'' +
                ", roles=" + getListProperty(ROLES) +
                ", taskTimeoutMs=" + getTaskTimeoutMs() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
