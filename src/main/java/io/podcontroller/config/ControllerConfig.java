package io.podcontroller.config;

import io.podcontroller.util.EnvironmentUtils;
import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.podcontroller.config.Constants.*;

/**
 * Configuration for the replication controller process.
 * Loads configuration from application.yml with fallbacks to constants.
 */
@Slf4j
@Getter
public class ControllerConfig {

    private final String controllerId;
    private final String[] etcdEndpoints;
    private final int storeRetries;
    private final int labelRetries;
    private final long watchIntervalSeconds;
    private final int lockTtlSeconds;
    private final String nodeEndpoint;
    private final Map<String, String> nodeEndpointHeaders;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";
    // Environment variable to check for external config file path
    private static final String EXTERNAL_CONFIG_ENV_VAR = "RC_CONFIG_FILE";

    public ControllerConfig() {
        this(loadYamlConfig());
    }

    ControllerConfig(ConfigModel config) {
        this.controllerId = EnvironmentUtils.resolveControllerId(
            config.getController() != null ? config.getController().getId() : null);
        this.etcdEndpoints = parseEndpoints(config);
        this.storeRetries = positiveOrDefault(
            config.getStore() != null ? config.getStore().getRetries() : null, DEFAULT_STORE_RETRIES, "store.retries");
        this.labelRetries = positiveOrDefault(
            config.getLabels() != null ? config.getLabels().getRetries() : null, DEFAULT_LABEL_RETRIES, "labels.retries");
        this.watchIntervalSeconds = parseWatchIntervalSeconds(config);
        this.lockTtlSeconds = positiveOrDefault(
            config.getLock() != null ? config.getLock().getTtlSeconds() : null, DEFAULT_LOCK_TTL_SECONDS, "lock.ttlSeconds");
        this.nodeEndpoint = parseNodeEndpoint(config);
        this.nodeEndpointHeaders = parseNodeEndpointHeaders(config);

        log.info("Loaded replication controller config - controller: {}, etcd endpoints: {}, store retries: {}, watch interval: {}s",
                controllerId, String.join(", ", etcdEndpoints), storeRetries, watchIntervalSeconds);
    }

    static ConfigModel loadYamlConfig() {
        Yaml yaml = new Yaml(new Constructor(ConfigModel.class, new LoaderOptions()));
        InputStream inputStream = null;
        String loadedFrom = "";

        // 1. Check environment variable for external config file path
        String externalConfigPath = System.getenv(EXTERNAL_CONFIG_ENV_VAR);
        if (externalConfigPath != null && !externalConfigPath.trim().isEmpty()) {
            log.info("External config file path specified via {}: {}", EXTERNAL_CONFIG_ENV_VAR, externalConfigPath);
            try {
                if (Files.exists(Paths.get(externalConfigPath))) {
                    inputStream = new FileInputStream(externalConfigPath);
                    loadedFrom = "external file (" + externalConfigPath + ")";
                } else {
                    log.warn("External config file specified but not found at path: {}. Falling back.", externalConfigPath);
                }
            } catch (IOException e) {
                log.warn("Error opening external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
            }
        } else {
            log.debug("{} environment variable not set, looking for config on classpath.", EXTERNAL_CONFIG_ENV_VAR);
        }

        // 2. If external file wasn't loaded, try classpath
        if (inputStream == null) {
            inputStream = ControllerConfig.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE_CLASSPATH);
            loadedFrom = "classpath (" + DEFAULT_CONFIG_FILE_CLASSPATH + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", DEFAULT_CONFIG_FILE_CLASSPATH);
                return new ConfigModel();
            }
        }

        // 3. Load from the determined InputStream
        try (InputStream is = inputStream) {
            ConfigModel config = yaml.load(is);
            log.info("Successfully loaded configuration from {}", loadedFrom);
            return config != null ? config : new ConfigModel();
        } catch (Exception e) {
            log.warn("Failed to parse configuration from {}: {}. Using defaults.", loadedFrom, e.getMessage());
            return new ConfigModel();
        }
    }

    private String[] parseEndpoints(ConfigModel config) {
        if (config.getEtcd() != null && config.getEtcd().getEndpoints() != null) {
            var endpoints = config.getEtcd().getEndpoints();
            if (!endpoints.isEmpty()) {
                return endpoints.toArray(new String[0]);
            }
        }
        return new String[]{DEFAULT_ETCD_ENDPOINT};
    }

    private long parseWatchIntervalSeconds(ConfigModel config) {
        if (config.getWatch() != null && config.getWatch().getIntervalSeconds() != null
                && config.getWatch().getIntervalSeconds() > 0) {
            return config.getWatch().getIntervalSeconds();
        }
        return DEFAULT_WATCH_INTERVAL_SECONDS;
    }

    private String parseNodeEndpoint(ConfigModel config) {
        if (config.getScheduler() != null && config.getScheduler().getNodeEndpoint() != null
                && !config.getScheduler().getNodeEndpoint().isBlank()) {
            return config.getScheduler().getNodeEndpoint().trim();
        }
        return null;
    }

    private Map<String, String> parseNodeEndpointHeaders(ConfigModel config) {
        if (config.getScheduler() != null && config.getScheduler().getHeaders() != null) {
            return Map.copyOf(config.getScheduler().getHeaders());
        }
        return Map.of();
    }

    private static int positiveOrDefault(Integer value, int defaultValue, String name) {
        if (value == null) {
            return defaultValue;
        }
        if (value <= 0) {
            log.warn("Ignoring non-positive value {} for {}, using default {}", value, name, defaultValue);
            return defaultValue;
        }
        return value;
    }

    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private Controller controller;
        private Etcd etcd;
        private Store store;
        private Labels labels;
        private Watch watch;
        private Lock lock;
        private Scheduler scheduler;
    }

    @Data
    public static class Controller {
        private String id;
    }

    @Data
    public static class Etcd {
        private List<String> endpoints;
    }

    @Data
    public static class Store {
        private Integer retries;
    }

    @Data
    public static class Labels {
        private Integer retries;
    }

    @Data
    public static class Watch {
        private Long intervalSeconds;
    }

    @Data
    public static class Lock {
        private Integer ttlSeconds;
    }

    @Data
    public static class Scheduler {
        private String nodeEndpoint;
        private Map<String, String> headers = new HashMap<>();
    }
}
