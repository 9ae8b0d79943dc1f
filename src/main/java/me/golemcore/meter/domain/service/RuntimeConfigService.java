package me.golemcore.meter.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.meter.domain.model.ConfigUpdateException;
import me.golemcore.meter.domain.model.RuntimeConfig;
import me.golemcore.meter.domain.model.ServiceConfig;
import me.golemcore.meter.infrastructure.config.MeterProperties;
import me.golemcore.meter.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Service for managing the daemon's runtime configuration. Loads from
 * {@code config/config.json} via StoragePort, accepts partial updates from the
 * gateway and persists after every change.
 *
 * <p>
 * Credential-like keys ({@code api_key}, {@code token}, {@code sessionKey},
 * ...) are stripped at every level before a configuration is accepted, so
 * they are never held in memory, written to disk or returned to clients. The
 * config file is restricted to the owning user after each write.
 */
@Service
@Slf4j
public class RuntimeConfigService {

    private static final String LOG_PREFIX = "[RuntimeConfig]";
    private static final String CONFIG_FILE = "config.json";
    private static final List<String> CREDENTIAL_MARKERS = List.of(
            "apikey", "token", "secret", "password", "cookie", "sessionkey", "credential");
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final SharedStateLock stateLock;
    private final String configDir;
    private final int defaultRefreshInterval;

    private final ReentrantLock persistLock = new ReentrantLock();

    private RuntimeConfig current;

    public RuntimeConfigService(StoragePort storagePort, ObjectMapper objectMapper, SharedStateLock stateLock,
            MeterProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.stateLock = stateLock;
        this.configDir = properties.getStorage().getDirectories().getConfig();
        this.defaultRefreshInterval = properties.getPoller().getDefaultRefreshIntervalSeconds();
    }

    @PostConstruct
    public void init() {
        getRuntimeConfig();
    }

    /**
     * Get current RuntimeConfig (lazy-loaded, cached).
     */
    public RuntimeConfig getRuntimeConfig() {
        RuntimeConfig cfg = stateLock.withLock(() -> current);
        if (cfg != null) {
            return cfg;
        }
        RuntimeConfig loaded = loadOrCreate();
        return stateLock.withLock(() -> {
            if (current == null) {
                current = loaded;
            }
            return current;
        });
    }

    public int getRefreshIntervalSeconds() {
        return Math.max(1, getRuntimeConfig().getRefreshInterval());
    }

    public Optional<ServiceConfig> getServiceConfig(String serviceId) {
        return Optional.ofNullable(getRuntimeConfig().getServices().get(serviceId));
    }

    /**
     * Enabled services in configuration order.
     */
    public Map<String, ServiceConfig> getEnabledServices() {
        Map<String, ServiceConfig> enabled = new LinkedHashMap<>();
        getRuntimeConfig().getServices().forEach((id, cfg) -> {
            if (cfg.isEnabled()) {
                enabled.put(id, cfg);
            }
        });
        return enabled;
    }

    /**
     * Configuration as exposed through the gateway.
     */
    public Map<String, Object> getRuntimeConfigForApi() {
        return objectMapper.convertValue(getRuntimeConfig(), MAP_TYPE);
    }

    /**
     * Shallow merge: each top-level key of {@code partial} replaces the stored
     * value wholesale. The result is validated before it replaces the current
     * configuration, then persisted.
     *
     * @throws ConfigUpdateException
     *             if the merged configuration is invalid; the current
     *             configuration is left untouched
     */
    public RuntimeConfig merge(Map<String, Object> partial) {
        if (partial == null) {
            throw new ConfigUpdateException(ConfigUpdateException.Reason.MALFORMED,
                    "Invalid JSON: expected an object");
        }
        getRuntimeConfig();

        RuntimeConfig merged = stateLock.withLock(() -> {
            Map<String, Object> combined = objectMapper.convertValue(current, MAP_TYPE);
            combined.putAll(partial);
            stripCredentials(combined);

            RuntimeConfig candidate;
            try {
                candidate = objectMapper.convertValue(combined, RuntimeConfig.class);
            } catch (IllegalArgumentException e) {
                throw new ConfigUpdateException(ConfigUpdateException.Reason.INVALID_VALUE,
                        "Invalid config: " + describe(e), e);
            }
            normalize(candidate);
            if (candidate.getRefreshInterval() < 1) {
                throw new ConfigUpdateException(ConfigUpdateException.Reason.INVALID_VALUE,
                        "Invalid config: refresh_interval must be a positive number of seconds");
            }
            current = candidate;
            return candidate;
        });

        log.info("{} Config updated (keys: {}, refresh interval: {}s, services: {})", LOG_PREFIX,
                partial.keySet(), merged.getRefreshInterval(), merged.getServices().keySet());
        persistCurrent();
        return merged;
    }

    private void persistCurrent() {
        persistLock.lock();
        try {
            write(stateLock.withLock(() -> current));
        } finally {
            persistLock.unlock();
        }
    }

    private void persist(RuntimeConfig cfg) {
        persistLock.lock();
        try {
            write(cfg);
        } finally {
            persistLock.unlock();
        }
    }

    private void write(RuntimeConfig cfg) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
            storagePort.putTextAtomic(configDir, CONFIG_FILE, json, false).join();
            storagePort.restrictToOwner(configDir, CONFIG_FILE).join();
            log.debug("{} Persisted runtime config", LOG_PREFIX);
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("{} Failed to persist runtime config", LOG_PREFIX, e);
        }
    }

    private RuntimeConfig loadOrCreate() {
        try {
            String json = storagePort.getText(configDir, CONFIG_FILE).join();
            if (json != null && !json.isBlank()) {
                Map<String, Object> raw = objectMapper.readValue(json, MAP_TYPE);
                stripCredentials(raw);
                RuntimeConfig loaded = objectMapper.convertValue(raw, RuntimeConfig.class);
                normalize(loaded);
                if (loaded.getRefreshInterval() < 1) {
                    loaded.setRefreshInterval(defaultRefreshInterval);
                }
                storagePort.restrictToOwner(configDir, CONFIG_FILE).join();
                log.info("{} Loaded runtime config from storage", LOG_PREFIX);
                return loaded;
            }
        } catch (IOException | RuntimeException e) { // NOSONAR
            log.warn("{} Unreadable runtime config, falling back to defaults: {}", LOG_PREFIX, e.getMessage());
        }

        RuntimeConfig defaultConfig = RuntimeConfig.builder()
                .refreshInterval(defaultRefreshInterval)
                .build();
        persist(defaultConfig);
        log.info("{} Created default runtime config", LOG_PREFIX);
        return defaultConfig;
    }

    private void normalize(RuntimeConfig cfg) {
        if (cfg.getServices() == null) {
            cfg.setServices(new LinkedHashMap<>());
        }
        cfg.getServices().values().removeIf(service -> service == null);
        if (cfg.getAdditional() == null) {
            cfg.setAdditional(new LinkedHashMap<>());
        }
    }

    static boolean isCredentialKey(String key) {
        if (key == null) {
            return false;
        }
        String normalized = key.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
        for (String marker : CREDENTIAL_MARKERS) {
            if (normalized.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private static void stripCredentials(Object node) {
        if (node instanceof Map<?, ?> map) {
            map.keySet().removeIf(key -> isCredentialKey(String.valueOf(key)));
            map.values().forEach(RuntimeConfigService::stripCredentials);
        } else if (node instanceof List<?> list) {
            list.forEach(RuntimeConfigService::stripCredentials);
        }
    }

    private static String describe(IllegalArgumentException e) {
        Throwable cause = e.getCause();
        if (cause instanceof JsonProcessingException jsonError) {
            return jsonError.getOriginalMessage();
        }
        return e.getMessage();
    }
}
