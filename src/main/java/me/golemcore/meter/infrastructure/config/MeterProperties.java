package me.golemcore.meter.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Centralized configuration properties for the meter daemon, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code meter.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - where history and config files live</li>
 * <li>{@link CacheProperties} - snapshot freshness window</li>
 * <li>{@link HistoryProperties} - history retention window</li>
 * <li>{@link PollerProperties} - background polling</li>
 * <li>{@link HttpProperties} - outbound HTTP timeouts</li>
 * <li>{@link ConfigProperties} - limits for runtime config updates</li>
 * <li>{@link AdapterProperties} - vendor endpoint base URLs</li>
 * <li>credentials - opaque credential lookup source</li>
 * </ul>
 *
 * <p>
 * Static settings only. Mutable runtime settings (refresh interval, enabled
 * services) live in {@link me.golemcore.meter.domain.model.RuntimeConfig}.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "meter")
@Data
public class MeterProperties {

    private StorageProperties storage = new StorageProperties();
    private CacheProperties cache = new CacheProperties();
    private HistoryProperties history = new HistoryProperties();
    private PollerProperties poller = new PollerProperties();
    private HttpProperties http = new HttpProperties();
    private ConfigProperties config = new ConfigProperties();
    private AdapterProperties adapters = new AdapterProperties();
    private Map<String, String> credentials = new HashMap<>();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private DirectoriesProperties directories = new DirectoriesProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/meter";
    }

    @Data
    public static class DirectoriesProperties {
        private String history = "history";
        private String config = "config";
    }

    @Data
    public static class CacheProperties {
        private int ttlSeconds = 60;
    }

    @Data
    public static class HistoryProperties {
        private int retentionDays = 28;
    }

    @Data
    public static class PollerProperties {
        private boolean enabled = true;
        private int initialDelaySeconds = 0;
        private int defaultRefreshIntervalSeconds = 300;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 15000;
        private long callTimeout = 15000;
        private long fetchTimeout = 20000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class ConfigProperties {
        private int maxPayloadBytes = 64 * 1024;
    }

    @Data
    public static class AdapterProperties {
        private EndpointProperties firecrawl = new EndpointProperties("https://api.firecrawl.dev");
        private EndpointProperties serpapi = new EndpointProperties("https://serpapi.com");
        private EndpointProperties claude = new EndpointProperties("https://claude.ai");
    }

    @Data
    public static class EndpointProperties {
        private String baseUrl;

        public EndpointProperties() {
        }

        public EndpointProperties(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }
}
