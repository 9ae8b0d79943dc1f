package me.golemcore.meter;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Meter.
 *
 * <p>
 * GolemCore Meter is a local daemon that aggregates quota usage of several
 * metered API services (Firecrawl, SerpAPI, Claude) into one loopback HTTP API
 * for a dashboard client.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → REST controllers (usage, history, velocity, config)
 * Domain Layer       → UsageService, UsageCacheService, UsageHistoryService,
 *                      VelocityService, RuntimeConfigService, UsagePoller
 * Infrastructure     → Vendor usage adapters, credential lookup, local storage
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * Static configuration via {@code application.properties} under the
 * {@code meter.*} prefix; runtime configuration (refresh interval, enabled
 * services) via {@code POST /config}.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class MeterApplication {

    public static void main(String[] args) {
        SpringApplication.run(MeterApplication.class, args);
    }

}
