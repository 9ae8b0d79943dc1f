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

package me.golemcore.meter.adapter.outbound.credential;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.meter.infrastructure.config.MeterProperties;
import me.golemcore.meter.port.outbound.CredentialPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves credentials from {@code meter.credentials.*}. The default
 * application.properties maps them from environment variables (for example
 * {@code METER_FIRECRAWL_API_KEY}) so they never reach config.json.
 *
 * <p>
 * Relaxed binding turns underscores in environment variable names into dots,
 * so {@code claude_work} is also looked up as {@code claude.work} and
 * {@code claude-work}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PropertiesCredentialAdapter implements CredentialPort {

    private final MeterProperties properties;

    @Override
    public Optional<String> resolve(String key) {
        if (key == null) {
            return Optional.empty();
        }
        Map<String, String> credentials = properties.getCredentials();
        if (credentials == null) {
            return Optional.empty();
        }
        for (String candidate : List.of(key, key.replace('_', '.'), key.replace('_', '-'))) {
            String value = credentials.get(candidate);
            if (value != null && !value.isBlank()) {
                return Optional.of(value.trim());
            }
        }
        log.debug("[Credentials] No credential configured for: {}", key);
        return Optional.empty();
    }
}
