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

package me.golemcore.meter.adapter.outbound.usage;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.meter.infrastructure.config.MeterProperties;
import me.golemcore.meter.port.outbound.CredentialPort;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Registers one {@link ClaudeUsageAdapter} per Claude account.
 */
@Configuration
public class ClaudeAdapterConfig {

    public static final String CLAUDE_WORK = "claude_work";
    public static final String CLAUDE_PRIVATE = "claude_private";

    @Bean
    public ClaudeUsageAdapter claudeWorkUsageAdapter(OkHttpClient okHttpClient, ObjectMapper objectMapper,
            CredentialPort credentialPort, MeterProperties properties, Clock clock) {
        return new ClaudeUsageAdapter(CLAUDE_WORK, properties.getAdapters().getClaude().getBaseUrl(),
                okHttpClient, objectMapper, credentialPort, clock);
    }

    @Bean
    public ClaudeUsageAdapter claudePrivateUsageAdapter(OkHttpClient okHttpClient, ObjectMapper objectMapper,
            CredentialPort credentialPort, MeterProperties properties, Clock clock) {
        return new ClaudeUsageAdapter(CLAUDE_PRIVATE, properties.getAdapters().getClaude().getBaseUrl(),
                okHttpClient, objectMapper, credentialPort, clock);
    }
}
