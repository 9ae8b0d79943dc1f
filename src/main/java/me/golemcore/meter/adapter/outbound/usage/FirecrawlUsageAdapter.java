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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.meter.domain.model.ServiceConfig;
import me.golemcore.meter.domain.model.UsageErrorKind;
import me.golemcore.meter.domain.model.UsageFetchException;
import me.golemcore.meter.domain.model.UsageSnapshot;
import me.golemcore.meter.infrastructure.config.MeterProperties;
import me.golemcore.meter.port.outbound.CredentialPort;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Firecrawl team credit usage.
 *
 * <p>
 * Calls {@code GET /v2/team/credit-usage} with the API key as a bearer token
 * and reports used credits against the plan allowance. Credits reset monthly
 * on {@code reset_day} (16 by default).
 */
@Component
public class FirecrawlUsageAdapter extends AbstractUsageAdapter {

    public static final String SERVICE_ID = "firecrawl";
    private static final String NAME = "Firecrawl";
    private static final String ICON = "cloud-download";
    private static final String UNIT = "credits";
    private static final String CREDIT_USAGE_PATH = "/v2/team/credit-usage";
    private static final int DEFAULT_RESET_DAY = 16;

    private final String baseUrl;

    public FirecrawlUsageAdapter(OkHttpClient httpClient, ObjectMapper objectMapper, CredentialPort credentialPort,
            MeterProperties properties, Clock clock) {
        super(SERVICE_ID, httpClient, objectMapper, credentialPort, clock);
        this.baseUrl = properties.getAdapters().getFirecrawl().getBaseUrl();
    }

    @Override
    protected String displayName(ServiceConfig config) {
        return NAME;
    }

    @Override
    protected UsageSnapshot doFetch(ServiceConfig config, String name) throws UsageFetchException {
        String apiKey = requireCredential(SERVICE_ID, "No API key configured");

        HttpResult result = get(baseUrl + CREDIT_USAGE_PATH, Map.of("Authorization", "Bearer " + apiKey));
        if (result.code() == 401) {
            throw new UsageFetchException(UsageErrorKind.AUTH, "Invalid API key");
        }
        if (!result.isOk()) {
            throw new UsageFetchException(UsageErrorKind.NETWORK, "HTTP " + result.code());
        }

        JsonNode root = parseJson(result.body(), "Parse error");
        JsonNode data = root.has("data") ? root.get("data") : root;
        if (!data.isObject()) {
            throw new UsageFetchException(UsageErrorKind.PARSE, "Parse error: unexpected response shape");
        }
        double total = data.path("planCredits").asDouble(1);
        double remaining = data.path("remainingCredits").asDouble(0);
        double used = total - remaining;

        return UsageSnapshot.builder()
                .serviceId(SERVICE_ID)
                .name(name)
                .icon(ICON)
                .percentage(percentOf(used, total))
                .used(used)
                .total(reportedTotal(total))
                .unit(UNIT)
                .planName(String.format(Locale.US, "%,d credits/mo", Math.round(total)))
                .resetInfo(ResetCountdown.untilDayOfMonth(config.getInt(ServiceConfig.RESET_DAY, DEFAULT_RESET_DAY),
                        now()))
                .details(new LinkedHashMap<>())
                .lastUpdated(now())
                .build();
    }
}
