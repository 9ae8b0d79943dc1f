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
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SerpAPI account quota.
 *
 * <p>
 * Reads {@code /account.json}; the API key travels as a query parameter, so
 * request URLs are never logged.
 */
@Component
public class SerpApiUsageAdapter extends AbstractUsageAdapter {

    public static final String SERVICE_ID = "serpapi";
    private static final String NAME = "SerpAPI";
    private static final String ICON = "search";
    private static final String UNIT = "searches";
    private static final String DEFAULT_PLAN_NAME = "Plan";
    private static final int DEFAULT_RESET_DAY = 19;

    private final String baseUrl;

    public SerpApiUsageAdapter(OkHttpClient httpClient, ObjectMapper objectMapper, CredentialPort credentialPort,
            MeterProperties properties, Clock clock) {
        super(SERVICE_ID, httpClient, objectMapper, credentialPort, clock);
        this.baseUrl = properties.getAdapters().getSerpapi().getBaseUrl();
    }

    @Override
    protected String displayName(ServiceConfig config) {
        return NAME;
    }

    @Override
    protected UsageSnapshot doFetch(ServiceConfig config, String name) throws UsageFetchException {
        String apiKey = requireCredential(SERVICE_ID, "No API key configured");

        HttpUrl base = HttpUrl.parse(baseUrl);
        if (base == null) {
            throw new UsageFetchException(UsageErrorKind.NETWORK, "Connection failed: invalid URL");
        }
        HttpUrl url = base.newBuilder()
                .addPathSegment("account.json")
                .addQueryParameter("api_key", apiKey)
                .build();

        HttpResult result = get(url, Map.of());
        if (!result.isOk()) {
            throw new UsageFetchException(UsageErrorKind.NETWORK, "HTTP " + result.code());
        }

        JsonNode account = parseJson(result.body(), "Parse error");
        String error = account.path("error").asText("");
        if (!error.isBlank()) {
            throw new UsageFetchException(UsageErrorKind.AUTH, error);
        }

        double total = account.path("searches_per_month").asDouble(1);
        JsonNode remainingNode = account.has("total_searches_left")
                ? account.get("total_searches_left")
                : account.path("plan_searches_left");
        double remaining = remainingNode.asDouble(0);
        double used = total - remaining;

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("hourly", account.path("last_hour_searches").asLong(0));

        return UsageSnapshot.builder()
                .serviceId(SERVICE_ID)
                .name(name)
                .icon(ICON)
                .percentage(percentOf(used, total))
                .used(used)
                .total(reportedTotal(total))
                .unit(UNIT)
                .planName(account.path("plan_name").asText(DEFAULT_PLAN_NAME))
                .resetInfo(ResetCountdown.untilDayOfMonth(config.getInt(ServiceConfig.RESET_DAY, DEFAULT_RESET_DAY),
                        now()))
                .details(details)
                .lastUpdated(now())
                .build();
    }
}
