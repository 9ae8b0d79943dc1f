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
import me.golemcore.meter.port.outbound.CredentialPort;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Claude subscription usage read through the claude.ai web API with a session
 * cookie.
 *
 * <p>
 * One instance per account ({@code claude_work}, {@code claude_private}). The
 * credential stored under the service id is either the bare
 * {@code sessionKey} value or a full cookie header containing it.
 *
 * <p>
 * The reported percentage is the higher of the five-hour and seven-day
 * utilization windows.
 */
public class ClaudeUsageAdapter extends AbstractUsageAdapter {

    public static final String SERVICE_PREFIX = "claude_";
    private static final String ICON = "dialog-messages";
    private static final String UNIT = "%";
    private static final String SESSION_COOKIE = "sessionKey";
    private static final String BROWSER_USER_AGENT = "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36";
    private static final double FULL_PERCENTAGE = 100.0;

    private final String baseUrl;

    public ClaudeUsageAdapter(String serviceId, String baseUrl, OkHttpClient httpClient, ObjectMapper objectMapper,
            CredentialPort credentialPort, Clock clock) {
        super(serviceId, httpClient, objectMapper, credentialPort, clock);
        this.baseUrl = baseUrl;
    }

    @Override
    protected String displayName(ServiceConfig config) {
        String label = config.getString(ServiceConfig.LABEL)
                .orElseGet(() -> titleCase(getServiceId().replace(SERVICE_PREFIX, "")));
        return "Claude (" + label + ")";
    }

    @Override
    protected UsageSnapshot doFetch(ServiceConfig config, String name) throws UsageFetchException {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("User-Agent", BROWSER_USER_AGENT);
        headers.put("Accept", "application/json");
        headers.put("Content-Type", "application/json");
        headers.put("Cookie", cookieHeader());

        HttpResult orgsResult = get(url("api", "organizations"), headers);
        if (orgsResult.code() == 401 || orgsResult.code() == 403) {
            throw new UsageFetchException(UsageErrorKind.AUTH, "Session expired");
        }
        if (!orgsResult.isOk()) {
            throw new UsageFetchException(UsageErrorKind.NETWORK, "HTTP " + orgsResult.code() + " fetching orgs");
        }

        JsonNode orgs = parseJson(orgsResult.body(), "Parse error (orgs)");
        if (!orgs.isArray() || orgs.isEmpty()) {
            throw new UsageFetchException(UsageErrorKind.PARSE, "No organizations found");
        }
        JsonNode org = orgs.get(0);
        String orgId = org.path("uuid").asText("");
        String orgName = org.path("name").asText("");
        String plan = planOf(org.path("capabilities"));

        HttpResult usageResult = get(url("api", "organizations", orgId, "usage"), headers);
        if (!usageResult.isOk()) {
            throw new UsageFetchException(UsageErrorKind.NETWORK, "HTTP " + usageResult.code() + " fetching usage");
        }

        JsonNode usage = parseJson(usageResult.body(), "Parse error (usage)");
        JsonNode fiveHour = usage.path("five_hour");
        JsonNode sevenDay = usage.path("seven_day");
        JsonNode sonnet = usage.path("seven_day_sonnet");

        double fiveHourPct = normalizeUtilization(fiveHour.path("utilization").asDouble(0));
        double sevenDayPct = normalizeUtilization(sevenDay.path("utilization").asDouble(0));
        double sonnetPct = normalizeUtilization(sonnet.path("utilization").asDouble(0));

        Instant now = now();
        long fiveHourReset = ResetCountdown.minutesUntil(fiveHour.path("resets_at").asText(null), now);
        long sevenDayReset = ResetCountdown.minutesUntil(sevenDay.path("resets_at").asText(null), now);

        double primary = Math.max(fiveHourPct, sevenDayPct);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("org_name", orgName);
        details.put("five_hour_usage", fiveHourPct);
        details.put("five_hour_reset_minutes", fiveHourReset);
        details.put("seven_day_usage", sevenDayPct);
        details.put("seven_day_reset_minutes", sevenDayReset);
        details.put("sonnet_usage", sonnetPct);

        return UsageSnapshot.builder()
                .serviceId(getServiceId())
                .name(name)
                .icon(ICON)
                .percentage(primary)
                .used(primary)
                .total(FULL_PERCENTAGE)
                .unit(UNIT)
                .planName(titleCase(plan))
                .resetInfo(fiveHourReset > 0 ? ResetCountdown.formatMinutes(fiveHourReset) : "")
                .details(details)
                .lastUpdated(now)
                .build();
    }

    private String cookieHeader() throws UsageFetchException {
        String credential = requireCredential(getServiceId(), "No session cookie found");
        if (!credential.contains("=")) {
            return SESSION_COOKIE + "=" + credential;
        }
        if (!credential.contains(SESSION_COOKIE + "=")) {
            throw new UsageFetchException(UsageErrorKind.CREDENTIAL_MISSING, "No session cookie found");
        }
        return credential;
    }

    private HttpUrl url(String... segments) throws UsageFetchException {
        HttpUrl base = HttpUrl.parse(baseUrl);
        if (base == null) {
            throw new UsageFetchException(UsageErrorKind.NETWORK, "Connection failed: invalid URL");
        }
        HttpUrl.Builder builder = base.newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder.build();
    }

    /**
     * Utilization arrives either as a 0..1 fraction or as a percentage.
     */
    static double normalizeUtilization(double value) {
        double percent = value > 1 ? value : value * 100;
        return Math.min(roundToTenth(percent), FULL_PERCENTAGE);
    }

    private static String planOf(JsonNode capabilities) {
        String caps = capabilities.toString().toLowerCase(Locale.ROOT);
        if (caps.contains("max")) {
            return "max";
        }
        if (caps.contains("pro")) {
            return "pro";
        }
        return "free";
    }

    static String titleCase(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean wordStart = true;
        for (char c : text.toCharArray()) {
            if (Character.isLetter(c)) {
                sb.append(wordStart ? Character.toUpperCase(c) : Character.toLowerCase(c));
                wordStart = false;
            } else {
                sb.append(c);
                wordStart = true;
            }
        }
        return sb.toString();
    }
}
