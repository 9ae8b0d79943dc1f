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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.meter.domain.model.ServiceConfig;
import me.golemcore.meter.domain.model.UsageErrorKind;
import me.golemcore.meter.domain.model.UsageFetchException;
import me.golemcore.meter.domain.model.UsageSnapshot;
import me.golemcore.meter.port.outbound.CredentialPort;
import me.golemcore.meter.port.outbound.UsageAdapterPort;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Base class for vendor usage adapters.
 *
 * <p>
 * Subclasses implement {@link #doFetch(ServiceConfig, String)} and signal
 * failures with {@link UsageFetchException}; {@link #fetch(ServiceConfig)}
 * turns every failure into an error snapshot so callers never see an
 * exception.
 */
@Slf4j
public abstract class AbstractUsageAdapter implements UsageAdapterPort {

    protected static final String USER_AGENT = "ApiDashboard/1.0";

    private final String serviceId;
    protected final OkHttpClient httpClient;
    protected final ObjectMapper objectMapper;
    protected final CredentialPort credentialPort;
    protected final Clock clock;

    protected AbstractUsageAdapter(String serviceId, OkHttpClient httpClient, ObjectMapper objectMapper,
            CredentialPort credentialPort, Clock clock) {
        this.serviceId = serviceId;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.credentialPort = credentialPort;
        this.clock = clock;
    }

    @Override
    public String getServiceId() {
        return serviceId;
    }

    @Override
    public final UsageSnapshot fetch(ServiceConfig config) {
        ServiceConfig settings = config != null ? config : new ServiceConfig();
        String name = displayName(settings);
        try {
            return doFetch(settings, name);
        } catch (UsageFetchException e) {
            log.warn("[Usage] {} fetch failed ({}): {}", serviceId, e.getKind(), e.getMessage());
            return UsageSnapshot.error(serviceId, name, e.getMessage(), clock.instant());
        } catch (RuntimeException e) {
            log.error("[Usage] {} fetch failed unexpectedly", serviceId, e);
            return UsageSnapshot.error(serviceId, name, "Request failed: " + e.getMessage(), clock.instant());
        }
    }

    protected abstract UsageSnapshot doFetch(ServiceConfig config, String name) throws UsageFetchException;

    /**
     * Display name used for both successful and error snapshots.
     */
    protected abstract String displayName(ServiceConfig config);

    protected String requireCredential(String key, String missingMessage) throws UsageFetchException {
        return credentialPort.resolve(key)
                .orElseThrow(() -> new UsageFetchException(UsageErrorKind.CREDENTIAL_MISSING, missingMessage));
    }

    protected HttpResult get(String url, Map<String, String> headers) throws UsageFetchException {
        HttpUrl parsed = HttpUrl.parse(url);
        if (parsed == null) {
            throw new UsageFetchException(UsageErrorKind.NETWORK, "Connection failed: invalid URL");
        }
        return get(parsed, headers);
    }

    /**
     * Executes a GET request. Non-2xx statuses are returned to the caller;
     * only transport failures raise.
     */
    protected HttpResult get(HttpUrl url, Map<String, String> headers) throws UsageFetchException {
        Request.Builder builder = new Request.Builder()
                .url(url)
                .header("User-Agent", USER_AGENT)
                .get();
        headers.forEach(builder::header);

        try (Response response = httpClient.newCall(builder.build()).execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            return new HttpResult(response.code(), text);
        } catch (IOException e) {
            throw new UsageFetchException(UsageErrorKind.NETWORK, "Connection failed: " + e.getMessage(), e);
        }
    }

    protected JsonNode parseJson(String body, String errorPrefix) throws UsageFetchException {
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node == null || node.isMissingNode()) {
                throw new UsageFetchException(UsageErrorKind.PARSE, errorPrefix + ": empty response");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new UsageFetchException(UsageErrorKind.PARSE, errorPrefix + ": " + e.getOriginalMessage(), e);
        }
    }

    protected Instant now() {
        return clock.instant();
    }

    protected static double percentOf(double used, double total) {
        if (total <= 0) {
            return 0;
        }
        return UsageSnapshot.clampPercentage(roundToTenth(used / total * 100));
    }

    /**
     * Allowance as reported in a snapshot; never below one, even when the
     * vendor reports an empty or missing plan.
     */
    protected static double reportedTotal(double total) {
        return Math.max(1, total);
    }

    protected static double roundToTenth(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    /**
     * Status code and body of a completed HTTP exchange.
     */
    protected record HttpResult(int code, String body) {

        boolean isOk() {
            return code == 200;
        }
    }
}
