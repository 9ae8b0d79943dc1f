package me.golemcore.meter.adapter.outbound.usage;

import me.golemcore.meter.domain.model.ServiceConfig;
import me.golemcore.meter.domain.model.UsageSnapshot;
import me.golemcore.meter.infrastructure.config.AutoConfiguration;
import me.golemcore.meter.port.outbound.CredentialPort;
import me.golemcore.meter.testsupport.http.OkHttpMockEngine;
import me.golemcore.meter.testsupport.time.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ClaudeUsageAdapterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final String ORGS = "[{\"uuid\":\"org-1\",\"name\":\"Acme\","
            + "\"capabilities\":[\"chat\",\"claude_pro\"]}]";
    private static final String USAGE = "{"
            + "\"five_hour\":{\"utilization\":0.42,\"resets_at\":\"2026-03-01T13:30:00Z\"},"
            + "\"seven_day\":{\"utilization\":63,\"resets_at\":\"2026-03-04T12:00:00+00:00\"},"
            + "\"seven_day_sonnet\":{\"utilization\":0.1}}";

    private OkHttpMockEngine engine;
    private CredentialPort credentialPort;
    private ClaudeUsageAdapter adapter;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        credentialPort = mock(CredentialPort.class);
        adapter = new ClaudeUsageAdapter("claude_work", "https://claude.test", engine.client(),
                AutoConfiguration.objectMapper(), credentialPort, new MutableClock(NOW));
        when(credentialPort.resolve("claude_work")).thenReturn(Optional.of("sk-ant-session"));
    }

    @Test
    void shouldReportHigherOfBothWindows() {
        engine.enqueueJson(200, ORGS);
        engine.enqueueJson(200, USAGE);

        UsageSnapshot snapshot = adapter.fetch(new ServiceConfig());

        assertTrue(snapshot.isSuccessful());
        assertEquals("claude_work", snapshot.getServiceId());
        assertEquals("Claude (Work)", snapshot.getName());
        assertEquals(63.0, snapshot.getPercentage());
        assertEquals(100.0, snapshot.getTotal());
        assertEquals("%", snapshot.getUnit());
        assertEquals("Pro", snapshot.getPlanName());
        assertEquals("1h 30m", snapshot.getResetInfo());
        assertEquals("Acme", snapshot.getDetails().get("org_name"));
        assertEquals(42.0, snapshot.getDetails().get("five_hour_usage"));
        assertEquals(90L, snapshot.getDetails().get("five_hour_reset_minutes"));
        assertEquals(63.0, snapshot.getDetails().get("seven_day_usage"));
        assertEquals(4320L, snapshot.getDetails().get("seven_day_reset_minutes"));
        assertEquals(10.0, snapshot.getDetails().get("sonnet_usage"));
    }

    @Test
    void shouldCallOrganizationThenUsageEndpointWithSessionCookie() {
        engine.enqueueJson(200, ORGS);
        engine.enqueueJson(200, USAGE);

        adapter.fetch(new ServiceConfig());

        OkHttpMockEngine.CapturedRequest orgs = engine.takeRequest();
        assertEquals("/api/organizations", orgs.path());
        assertEquals("sessionKey=sk-ant-session", orgs.header("Cookie"));
        assertEquals("/api/organizations/org-1/usage", engine.takeRequest().path());
    }

    @Test
    void shouldPassFullCookieHeaderThrough() {
        when(credentialPort.resolve("claude_work")).thenReturn(Optional.of("lang=en; sessionKey=abc"));
        engine.enqueueJson(200, ORGS);
        engine.enqueueJson(200, USAGE);

        adapter.fetch(new ServiceConfig());

        assertEquals("lang=en; sessionKey=abc", engine.takeRequest().header("Cookie"));
    }

    @Test
    void shouldRejectCookieWithoutSessionKey() {
        when(credentialPort.resolve("claude_work")).thenReturn(Optional.of("lang=en"));

        UsageSnapshot snapshot = adapter.fetch(new ServiceConfig());

        assertEquals("No session cookie found", snapshot.getError());
        assertEquals(0, engine.getRequestCount());
    }

    @Test
    void shouldReportMissingSession() {
        when(credentialPort.resolve("claude_work")).thenReturn(Optional.empty());

        assertEquals("No session cookie found", adapter.fetch(new ServiceConfig()).getError());
    }

    @Test
    void shouldUseConfiguredLabel() {
        when(credentialPort.resolve("claude_work")).thenReturn(Optional.empty());
        ServiceConfig config = new ServiceConfig();
        config.putSetting(ServiceConfig.LABEL, "Office");

        assertEquals("Claude (Office)", adapter.fetch(config).getName());
    }

    @Test
    void shouldReportExpiredSession() {
        engine.enqueueJson(403, "{}");

        assertEquals("Session expired", adapter.fetch(new ServiceConfig()).getError());
    }

    @Test
    void shouldReportEmptyOrganizationList() {
        engine.enqueueJson(200, "[]");

        assertEquals("No organizations found", adapter.fetch(new ServiceConfig()).getError());
    }

    @Test
    void shouldReportUsageFailure() {
        engine.enqueueJson(200, ORGS);
        engine.enqueueJson(500, "");

        assertEquals("HTTP 500 fetching usage", adapter.fetch(new ServiceConfig()).getError());
    }

    @Test
    void shouldNormalizeUtilization() {
        assertEquals(42.0, ClaudeUsageAdapter.normalizeUtilization(0.42));
        assertEquals(100.0, ClaudeUsageAdapter.normalizeUtilization(1.0));
        assertEquals(57.0, ClaudeUsageAdapter.normalizeUtilization(57));
        assertEquals(100.0, ClaudeUsageAdapter.normalizeUtilization(130));
    }

    @Test
    void shouldTitleCaseLabels() {
        assertEquals("Private", ClaudeUsageAdapter.titleCase("private"));
        assertEquals("Side-Project", ClaudeUsageAdapter.titleCase("side-project"));
    }
}
