package me.golemcore.meter.domain.service;

import me.golemcore.meter.domain.model.UnknownServiceException;
import me.golemcore.meter.port.outbound.UsageAdapterPort;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ServiceAdapterRegistryTest {

    @Test
    void shouldIndexAdaptersById() {
        UsageAdapterPort firecrawl = adapter("firecrawl");
        UsageAdapterPort serpapi = adapter("serpapi");

        ServiceAdapterRegistry registry = new ServiceAdapterRegistry(List.of(firecrawl, serpapi));

        assertSame(firecrawl, registry.require("firecrawl"));
        assertTrue(registry.isKnown("serpapi"));
        assertEquals(Set.of("firecrawl", "serpapi"), registry.getServiceIds());
    }

    @Test
    void shouldThrowForUnknownService() {
        ServiceAdapterRegistry registry = new ServiceAdapterRegistry(List.of(adapter("firecrawl")));

        UnknownServiceException ex = assertThrows(UnknownServiceException.class,
                () -> registry.require("openai"));

        assertEquals("Unknown service: openai", ex.getMessage());
        assertFalse(registry.isKnown(null));
        assertTrue(registry.find("openai").isEmpty());
    }

    @Test
    void shouldRejectDuplicateServiceIds() {
        List<UsageAdapterPort> adapters = List.of(adapter("claude_work"), adapter("claude_work"));

        assertThrows(IllegalStateException.class, () -> new ServiceAdapterRegistry(adapters));
    }

    private static UsageAdapterPort adapter(String serviceId) {
        UsageAdapterPort adapter = mock(UsageAdapterPort.class);
        when(adapter.getServiceId()).thenReturn(serviceId);
        return adapter;
    }
}
