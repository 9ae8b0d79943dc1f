package me.golemcore.meter.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.meter.domain.model.UnknownServiceException;
import me.golemcore.meter.port.outbound.UsageAdapterPort;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed set of usage adapters indexed by service id.
 */
@Component
@Slf4j
public class ServiceAdapterRegistry {

    private final Map<String, UsageAdapterPort> adaptersById = new LinkedHashMap<>();

    public ServiceAdapterRegistry(List<UsageAdapterPort> adapters) {
        for (UsageAdapterPort adapter : adapters) {
            UsageAdapterPort previous = adaptersById.putIfAbsent(adapter.getServiceId(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Duplicate usage adapter for service: " + adapter.getServiceId());
            }
            log.debug("[Registry] Registered usage adapter: {}", adapter.getServiceId());
        }
    }

    public UsageAdapterPort require(String serviceId) {
        return find(serviceId).orElseThrow(() -> new UnknownServiceException(serviceId));
    }

    public Optional<UsageAdapterPort> find(String serviceId) {
        if (serviceId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(adaptersById.get(serviceId));
    }

    public boolean isKnown(String serviceId) {
        return serviceId != null && adaptersById.containsKey(serviceId);
    }

    public Set<String> getServiceIds() {
        return Collections.unmodifiableSet(adaptersById.keySet());
    }
}
