package com.arbor.hierarchy.api;

import com.arbor.hierarchy.config.HierarchyProperties;
import com.arbor.hierarchy.config.ServiceProperties;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lightweight runtime information about this instance. Actuator's {@code /actuator/info} covers
 * build metadata; this adds the effective hierarchy settings.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final ServiceProperties service;
    private final HierarchyProperties hierarchy;

    public ServiceInfoController(ServiceProperties service, HierarchyProperties hierarchy) {
        this.service = service;
        this.hierarchy = hierarchy;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        return Map.of(
                "name", service.name(),
                "environment", service.environment(),
                "description", service.description() != null ? service.description() : "",
                "store", hierarchy.store().name().toLowerCase(Locale.ROOT),
                "separator", hierarchy.separator(),
                "allowMultipleRoots", hierarchy.allowMultipleRoots(),
                "status", "running",
                "timestamp", Instant.now().toString());
    }
}
