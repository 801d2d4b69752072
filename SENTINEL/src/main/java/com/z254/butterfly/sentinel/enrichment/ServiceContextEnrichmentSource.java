package com.z254.butterfly.sentinel.enrichment;

import com.z254.butterfly.sentinel.domain.model.Alert;
import com.z254.butterfly.sentinel.domain.model.BusinessContext;
import com.z254.butterfly.sentinel.domain.model.EnrichmentRule;
import com.z254.butterfly.sentinel.domain.repository.BusinessContextRepository;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Business context of the alerting service, plus the registered services that depend on it.
 */
@Component
public class ServiceContextEnrichmentSource implements EnrichmentSource {

    public static final String ID = "service-context";

    private final BusinessContextRepository repository;

    public ServiceContextEnrichmentSource(BusinessContextRepository repository) {
        this.repository = repository;
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public SourceLookup lookup(Alert alert, EnrichmentRule rule, String query) {
        String serviceId = alert.getSource();
        Optional<BusinessContext> context = repository.findByServiceId(serviceId);
        List<String> dependents = repository.findAll().stream()
                .filter(other -> other.getDependencies() != null && other.getDependencies().contains(serviceId))
                .map(BusinessContext::getServiceId)
                .sorted()
                .toList();

        if (context.isEmpty() && dependents.isEmpty()) {
            return SourceLookup.builder()
                    .data(Map.of())
                    .resultCount(0)
                    .summary("No business context registered for " + serviceId)
                    .build();
        }

        Map<String, Object> data = new LinkedHashMap<>();
        context.ifPresent(service -> {
            data.put("serviceId", service.getServiceId());
            data.put("serviceName", service.getServiceName());
            data.put("tier", service.getTier() != null ? service.getTier().name() : null);
            data.put("sla", service.getSla());
            data.put("users", service.getUsers());
            data.put("revenue", service.getRevenue());
            data.put("dependencies", service.getDependencies() != null ? service.getDependencies() : List.of());
        });
        data.put("dependents", dependents);

        String summary = context
                .map(service -> "Service " + serviceId + " (" + service.getTier() + ") with "
                        + (service.getDependencies() != null ? service.getDependencies().size() : 0)
                        + " dependencies and " + dependents.size() + " dependents")
                .orElse("Unregistered service " + serviceId + " with " + dependents.size() + " dependents");
        return SourceLookup.builder()
                .data(data)
                .resultCount((context.isPresent() ? 1 : 0) + dependents.size())
                .summary(summary)
                .build();
    }
}
