package com.z254.butterfly.sentinel.domain.repository;

import com.z254.butterfly.sentinel.domain.model.BusinessContext;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry, populated by the host at startup.
 */
@Repository
public class InMemoryBusinessContextRepository implements BusinessContextRepository {

    private final Map<String, BusinessContext> store = new ConcurrentHashMap<>();

    @Override
    public BusinessContext save(BusinessContext context) {
        store.put(context.getServiceId(), context);
        return context;
    }

    @Override
    public Optional<BusinessContext> findByServiceId(String serviceId) {
        return serviceId == null ? Optional.empty() : Optional.ofNullable(store.get(serviceId));
    }

    @Override
    public List<BusinessContext> findAll() {
        return new ArrayList<>(store.values());
    }

    @Override
    public void delete(String serviceId) {
        store.remove(serviceId);
    }
}
