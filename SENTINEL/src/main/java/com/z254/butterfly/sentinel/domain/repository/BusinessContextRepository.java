package com.z254.butterfly.sentinel.domain.repository;

import com.z254.butterfly.sentinel.domain.model.BusinessContext;

import java.util.List;
import java.util.Optional;

/**
 * Registry of business facts per service, consumed by the impact scorer.
 */
public interface BusinessContextRepository {

    BusinessContext save(BusinessContext context);

    Optional<BusinessContext> findByServiceId(String serviceId);

    List<BusinessContext> findAll();

    void delete(String serviceId);
}
