package com.flagship.payment_settlement.organization;

import com.flagship.payment_settlement.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Service
@RequiredArgsConstructor
public class OrganizationService {

    private final OrganizationRepository organizationRepository;

    @Transactional
    public Organization register(String name) {
        return organizationRepository.save(Organization.create(name));
    }

    @Transactional(readOnly = true)
    public Organization getRequired(UUID organizationId) {
        return organizationRepository.findById(organizationId)
                .orElseThrow(() -> new ResourceNotFoundException("Organization", organizationId));
    }
}
