package com.flagship.payment_settlement.customer;

import com.flagship.payment_settlement.exception.AmbiguousCustomerException;
import com.flagship.payment_settlement.exception.OrganizationMismatchException;
import com.flagship.payment_settlement.exception.ResourceNotFoundException;
import com.flagship.payment_settlement.organization.Organization;
import com.flagship.payment_settlement.organization.OrganizationService;
import com.flagship.payment_settlement.reference.ReferenceGenerator;
import com.flagship.payment_settlement.reference.ReferenceKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class CustomerService {

    private final CustomerRepository customerRepository;
    private final OrganizationService organizationService;
    private final ReferenceGenerator referenceGenerator;

    @Transactional
    public Customer register(UUID organizationId, String firstName, String lastName,
                             String phoneNumber, String email) {
        Organization organization = organizationService.getRequired(organizationId);
        String code = referenceGenerator.nextReference(
                organizationId, organization.getName(), ReferenceKind.CUSTOMER);
        Customer saved = customerRepository.save(
                Customer.create(organizationId, code, firstName, lastName, phoneNumber, email));
        log.info("Registered customer {} for organization {}", code, organizationId);
        return saved;
    }

    @Transactional(readOnly = true)
    public Customer getForOrganization(UUID organizationId, UUID customerId) {
        Customer customer = customerRepository.findById(customerId)
                .orElseThrow(() -> new ResourceNotFoundException("Customer", customerId));
        if (!customer.getOrganizationId().equals(organizationId)) {
            throw new OrganizationMismatchException("Customer", customerId, organizationId);
        }
        return customer;
    }

    /**
     * Resolves the customer a payment belongs to.
     *
     * An explicit id wins and must belong to the organization. Otherwise the payer's
     * phone and e-mail are matched exactly within the organization; no match leaves the
     * payment unlinked and more than one distinct match is rejected.
     */
    @Transactional(readOnly = true)
    public Optional<UUID> resolve(UUID organizationId, UUID explicitCustomerId, String phone, String email) {
        if (explicitCustomerId != null) {
            return Optional.of(getForOrganization(organizationId, explicitCustomerId).getId());
        }

        Map<UUID, Customer> matches = new LinkedHashMap<>();
        if (phone != null && !phone.isBlank()) {
            customerRepository.findByOrganizationIdAndPhoneNumber(organizationId, phone)
                    .forEach(c -> matches.put(c.getId(), c));
        }
        if (email != null && !email.isBlank()) {
            customerRepository.findByOrganizationIdAndEmailIgnoreCase(organizationId, email)
                    .forEach(c -> matches.put(c.getId(), c));
        }

        if (matches.size() > 1) {
            throw new AmbiguousCustomerException(phone, email, matches.size());
        }
        return matches.keySet().stream().findFirst();
    }

    /**
     * Called inside the reconciliation transaction.
     */
    @Transactional
    public void recordPayment(UUID customerId, Instant paidAt) {
        customerRepository.findById(customerId).ifPresent(customer -> {
            customer.recordPayment(paidAt);
            customerRepository.save(customer);
        });
    }
}
