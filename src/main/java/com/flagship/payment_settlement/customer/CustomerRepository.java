package com.flagship.payment_settlement.customer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CustomerRepository extends JpaRepository<Customer, UUID> {

    List<Customer> findByOrganizationIdAndPhoneNumber(UUID organizationId, String phoneNumber);

    List<Customer> findByOrganizationIdAndEmailIgnoreCase(UUID organizationId, String email);
}
