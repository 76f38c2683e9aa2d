package com.flagship.payment_settlement.integration;

import com.flagship.payment_settlement.exception.ResourceNotFoundException;
import com.flagship.payment_settlement.organization.OrganizationService;
import com.flagship.payment_settlement.provider.InvalidCredentialsException;
import com.flagship.payment_settlement.provider.ProviderCredentials;
import com.flagship.payment_settlement.provider.ProviderEnvironment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.Optional;
import java.util.UUID;

@Service
@Slf4j
public class IntegrationService {

    static final String WEBHOOK_PATH = "/webhooks/mpesa/";

    private final IntegrationRepository integrationRepository;
    private final OrganizationService organizationService;
    private final String callbackBaseUrl;

    public IntegrationService(IntegrationRepository integrationRepository,
                              OrganizationService organizationService,
                              @Value("${mpesa.callback-base-url:http://localhost:8080}") String callbackBaseUrl) {
        this.integrationRepository = integrationRepository;
        this.organizationService = organizationService;
        this.callbackBaseUrl = callbackBaseUrl.endsWith("/")
                ? callbackBaseUrl.substring(0, callbackBaseUrl.length() - 1)
                : callbackBaseUrl;
    }

    @Transactional
    public Integration registerMpesa(UUID organizationId, String name, ProviderEnvironment environment,
                                     String consumerKey, String consumerSecret,
                                     String businessShortCode, String passkey) {
        organizationService.getRequired(organizationId);
        Integration saved = integrationRepository.save(Integration.mpesa(
                organizationId, name, environment, consumerKey, consumerSecret, businessShortCode, passkey));
        log.info("Registered {} M-Pesa integration {} for organization {}", environment, saved.getId(), organizationId);
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<Integration> findById(UUID integrationId) {
        return integrationRepository.findById(integrationId);
    }

    /**
     * Active M-Pesa integration used to dispatch for an organization. Production wins
     * over sandbox when both are active.
     *
     * @throws InvalidCredentialsException if the organization has none
     */
    @Transactional(readOnly = true)
    public Integration getActiveMpesa(UUID organizationId) {
        return integrationRepository
                .findByOrganizationIdAndProviderAndStatus(organizationId, Integration.PROVIDER_MPESA,
                        IntegrationStatus.ACTIVE)
                .stream()
                .max(Comparator.comparing(i -> i.getEnvironment() == ProviderEnvironment.PRODUCTION))
                .orElseThrow(() -> new InvalidCredentialsException(
                        "Organization " + organizationId + " has no active M-Pesa integration", null, null));
    }

    public ProviderCredentials credentialsFor(Integration integration) {
        return ProviderCredentials.builder()
                .environment(integration.getEnvironment())
                .consumerKey(integration.getConsumerKey())
                .consumerSecret(integration.getConsumerSecret())
                .businessShortCode(integration.getBusinessShortCode())
                .passkey(integration.getPasskey())
                .callbackUrl(callbackUrlFor(integration.getId()))
                .build();
    }

    public String callbackUrlFor(UUID integrationId) {
        return callbackBaseUrl + WEBHOOK_PATH + integrationId;
    }

    @Transactional
    public Integration rotateWebhookSecret(UUID integrationId) {
        Integration integration = integrationRepository.findById(integrationId)
                .orElseThrow(() -> new ResourceNotFoundException("Integration", integrationId));
        integration.rotateWebhookSecret();
        log.warn("Webhook secret rotated for integration {}", integrationId);
        return integrationRepository.save(integration);
    }

    @Transactional
    public Integration changeStatus(UUID integrationId, IntegrationStatus status) {
        Integration integration = integrationRepository.findById(integrationId)
                .orElseThrow(() -> new ResourceNotFoundException("Integration", integrationId));
        integration.changeStatus(status);
        return integrationRepository.save(integration);
    }
}
