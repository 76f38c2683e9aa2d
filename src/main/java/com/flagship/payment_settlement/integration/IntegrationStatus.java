package com.flagship.payment_settlement.integration;

public enum IntegrationStatus {
    ACTIVE,
    INACTIVE,
    TESTING,
    FAILED
}
