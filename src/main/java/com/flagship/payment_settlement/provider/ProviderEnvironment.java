package com.flagship.payment_settlement.provider;

public enum ProviderEnvironment {
    SANDBOX,
    PRODUCTION
}
