package com.flagship.payment_settlement.integration;

public enum ApiLogStatus {
    SUCCESS,
    FAILED,
    PENDING,
    TIMEOUT
}
