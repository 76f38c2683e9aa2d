package com.flagship.payment_settlement.integration;

public enum ApiRequestType {
    MPESA_AUTH,
    MPESA_STK_PUSH,
    WEBHOOK
}
