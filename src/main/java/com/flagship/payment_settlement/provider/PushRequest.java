package com.flagship.payment_settlement.provider;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class PushRequest {
    String phoneNumber;
    BigDecimal amount;
    String accountReference;
    String description;
}
