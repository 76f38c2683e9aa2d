package com.flagship.payment_settlement.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payment_settlement.payment.PaymentService;
import com.flagship.payment_settlement.payment.PaymentStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

@Value
public class PaymentStatisticsResponse {

    @JsonProperty("total_count")
    long totalCount;

    @JsonProperty("count_by_status")
    Map<PaymentStatus, Long> countByStatus;

    @JsonProperty("amount_by_status")
    Map<PaymentStatus, BigDecimal> amountByStatus;

    public static PaymentStatisticsResponse from(PaymentService.Statistics statistics) {
        return new PaymentStatisticsResponse(statistics.totalCount(),
                statistics.countByStatus(), statistics.amountByStatus());
    }
}
