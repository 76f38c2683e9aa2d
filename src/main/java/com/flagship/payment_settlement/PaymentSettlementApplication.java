package com.flagship.payment_settlement;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PaymentSettlementApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaymentSettlementApplication.class, args);
    }
}
