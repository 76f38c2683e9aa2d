package com.flagship.payment_settlement.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics written by the outbox publisher.
 *
 * payments: settlement facts for downstream consumers.
 * notifications: wake-up signals for the notification worker.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.payments:payments}")
    private String paymentsTopic;

    @Value("${kafka.topic.notifications:notifications}")
    private String notificationsTopic;

    @Bean
    public NewTopic paymentsTopic() {
        return TopicBuilder.name(paymentsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic notificationsTopic() {
        return TopicBuilder.name(notificationsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
