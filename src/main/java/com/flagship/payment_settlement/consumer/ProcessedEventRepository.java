package com.flagship.payment_settlement.consumer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ProcessedEventRepository extends JpaRepository<ProcessedEventEntity, UUID> {

    boolean existsByEventIdAndConsumerGroup(UUID eventId, String consumerGroup);

    Optional<ProcessedEventEntity> findByEventIdAndConsumerGroup(UUID eventId, String consumerGroup);

    long countByConsumerGroup(String consumerGroup);
}
