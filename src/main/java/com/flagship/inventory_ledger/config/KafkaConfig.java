package com.flagship.inventory_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics the outbox publisher writes to, one per aggregate family.
 * Events are keyed by aggregate id, so ordering holds per invoice or batch.
 */
@Configuration
public class KafkaConfig {

    private static final int PARTITIONS = 3;

    @Value("${kafka.topic.purchases:inventory.purchases}")
    private String purchasesTopic;

    @Value("${kafka.topic.payments:inventory.payments}")
    private String paymentsTopic;

    @Value("${kafka.topic.production:inventory.production}")
    private String productionTopic;

    @Value("${kafka.topic.stock:inventory.stock}")
    private String stockTopic;

    @Bean
    public NewTopic purchasesTopic() {
        return topic(purchasesTopic);
    }

    @Bean
    public NewTopic paymentsTopic() {
        return topic(paymentsTopic);
    }

    @Bean
    public NewTopic productionTopic() {
        return topic(productionTopic);
    }

    @Bean
    public NewTopic stockTopic() {
        return topic(stockTopic);
    }

    private NewTopic topic(String name) {
        return TopicBuilder.name(name)
                .partitions(PARTITIONS)
                .replicas(1)
                .build();
    }
}
