package com.flagship.budget_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the topic ledger events are published to.
 * Partitioned by aggregate id, so events of one transfer, run or loan stay ordered.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.ledger-events:budget-ledger-events}")
    private String ledgerEventsTopic;

    @Bean
    public NewTopic ledgerEventsTopic() {
        return TopicBuilder.name(ledgerEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
