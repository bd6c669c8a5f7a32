package com.flagship.agent_settlement.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the settlement events topic.
 *
 * Events are keyed by subject id (exchange, wager or jackpot), so 3
 * partitions keep per-subject ordering while allowing parallel consumers.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.settlement-events:settlement-events}")
    private String settlementEventsTopic;

    @Bean
    public NewTopic settlementEventsTopic() {
        return TopicBuilder.name(settlementEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
