package com.flagship.fund_quarantine.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for quarantine lifecycle events.
 *
 * Events are keyed by quarantine id, so all events of one quarantine land
 * on the same partition in publish order.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.quarantines:fund-quarantine}")
    private String quarantinesTopic;

    @Bean
    @ConditionalOnProperty(name = "kafka.topic.auto-create", havingValue = "true", matchIfMissing = true)
    public NewTopic quarantinesTopic() {
        return TopicBuilder.name(quarantinesTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
