package com.flagship.payday.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topics: published payment events and inbound node notifications.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.events:payday.events}")
    private String eventsTopic;

    @Value("${kafka.topic.node-notifications:payday.node-notifications}")
    private String nodeNotificationsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    /**
     * Events are keyed by aggregate id, so each payment's events share a partition.
     */
    @Bean
    public NewTopic eventsTopic() {
        return TopicBuilder.name(eventsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic nodeNotificationsTopic() {
        return TopicBuilder.name(nodeNotificationsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
