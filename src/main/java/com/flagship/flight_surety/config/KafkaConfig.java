package com.flagship.flight_surety.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for registry notifications.
 *
 * Oracle nodes listen for status requests here; dashboards follow admissions,
 * resolutions and payouts.
 */
@Configuration
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.surety:flight-surety}")
    private String suretyTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic suretyTopic() {
        return TopicBuilder.name(suretyTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
