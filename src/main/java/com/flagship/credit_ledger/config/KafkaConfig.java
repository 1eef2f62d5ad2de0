package com.flagship.credit_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics this service produces to or consumes from.
 *
 * generation-jobs:     dispatch messages for the worker pool (keyed by generation id)
 * generation-results:  worker reports (started / completed / failed)
 * user-notifications:  outcome messages for the bot front-end
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.generation-jobs:generation-jobs}")
    private String generationJobsTopic;

    @Value("${kafka.topic.generation-results:generation-results}")
    private String generationResultsTopic;

    @Value("${kafka.topic.user-notifications:user-notifications}")
    private String userNotificationsTopic;

    @Bean
    public NewTopic generationJobsTopic() {
        return TopicBuilder.name(generationJobsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic generationResultsTopic() {
        return TopicBuilder.name(generationResultsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic userNotificationsTopic() {
        return TopicBuilder.name(userNotificationsTopic)
                .partitions(1)
                .replicas(1)
                .build();
    }
}
