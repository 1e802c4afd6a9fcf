package com.inboxai.credit_core.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics the outbox publisher writes to. Created on startup if missing.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.credits:credit-events}")
    private String creditsTopic;

    @Value("${kafka.topic.schedules:schedule-events}")
    private String schedulesTopic;

    @Value("${kafka.topic.outbound-messages:outbound-messages}")
    private String outboundMessagesTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic creditsTopic() {
        return TopicBuilder.name(creditsTopic).partitions(partitions).replicas(1).build();
    }

    @Bean
    public NewTopic schedulesTopic() {
        return TopicBuilder.name(schedulesTopic).partitions(partitions).replicas(1).build();
    }

    @Bean
    public NewTopic outboundMessagesTopic() {
        return TopicBuilder.name(outboundMessagesTopic).partitions(partitions).replicas(1).build();
    }
}
