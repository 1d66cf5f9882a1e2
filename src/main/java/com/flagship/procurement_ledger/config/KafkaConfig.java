package com.flagship.procurement_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Chat topics. Both are keyed by chat identity; partitions let different
 * users be served in parallel while each user's events stay ordered.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.chat-inbound:chat.inbound}")
    private String inboundTopic;

    @Value("${kafka.topic.chat-outbound:chat.outbound}")
    private String outboundTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic chatInboundTopic() {
        return TopicBuilder.name(inboundTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic chatOutboundTopic() {
        return TopicBuilder.name(outboundTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
