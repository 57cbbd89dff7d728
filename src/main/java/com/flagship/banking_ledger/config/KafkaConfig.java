package com.flagship.banking_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics the outbox publisher writes to.
 *
 * Account-side events (transactions, lifecycle, interest batches) go to the ledger topic,
 * loan events to the loans topic. Both are keyed by aggregate id, so events for one
 * account or loan stay in one partition.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.ledger:ledger-events}")
    private String ledgerTopic;

    @Value("${kafka.topic.loans:loan-events}")
    private String loansTopic;

    @Bean
    public NewTopic ledgerTopic() {
        return TopicBuilder.name(ledgerTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic loansTopic() {
        return TopicBuilder.name(loansTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
