package com.flagship.banking_ledger.outbox;

import com.flagship.banking_ledger.event.AggregateTypes;
import com.flagship.banking_ledger.observability.CorrelationContext;
import com.flagship.banking_ledger.observability.OutboxMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;

/**
 * Polls the outbox and publishes ledger events to Kafka.
 *
 * Events are sent one at a time and acknowledged before being marked published, keyed by
 * aggregate id. When an event fails, later events of the same aggregate in the batch are
 * held back so consumers never see an account's or loan's events out of order.
 * An event that reaches {@code max-retries} is dead-lettered: it stays in the table and is
 * no longer picked up.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;
    private final String ledgerTopic;
    private final String loansTopic;
    private final int batchSize;
    private final int maxRetries;

    public OutboxPublisher(OutboxService outboxService,
                           KafkaTemplate<String, String> kafkaTemplate,
                           OutboxMetrics outboxMetrics,
                           @Value("${kafka.topic.ledger:ledger-events}") String ledgerTopic,
                           @Value("${kafka.topic.loans:loan-events}") String loansTopic,
                           @Value("${outbox.publisher.batch-size:100}") int batchSize,
                           @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxService = outboxService;
        this.kafkaTemplate = kafkaTemplate;
        this.outboxMetrics = outboxMetrics;
        this.ledgerTopic = ledgerTopic;
        this.loansTopic = loansTopic;
        this.batchSize = batchSize;
        this.maxRetries = maxRetries;
    }

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        CorrelationContext.setCorrelationId(null);
        try {
            List<OutboxEvent> events = outboxService.findPublishableEvents(batchSize, maxRetries);
            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} unpublished events to process", events.size());

            Set<String> blockedAggregates = new HashSet<>();
            for (OutboxEvent event : events) {
                String aggregateKey = event.getAggregateType() + ":" + event.getAggregateId();
                if (blockedAggregates.contains(aggregateKey)) {
                    continue;
                }
                if (!publishEvent(event)) {
                    blockedAggregates.add(aggregateKey);
                }
            }

        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        } finally {
            CorrelationContext.clear();
        }
    }

    /**
     * @return true if the event was acknowledged by Kafka
     */
    boolean publishEvent(OutboxEvent event) {
        String topic = topicFor(event.getAggregateType());
        try {
            SendResult<String, String> result =
                    kafkaTemplate.send(topic, event.getAggregateId(), event.getPayload()).get();

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
            return true;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, "interrupted while publishing");
            return false;
        } catch (ExecutionException | RuntimeException e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            recordFailure(event, e.getMessage());
            return false;
        }
    }

    String topicFor(String aggregateType) {
        return AggregateTypes.LOAN.equals(aggregateType) ? loansTopic : ledgerTopic;
    }

    private void recordFailure(OutboxEvent event, String error) {
        int retries = outboxService.markFailed(event.getId(), error);
        outboxMetrics.recordEventPublishFailed(event.getEventType());
        if (retries >= maxRetries) {
            log.warn("Event {} reached max retries ({}), moved to dead letter. eventType={}, aggregateId={}",
                    event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
            outboxMetrics.recordEventDeadLettered(event.getEventType());
        }
    }
}
