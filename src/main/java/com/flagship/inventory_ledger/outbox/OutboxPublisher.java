package com.flagship.inventory_ledger.outbox;

import com.flagship.inventory_ledger.event.AggregateType;
import com.flagship.inventory_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Polls the outbox and publishes events to Kafka.
 *
 * Sends are synchronous and keyed by aggregate id, so events of one invoice
 * or batch reach their partition in commit order. Events that failed
 * {@code outbox.publisher.max-retries} times stay in the table for manual
 * inspection.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private static final long SEND_TIMEOUT_SECONDS = 10;

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.purchases:inventory.purchases}")
    private String purchasesTopic;

    @Value("${kafka.topic.payments:inventory.payments}")
    private String paymentsTopic;

    @Value("${kafka.topic.production:inventory.production}")
    private String productionTopic;

    @Value("${kafka.topic.stock:inventory.stock}")
    private String stockTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> events;
        try {
            events = outboxService.findUnpublishedEvents(batchSize, maxRetries);
        } catch (RuntimeException e) {
            log.error("Error polling outbox", e);
            return;
        }
        if (events.isEmpty()) {
            return;
        }
        log.debug("Found {} unpublished events to process", events.size());
        for (OutboxEvent event : events) {
            publishEvent(event);
        }
    }

    private void publishEvent(OutboxEvent event) {
        try {
            String topic = topicFor(event.getAggregateType());
            SendResult<String, String> result = kafkaTemplate
                    .send(topic, event.getAggregateId(), event.getPayload())
                    .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "interrupted");
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());
            if (event.getRetryCount() + 1 >= maxRetries) {
                log.warn("Event {} reached max retries ({}), leaving it for manual handling. eventType={}, aggregateId={}",
                        event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }

    String topicFor(String aggregateType) {
        return switch (AggregateType.fromCode(aggregateType)) {
            case PURCHASE_INVOICE -> purchasesTopic;
            case PAYMENT -> paymentsTopic;
            case PRODUCTION_BATCH -> productionTopic;
            case ITEM -> stockTopic;
        };
    }

    /**
     * Runs one polling cycle immediately.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }
}
