package com.flagship.credit_ledger.outbox;

import com.flagship.credit_ledger.observability.CorrelationContext;
import com.flagship.credit_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Relays committed outbox rows to Kafka.
 *
 * GenerationJob messages go to the generation-jobs topic (the job queue the
 * worker pool consumes), UserNotification messages go to user-notifications.
 * The aggregate id is the record key, so all messages about one generation or
 * topup land on one partition in order.
 *
 * Delivery is at-least-once: a crash between the Kafka ack and markPublished
 * re-sends the message, which is why every consumer dedups.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    public static final String EVENT_TYPE_HEADER = "eventType";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${outbox.publisher.enabled:true}")
    private boolean enabled;

    @Value("${kafka.topic.generation-jobs:generation-jobs}")
    private String generationJobsTopic;

    @Value("${kafka.topic.user-notifications:user-notifications}")
    private String userNotificationsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Scheduled(fixedDelayString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        if (!enabled) {
            return;
        }
        relayBatch();
    }

    /**
     * Relays one batch regardless of the enabled flag.
     *
     * @return number of events handed to Kafka successfully
     */
    public int relayBatch() {
        int published = 0;
        try {
            List<OutboxEvent> events = outboxService.findUnpublishedEvents(batchSize);
            if (events.isEmpty()) {
                return 0;
            }

            log.debug("Found {} unpublished events to relay", events.size());

            for (OutboxEvent event : events) {
                if (publishEvent(event)) {
                    published++;
                }
            }
        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
        return published;
    }

    private boolean publishEvent(OutboxEvent event) {
        try {
            ProducerRecord<String, String> record = new ProducerRecord<>(
                    topicFor(event), event.getAggregateId().toString(), event.getPayload());
            record.headers().add(EVENT_TYPE_HEADER, event.getEventType().getBytes(StandardCharsets.UTF_8));
            if (event.getCorrelationId() != null) {
                record.headers().add(CorrelationContext.CORRELATION_ID_HEADER,
                        event.getCorrelationId().getBytes(StandardCharsets.UTF_8));
            }

            // Synchronous send keeps per-aggregate ordering
            SendResult<String, String> result = kafkaTemplate.send(record).get();

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
            outboxService.markFailed(event.getId(), "interrupted");
            return false;
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());

            if (outboxService.markFailed(event.getId(), e.getMessage())) {
                log.error("Event {} exhausted its retries and is now a dead letter: eventType={}, aggregateId={}",
                        event.getId(), event.getEventType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
            return false;
        }
    }

    private String topicFor(OutboxEvent event) {
        return switch (event.getAggregateType()) {
            case AggregateTypes.GENERATION_JOB -> generationJobsTopic;
            case AggregateTypes.USER_NOTIFICATION -> userNotificationsTopic;
            default -> throw new IllegalStateException(
                    "No topic configured for aggregate type " + event.getAggregateType());
        };
    }
}
