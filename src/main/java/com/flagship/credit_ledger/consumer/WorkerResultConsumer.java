package com.flagship.credit_ledger.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.credit_ledger.generation.GenerationNotFoundException;
import com.flagship.credit_ledger.generation.GenerationResult;
import com.flagship.credit_ledger.generation.JobCoordinator;
import com.flagship.credit_ledger.generation.WorkerOutcome;
import com.flagship.credit_ledger.ledger.InvariantViolationException;
import com.flagship.credit_ledger.observability.CorrelationContext;
import com.flagship.credit_ledger.outbox.AggregateTypes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.UUID;

/**
 * Feeds worker reports from the generation-results topic into the coordinator.
 *
 * Offsets are acknowledged only after the report has been applied (or found to
 * be a duplicate). On any other failure the exception propagates without an ack
 * and the record is redelivered. Reports that can never apply (malformed,
 * unknown job, unknown type, ledger invariant violation) are recorded as
 * skipped where possible and acknowledged.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class WorkerResultConsumer {

    static final String CONSUMER_GROUP = "worker-result-consumer";

    private final IdempotentEventProcessor eventProcessor;
    private final JobCoordinator jobCoordinator;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.generation-results:generation-results}",
        groupId = "${spring.kafka.consumer.group-id:credit-ledger-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        restoreCorrelationId(record);
        log.debug("Received worker report: partition={}, offset={}, key={}",
                record.partition(), record.offset(), record.key());

        try {
            WorkerResultMessage message = parse(record.value());
            if (message == null) {
                ack.acknowledge();
                return;
            }

            handle(message);
            ack.acknowledge();

        } catch (RuntimeException e) {
            log.error("Error processing worker report at offset {}: {}", record.offset(), e.getMessage(), e);
            throw e;
        } finally {
            CorrelationContext.clear();
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
        }
    }

    void handle(WorkerResultMessage message) {
        String type = message.getType().toUpperCase(Locale.ROOT);
        UUID eventId = message.getEventId() != null
                ? message.getEventId()
                : UUID.nameUUIDFromBytes((message.getJobId() + ":" + type).getBytes(StandardCharsets.UTF_8));
        UUID aggregateId = aggregateIdFor(message.getJobId());

        Runnable handler = switch (type) {
            case "STARTED" -> () -> jobCoordinator.markProcessing(message.getJobId());
            case "COMPLETED" -> () -> jobCoordinator.report(message.getJobId(),
                    WorkerOutcome.completed(new GenerationResult(message.getImageUrl(), message.getSeed())));
            case "FAILED" -> () -> jobCoordinator.report(message.getJobId(), WorkerOutcome.failed(message.getError()));
            default -> null;
        };

        if (handler == null) {
            log.warn("Unknown worker report type {} for job {}, skipping", type, message.getJobId());
            eventProcessor.skipEvent(eventId, type, AggregateTypes.GENERATION_JOB, aggregateId,
                    CONSUMER_GROUP, "Unknown report type");
            return;
        }

        try {
            boolean processed = eventProcessor.processEvent(eventId, type, AggregateTypes.GENERATION_JOB,
                    aggregateId, CONSUMER_GROUP, handler);
            if (processed) {
                log.info("Applied worker report: type={}, jobId={}", type, message.getJobId());
            }
        } catch (GenerationNotFoundException e) {
            log.warn("Worker report for unknown job {}, skipping", message.getJobId());
            eventProcessor.skipEvent(eventId, type, AggregateTypes.GENERATION_JOB, aggregateId,
                    CONSUMER_GROUP, e.getMessage());
        } catch (InvariantViolationException e) {
            // Redelivery cannot fix this; the job is left for manual reconciliation
            log.error("Ledger invariant violated applying {} report for job {}, skipping: {}",
                    type, message.getJobId(), e.getMessage());
            eventProcessor.skipEvent(eventId, type, AggregateTypes.GENERATION_JOB, aggregateId,
                    CONSUMER_GROUP, e.getMessage());
        }
    }

    private WorkerResultMessage parse(String rawPayload) {
        try {
            WorkerResultMessage message = objectMapper.readValue(rawPayload, WorkerResultMessage.class);
            if (message.getJobId() == null || message.getType() == null) {
                log.warn("Worker report without jobId or type, acknowledging to skip: {}", rawPayload);
                return null;
            }
            return message;
        } catch (JsonProcessingException e) {
            log.warn("Could not parse worker report, acknowledging to skip: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static UUID aggregateIdFor(String jobId) {
        try {
            return UUID.fromString(jobId);
        } catch (IllegalArgumentException e) {
            return UUID.nameUUIDFromBytes(jobId.getBytes(StandardCharsets.UTF_8));
        }
    }

    private static void restoreCorrelationId(ConsumerRecord<String, String> record) {
        Header header = record.headers().lastHeader(CorrelationContext.CORRELATION_ID_HEADER);
        String correlationId = header != null && header.value() != null
                ? new String(header.value(), StandardCharsets.UTF_8)
                : CorrelationContext.generateCorrelationId();
        CorrelationContext.setCorrelationId(correlationId);
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, CorrelationContext.getCorrelationId());
    }
}
