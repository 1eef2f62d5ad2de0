package com.flagship.credit_ledger.generation;

import com.flagship.credit_ledger.outbox.AggregateTypes;
import com.flagship.credit_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Job queue backed by the transactional outbox; the publisher relays rows to
 * the generation-jobs topic keyed by generation id.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxJobQueue implements JobQueue {

    public static final String EVENT_TYPE = "GenerationRequested";

    private final OutboxService outboxService;

    @Override
    public void enqueue(GenerationJobMessage message) {
        outboxService.saveEvent(AggregateTypes.GENERATION_JOB, message.getGenerationId(), EVENT_TYPE, message);
        log.debug("Queued generation job {}", message.getJobId());
    }
}
