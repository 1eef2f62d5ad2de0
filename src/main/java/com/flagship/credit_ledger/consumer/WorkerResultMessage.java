package com.flagship.credit_ledger.consumer;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

/**
 * Worker report read from the generation-results topic.
 * type is STARTED, COMPLETED or FAILED.
 */
@Value
@Builder
@Jacksonized
public class WorkerResultMessage {
    UUID eventId;
    String jobId;
    String type;
    String imageUrl;
    Long seed;
    String error;
}
