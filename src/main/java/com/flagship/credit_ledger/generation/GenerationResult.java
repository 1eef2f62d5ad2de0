package com.flagship.credit_ledger.generation;

import lombok.Value;

/**
 * What a worker produced for a completed job.
 */
@Value
public class GenerationResult {
    String imageUrl;
    Long seed;
}
