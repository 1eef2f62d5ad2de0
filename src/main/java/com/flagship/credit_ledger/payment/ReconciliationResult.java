package com.flagship.credit_ledger.payment;

import lombok.Value;

import java.util.UUID;

@Value
public class ReconciliationResult {
    ReconciliationOutcome outcome;
    String paymentId;
    UUID topupId;

    public boolean isDuplicate() {
        return outcome == ReconciliationOutcome.DUPLICATE;
    }
}
