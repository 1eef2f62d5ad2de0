package com.flagship.credit_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable audit record of one ledger mutation.
 *
 * balanceBefore/balanceAfter are totals (available + reserved); the per-component
 * snapshots after the mutation are kept so a single row is enough to explain a balance.
 */
@Value
public class LedgerTransaction {
    UUID id;
    long userId;
    TransactionKind kind;
    long amount;
    long balanceBefore;
    long balanceAfter;
    long availableAfter;
    long reservedAfter;
    UUID referenceId;
    Instant createdAt;
}
