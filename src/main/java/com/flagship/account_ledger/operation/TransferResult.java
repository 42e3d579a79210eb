package com.flagship.account_ledger.operation;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Outcome of a committed transfer. The correlation id is shared by the
 * TRANSFER_OUT and TRANSFER_IN ledger entries.
 */
@Value
@Builder
public class TransferResult {
    UUID correlationId;
    String fromAccountNumber;
    String toAccountNumber;
    long fromBalanceCents;
    long toBalanceCents;
    String currency;
}
