package com.flagship.flight_surety.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One leg of a posted ledger transaction. Entries are never modified once written.
 */
@Value
public class LedgerEntry {
    long sequenceNumber;
    UUID transactionId;
    LedgerAccount account;
    long amount;
    EntryType entryType;
    String description;
    Instant createdAt;
}
