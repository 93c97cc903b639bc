package com.flagship.flight_surety.ledger;

/**
 * Side of a ledger leg.
 * A debit takes value out of an account, a credit puts value into one.
 */
public enum EntryType {
    DEBIT,
    CREDIT
}
