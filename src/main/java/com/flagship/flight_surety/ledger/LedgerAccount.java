package com.flagship.flight_surety.ledger;

import com.flagship.flight_surety.common.AccountId;
import lombok.Value;

/**
 * An account of the fund ledger.
 *
 * Aggregate accounts have no holder. Credit accounts belong to one participant
 * and hold what the registry owes them.
 */
@Value
public class LedgerAccount {
    Type type;
    AccountId holder;

    public enum Type {
        /**
         * Counterparty for value entering or leaving the registry. Its balance is
         * the negated net value held by the registry.
         */
        EXTERNAL,
        AIRLINE_ESCROW,
        INSURANCE_POOL,
        ORACLE_FEES,
        CREDIT
    }

    public static final LedgerAccount EXTERNAL = new LedgerAccount(Type.EXTERNAL, null);
    public static final LedgerAccount AIRLINE_ESCROW = new LedgerAccount(Type.AIRLINE_ESCROW, null);
    public static final LedgerAccount INSURANCE_POOL = new LedgerAccount(Type.INSURANCE_POOL, null);
    public static final LedgerAccount ORACLE_FEES = new LedgerAccount(Type.ORACLE_FEES, null);

    public static LedgerAccount creditOf(AccountId holder) {
        if (holder == null) {
            throw new IllegalArgumentException("Credit account requires a holder");
        }
        return new LedgerAccount(Type.CREDIT, holder);
    }

    public boolean isExternal() {
        return type == Type.EXTERNAL;
    }

    @Override
    public String toString() {
        return holder == null ? type.name() : type.name() + ":" + holder;
    }
}
