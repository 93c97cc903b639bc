package com.flagship.flight_surety.ledger;

import lombok.Value;

import java.util.List;
import java.util.Objects;

/**
 * Request object for posting a transaction.
 * Contains debits and credits that must balance.
 *
 * Invariant: Sum of debits must equal sum of credits.
 */
@Value
public class TransactionRequest {
    String description;
    List<DebitCredit> debits;
    List<DebitCredit> credits;

    /**
     * Single-leg transfer from one account to another.
     */
    public static TransactionRequest transfer(String description, LedgerAccount from, LedgerAccount to, long amount) {
        return new TransactionRequest(
            description,
            List.of(DebitCredit.of(from, amount, description)),
            List.of(DebitCredit.of(to, amount, description))
        );
    }

    public boolean isBalanced() {
        return getDebitTotal() == getCreditTotal();
    }

    public long getDebitTotal() {
        return debits.stream().mapToLong(DebitCredit::getAmount).sum();
    }

    public long getCreditTotal() {
        return credits.stream().mapToLong(DebitCredit::getAmount).sum();
    }

    /**
     * Represents a single debit or credit entry.
     */
    @Value
    public static class DebitCredit {
        LedgerAccount account;
        long amount;
        String description;

        private DebitCredit(LedgerAccount account, long amount, String description) {
            this.account = Objects.requireNonNull(account);
            if (amount <= 0) {
                throw new IllegalArgumentException("Amount must be positive");
            }
            this.amount = amount;
            this.description = description;
        }

        public static DebitCredit of(LedgerAccount account, long amount, String description) {
            return new DebitCredit(account, amount, description);
        }
    }
}
