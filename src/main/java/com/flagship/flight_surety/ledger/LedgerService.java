package com.flagship.flight_surety.ledger;

import com.flagship.flight_surety.common.AccountId;
import com.flagship.flight_surety.common.ExecutionSerializer;
import com.flagship.flight_surety.common.SuretyError;
import com.flagship.flight_surety.common.SuretyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Double-entry fund ledger of the registry.
 *
 * This service enforces the core invariants:
 * 1. Debits must equal credits (balanced transactions)
 * 2. Ledger entries are immutable once written
 * 3. No internal account is ever overdrawn
 *
 * The external account is the counterparty of every inflow and outflow, so the
 * balances of all accounts always sum to zero and the internal balances sum to the
 * net value received.
 */
@Service
@Slf4j
public class LedgerService implements FundLedger {

    private final ExecutionSerializer serializer;
    private final List<LedgerEntry> journal = new ArrayList<>();
    private final Map<LedgerAccount, Long> balances = new HashMap<>();
    private long nextSequenceNumber = 1;

    public LedgerService(ExecutionSerializer serializer) {
        this.serializer = serializer;
    }

    /**
     * Posts a transaction to the ledger.
     *
     * @param request The transaction request with debits and credits
     * @return The id of the created transaction
     * @throws IllegalArgumentException if the transaction is not balanced
     * @throws IllegalStateException if a debit would overdraw an internal account
     */
    public UUID postTransaction(TransactionRequest request) {
        return serializer.execute("postTransaction", null, () -> {
            if (!request.isBalanced()) {
                throw new IllegalArgumentException(
                    String.format("Transaction is not balanced: debits=%d, credits=%d",
                        request.getDebitTotal(), request.getCreditTotal()));
            }
            validateNoOverdraft(request);

            UUID transactionId = UUID.randomUUID();
            Instant now = Instant.now();
            for (TransactionRequest.DebitCredit debit : request.getDebits()) {
                createLedgerEntry(transactionId, debit, EntryType.DEBIT, now);
            }
            for (TransactionRequest.DebitCredit credit : request.getCredits()) {
                createLedgerEntry(transactionId, credit, EntryType.CREDIT, now);
            }
            log.debug("Posted ledger transaction: txId={}, amount={}, description={}",
                transactionId, request.getDebitTotal(), request.getDescription());
            return transactionId;
        });
    }

    @Override
    public void depositMembershipFund(AccountId airline, long amount) {
        postTransaction(TransactionRequest.transfer(
            "Membership fund from " + airline, LedgerAccount.EXTERNAL, LedgerAccount.AIRLINE_ESCROW, amount));
    }

    @Override
    public void depositPremium(AccountId passenger, long amount) {
        postTransaction(TransactionRequest.transfer(
            "Premium from " + passenger, LedgerAccount.EXTERNAL, LedgerAccount.INSURANCE_POOL, amount));
    }

    @Override
    public void depositOracleFee(AccountId oracle, long amount) {
        postTransaction(TransactionRequest.transfer(
            "Oracle registration fee from " + oracle, LedgerAccount.EXTERNAL, LedgerAccount.ORACLE_FEES, amount));
    }

    @Override
    public void creditUnreturnedValue(AccountId payer, long amount) {
        postTransaction(TransactionRequest.transfer(
            "Unreturned value owed to " + payer, LedgerAccount.EXTERNAL, LedgerAccount.creditOf(payer), amount));
    }

    @Override
    public void creditPayout(AccountId passenger, long amount, String reference) {
        serializer.run("creditPayout", passenger, () -> {
            long pool = balanceOf(LedgerAccount.INSURANCE_POOL);
            long shortfall = amount - pool;
            if (shortfall > 0 && shortfall > balanceOf(LedgerAccount.AIRLINE_ESCROW)) {
                throw new SuretyException(SuretyError.POOL_UNDERFUNDED,
                    String.format("Cannot cover payout of %d for %s: pool=%d, escrow=%d",
                        amount, reference, pool, balanceOf(LedgerAccount.AIRLINE_ESCROW)));
            }
            if (shortfall > 0) {
                postTransaction(TransactionRequest.transfer(
                    "Underwriting draw for " + reference,
                    LedgerAccount.AIRLINE_ESCROW, LedgerAccount.INSURANCE_POOL, shortfall));
                log.info("Drew {} from airline escrow into insurance pool for {}", shortfall, reference);
            }
            postTransaction(TransactionRequest.transfer(
                "Payout " + reference, LedgerAccount.INSURANCE_POOL, LedgerAccount.creditOf(passenger), amount));
        });
    }

    @Override
    public void debitCredit(AccountId holder, long amount) {
        serializer.run("debitCredit", holder, () -> {
            long credit = balanceOf(LedgerAccount.creditOf(holder));
            if (amount > credit) {
                throw new SuretyException(SuretyError.INSUFFICIENT_CREDIT,
                    String.format("Requested %d but credit of %s is %d", amount, holder, credit));
            }
            postTransaction(TransactionRequest.transfer(
                "Withdrawal by " + holder, LedgerAccount.creditOf(holder), LedgerAccount.EXTERNAL, amount));
        });
    }

    @Override
    public void restoreCredit(AccountId holder, long amount) {
        postTransaction(TransactionRequest.transfer(
            "Reversal of failed withdrawal by " + holder,
            LedgerAccount.EXTERNAL, LedgerAccount.creditOf(holder), amount));
    }

    @Override
    public long creditOf(AccountId holder) {
        return getAccountBalance(LedgerAccount.creditOf(holder));
    }

    @Override
    public long airlineEscrowTotal() {
        return getAccountBalance(LedgerAccount.AIRLINE_ESCROW);
    }

    @Override
    public long insurancePoolTotal() {
        return getAccountBalance(LedgerAccount.INSURANCE_POOL);
    }

    @Override
    public long oracleFeeTotal() {
        return getAccountBalance(LedgerAccount.ORACLE_FEES);
    }

    @Override
    public long netValueReceived() {
        return -getAccountBalance(LedgerAccount.EXTERNAL);
    }

    @Override
    public boolean isConserved() {
        return serializer.read(() -> {
            long internal = balances.entrySet().stream()
                .filter(e -> !e.getKey().isExternal())
                .mapToLong(Map.Entry::getValue)
                .sum();
            return internal == -balanceOf(LedgerAccount.EXTERNAL);
        });
    }

    public long getAccountBalance(LedgerAccount account) {
        return serializer.read(() -> balanceOf(account));
    }

    /**
     * Gets all ledger entries for a transaction.
     */
    public List<LedgerEntry> getLedgerEntriesForTransaction(UUID transactionId) {
        return serializer.read(() -> journal.stream()
            .filter(entry -> entry.getTransactionId().equals(transactionId))
            .toList());
    }

    public List<LedgerEntry> getJournal() {
        return serializer.read(() -> List.copyOf(journal));
    }

    private void validateNoOverdraft(TransactionRequest request) {
        Map<LedgerAccount, Long> outgoing = new HashMap<>();
        for (TransactionRequest.DebitCredit debit : request.getDebits()) {
            outgoing.merge(debit.getAccount(), debit.getAmount(), Long::sum);
        }
        for (Map.Entry<LedgerAccount, Long> entry : outgoing.entrySet()) {
            LedgerAccount account = entry.getKey();
            if (!account.isExternal() && entry.getValue() > balanceOf(account)) {
                throw new IllegalStateException(
                    String.format("Transaction would overdraw %s: balance=%d, debit=%d",
                        account, balanceOf(account), entry.getValue()));
            }
        }
    }

    private void createLedgerEntry(UUID transactionId, TransactionRequest.DebitCredit leg,
                                   EntryType entryType, Instant createdAt) {
        long delta = entryType == EntryType.CREDIT ? leg.getAmount() : -leg.getAmount();
        balances.merge(leg.getAccount(), delta, Long::sum);
        journal.add(new LedgerEntry(
            nextSequenceNumber++,
            transactionId,
            leg.getAccount(),
            leg.getAmount(),
            entryType,
            leg.getDescription(),
            createdAt
        ));
    }

    private long balanceOf(LedgerAccount account) {
        return balances.getOrDefault(account, 0L);
    }
}
