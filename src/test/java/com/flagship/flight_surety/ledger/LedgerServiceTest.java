package com.flagship.flight_surety.ledger;

import com.flagship.flight_surety.SuretyFixture;
import com.flagship.flight_surety.common.AccountId;
import com.flagship.flight_surety.common.SuretyError;
import com.flagship.flight_surety.common.SuretyException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static com.flagship.flight_surety.SuretyFixture.UNIT;
import static com.flagship.flight_surety.SuretyFixture.account;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the double-entry fund ledger.
 *
 * These tests verify that:
 * - Only balanced transactions are posted
 * - Internal accounts are never overdrawn
 * - Payouts draw on airline escrow when the pool is short
 * - The internal balances always equal the net value received
 */
class LedgerServiceTest {

    private static final AccountId AIRLINE = account("airline");
    private static final AccountId PASSENGER = account("passenger");

    private LedgerService ledger;

    @BeforeEach
    void setUp() {
        ledger = new SuretyFixture().ledger;
    }

    @Test
    @DisplayName("Transfer writes one debit and one credit entry")
    void transferWritesTwoEntries() {
        UUID txId = ledger.postTransaction(TransactionRequest.transfer(
            "premium", LedgerAccount.EXTERNAL, LedgerAccount.INSURANCE_POOL, UNIT));

        List<LedgerEntry> entries = ledger.getLedgerEntriesForTransaction(txId);
        assertEquals(2, entries.size());
        assertEquals(EntryType.DEBIT, entries.get(0).getEntryType());
        assertEquals(LedgerAccount.EXTERNAL, entries.get(0).getAccount());
        assertEquals(EntryType.CREDIT, entries.get(1).getEntryType());
        assertEquals(LedgerAccount.INSURANCE_POOL, entries.get(1).getAccount());
        assertTrue(entries.get(0).getSequenceNumber() < entries.get(1).getSequenceNumber());
    }

    @Test
    @DisplayName("Unbalanced transaction is rejected")
    void unbalancedTransactionIsRejected() {
        TransactionRequest request = new TransactionRequest("broken",
            List.of(TransactionRequest.DebitCredit.of(LedgerAccount.EXTERNAL, 2 * UNIT, "out")),
            List.of(TransactionRequest.DebitCredit.of(LedgerAccount.INSURANCE_POOL, UNIT, "in")));

        assertThrows(IllegalArgumentException.class, () -> ledger.postTransaction(request));
        assertTrue(ledger.getJournal().isEmpty());
    }

    @Test
    @DisplayName("Internal accounts cannot be overdrawn")
    void overdraftIsRejected() {
        ledger.depositPremium(PASSENGER, UNIT);

        assertThrows(IllegalStateException.class, () -> ledger.postTransaction(TransactionRequest.transfer(
            "too much", LedgerAccount.INSURANCE_POOL, LedgerAccount.creditOf(PASSENGER), 2 * UNIT)));
        assertEquals(UNIT, ledger.insurancePoolTotal());
    }

    @Test
    @DisplayName("Deposits land in their aggregate accounts")
    void depositsAreTracked() {
        ledger.depositMembershipFund(AIRLINE, 10 * UNIT);
        ledger.depositPremium(PASSENGER, UNIT);
        ledger.depositOracleFee(account("oracle"), UNIT);

        assertEquals(10 * UNIT, ledger.airlineEscrowTotal());
        assertEquals(UNIT, ledger.insurancePoolTotal());
        assertEquals(UNIT, ledger.oracleFeeTotal());
        assertEquals(12 * UNIT, ledger.netValueReceived());
        assertTrue(ledger.isConserved());
    }

    @Test
    @DisplayName("Payout is paid from the pool when it suffices")
    void payoutFromPool() {
        ledger.depositPremium(PASSENGER, 2 * UNIT);
        ledger.depositMembershipFund(AIRLINE, 10 * UNIT);

        ledger.creditPayout(PASSENGER, 3 * UNIT / 2, "claim");

        assertEquals(3 * UNIT / 2, ledger.creditOf(PASSENGER));
        assertEquals(UNIT / 2, ledger.insurancePoolTotal());
        assertEquals(10 * UNIT, ledger.airlineEscrowTotal());
    }

    @Test
    @DisplayName("Pool shortfall is drawn from airline escrow")
    void shortfallIsDrawnFromEscrow() {
        ledger.depositMembershipFund(AIRLINE, 10 * UNIT);
        ledger.depositPremium(PASSENGER, UNIT);

        ledger.creditPayout(PASSENGER, 3 * UNIT / 2, "claim");

        assertEquals(3 * UNIT / 2, ledger.creditOf(PASSENGER));
        assertEquals(0, ledger.insurancePoolTotal());
        assertEquals(10 * UNIT - UNIT / 2, ledger.airlineEscrowTotal());
        assertEquals(11 * UNIT, ledger.netValueReceived());
        assertTrue(ledger.isConserved());
    }

    @Test
    @DisplayName("Payout beyond pool and escrow is rejected without any posting")
    void underfundedPayoutIsRejected() {
        ledger.depositPremium(PASSENGER, UNIT);
        int journalSize = ledger.getJournal().size();

        SuretyException e = assertThrows(SuretyException.class,
            () -> ledger.creditPayout(PASSENGER, 3 * UNIT / 2, "claim"));

        assertEquals(SuretyError.POOL_UNDERFUNDED, e.getError());
        assertEquals(journalSize, ledger.getJournal().size());
        assertEquals(0, ledger.creditOf(PASSENGER));
    }

    @Test
    @DisplayName("Credit cannot be debited beyond its balance")
    void insufficientCredit() {
        ledger.creditUnreturnedValue(PASSENGER, UNIT);

        SuretyException e = assertThrows(SuretyException.class, () -> ledger.debitCredit(PASSENGER, 2 * UNIT));
        assertEquals(SuretyError.INSUFFICIENT_CREDIT, e.getError());

        ledger.debitCredit(PASSENGER, UNIT);
        assertEquals(0, ledger.creditOf(PASSENGER));
        assertEquals(0, ledger.netValueReceived());
    }

    @Test
    @DisplayName("Restored credit reverses a debit")
    void restoreCredit() {
        ledger.creditUnreturnedValue(PASSENGER, UNIT);
        ledger.debitCredit(PASSENGER, UNIT);

        ledger.restoreCredit(PASSENGER, UNIT);

        assertEquals(UNIT, ledger.creditOf(PASSENGER));
        assertEquals(UNIT, ledger.netValueReceived());
        assertTrue(ledger.isConserved());
    }
}
