package com.flagship.flight_surety.ledger;

import com.flagship.flight_surety.common.AccountId;

/**
 * The entry points through which components may move value.
 *
 * Components never touch balances directly. Each method posts one or more balanced
 * transactions; a method that rejects its call posts nothing.
 */
public interface FundLedger {

    /**
     * Value received from an airline for its membership; held in airline escrow.
     */
    void depositMembershipFund(AccountId airline, long amount);

    /**
     * Premium received from a passenger; held in the insurance pool.
     */
    void depositPremium(AccountId passenger, long amount);

    /**
     * Registration fee received from an oracle.
     */
    void depositOracleFee(AccountId oracle, long amount);

    /**
     * Value received but not returned to its payer; owed back as withdrawable credit.
     */
    void creditUnreturnedValue(AccountId payer, long amount);

    /**
     * Credits an insurance payout from the pool to a passenger.
     *
     * If the pool holds less than {@code amount}, the shortfall is drawn from airline
     * escrow into the pool first.
     *
     * @throws com.flagship.flight_surety.common.SuretyException POOL_UNDERFUNDED if pool
     *         and escrow together cannot cover the payout
     */
    void creditPayout(AccountId passenger, long amount, String reference);

    /**
     * Removes withdrawn value from a holder's credit. Must precede the external transfer.
     *
     * @throws com.flagship.flight_surety.common.SuretyException INSUFFICIENT_CREDIT
     */
    void debitCredit(AccountId holder, long amount);

    /**
     * Reverses a {@link #debitCredit} whose external transfer failed.
     */
    void restoreCredit(AccountId holder, long amount);

    long creditOf(AccountId holder);

    long airlineEscrowTotal();

    long insurancePoolTotal();

    long oracleFeeTotal();

    /**
     * Value received minus value paid out.
     */
    long netValueReceived();

    /**
     * True when the sum of all internal balances equals the net value received.
     */
    boolean isConserved();
}
