package com.flagship.flight_surety.insurance;

import lombok.Value;

import java.time.Instant;

/**
 * A passenger's insurance purchase against one flight.
 *
 * The payout is issued at most once; {@link #markPaidOut} rejects a second call.
 */
@Value
public class InsuranceClaim {
    ClaimKey key;
    long premiumPaid;
    boolean payoutIssued;
    long payoutAmount;
    Instant purchasedAt;
    Instant paidOutAt;

    public static InsuranceClaim purchase(ClaimKey key, long premium) {
        return new InsuranceClaim(key, premium, false, 0L, Instant.now(), null);
    }

    /**
     * @throws IllegalStateException if the payout was already issued
     */
    public InsuranceClaim markPaidOut(long payout) {
        if (payoutIssued) {
            throw new IllegalStateException("Payout already issued for claim " + key);
        }
        return new InsuranceClaim(key, premiumPaid, true, payout, purchasedAt, Instant.now());
    }
}
