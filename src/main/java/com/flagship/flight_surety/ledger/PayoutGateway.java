package com.flagship.flight_surety.ledger;

import com.flagship.flight_surety.common.AccountId;

/**
 * Moves value out of the registry to an external account.
 *
 * Callers must have removed the value from the ledger before calling {@link #send};
 * an implementation may call back into the registry while the transfer is in flight.
 */
public interface PayoutGateway {

    /**
     * @throws RuntimeException if the transfer did not happen
     */
    void send(AccountId recipient, long amount);
}
