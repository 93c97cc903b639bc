package com.flagship.flight_surety.event;

import com.flagship.flight_surety.common.AccountId;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published after credit has been withdrawn and transferred out.
 */
@Value
public class CreditWithdrawnEvent implements SuretyEvent {
    UUID eventId;
    AccountId holder;
    long amount;
    long remainingCredit;
    Instant occurredAt;

    public static final String EVENT_TYPE = "CreditWithdrawn";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return ACCOUNT;
    }

    @Override
    public String getAggregateId() {
        return holder.getValue();
    }

    public static CreditWithdrawnEvent of(AccountId holder, long amount, long remainingCredit) {
        return new CreditWithdrawnEvent(UUID.randomUUID(), holder, amount, remainingCredit, Instant.now());
    }
}
