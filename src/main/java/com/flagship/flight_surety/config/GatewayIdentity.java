package com.flagship.flight_surety.config;

import com.flagship.flight_surety.common.AccountId;
import com.flagship.flight_surety.common.CallContext;
import lombok.Value;

/**
 * Identity under which the HTTP boundary forwards calls into the core.
 */
@Value
public class GatewayIdentity {
    AccountId id;

    public CallContext onBehalfOf(AccountId caller) {
        return CallContext.of(id, caller);
    }
}
