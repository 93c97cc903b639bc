package com.flagship.flight_surety.common;

import lombok.NonNull;
import lombok.Value;

/**
 * Who is invoking a core operation.
 *
 * The gateway is the component that forwards the call and must be authorized with
 * {@link com.flagship.flight_surety.access.AccessControl}. The caller is the account
 * on whose behalf the call is made.
 */
@Value(staticConstructor = "of")
public class CallContext {
    @NonNull
    AccountId gateway;
    @NonNull
    AccountId caller;
}
