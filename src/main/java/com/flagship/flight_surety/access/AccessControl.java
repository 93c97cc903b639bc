package com.flagship.flight_surety.access;

import com.flagship.flight_surety.common.AccountId;
import com.flagship.flight_surety.common.CallContext;
import com.flagship.flight_surety.common.ExecutionSerializer;
import com.flagship.flight_surety.common.SuretyError;
import com.flagship.flight_surety.common.SuretyException;
import com.flagship.flight_surety.config.SuretyProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Gate in front of every state-changing core operation.
 *
 * Tracks the callers (gateways) allowed to invoke privileged transitions and a
 * global operational flag. Only the owner fixed at construction may change either.
 * The operational flag is the manual circuit breaker: while it is off every
 * state-changing call fails with NOT_OPERATIONAL, except turning it back on.
 */
@Component
@Slf4j
public class AccessControl {

    private final AccountId owner;
    private final ExecutionSerializer serializer;
    private final Set<AccountId> authorizedCallers = new LinkedHashSet<>();
    private boolean operational = true;

    public AccessControl(SuretyProperties properties, ExecutionSerializer serializer) {
        this.owner = properties.ownerId();
        this.serializer = serializer;
    }

    public void authorize(AccountId requester, AccountId callerId) {
        serializer.run("authorize", requester, () -> {
            requireOwner(requester);
            requireOperational();
            if (authorizedCallers.add(callerId)) {
                log.info("Caller authorized: callerId={}", callerId);
            }
        });
    }

    public void revoke(AccountId requester, AccountId callerId) {
        serializer.run("revoke", requester, () -> {
            requireOwner(requester);
            requireOperational();
            if (authorizedCallers.remove(callerId)) {
                log.info("Caller authorization revoked: callerId={}", callerId);
            }
        });
    }

    /**
     * Engages or releases the circuit breaker. Allowed while not operational.
     */
    public void setOperational(AccountId requester, boolean mode) {
        serializer.run("setOperational", requester, () -> {
            requireOwner(requester);
            if (operational != mode) {
                operational = mode;
                log.info("Operational status changed: operational={}", mode);
            }
        });
    }

    public boolean isOperational() {
        return serializer.read(() -> operational);
    }

    public boolean isAuthorized(AccountId callerId) {
        return serializer.read(() -> authorizedCallers.contains(callerId));
    }

    /**
     * Checks both preconditions of a state-changing call.
     *
     * @throws SuretyException NOT_OPERATIONAL or UNAUTHORIZED
     */
    public void check(CallContext context) {
        serializer.run("checkAccess", null, () -> {
            requireOperational();
            if (!authorizedCallers.contains(context.getGateway())) {
                throw new SuretyException(SuretyError.UNAUTHORIZED,
                    "Caller is not authorized: " + context.getGateway());
            }
        });
    }

    private void requireOperational() {
        if (!operational) {
            throw new SuretyException(SuretyError.NOT_OPERATIONAL, "Registry is not operational");
        }
    }

    private void requireOwner(AccountId requester) {
        if (!owner.equals(requester)) {
            throw new SuretyException(SuretyError.UNAUTHORIZED, "Caller is not the owner: " + requester);
        }
    }
}
