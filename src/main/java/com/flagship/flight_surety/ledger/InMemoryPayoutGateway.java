package com.flagship.flight_surety.ledger;

import com.flagship.flight_surety.common.AccountId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default gateway. Keeps the running external balance received by each account.
 */
@Component
@Slf4j
public class InMemoryPayoutGateway implements PayoutGateway {

    private final Map<AccountId, Long> received = new ConcurrentHashMap<>();

    @Override
    public void send(AccountId recipient, long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Transfer amount must be positive");
        }
        received.merge(recipient, amount, Long::sum);
        log.info("Transferred {} to external account {}", amount, recipient);
    }

    public long receivedBy(AccountId recipient) {
        return received.getOrDefault(recipient, 0L);
    }
}
