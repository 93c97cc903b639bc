package com.flagship.flight_surety.ledger;

import com.flagship.flight_surety.common.AccountId;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Returns overpayment to the payer once the paying call has updated its state.
 *
 * If the transfer fails, the excess is recorded as withdrawable credit of the payer
 * so that the paying call still completes and no value is left untracked.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RefundService {

    private final PayoutGateway payoutGateway;
    private final FundLedger fundLedger;

    /**
     * @return true if the excess was transferred, false if it was credited instead
     */
    public boolean refundExcess(AccountId payer, long excess, String reason) {
        if (excess <= 0) {
            return true;
        }
        try {
            payoutGateway.send(payer, excess);
            log.debug("Refunded excess payment: payer={}, amount={}, reason={}", payer, excess, reason);
            return true;
        } catch (RuntimeException e) {
            log.error("Refund transfer failed, crediting payer instead: payer={}, amount={}, reason={}, error={}",
                payer, excess, reason, e.getMessage());
            fundLedger.creditUnreturnedValue(payer, excess);
            return false;
        }
    }
}
