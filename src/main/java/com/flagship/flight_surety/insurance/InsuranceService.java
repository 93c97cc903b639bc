package com.flagship.flight_surety.insurance;

import com.flagship.flight_surety.access.AccessControl;
import com.flagship.flight_surety.airline.AirlineRegistry;
import com.flagship.flight_surety.common.AccountId;
import com.flagship.flight_surety.common.CallContext;
import com.flagship.flight_surety.common.ExecutionSerializer;
import com.flagship.flight_surety.common.SuretyError;
import com.flagship.flight_surety.common.SuretyException;
import com.flagship.flight_surety.config.SuretyProperties;
import com.flagship.flight_surety.event.CreditWithdrawnEvent;
import com.flagship.flight_surety.event.InsurancePurchasedEvent;
import com.flagship.flight_surety.event.PayoutCreditedEvent;
import com.flagship.flight_surety.flight.Flight;
import com.flagship.flight_surety.flight.FlightKey;
import com.flagship.flight_surety.flight.FlightRegistry;
import com.flagship.flight_surety.ledger.FundLedger;
import com.flagship.flight_surety.ledger.PayoutGateway;
import com.flagship.flight_surety.ledger.RefundService;
import com.flagship.flight_surety.observability.CorrelationContext;
import com.flagship.flight_surety.observability.SuretyMetrics;
import com.flagship.flight_surety.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Premium intake, payout crediting and credit withdrawal.
 *
 * Key principles:
 * - One claim per (passenger, flight); a second purchase is rejected, never overwritten
 * - A claim is paid out at most once, so resolving the same delay twice is a no-op
 * - A claim the pool cannot cover stays unpaid without affecting the other claims
 * - Withdrawals debit the ledger before the external transfer
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InsuranceService {

    private final SuretyProperties properties;
    private final AccessControl accessControl;
    private final AirlineRegistry airlineRegistry;
    private final FlightRegistry flightRegistry;
    private final FundLedger fundLedger;
    private final PayoutGateway payoutGateway;
    private final RefundService refundService;
    private final OutboxService outboxService;
    private final SuretyMetrics metrics;
    private final ExecutionSerializer serializer;

    private final Map<ClaimKey, InsuranceClaim> claims = new HashMap<>();
    // purchase order of the claims on each flight
    private final Map<FlightKey, List<ClaimKey>> claimsByFlight = new LinkedHashMap<>();

    /**
     * Buys insurance for {@code passenger} on a flight.
     *
     * @param context Gateway and paying account
     * @param passenger Insured passenger
     * @param flightKey Insured flight
     * @param declaredAmount Premium to insure, at most {@code maxInsuranceAmount}
     * @param paidAmount Value sent with the call; the excess over the premium is refunded
     * @return Key of the created claim
     * @throws SuretyException INVALID_BUYER, UNKNOWN_FLIGHT, FLIGHT_NOT_INSURABLE,
     *         INVALID_AMOUNT, INSUFFICIENT_PAYMENT, DUPLICATE_CLAIM
     */
    public ClaimKey buyInsurance(CallContext context, AccountId passenger, FlightKey flightKey,
                                 long declaredAmount, long paidAmount) {
        return serializer.execute("buyInsurance", context.getCaller(), () -> {
            accessControl.check(context);
            if (airlineRegistry.isRegistered(passenger)) {
                throw new SuretyException(SuretyError.INVALID_BUYER,
                    "Registered airlines cannot buy insurance: " + passenger);
            }
            Flight flight = flightRegistry.requireFlight(flightKey);
            if (!flight.isInsurable()) {
                throw new SuretyException(SuretyError.FLIGHT_NOT_INSURABLE,
                    String.format("Flight %s already has status %s", flightKey, flight.getStatus()));
            }
            if (declaredAmount <= 0 || declaredAmount > properties.getMaxInsuranceAmount()) {
                throw new SuretyException(SuretyError.INVALID_AMOUNT,
                    String.format("Insurance amount must be in (0, %d], got %d",
                        properties.getMaxInsuranceAmount(), declaredAmount));
            }
            if (paidAmount < declaredAmount) {
                throw new SuretyException(SuretyError.INSUFFICIENT_PAYMENT,
                    String.format("Paid %d for an insurance amount of %d", paidAmount, declaredAmount));
            }
            ClaimKey claimKey = ClaimKey.of(passenger, flightKey);
            if (claims.containsKey(claimKey)) {
                throw new SuretyException(SuretyError.DUPLICATE_CLAIM,
                    String.format("Passenger %s already insured flight %s", passenger, flightKey));
            }

            claims.put(claimKey, InsuranceClaim.purchase(claimKey, declaredAmount));
            claimsByFlight.computeIfAbsent(flightKey, k -> new ArrayList<>()).add(claimKey);
            fundLedger.depositPremium(passenger, declaredAmount);

            outboxService.saveEvent(InsurancePurchasedEvent.of(passenger, flightKey, declaredAmount));
            metrics.recordInsurancePurchased(declaredAmount);
            log.info("Insurance purchased: passenger={}, flightKey={}, premium={}", passenger, flightKey, declaredAmount);

            refundService.refundExcess(context.getCaller(), paidAmount - declaredAmount, "premium overpayment");
            return claimKey;
        });
    }

    /**
     * Credits every unpaid claim on a delayed flight with premium * 3 / 2.
     *
     * Called once the flight's status becomes a late status. Re-invocation only pays
     * claims that were not paid before (for example because the pool was underfunded).
     */
    public PayoutReport resolveDelay(FlightKey flightKey) {
        return serializer.execute("resolveDelay", null, () -> {
            List<ClaimKey> flightClaims = claimsByFlight.getOrDefault(flightKey, List.of());
            if (flightClaims.isEmpty()) {
                return PayoutReport.empty(flightKey);
            }

            try (CorrelationContext.Scope ignored = CorrelationContext.withFlight(flightKey)) {
                List<ClaimKey> paid = new ArrayList<>();
                List<ClaimKey> underfunded = new ArrayList<>();
                long totalCredited = 0;
                for (ClaimKey claimKey : flightClaims) {
                    InsuranceClaim claim = claims.get(claimKey);
                    if (claim.isPayoutIssued()) {
                        continue;
                    }
                    long payout = payoutFor(claim.getPremiumPaid());
                    try {
                        fundLedger.creditPayout(claimKey.getPassenger(), payout, claimKey.toString());
                    } catch (SuretyException e) {
                        if (e.getError() != SuretyError.POOL_UNDERFUNDED) {
                            throw e;
                        }
                        underfunded.add(claimKey);
                        metrics.recordPayout("underfunded", 0L);
                        log.warn("Payout halted for claim: passenger={}, payout={}, reason={}",
                            claimKey.getPassenger(), payout, e.getMessage());
                        continue;
                    }
                    claims.put(claimKey, claim.markPaidOut(payout));
                    paid.add(claimKey);
                    totalCredited += payout;
                    outboxService.saveEvent(PayoutCreditedEvent.of(
                        claimKey.getPassenger(), flightKey, claim.getPremiumPaid(), payout));
                    metrics.recordPayout("credited", payout);
                }
                log.info("Delay payouts resolved: flightKey={}, paid={}, underfunded={}, totalCredited={}",
                    flightKey, paid.size(), underfunded.size(), totalCredited);
                return new PayoutReport(flightKey, List.copyOf(paid), List.copyOf(underfunded), totalCredited);
            }
        });
    }

    /**
     * Withdraws credited value to the caller's external account.
     *
     * The credit is debited before the transfer. If the transfer fails the debit is
     * reversed and the call fails with TRANSFER_FAILED.
     *
     * @throws SuretyException INVALID_AMOUNT, INSUFFICIENT_CREDIT, TRANSFER_FAILED
     */
    public long withdraw(CallContext context, long amount) {
        return serializer.execute("withdraw", context.getCaller(), () -> {
            accessControl.check(context);
            AccountId holder = context.getCaller();
            if (amount <= 0) {
                throw new SuretyException(SuretyError.INVALID_AMOUNT, "Withdrawal amount must be positive");
            }
            fundLedger.debitCredit(holder, amount);
            try {
                payoutGateway.send(holder, amount);
            } catch (RuntimeException e) {
                fundLedger.restoreCredit(holder, amount);
                log.error("Withdrawal transfer failed, credit restored: holder={}, amount={}, error={}",
                    holder, amount, e.getMessage());
                throw new SuretyException(SuretyError.TRANSFER_FAILED, "Transfer to " + holder + " failed", e);
            }

            long remaining = fundLedger.creditOf(holder);
            outboxService.saveEvent(CreditWithdrawnEvent.of(holder, amount, remaining));
            metrics.recordWithdrawal(amount);
            log.info("Credit withdrawn: holder={}, amount={}, remaining={}", holder, amount, remaining);
            return remaining;
        });
    }

    /**
     * Premium the passenger paid for a flight, or 0 if not insured.
     */
    public long checkInsuranceAmount(AccountId passenger, FlightKey flightKey) {
        return serializer.read(() -> Optional.ofNullable(claims.get(ClaimKey.of(passenger, flightKey)))
            .map(InsuranceClaim::getPremiumPaid)
            .orElse(0L));
    }

    public Optional<InsuranceClaim> getClaim(ClaimKey claimKey) {
        return serializer.read(() -> Optional.ofNullable(claims.get(claimKey)));
    }

    public List<InsuranceClaim> getClaimsForFlight(FlightKey flightKey) {
        return serializer.read(() -> claimsByFlight.getOrDefault(flightKey, List.of()).stream()
            .map(claims::get)
            .toList());
    }

    public long getPassengerBalance(AccountId passenger) {
        return fundLedger.creditOf(passenger);
    }

    long payoutFor(long premium) {
        return premium * properties.getPayoutNumerator() / properties.getPayoutDenominator();
    }
}
