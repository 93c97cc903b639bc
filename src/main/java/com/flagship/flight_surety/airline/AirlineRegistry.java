package com.flagship.flight_surety.airline;

import com.flagship.flight_surety.access.AccessControl;
import com.flagship.flight_surety.common.AccountId;
import com.flagship.flight_surety.common.CallContext;
import com.flagship.flight_surety.common.ExecutionSerializer;
import com.flagship.flight_surety.common.SuretyError;
import com.flagship.flight_surety.common.SuretyException;
import com.flagship.flight_surety.config.SuretyProperties;
import com.flagship.flight_surety.event.AirlineAdmittedEvent;
import com.flagship.flight_surety.event.AirlineFundedEvent;
import com.flagship.flight_surety.ledger.FundLedger;
import com.flagship.flight_surety.ledger.RefundService;
import com.flagship.flight_surety.observability.CorrelationContext;
import com.flagship.flight_surety.observability.SuretyMetrics;
import com.flagship.flight_surety.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Airline admission consensus.
 *
 * While fewer than {@code consensusThreshold} airlines are registered, any
 * participating airline admits a new one directly. From then on each participating
 * airline casts at most one vote per target, and the target is admitted once
 * distinct votes reach {@code registeredCount / multiPartyRate}.
 *
 * The final admitted/pending outcome depends only on the set of voters, not on the
 * order in which their votes arrive.
 */
@Service
@Slf4j
public class AirlineRegistry {

    private final SuretyProperties properties;
    private final AccessControl accessControl;
    private final FundLedger fundLedger;
    private final RefundService refundService;
    private final OutboxService outboxService;
    private final SuretyMetrics metrics;
    private final ExecutionSerializer serializer;

    private final Map<AccountId, Airline> airlines = new HashMap<>();
    // target -> distinct voters; emptied (not removed) when the target is admitted
    private final Map<AccountId, Set<AccountId>> pendingVotes = new HashMap<>();
    private int registeredCount;

    public AirlineRegistry(SuretyProperties properties,
                           AccessControl accessControl,
                           FundLedger fundLedger,
                           RefundService refundService,
                           OutboxService outboxService,
                           SuretyMetrics metrics,
                           ExecutionSerializer serializer) {
        this.properties = properties;
        this.accessControl = accessControl;
        this.fundLedger = fundLedger;
        this.refundService = refundService;
        this.outboxService = outboxService;
        this.metrics = metrics;
        this.serializer = serializer;

        AccountId firstAirline = properties.firstAirlineId();
        serializer.run("bootstrapAirline", firstAirline, () -> admit(firstAirline, 0));
    }

    /**
     * Admits {@code target} directly or records the caller's vote for it.
     *
     * @param context Gateway and calling airline
     * @param target Airline to admit
     * @return Whether the target is now registered, and its vote count
     * @throws SuretyException NOT_AUTHORIZED_AIRLINE, ALREADY_REGISTERED, DUPLICATE_VOTE
     */
    public AdmissionResult registerAirline(CallContext context, AccountId target) {
        Objects.requireNonNull(target, "Target airline is required");
        return serializer.execute("registerAirline", context.getCaller(), () -> {
            accessControl.check(context);
            AccountId caller = context.getCaller();
            requireFundedAirline(caller);
            if (isRegisteredInternal(target)) {
                throw new SuretyException(SuretyError.ALREADY_REGISTERED, "Airline already registered: " + target);
            }

            try (CorrelationContext.Scope ignored = CorrelationContext.withAirline(target)) {
                int registered = registeredCount;
                if (registered < properties.getConsensusThreshold()) {
                    admit(target, 0);
                    return new AdmissionResult(true, 0);
                }
                return vote(caller, target, registered);
            }
        });
    }

    /**
     * Pays the membership fund of the calling airline.
     *
     * Exactly {@code joinFee} is escrowed; any excess is returned to the caller.
     *
     * @throws SuretyException NOT_AUTHORIZED_AIRLINE, ALREADY_FUNDED, INSUFFICIENT_PAYMENT
     */
    public void payMembershipFund(CallContext context, long amount) {
        serializer.run("payMembershipFund", context.getCaller(), () -> {
            accessControl.check(context);
            AccountId caller = context.getCaller();
            Airline airline = airlines.get(caller);
            if (airline == null || !airline.isRegistered()) {
                throw new SuretyException(SuretyError.NOT_AUTHORIZED_AIRLINE, "Airline is not registered: " + caller);
            }
            if (airline.isPaidFund()) {
                throw new SuretyException(SuretyError.ALREADY_FUNDED, "Airline already paid its fund: " + caller);
            }
            long joinFee = properties.getJoinFee();
            if (amount < joinFee) {
                throw new SuretyException(SuretyError.INSUFFICIENT_PAYMENT,
                    String.format("Membership fund requires %d, received %d", joinFee, amount));
            }

            airlines.put(caller, airline.fund());
            fundLedger.depositMembershipFund(caller, joinFee);
            outboxService.saveEvent(AirlineFundedEvent.of(caller, joinFee));
            metrics.recordAirlineFunded();
            log.info("Airline paid membership fund: airlineId={}, amount={}", caller, joinFee);

            refundService.refundExcess(caller, amount - joinFee, "membership fund overpayment");
        });
    }

    public boolean isRegistered(AccountId airline) {
        return serializer.read(() -> isRegisteredInternal(airline));
    }

    public boolean hasPaidFund(AccountId airline) {
        return serializer.read(() -> {
            Airline found = airlines.get(airline);
            return found != null && found.isPaidFund();
        });
    }

    /**
     * An airline is pending while it has at least one vote and is not yet registered.
     */
    public boolean isPending(AccountId airline) {
        return serializer.read(() -> !isRegisteredInternal(airline) && voteCountInternal(airline) > 0);
    }

    public int getRegisteredAirlineCount() {
        return serializer.read(() -> registeredCount);
    }

    public int getVoteCount(AccountId target) {
        return serializer.read(() -> voteCountInternal(target));
    }

    /**
     * @throws SuretyException NOT_AUTHORIZED_AIRLINE unless the airline is registered and funded
     */
    public void requireFundedAirline(AccountId airline) {
        serializer.read(() -> {
            Airline found = airlines.get(airline);
            if (found == null || !found.isParticipating()) {
                throw new SuretyException(SuretyError.NOT_AUTHORIZED_AIRLINE,
                    "Airline is not registered and funded: " + airline);
            }
            return found;
        });
    }

    private AdmissionResult vote(AccountId voter, AccountId target, int registered) {
        Set<AccountId> voters = pendingVotes.getOrDefault(target, Set.of());
        if (voters.contains(voter)) {
            throw new SuretyException(SuretyError.DUPLICATE_VOTE,
                String.format("Airline %s already voted for %s", voter, target));
        }

        Set<AccountId> updated = pendingVotes.computeIfAbsent(target, k -> new LinkedHashSet<>());
        updated.add(voter);
        airlines.put(voter, airlines.get(voter).withVoteFor(target));
        airlines.putIfAbsent(target, Airline.pending(target));
        int votes = updated.size();
        metrics.recordVote();
        log.debug("Vote recorded: voter={}, target={}, votes={}, registered={}", voter, target, votes, registered);

        if (votes >= registered / properties.getMultiPartyRate()) {
            admit(target, votes);
            updated.clear();
            return new AdmissionResult(true, votes);
        }
        log.info("Airline pending admission: airlineId={}, votes={}, required={}",
            target, votes, registered / properties.getMultiPartyRate());
        return new AdmissionResult(false, votes);
    }

    private void admit(AccountId target, int votes) {
        Airline airline = airlines.getOrDefault(target, Airline.pending(target));
        airlines.put(target, airline.register());
        registeredCount++;
        outboxService.saveEvent(AirlineAdmittedEvent.of(target, votes, registeredCount));
        metrics.recordAirlineAdmitted(votes > 0 ? "consensus" : "direct");
        log.info("Airline admitted: airlineId={}, votes={}, registeredCount={}", target, votes, registeredCount);
    }

    private boolean isRegisteredInternal(AccountId airline) {
        Airline found = airlines.get(airline);
        return found != null && found.isRegistered();
    }

    private int voteCountInternal(AccountId target) {
        return pendingVotes.getOrDefault(target, Set.of()).size();
    }
}
