package com.flagship.flight_surety.airline;

import com.flagship.flight_surety.common.AccountId;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Airline domain object.
 *
 * Lifecycle: Pending (votes recorded, not admitted) -> Registered (terminal).
 * A registered airline may pay its membership fund exactly once.
 * State changes are immutable (create new Airline with new state).
 */
@Value
public class Airline {
    AccountId id;
    boolean registered;
    boolean paidFund;
    Set<AccountId> votesCast;
    Instant registeredAt;

    public static Airline pending(AccountId id) {
        return new Airline(id, false, false, Set.of(), null);
    }

    /**
     * @throws IllegalStateException if the airline is already registered
     */
    public Airline register() {
        if (registered) {
            throw new IllegalStateException("Airline " + id + " is already registered");
        }
        return new Airline(id, true, paidFund, votesCast, Instant.now());
    }

    /**
     * @throws IllegalStateException unless registered and not yet funded
     */
    public Airline fund() {
        if (!registered || paidFund) {
            throw new IllegalStateException(
                String.format("Cannot fund airline %s (registered=%s, paidFund=%s)", id, registered, paidFund));
        }
        return new Airline(id, registered, true, votesCast, registeredAt);
    }

    public Airline withVoteFor(AccountId target) {
        Set<AccountId> votes = new LinkedHashSet<>(votesCast);
        votes.add(target);
        return new Airline(id, registered, paidFund, Set.copyOf(votes), registeredAt);
    }

    public boolean hasVotedFor(AccountId target) {
        return votesCast.contains(target);
    }

    /**
     * Registered and funded airlines may admit others and register flights.
     */
    public boolean isParticipating() {
        return registered && paidFund;
    }
}
