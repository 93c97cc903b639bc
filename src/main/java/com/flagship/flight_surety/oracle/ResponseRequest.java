package com.flagship.flight_surety.oracle;

import com.flagship.flight_surety.common.AccountId;
import com.flagship.flight_surety.flight.FlightStatus;
import lombok.Value;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * An open or closed flight status request and the oracles that reported on it,
 * grouped by the status they reported.
 *
 * State changes are immutable (create new ResponseRequest). A closed request keeps
 * its reports and the status it resolved to.
 */
@Value
public class ResponseRequest {
    AccountId requester;
    boolean open;
    Map<FlightStatus, Set<AccountId>> reports;
    FlightStatus resolvedStatus;
    Instant openedAt;

    public static ResponseRequest open(AccountId requester) {
        return new ResponseRequest(requester, true, Map.of(), null, Instant.now());
    }

    public boolean hasReported(FlightStatus status, AccountId oracle) {
        return reports.getOrDefault(status, Set.of()).contains(oracle);
    }

    public int reportCount(FlightStatus status) {
        return reports.getOrDefault(status, Set.of()).size();
    }

    /**
     * @throws IllegalStateException if the request is closed
     */
    public ResponseRequest withReport(FlightStatus status, AccountId oracle) {
        if (!open) {
            throw new IllegalStateException("Request is closed");
        }
        Map<FlightStatus, Set<AccountId>> updated = new EnumMap<>(FlightStatus.class);
        reports.forEach((s, oracles) -> updated.put(s, oracles));
        Set<AccountId> reporters = new LinkedHashSet<>(updated.getOrDefault(status, Set.of()));
        reporters.add(oracle);
        updated.put(status, Set.copyOf(reporters));
        return new ResponseRequest(requester, true, Map.copyOf(updated), null, openedAt);
    }

    public ResponseRequest close(FlightStatus resolved) {
        return new ResponseRequest(requester, false, reports, resolved, openedAt);
    }
}
