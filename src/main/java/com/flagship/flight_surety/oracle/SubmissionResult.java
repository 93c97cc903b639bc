package com.flagship.flight_surety.oracle;

import com.flagship.flight_surety.flight.FlightStatus;
import lombok.Value;

/**
 * Outcome of an oracle report.
 *
 * {@code counted} is false for a repeated report of the same status by the same oracle.
 * {@code resolvedStatus} is set only on the report that reached quorum.
 */
@Value
public class SubmissionResult {
    boolean counted;
    int reportCount;
    FlightStatus resolvedStatus;

    public boolean isResolved() {
        return resolvedStatus != null;
    }
}
