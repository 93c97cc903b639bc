package com.flagship.flight_surety.event;

import com.flagship.flight_surety.common.AccountId;
import com.flagship.flight_surety.flight.FlightKey;
import com.flagship.flight_surety.flight.FlightStatus;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published for every counted oracle report.
 */
@Value
public class OracleReportReceivedEvent implements SuretyEvent {
    UUID eventId;
    int index;
    FlightKey flight;
    AccountId oracle;
    FlightStatus status;
    int reportCount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OracleReportReceived";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return ORACLE_REQUEST;
    }

    @Override
    public String getAggregateId() {
        return flight.toString();
    }

    public static OracleReportReceivedEvent of(int index, FlightKey flight, AccountId oracle, FlightStatus status, int reportCount) {
        return new OracleReportReceivedEvent(UUID.randomUUID(), index, flight, oracle, status, reportCount, Instant.now());
    }
}
