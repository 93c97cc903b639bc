package com.flagship.flight_surety.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.flight_surety.flight.Flight;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class FlightResponse {

    @JsonProperty("airline")
    String airline;

    @JsonProperty("code")
    String code;

    @JsonProperty("timestamp")
    long timestamp;

    @JsonProperty("status")
    String status;

    @JsonProperty("status_code")
    int statusCode;

    @JsonProperty("oracle_resolved")
    boolean oracleResolved;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static FlightResponse from(Flight flight) {
        return FlightResponse.builder()
            .airline(flight.getKey().getAirline().getValue())
            .code(flight.getKey().getCode())
            .timestamp(flight.getKey().getTimestamp())
            .status(flight.getStatus().name())
            .statusCode(flight.getStatus().getCode())
            .oracleResolved(flight.isOracleResolved())
            .updatedAt(flight.getUpdatedAt())
            .build();
    }
}
