package com.flagship.flight_surety.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.flight_surety.common.AccountId;
import com.flagship.flight_surety.flight.FlightKey;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * Fully qualified flight, used when the caller is not the operating airline.
 */
@Value
public class FlightReference {

    @NotBlank(message = "Airline is required")
    @JsonProperty("airline")
    String airline;

    @NotBlank(message = "Flight code is required")
    @JsonProperty("code")
    String code;

    @NotNull(message = "Timestamp is required")
    @JsonProperty("timestamp")
    Long timestamp;

    public FlightKey toKey() {
        return FlightKey.of(AccountId.of(airline), code, timestamp);
    }
}
