package com.flagship.flight_surety.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * Flight registration by the calling airline.
 */
@Value
public class FlightRequest {

    @NotBlank(message = "Flight code is required")
    @JsonProperty("code")
    String code;

    @NotNull(message = "Timestamp is required")
    @JsonProperty("timestamp")
    Long timestamp;
}
