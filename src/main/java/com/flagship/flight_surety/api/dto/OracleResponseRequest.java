package com.flagship.flight_surety.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class OracleResponseRequest {

    @NotNull(message = "Index is required")
    @JsonProperty("index")
    Integer index;

    @NotNull(message = "Flight is required")
    @Valid
    @JsonProperty("flight")
    FlightReference flight;

    @NotNull(message = "Status code is required")
    @JsonProperty("status_code")
    Integer statusCode;
}
