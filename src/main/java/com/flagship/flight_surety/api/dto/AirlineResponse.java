package com.flagship.flight_surety.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AirlineResponse {

    @JsonProperty("airline")
    String airline;

    @JsonProperty("registered")
    boolean registered;

    @JsonProperty("funded")
    boolean funded;

    @JsonProperty("pending")
    boolean pending;

    @JsonProperty("votes")
    int votes;
}
