package com.flagship.flight_surety.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AdmissionResponse {

    @JsonProperty("airline")
    String airline;

    @JsonProperty("admitted")
    boolean admitted;

    @JsonProperty("votes")
    int votes;

    @JsonProperty("registered_count")
    int registeredCount;
}
