package com.flagship.flight_surety.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class OperationalRequest {

    @NotNull(message = "Operational flag is required")
    @JsonProperty("operational")
    Boolean operational;
}
