package com.flagship.flight_surety.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * Status update by the airline operating the flight. {@code statusCode} is one of
 * 0, 10, 20, 30, 40, 50.
 */
@Value
public class FlightStatusUpdateRequest {

    @NotBlank(message = "Flight code is required")
    @JsonProperty("code")
    String code;

    @NotNull(message = "Timestamp is required")
    @JsonProperty("timestamp")
    Long timestamp;

    @NotNull(message = "Status code is required")
    @JsonProperty("status_code")
    Integer statusCode;
}
