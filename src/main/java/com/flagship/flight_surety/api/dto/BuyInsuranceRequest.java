package com.flagship.flight_surety.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

/**
 * Insurance purchase by the calling passenger.
 *
 * {@code amount} is the premium to insure; {@code paid} is the value sent with it.
 * When {@code paid} is omitted it equals {@code amount}.
 */
@Value
public class BuyInsuranceRequest {

    @NotNull(message = "Flight is required")
    @Valid
    @JsonProperty("flight")
    FlightReference flight;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    Long amount;

    @PositiveOrZero(message = "Paid amount cannot be negative")
    @JsonProperty("paid")
    Long paid;

    public long paidOrAmount() {
        return paid != null ? paid : amount;
    }
}
