package com.flagship.flight_surety.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.flight_surety.insurance.InsuranceClaim;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ClaimResponse {

    @JsonProperty("passenger")
    String passenger;

    @JsonProperty("flight")
    String flight;

    @JsonProperty("premium")
    long premium;

    @JsonProperty("payout_issued")
    boolean payoutIssued;

    @JsonProperty("payout")
    long payout;

    @JsonProperty("purchased_at")
    Instant purchasedAt;

    public static ClaimResponse from(InsuranceClaim claim) {
        return ClaimResponse.builder()
            .passenger(claim.getKey().getPassenger().getValue())
            .flight(claim.getKey().getFlight().toString())
            .premium(claim.getPremiumPaid())
            .payoutIssued(claim.isPayoutIssued())
            .payout(claim.getPayoutAmount())
            .purchasedAt(claim.getPurchasedAt())
            .build();
    }
}
