package com.flagship.flight_surety.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.flight_surety.insurance.ClaimKey;
import com.flagship.flight_surety.insurance.PayoutReport;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Flight state after a status change, with any payouts it triggered.
 */
@Value
@Builder
public class PayoutReportResponse {

    @JsonProperty("flight")
    FlightResponse flight;

    @JsonProperty("paid")
    List<String> paid;

    @JsonProperty("underfunded")
    List<String> underfunded;

    @JsonProperty("total_credited")
    long totalCredited;

    public static PayoutReportResponse from(FlightResponse flight, PayoutReport report) {
        return PayoutReportResponse.builder()
            .flight(flight)
            .paid(passengers(report.getPaid()))
            .underfunded(passengers(report.getUnderfunded()))
            .totalCredited(report.getTotalCredited())
            .build();
    }

    private static List<String> passengers(List<ClaimKey> claims) {
        return claims.stream()
            .map(claim -> claim.getPassenger().getValue())
            .collect(Collectors.toList());
    }
}
