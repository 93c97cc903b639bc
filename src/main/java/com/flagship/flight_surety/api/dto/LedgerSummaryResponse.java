package com.flagship.flight_surety.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.flight_surety.ledger.FundLedger;
import lombok.Builder;
import lombok.Value;

/**
 * Fund totals held by the registry, in base units.
 */
@Value
@Builder
public class LedgerSummaryResponse {

    @JsonProperty("airline_escrow")
    long airlineEscrow;

    @JsonProperty("insurance_pool")
    long insurancePool;

    @JsonProperty("oracle_fees")
    long oracleFees;

    @JsonProperty("net_value_received")
    long netValueReceived;

    @JsonProperty("conserved")
    boolean conserved;

    public static LedgerSummaryResponse from(FundLedger ledger) {
        return LedgerSummaryResponse.builder()
            .airlineEscrow(ledger.airlineEscrowTotal())
            .insurancePool(ledger.insurancePoolTotal())
            .oracleFees(ledger.oracleFeeTotal())
            .netValueReceived(ledger.netValueReceived())
            .conserved(ledger.isConserved())
            .build();
    }
}
