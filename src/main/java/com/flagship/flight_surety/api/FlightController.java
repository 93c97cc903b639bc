package com.flagship.flight_surety.api;

import com.flagship.flight_surety.api.dto.ClaimResponse;
import com.flagship.flight_surety.api.dto.FlightRequest;
import com.flagship.flight_surety.api.dto.FlightResponse;
import com.flagship.flight_surety.api.dto.FlightStatusUpdateRequest;
import com.flagship.flight_surety.api.dto.PayoutReportResponse;
import com.flagship.flight_surety.common.AccountId;
import com.flagship.flight_surety.common.SuretyError;
import com.flagship.flight_surety.common.SuretyException;
import com.flagship.flight_surety.config.GatewayIdentity;
import com.flagship.flight_surety.flight.FlightKey;
import com.flagship.flight_surety.flight.FlightRegistry;
import com.flagship.flight_surety.flight.FlightStatus;
import com.flagship.flight_surety.insurance.InsuranceService;
import com.flagship.flight_surety.insurance.PayoutReport;
import com.flagship.flight_surety.settlement.StatusSettlementService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST Controller for flight registration and airline status updates.
 */
@RestController
@RequestMapping("/api/flights")
@RequiredArgsConstructor
@Slf4j
public class FlightController {

    private final FlightRegistry flightRegistry;
    private final StatusSettlementService settlementService;
    private final InsuranceService insuranceService;
    private final GatewayIdentity gateway;

    @PostMapping
    public ResponseEntity<FlightResponse> registerFlight(
            @Valid @RequestBody FlightRequest request,
            @RequestHeader(ApiHeaders.ACCOUNT_ID) String caller) {

        FlightKey key = flightRegistry.registerFlight(
            gateway.onBehalfOf(AccountId.of(caller)), request.getCode(), request.getTimestamp());
        return ResponseEntity.status(HttpStatus.CREATED).body(FlightResponse.from(flightRegistry.requireFlight(key)));
    }

    /**
     * Sets the status of one of the caller's flights. A late status credits insured
     * passengers in the same call.
     */
    @PutMapping("/status")
    public ResponseEntity<PayoutReportResponse> updateStatus(
            @Valid @RequestBody FlightStatusUpdateRequest request,
            @RequestHeader(ApiHeaders.ACCOUNT_ID) String caller) {

        AccountId airline = AccountId.of(caller);
        FlightStatus status = FlightStatus.fromCode(request.getStatusCode());
        PayoutReport report = settlementService.updateByAirline(
            gateway.onBehalfOf(airline), request.getCode(), request.getTimestamp(), status);

        FlightKey key = FlightKey.of(airline, request.getCode(), request.getTimestamp());
        return ResponseEntity.ok(PayoutReportResponse.from(FlightResponse.from(flightRegistry.requireFlight(key)), report));
    }

    @GetMapping("/{airline}/{code}/{timestamp}")
    public ResponseEntity<FlightResponse> getFlight(
            @PathVariable String airline,
            @PathVariable String code,
            @PathVariable long timestamp) {

        FlightKey key = FlightKey.of(AccountId.of(airline), code, timestamp);
        return flightRegistry.getFlight(key)
            .map(flight -> ResponseEntity.ok(FlightResponse.from(flight)))
            .orElseThrow(() -> new SuretyException(SuretyError.UNKNOWN_FLIGHT, "Unknown flight: " + key));
    }

    @GetMapping("/{airline}/{code}/{timestamp}/claims")
    public ResponseEntity<List<ClaimResponse>> getClaims(
            @PathVariable String airline,
            @PathVariable String code,
            @PathVariable long timestamp) {

        FlightKey key = FlightKey.of(AccountId.of(airline), code, timestamp);
        flightRegistry.requireFlight(key);
        return ResponseEntity.ok(insuranceService.getClaimsForFlight(key).stream()
            .map(ClaimResponse::from)
            .collect(Collectors.toList()));
    }
}
