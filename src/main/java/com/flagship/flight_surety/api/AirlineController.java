package com.flagship.flight_surety.api;

import com.flagship.flight_surety.airline.AdmissionResult;
import com.flagship.flight_surety.airline.AirlineRegistry;
import com.flagship.flight_surety.api.dto.AccountRequest;
import com.flagship.flight_surety.api.dto.AdmissionResponse;
import com.flagship.flight_surety.api.dto.AirlineResponse;
import com.flagship.flight_surety.api.dto.PaymentRequest;
import com.flagship.flight_surety.common.AccountId;
import com.flagship.flight_surety.config.GatewayIdentity;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST Controller for airline admission and membership funding.
 */
@RestController
@RequestMapping("/api/airlines")
@RequiredArgsConstructor
@Slf4j
public class AirlineController {

    private final AirlineRegistry airlineRegistry;
    private final GatewayIdentity gateway;

    /**
     * Registers (or votes for) an airline on behalf of the calling airline.
     * Returns 200 in both cases; {@code admitted} tells whether the target is now registered.
     */
    @PostMapping
    public ResponseEntity<AdmissionResponse> registerAirline(
            @Valid @RequestBody AccountRequest request,
            @RequestHeader(ApiHeaders.ACCOUNT_ID) String caller) {

        AccountId target = AccountId.of(request.getAccount());
        log.info("Received airline registration: caller={}, target={}", caller, target);

        AdmissionResult result = airlineRegistry.registerAirline(gateway.onBehalfOf(AccountId.of(caller)), target);
        return ResponseEntity.ok(AdmissionResponse.builder()
            .airline(target.getValue())
            .admitted(result.isAdmitted())
            .votes(result.getVotes())
            .registeredCount(airlineRegistry.getRegisteredAirlineCount())
            .build());
    }

    @PostMapping("/fund")
    public ResponseEntity<AirlineResponse> payMembershipFund(
            @Valid @RequestBody PaymentRequest request,
            @RequestHeader(ApiHeaders.ACCOUNT_ID) String caller) {

        AccountId airline = AccountId.of(caller);
        airlineRegistry.payMembershipFund(gateway.onBehalfOf(airline), request.getAmount());
        return ResponseEntity.ok(describe(airline));
    }

    @GetMapping("/{account}")
    public ResponseEntity<AirlineResponse> getAirline(@PathVariable String account) {
        return ResponseEntity.ok(describe(AccountId.of(account)));
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> getRegisteredCount() {
        return ResponseEntity.ok(Map.of("registered_count", airlineRegistry.getRegisteredAirlineCount()));
    }

    private AirlineResponse describe(AccountId airline) {
        return AirlineResponse.builder()
            .airline(airline.getValue())
            .registered(airlineRegistry.isRegistered(airline))
            .funded(airlineRegistry.hasPaidFund(airline))
            .pending(airlineRegistry.isPending(airline))
            .votes(airlineRegistry.getVoteCount(airline))
            .build();
    }
}
