package com.flagship.flight_surety.api;

import com.flagship.flight_surety.api.dto.BalanceResponse;
import com.flagship.flight_surety.api.dto.BuyInsuranceRequest;
import com.flagship.flight_surety.api.dto.ClaimResponse;
import com.flagship.flight_surety.api.dto.PaymentRequest;
import com.flagship.flight_surety.common.AccountId;
import com.flagship.flight_surety.config.GatewayIdentity;
import com.flagship.flight_surety.flight.FlightKey;
import com.flagship.flight_surety.insurance.ClaimKey;
import com.flagship.flight_surety.insurance.InsuranceService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
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
 * REST Controller for insurance purchases, passenger credit and withdrawals.
 */
@RestController
@RequestMapping("/api/insurance")
@RequiredArgsConstructor
@Slf4j
public class InsuranceController {

    private final InsuranceService insuranceService;
    private final GatewayIdentity gateway;

    /**
     * Buys insurance for the calling passenger.
     */
    @PostMapping
    public ResponseEntity<ClaimResponse> buyInsurance(
            @Valid @RequestBody BuyInsuranceRequest request,
            @RequestHeader(ApiHeaders.ACCOUNT_ID) String caller) {

        AccountId passenger = AccountId.of(caller);
        ClaimKey claimKey = insuranceService.buyInsurance(gateway.onBehalfOf(passenger), passenger,
            request.getFlight().toKey(), request.getAmount(), request.paidOrAmount());

        return insuranceService.getClaim(claimKey)
            .map(claim -> ResponseEntity.status(HttpStatus.CREATED).body(ClaimResponse.from(claim)))
            .orElseThrow(() -> new IllegalStateException("Claim not recorded: " + claimKey));
    }

    @GetMapping("/{passenger}/{airline}/{code}/{timestamp}")
    public ResponseEntity<Map<String, Object>> checkInsuranceAmount(
            @PathVariable String passenger,
            @PathVariable String airline,
            @PathVariable String code,
            @PathVariable long timestamp) {

        FlightKey key = FlightKey.of(AccountId.of(airline), code, timestamp);
        long amount = insuranceService.checkInsuranceAmount(AccountId.of(passenger), key);
        return ResponseEntity.ok(Map.of("passenger", AccountId.of(passenger).getValue(), "amount", amount));
    }

    @GetMapping("/credits/{account}")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable String account) {
        AccountId holder = AccountId.of(account);
        return ResponseEntity.ok(new BalanceResponse(holder.getValue(), insuranceService.getPassengerBalance(holder)));
    }

    /**
     * Withdraws credited payouts to the caller. Returns the remaining credit.
     */
    @PostMapping("/withdrawals")
    public ResponseEntity<BalanceResponse> withdraw(
            @Valid @RequestBody PaymentRequest request,
            @RequestHeader(ApiHeaders.ACCOUNT_ID) String caller) {

        AccountId holder = AccountId.of(caller);
        long remaining = insuranceService.withdraw(gateway.onBehalfOf(holder), request.getAmount());
        return ResponseEntity.ok(new BalanceResponse(holder.getValue(), remaining));
    }
}
