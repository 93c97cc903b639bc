package com.flagship.flight_surety.api;

import com.flagship.flight_surety.access.AccessControl;
import com.flagship.flight_surety.api.dto.AccountRequest;
import com.flagship.flight_surety.api.dto.LedgerSummaryResponse;
import com.flagship.flight_surety.api.dto.OperationalRequest;
import com.flagship.flight_surety.common.AccountId;
import com.flagship.flight_surety.ledger.FundLedger;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Owner-only administration: authorized callers and the operational flag.
 *
 * The requesting account comes from the X-Account-Id header and is passed to
 * {@link AccessControl} directly; these operations do not go through the gateway.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private final AccessControl accessControl;
    private final FundLedger fundLedger;

    @PostMapping("/authorized-callers")
    public ResponseEntity<Map<String, Object>> authorizeCaller(
            @Valid @RequestBody AccountRequest request,
            @RequestHeader(ApiHeaders.ACCOUNT_ID) String requester) {

        AccountId callerId = AccountId.of(request.getAccount());
        accessControl.authorize(AccountId.of(requester), callerId);
        return ResponseEntity.ok(Map.of("account", callerId.getValue(), "authorized", true));
    }

    @DeleteMapping("/authorized-callers/{account}")
    public ResponseEntity<Map<String, Object>> revokeCaller(
            @PathVariable String account,
            @RequestHeader(ApiHeaders.ACCOUNT_ID) String requester) {

        AccountId callerId = AccountId.of(account);
        accessControl.revoke(AccountId.of(requester), callerId);
        return ResponseEntity.ok(Map.of("account", callerId.getValue(), "authorized", false));
    }

    @GetMapping("/authorized-callers/{account}")
    public ResponseEntity<Map<String, Object>> isAuthorized(@PathVariable String account) {
        AccountId callerId = AccountId.of(account);
        return ResponseEntity.ok(Map.of(
            "account", callerId.getValue(),
            "authorized", accessControl.isAuthorized(callerId)));
    }

    @PutMapping("/operational")
    public ResponseEntity<Map<String, Object>> setOperational(
            @Valid @RequestBody OperationalRequest request,
            @RequestHeader(ApiHeaders.ACCOUNT_ID) String requester) {

        accessControl.setOperational(AccountId.of(requester), request.getOperational());
        return ResponseEntity.ok(Map.of("operational", accessControl.isOperational()));
    }

    @GetMapping("/operational")
    public ResponseEntity<Map<String, Object>> isOperational() {
        return ResponseEntity.ok(Map.of("operational", accessControl.isOperational()));
    }

    @GetMapping("/ledger")
    public ResponseEntity<LedgerSummaryResponse> ledgerSummary() {
        return ResponseEntity.ok(LedgerSummaryResponse.from(fundLedger));
    }
}
