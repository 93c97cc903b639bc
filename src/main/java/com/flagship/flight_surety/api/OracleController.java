package com.flagship.flight_surety.api;

import com.flagship.flight_surety.api.dto.FlightReference;
import com.flagship.flight_surety.api.dto.OracleIndexesResponse;
import com.flagship.flight_surety.api.dto.OracleResponseRequest;
import com.flagship.flight_surety.api.dto.PaymentRequest;
import com.flagship.flight_surety.api.dto.StatusRequestResponse;
import com.flagship.flight_surety.api.dto.SubmissionResponse;
import com.flagship.flight_surety.common.AccountId;
import com.flagship.flight_surety.config.GatewayIdentity;
import com.flagship.flight_surety.flight.FlightStatus;
import com.flagship.flight_surety.oracle.OracleConsensusService;
import com.flagship.flight_surety.oracle.ResponseKey;
import com.flagship.flight_surety.oracle.SubmissionResult;
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

import java.util.List;

/**
 * REST Controller for oracle registration, status requests and oracle reports.
 */
@RestController
@RequestMapping("/api/oracles")
@RequiredArgsConstructor
@Slf4j
public class OracleController {

    private final OracleConsensusService oracleService;
    private final GatewayIdentity gateway;

    @PostMapping
    public ResponseEntity<OracleIndexesResponse> registerOracle(
            @Valid @RequestBody PaymentRequest request,
            @RequestHeader(ApiHeaders.ACCOUNT_ID) String caller) {

        AccountId oracle = AccountId.of(caller);
        List<Integer> indexes = oracleService.registerOracle(gateway.onBehalfOf(oracle), request.getAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(new OracleIndexesResponse(oracle.getValue(), indexes));
    }

    @GetMapping("/{account}/indexes")
    public ResponseEntity<OracleIndexesResponse> getIndexes(@PathVariable String account) {
        AccountId oracle = AccountId.of(account);
        return ResponseEntity.ok(new OracleIndexesResponse(oracle.getValue(), oracleService.getMyIndexes(oracle)));
    }

    /**
     * Opens a status request. Oracles holding the returned index may answer it.
     */
    @PostMapping("/requests")
    public ResponseEntity<StatusRequestResponse> requestFlightStatus(
            @Valid @RequestBody FlightReference flight,
            @RequestHeader(ApiHeaders.ACCOUNT_ID) String caller) {

        ResponseKey key = oracleService.requestStatus(gateway.onBehalfOf(AccountId.of(caller)), flight.toKey());
        return ResponseEntity.ok(StatusRequestResponse.from(key));
    }

    @PostMapping("/responses")
    public ResponseEntity<SubmissionResponse> submitResponse(
            @Valid @RequestBody OracleResponseRequest request,
            @RequestHeader(ApiHeaders.ACCOUNT_ID) String caller) {

        FlightStatus status = FlightStatus.fromCode(request.getStatusCode());
        SubmissionResult result = oracleService.submitResponse(gateway.onBehalfOf(AccountId.of(caller)),
            request.getIndex(), request.getFlight().toKey(), status);
        return ResponseEntity.ok(SubmissionResponse.from(result));
    }
}
