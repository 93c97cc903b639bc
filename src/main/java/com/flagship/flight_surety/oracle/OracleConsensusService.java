package com.flagship.flight_surety.oracle;

import com.flagship.flight_surety.access.AccessControl;
import com.flagship.flight_surety.common.AccountId;
import com.flagship.flight_surety.common.CallContext;
import com.flagship.flight_surety.common.ExecutionSerializer;
import com.flagship.flight_surety.common.SuretyError;
import com.flagship.flight_surety.common.SuretyException;
import com.flagship.flight_surety.config.SuretyProperties;
import com.flagship.flight_surety.event.FlightStatusResolvedEvent;
import com.flagship.flight_surety.event.OracleReportReceivedEvent;
import com.flagship.flight_surety.event.StatusRequestOpenedEvent;
import com.flagship.flight_surety.flight.FlightKey;
import com.flagship.flight_surety.flight.FlightRegistry;
import com.flagship.flight_surety.flight.FlightStatus;
import com.flagship.flight_surety.ledger.FundLedger;
import com.flagship.flight_surety.ledger.RefundService;
import com.flagship.flight_surety.observability.CorrelationContext;
import com.flagship.flight_surety.observability.SuretyMetrics;
import com.flagship.flight_surety.outbox.OutboxService;
import com.flagship.flight_surety.settlement.StatusSettlementService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Oracle status consensus.
 *
 * Each registered oracle holds three distinct indexes. A status request carries one
 * index, and only oracles holding it may answer. Reports are counted once per oracle
 * per status; the first status to reach {@code minResponses} reports closes the request
 * and becomes the flight's status.
 *
 * Open requests do not expire.
 */
@Service
@Slf4j
public class OracleConsensusService {

    private final SuretyProperties properties;
    private final AccessControl accessControl;
    private final FlightRegistry flightRegistry;
    private final StatusSettlementService settlementService;
    private final FundLedger fundLedger;
    private final RefundService refundService;
    private final IndexSource indexSource;
    private final OutboxService outboxService;
    private final SuretyMetrics metrics;
    private final ExecutionSerializer serializer;

    private final Map<AccountId, OracleRegistration> oracles = new HashMap<>();
    private final Map<ResponseKey, ResponseRequest> requests = new HashMap<>();

    public OracleConsensusService(SuretyProperties properties,
                                  AccessControl accessControl,
                                  FlightRegistry flightRegistry,
                                  StatusSettlementService settlementService,
                                  FundLedger fundLedger,
                                  RefundService refundService,
                                  IndexSource indexSource,
                                  OutboxService outboxService,
                                  SuretyMetrics metrics,
                                  ExecutionSerializer serializer) {
        if (properties.getOracleIndexRange() < 3) {
            throw new IllegalArgumentException("Oracle index range must allow three distinct indexes");
        }
        this.properties = properties;
        this.accessControl = accessControl;
        this.flightRegistry = flightRegistry;
        this.settlementService = settlementService;
        this.fundLedger = fundLedger;
        this.refundService = refundService;
        this.indexSource = indexSource;
        this.outboxService = outboxService;
        this.metrics = metrics;
        this.serializer = serializer;
    }

    /**
     * Registers the calling oracle and assigns its indexes.
     *
     * @return The three distinct indexes assigned to the oracle
     * @throws SuretyException ALREADY_REGISTERED, INSUFFICIENT_PAYMENT
     */
    public List<Integer> registerOracle(CallContext context, long payment) {
        return serializer.execute("registerOracle", context.getCaller(), () -> {
            accessControl.check(context);
            AccountId oracle = context.getCaller();
            if (oracles.containsKey(oracle)) {
                throw new SuretyException(SuretyError.ALREADY_REGISTERED, "Oracle already registered: " + oracle);
            }
            long fee = properties.getOracleRegistrationFee();
            if (payment < fee) {
                throw new SuretyException(SuretyError.INSUFFICIENT_PAYMENT,
                    String.format("Oracle registration requires %d, received %d", fee, payment));
            }

            List<Integer> indexes = generateIndexes(oracle);
            oracles.put(oracle, new OracleRegistration(oracle, indexes, Instant.now()));
            fundLedger.depositOracleFee(oracle, fee);
            metrics.recordOracleRegistered();
            log.info("Oracle registered: oracle={}, indexes={}", oracle, indexes);

            refundService.refundExcess(oracle, payment - fee, "oracle registration overpayment");
            return indexes;
        });
    }

    /**
     * @throws SuretyException UNKNOWN_ORACLE
     */
    public List<Integer> getMyIndexes(AccountId oracle) {
        return serializer.read(() -> {
            OracleRegistration registration = oracles.get(oracle);
            if (registration == null) {
                throw new SuretyException(SuretyError.UNKNOWN_ORACLE, "Oracle not registered: " + oracle);
            }
            return registration.getIndexes();
        });
    }

    public boolean isRegistered(AccountId oracle) {
        return serializer.read(() -> oracles.containsKey(oracle));
    }

    /**
     * Opens a status request for a flight under an index derived for the requester.
     * Requesting a key that is already open leaves the open request untouched; a closed
     * key is reopened with no reports.
     *
     * @throws SuretyException UNKNOWN_FLIGHT
     */
    public ResponseKey requestStatus(CallContext context, FlightKey flightKey) {
        return serializer.execute("requestFlightStatus", context.getCaller(), () -> {
            accessControl.check(context);
            flightRegistry.requireFlight(flightKey);

            int index = indexSource.nextIndex(context.getCaller(), properties.getOracleIndexRange());
            ResponseKey key = ResponseKey.of(index, flightKey);
            ResponseRequest existing = requests.get(key);
            if (existing != null && existing.isOpen()) {
                log.debug("Status request already open: index={}, flightKey={}", index, flightKey);
                return key;
            }

            requests.put(key, ResponseRequest.open(context.getCaller()));
            outboxService.saveEvent(StatusRequestOpenedEvent.of(index, flightKey, context.getCaller()));
            metrics.recordStatusRequested();
            log.info("Status request opened: index={}, flightKey={}, requester={}",
                index, flightKey, context.getCaller());
            return key;
        });
    }

    /**
     * Records an oracle's report and resolves the request on quorum.
     *
     * @throws SuretyException INDEX_MISMATCH if the caller does not hold {@code index};
     *         NO_MATCHING_REQUEST if no open request exists for it
     */
    public SubmissionResult submitResponse(CallContext context, int index, FlightKey flightKey, FlightStatus status) {
        return serializer.execute("submitOracleResponse", context.getCaller(), () -> {
            accessControl.check(context);
            AccountId oracle = context.getCaller();
            OracleRegistration registration = oracles.get(oracle);
            if (registration == null || !registration.holds(index)) {
                throw new SuretyException(SuretyError.INDEX_MISMATCH,
                    String.format("Oracle %s does not hold index %d", oracle, index));
            }
            ResponseKey key = ResponseKey.of(index, flightKey);
            ResponseRequest request = requests.get(key);
            if (request == null || !request.isOpen()) {
                throw new SuretyException(SuretyError.NO_MATCHING_REQUEST,
                    String.format("No open request for index %d and flight %s", index, flightKey));
            }

            try (CorrelationContext.Scope ignored = CorrelationContext.withFlight(flightKey)) {
                if (request.hasReported(status, oracle)) {
                    log.debug("Repeated report ignored: oracle={}, status={}", oracle, status);
                    return new SubmissionResult(false, request.reportCount(status), null);
                }

                ResponseRequest updated = request.withReport(status, oracle);
                int count = updated.reportCount(status);
                outboxService.saveEvent(OracleReportReceivedEvent.of(index, flightKey, oracle, status, count));
                metrics.recordOracleReport(status.name());
                log.debug("Oracle report counted: oracle={}, index={}, status={}, count={}",
                    oracle, index, status, count);

                if (count < properties.getMinResponses()) {
                    requests.put(key, updated);
                    return new SubmissionResult(true, count, null);
                }

                requests.put(key, updated.close(status));
                outboxService.saveEvent(FlightStatusResolvedEvent.of(index, flightKey, status));
                log.info("Oracle quorum reached: index={}, flightKey={}, status={}, reports={}",
                    index, flightKey, status, count);
                settlementService.applyResolution(flightKey, status);
                return new SubmissionResult(true, count, status);
            }
        });
    }

    public Optional<ResponseRequest> getRequest(ResponseKey key) {
        return serializer.read(() -> Optional.ofNullable(requests.get(key)));
    }

    private List<Integer> generateIndexes(AccountId oracle) {
        int range = properties.getOracleIndexRange();
        int first = indexSource.nextIndex(oracle, range);

        int second = indexSource.nextIndex(oracle, range);
        while (second == first) {
            second = indexSource.nextIndex(oracle, range);
        }

        int third = indexSource.nextIndex(oracle, range);
        while (third == first || third == second) {
            third = indexSource.nextIndex(oracle, range);
        }
        return List.of(first, second, third);
    }
}
