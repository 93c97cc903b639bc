package com.flagship.flight_surety.settlement;

import com.flagship.flight_surety.common.CallContext;
import com.flagship.flight_surety.common.ExecutionSerializer;
import com.flagship.flight_surety.flight.Flight;
import com.flagship.flight_surety.flight.FlightKey;
import com.flagship.flight_surety.flight.FlightRegistry;
import com.flagship.flight_surety.flight.FlightStatus;
import com.flagship.flight_surety.insurance.InsuranceService;
import com.flagship.flight_surety.insurance.PayoutReport;
import com.flagship.flight_surety.observability.SuretyMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Applies flight status changes and settles insurance for late flights.
 *
 * Both ways a status can change end here:
 * 1. A direct update by the airline operating the flight
 * 2. Oracle consensus resolution
 *
 * In both cases the status write and the payout run inside the same serialized call,
 * so a late status is never visible without its payouts having been attempted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatusSettlementService {

    private final FlightRegistry flightRegistry;
    private final InsuranceService insuranceService;
    private final SuretyMetrics metrics;
    private final ExecutionSerializer serializer;

    /**
     * Status update by the calling airline for one of its own flights.
     */
    public PayoutReport updateByAirline(CallContext context, String code, long timestamp, FlightStatus status) {
        FlightKey key = FlightKey.of(context.getCaller(), code, timestamp);
        return serializer.execute("updateFlightStatus", context.getCaller(), () -> {
            Flight updated = flightRegistry.setStatus(context, key, status);
            return settle(updated);
        });
    }

    /**
     * Status resolved by oracle consensus.
     */
    public PayoutReport applyResolution(FlightKey key, FlightStatus status) {
        return serializer.execute("applyResolution", null, () -> {
            Flight resolved = flightRegistry.applyResolvedStatus(key, status);
            metrics.recordStatusResolved(status.name());
            return settle(resolved);
        });
    }

    private PayoutReport settle(Flight flight) {
        if (!flight.getStatus().isLate()) {
            return PayoutReport.empty(flight.getKey());
        }
        PayoutReport report = insuranceService.resolveDelay(flight.getKey());
        if (!report.isComplete()) {
            log.warn("Flight settled with underfunded claims: flightKey={}, underfunded={}",
                flight.getKey(), report.getUnderfunded().size());
        }
        return report;
    }
}
