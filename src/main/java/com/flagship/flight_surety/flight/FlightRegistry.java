package com.flagship.flight_surety.flight;

import com.flagship.flight_surety.access.AccessControl;
import com.flagship.flight_surety.airline.AirlineRegistry;
import com.flagship.flight_surety.common.CallContext;
import com.flagship.flight_surety.common.ExecutionSerializer;
import com.flagship.flight_surety.common.SuretyError;
import com.flagship.flight_surety.common.SuretyException;
import com.flagship.flight_surety.event.FlightRegisteredEvent;
import com.flagship.flight_surety.observability.SuretyMetrics;
import com.flagship.flight_surety.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Owns flight existence and the current status of each flight.
 *
 * Status is written either by the owning airline or by the oracle resolution
 * callback. An oracle-resolved status freezes the flight against airline updates;
 * a later oracle resolution still overwrites it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FlightRegistry {

    private final AccessControl accessControl;
    private final AirlineRegistry airlineRegistry;
    private final OutboxService outboxService;
    private final SuretyMetrics metrics;
    private final ExecutionSerializer serializer;

    private final Map<FlightKey, Flight> flights = new HashMap<>();

    /**
     * Registers a flight of the calling airline in UNKNOWN status.
     *
     * @throws SuretyException NOT_AUTHORIZED_AIRLINE if the caller is not a registered,
     *         funded airline; FLIGHT_ALREADY_EXISTS on a second registration
     */
    public FlightKey registerFlight(CallContext context, String code, long timestamp) {
        return serializer.execute("registerFlight", context.getCaller(), () -> {
            accessControl.check(context);
            if (code == null || code.isBlank()) {
                throw new IllegalArgumentException("Flight code is required");
            }
            airlineRegistry.requireFundedAirline(context.getCaller());

            FlightKey key = FlightKey.of(context.getCaller(), code, timestamp);
            if (flights.containsKey(key)) {
                throw new SuretyException(SuretyError.FLIGHT_ALREADY_EXISTS, "Flight already registered: " + key);
            }
            flights.put(key, Flight.register(key));

            outboxService.saveEvent(FlightRegisteredEvent.of(key));
            metrics.recordFlightRegistered();
            log.info("Flight registered: flightKey={}", key);
            return key;
        });
    }

    /**
     * Direct status update by the airline that owns the flight.
     *
     * @throws SuretyException UNKNOWN_FLIGHT, NOT_AUTHORIZED_AIRLINE if the caller does not
     *         own the flight, STATUS_FROZEN after oracle resolution
     */
    public Flight setStatus(CallContext context, FlightKey key, FlightStatus status) {
        return serializer.execute("setFlightStatus", context.getCaller(), () -> {
            accessControl.check(context);
            Flight flight = requireFlight(key);
            if (!flight.getKey().getAirline().equals(context.getCaller())) {
                throw new SuretyException(SuretyError.NOT_AUTHORIZED_AIRLINE,
                    "Caller does not operate flight " + key);
            }
            Flight updated = flight.updateByAirline(status);
            flights.put(key, updated);
            log.info("Flight status set by airline: flightKey={}, status={}", key, status);
            return updated;
        });
    }

    /**
     * Writes a status resolved by oracle consensus. Callers have already passed the
     * access check of the reporting call.
     */
    public Flight applyResolvedStatus(FlightKey key, FlightStatus status) {
        return serializer.execute("applyResolvedStatus", null, () -> {
            Flight resolved = requireFlight(key).resolve(status);
            flights.put(key, resolved);
            log.info("Flight status resolved by oracles: flightKey={}, status={}", key, status);
            return resolved;
        });
    }

    public Optional<Flight> getFlight(FlightKey key) {
        return serializer.read(() -> Optional.ofNullable(flights.get(key)));
    }

    public boolean exists(FlightKey key) {
        return serializer.read(() -> flights.containsKey(key));
    }

    /**
     * @throws SuretyException UNKNOWN_FLIGHT
     */
    public FlightStatus getFlightStatus(FlightKey key) {
        return serializer.read(() -> requireFlight(key).getStatus());
    }

    /**
     * @throws SuretyException UNKNOWN_FLIGHT
     */
    public Flight requireFlight(FlightKey key) {
        return serializer.read(() -> {
            Flight flight = flights.get(key);
            if (flight == null) {
                throw new SuretyException(SuretyError.UNKNOWN_FLIGHT, "Unknown flight: " + key);
            }
            return flight;
        });
    }
}
