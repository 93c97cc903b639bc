package com.flagship.flight_surety.settlement;

import com.flagship.flight_surety.SuretyFixture;
import com.flagship.flight_surety.common.AccountId;
import com.flagship.flight_surety.common.SuretyError;
import com.flagship.flight_surety.common.SuretyException;
import com.flagship.flight_surety.flight.FlightKey;
import com.flagship.flight_surety.flight.FlightStatus;
import com.flagship.flight_surety.insurance.PayoutReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.flagship.flight_surety.SuretyFixture.FIRST_AIRLINE;
import static com.flagship.flight_surety.SuretyFixture.UNIT;
import static com.flagship.flight_surety.SuretyFixture.account;
import static com.flagship.flight_surety.SuretyFixture.as;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for status changes and the payouts they trigger.
 *
 * These tests verify that:
 * - A late status set by the airline credits insured passengers in the same call
 * - A non-late status credits nobody
 * - Oracle resolution overrides the airline and freezes the status
 */
class StatusSettlementServiceTest {

    private static final AccountId PASSENGER = account("passenger");
    private static final String CODE = "ND1309";
    private static final long DEPARTURE = 1_700_000_000L;

    private SuretyFixture fixture;
    private StatusSettlementService settlement;
    private FlightKey flight;

    @BeforeEach
    void setUp() {
        fixture = new SuretyFixture();
        settlement = fixture.settlementService;
        fixture.fund(FIRST_AIRLINE);
        flight = fixture.registerFlight(FIRST_AIRLINE, CODE, DEPARTURE);
        fixture.insuranceService.buyInsurance(as(PASSENGER), PASSENGER, flight, UNIT, UNIT);
    }

    @Test
    @DisplayName("Late status from the airline credits insured passengers")
    void airlineLateStatusPaysOut() {
        PayoutReport report = settlement.updateByAirline(as(FIRST_AIRLINE), CODE, DEPARTURE, FlightStatus.LATE_TECHNICAL);

        assertEquals(1, report.getPaid().size());
        assertEquals(3 * UNIT / 2, fixture.insuranceService.getPassengerBalance(PASSENGER));
        assertEquals(FlightStatus.LATE_TECHNICAL, fixture.flightRegistry.getFlightStatus(flight));
        assertFalse(fixture.flightRegistry.requireFlight(flight).isOracleResolved());
    }

    @Test
    @DisplayName("On-time status credits nobody")
    void onTimeStatusPaysNothing() {
        PayoutReport report = settlement.updateByAirline(as(FIRST_AIRLINE), CODE, DEPARTURE, FlightStatus.ON_TIME);

        assertTrue(report.getPaid().isEmpty());
        assertEquals(0, fixture.insuranceService.getPassengerBalance(PASSENGER));
    }

    @Test
    @DisplayName("Airline update of an unknown flight is rejected")
    void unknownFlight() {
        SuretyException e = assertThrows(SuretyException.class,
            () -> settlement.updateByAirline(as(FIRST_AIRLINE), "NOPE", DEPARTURE, FlightStatus.LATE_AIRLINE));
        assertEquals(SuretyError.UNKNOWN_FLIGHT, e.getError());
    }

    @Test
    @DisplayName("Oracle resolution overrides the airline status and pays out")
    void resolutionOverridesAirline() {
        settlement.updateByAirline(as(FIRST_AIRLINE), CODE, DEPARTURE, FlightStatus.ON_TIME);

        PayoutReport report = settlement.applyResolution(flight, FlightStatus.LATE_WEATHER);

        assertEquals(1, report.getPaid().size());
        assertEquals(FlightStatus.LATE_WEATHER, fixture.flightRegistry.getFlightStatus(flight));
        assertEquals(3 * UNIT / 2, fixture.insuranceService.getPassengerBalance(PASSENGER));
    }

    @Test
    @DisplayName("Airline cannot change a status resolved by oracles")
    void resolvedStatusIsFrozen() {
        settlement.applyResolution(flight, FlightStatus.ON_TIME);

        SuretyException e = assertThrows(SuretyException.class,
            () -> settlement.updateByAirline(as(FIRST_AIRLINE), CODE, DEPARTURE, FlightStatus.LATE_AIRLINE));

        assertEquals(SuretyError.STATUS_FROZEN, e.getError());
        assertEquals(FlightStatus.ON_TIME, fixture.flightRegistry.getFlightStatus(flight));
        assertEquals(0, fixture.insuranceService.getPassengerBalance(PASSENGER));
    }

    @Test
    @DisplayName("A second late status does not pay the same claim twice")
    void secondLateStatusDoesNotPayTwice() {
        settlement.updateByAirline(as(FIRST_AIRLINE), CODE, DEPARTURE, FlightStatus.LATE_AIRLINE);
        PayoutReport second = settlement.applyResolution(flight, FlightStatus.LATE_OTHER);

        assertTrue(second.getPaid().isEmpty());
        assertEquals(3 * UNIT / 2, fixture.insuranceService.getPassengerBalance(PASSENGER));
    }

    @Test
    @DisplayName("Flight registered with surrounding spaces is updated by the same code")
    void paddedCodeNamesTheSameFlight() {
        FlightKey padded = fixture.registerFlight(FIRST_AIRLINE, " UA1 ", DEPARTURE);

        settlement.updateByAirline(as(FIRST_AIRLINE), " UA1 ", DEPARTURE, FlightStatus.LATE_AIRLINE);

        assertEquals(FlightKey.of(FIRST_AIRLINE, "UA1", DEPARTURE), padded);
        assertEquals("UA1", padded.getCode());
        assertEquals(FlightStatus.LATE_AIRLINE, fixture.flightRegistry.getFlightStatus(padded));
    }
}
