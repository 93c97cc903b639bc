package com.flagship.flight_surety.observability;

import com.flagship.flight_surety.common.AccountId;
import com.flagship.flight_surety.flight.FlightKey;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the registry logging context.
 */
class CorrelationContextTest {

    private static final AccountId AIRLINE = AccountId.of("0xairline");

    @AfterEach
    void tearDown() {
        CorrelationContext.clear();
    }

    @Test
    @DisplayName("Nested flight scope restores the outer flight on close")
    void nestedScopeRestoresOuterValue() {
        FlightKey reported = FlightKey.of(AIRLINE, "ND1309", 1L);
        FlightKey settled = FlightKey.of(AIRLINE, "ND1310", 2L);

        try (CorrelationContext.Scope outer = CorrelationContext.withFlight(reported)) {
            try (CorrelationContext.Scope inner = CorrelationContext.withFlight(settled)) {
                assertEquals(settled.toString(), MDC.get(CorrelationContext.FLIGHT_KEY_MDC_KEY));
            }
            assertEquals(reported.toString(), MDC.get(CorrelationContext.FLIGHT_KEY_MDC_KEY));
        }
        assertNull(MDC.get(CorrelationContext.FLIGHT_KEY_MDC_KEY));
    }

    @Test
    @DisplayName("Missing caller leaves the account key untouched")
    void nullAccountKeepsOuterValue() {
        try (CorrelationContext.Scope outer = CorrelationContext.withAccount(AIRLINE)) {
            try (CorrelationContext.Scope inner = CorrelationContext.withAccount(null)) {
                assertEquals("0xairline", MDC.get(CorrelationContext.ACCOUNT_ID_MDC_KEY));
            }
            assertEquals("0xairline", MDC.get(CorrelationContext.ACCOUNT_ID_MDC_KEY));
        }
    }

    @Test
    @DisplayName("Blank request id is replaced and clear drops every registry key")
    void beginAndClear() {
        String id = CorrelationContext.begin(" ");
        CorrelationContext.withAirline(AIRLINE);

        assertEquals(8, id.length());
        assertEquals(id, CorrelationContext.getCorrelationId());
        assertEquals("abc12345", CorrelationContext.begin("abc12345"));

        CorrelationContext.clear();

        assertNull(CorrelationContext.getCorrelationId());
        assertNull(MDC.get(CorrelationContext.AIRLINE_ID_MDC_KEY));
    }
}
