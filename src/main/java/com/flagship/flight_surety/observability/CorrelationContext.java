package com.flagship.flight_surety.observability;

import com.flagship.flight_surety.common.AccountId;
import com.flagship.flight_surety.flight.FlightKey;
import org.slf4j.MDC;

import java.util.List;
import java.util.UUID;

/**
 * Logging context of a registry call.
 *
 * The correlation id comes from the HTTP request (or is generated). The domain keys
 * name the account making the call, the airline under admission and the flight
 * being settled; they are set in nested scopes that restore the outer value on close,
 * so a settlement running inside an oracle report keeps the report's flight in the
 * MDC afterwards.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ACCOUNT_ID_MDC_KEY = "accountId";
    public static final String AIRLINE_ID_MDC_KEY = "airlineId";
    public static final String FLIGHT_KEY_MDC_KEY = "flightKey";

    private static final List<String> MDC_KEYS = List.of(
        CORRELATION_ID_MDC_KEY, ACCOUNT_ID_MDC_KEY, AIRLINE_ID_MDC_KEY, FLIGHT_KEY_MDC_KEY);

    private CorrelationContext() {
    }

    /**
     * Starts a request: uses the given id, or a fresh one when blank.
     *
     * @return the correlation id now in the MDC
     */
    public static String begin(String requestedId) {
        String id = requestedId == null || requestedId.isBlank() ? generateCorrelationId() : requestedId;
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        return id;
    }

    public static String getCorrelationId() {
        return MDC.get(CORRELATION_ID_MDC_KEY);
    }

    public static Scope withAccount(AccountId account) {
        return open(ACCOUNT_ID_MDC_KEY, account == null ? null : account.getValue());
    }

    public static Scope withAirline(AccountId airline) {
        return open(AIRLINE_ID_MDC_KEY, airline.getValue());
    }

    public static Scope withFlight(FlightKey flightKey) {
        return open(FLIGHT_KEY_MDC_KEY, flightKey.toString());
    }

    /**
     * Drops every key this context manages. Called at the end of request processing.
     */
    public static void clear() {
        MDC_KEYS.forEach(MDC::remove);
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    private static Scope open(String key, String value) {
        String previous = MDC.get(key);
        if (value != null) {
            MDC.put(key, value);
        }
        return new Scope(key, previous);
    }

    /**
     * Restores the key to its value from before the scope was opened.
     */
    public static final class Scope implements AutoCloseable {
        private final String key;
        private final String previous;

        private Scope(String key, String previous) {
            this.key = key;
            this.previous = previous;
        }

        @Override
        public void close() {
            if (previous == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, previous);
            }
        }
    }
}
