package com.flagship.flight_surety.config;

import com.flagship.flight_surety.common.AccountId;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Registry settings bound from {@code surety.*}.
 *
 * Amounts are in base units; {@link #UNIT} base units make one currency unit.
 */
@Data
@ConfigurationProperties(prefix = "surety")
public class SuretyProperties {

    public static final long UNIT = 1_000_000_000L;

    /**
     * Deploying identity. The only account allowed to run admin operations.
     */
    private String owner = "0x0000000000000000000000000000000000000001";

    /**
     * Airline admitted unconditionally when the registry starts.
     */
    private String firstAirline = "0x0000000000000000000000000000000000000002";

    private Gateway gateway = new Gateway();

    private long joinFee = 10 * UNIT;
    private long maxInsuranceAmount = UNIT;
    private long oracleRegistrationFee = UNIT;

    /**
     * Below this many registered airlines, admission needs no votes.
     */
    private int consensusThreshold = 4;

    /**
     * Votes needed = registered count / multiPartyRate (integer division).
     */
    private int multiPartyRate = 2;

    private int minResponses = 3;
    private int oracleIndexRange = 10;

    private int payoutNumerator = 3;
    private int payoutDenominator = 2;

    public AccountId ownerId() {
        return AccountId.of(owner);
    }

    public AccountId firstAirlineId() {
        return AccountId.of(firstAirline);
    }

    @Data
    public static class Gateway {
        /**
         * Identity the HTTP boundary uses when forwarding calls into the core.
         */
        private String id = "0x00000000000000000000000000000000000000ff";

        /**
         * Authorize the gateway with the owner identity at startup.
         */
        private boolean autoAuthorize = true;
    }
}
