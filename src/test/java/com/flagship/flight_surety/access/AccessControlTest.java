package com.flagship.flight_surety.access;

import com.flagship.flight_surety.SuretyFixture;
import com.flagship.flight_surety.common.AccountId;
import com.flagship.flight_surety.common.CallContext;
import com.flagship.flight_surety.common.SuretyError;
import com.flagship.flight_surety.common.SuretyException;
import io.micrometer.core.instrument.Counter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.flagship.flight_surety.SuretyFixture.FIRST_AIRLINE;
import static com.flagship.flight_surety.SuretyFixture.GATEWAY;
import static com.flagship.flight_surety.SuretyFixture.OWNER;
import static com.flagship.flight_surety.SuretyFixture.account;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the authorized-caller set and the operational circuit breaker.
 */
class AccessControlTest {

    private SuretyFixture fixture;
    private AccessControl accessControl;

    @BeforeEach
    void setUp() {
        fixture = new SuretyFixture();
        accessControl = fixture.accessControl;
    }

    @Test
    @DisplayName("Owner can authorize and revoke callers")
    void ownerCanAuthorizeAndRevoke() {
        AccountId other = account("othergateway");

        accessControl.authorize(OWNER, other);
        assertTrue(accessControl.isAuthorized(other));

        accessControl.revoke(OWNER, other);
        assertFalse(accessControl.isAuthorized(other));
        assertTrue(accessControl.isAuthorized(GATEWAY));
    }

    @Test
    @DisplayName("Non-owner cannot change the authorized callers")
    void nonOwnerCannotAuthorize() {
        AccountId other = account("othergateway");

        SuretyException e = assertThrows(SuretyException.class,
            () -> accessControl.authorize(FIRST_AIRLINE, other));

        assertEquals(SuretyError.UNAUTHORIZED, e.getError());
        assertFalse(accessControl.isAuthorized(other));
    }

    @Test
    @DisplayName("Calls through an unknown gateway are rejected without state change")
    void unknownGatewayIsRejected() {
        CallContext viaStranger = CallContext.of(account("stranger"), FIRST_AIRLINE);

        SuretyException e = assertThrows(SuretyException.class,
            () -> fixture.airlineRegistry.payMembershipFund(viaStranger, fixture.properties.getJoinFee()));

        assertEquals(SuretyError.UNAUTHORIZED, e.getError());
        assertFalse(fixture.airlineRegistry.hasPaidFund(FIRST_AIRLINE));
        assertEquals(0, fixture.ledger.airlineEscrowTotal());
    }

    @Test
    @DisplayName("Revoked gateway loses access on the next call")
    void revokedGatewayIsRejected() {
        accessControl.revoke(OWNER, GATEWAY);

        SuretyException e = assertThrows(SuretyException.class, () -> fixture.fund(FIRST_AIRLINE));
        assertEquals(SuretyError.UNAUTHORIZED, e.getError());
    }

    @Test
    @DisplayName("Paused registry rejects state changes but can be resumed by the owner")
    void pausedRegistryRejectsCalls() {
        accessControl.setOperational(OWNER, false);
        assertFalse(accessControl.isOperational());

        SuretyException paused = assertThrows(SuretyException.class, () -> fixture.fund(FIRST_AIRLINE));
        assertEquals(SuretyError.NOT_OPERATIONAL, paused.getError());

        SuretyException authorize = assertThrows(SuretyException.class,
            () -> accessControl.authorize(OWNER, account("othergateway")));
        assertEquals(SuretyError.NOT_OPERATIONAL, authorize.getError());

        accessControl.setOperational(OWNER, true);
        fixture.fund(FIRST_AIRLINE);
        assertTrue(fixture.airlineRegistry.hasPaidFund(FIRST_AIRLINE));
    }

    @Test
    @DisplayName("Only the owner can flip the operational flag")
    void nonOwnerCannotPause() {
        SuretyException e = assertThrows(SuretyException.class,
            () -> accessControl.setOperational(FIRST_AIRLINE, false));

        assertEquals(SuretyError.UNAUTHORIZED, e.getError());
        assertTrue(accessControl.isOperational());
    }

    @Test
    @DisplayName("Setting the current operational value is a no-op")
    void settingSameModeIsNoOp() {
        accessControl.setOperational(OWNER, true);
        assertTrue(accessControl.isOperational());
    }

    @Test
    @DisplayName("Rejections are counted once, under the outermost operation")
    void rejectionIsCountedUnderOutermostOperation() {
        accessControl.setOperational(OWNER, false);
        assertThrows(SuretyException.class, () -> fixture.fund(FIRST_AIRLINE));

        Counter counter = fixture.meterRegistry.find("surety.rejected")
            .tags("operation", "payMembershipFund", "code", "NOT_OPERATIONAL")
            .counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
        assertNull(fixture.meterRegistry.find("surety.rejected").tags("operation", "checkAccess").counter());
    }
}
