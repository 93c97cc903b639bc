package com.flagship.flight_surety.airline;

import com.flagship.flight_surety.SuretyFixture;
import com.flagship.flight_surety.common.AccountId;
import com.flagship.flight_surety.common.SuretyError;
import com.flagship.flight_surety.common.SuretyException;
import com.flagship.flight_surety.event.AirlineAdmittedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.flagship.flight_surety.SuretyFixture.FIRST_AIRLINE;
import static com.flagship.flight_surety.SuretyFixture.UNIT;
import static com.flagship.flight_surety.SuretyFixture.account;
import static com.flagship.flight_surety.SuretyFixture.as;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for airline admission and membership funding.
 *
 * These tests verify that:
 * - The first airline is registered at startup
 * - Below four airlines, a funded airline admits others directly
 * - From four airlines on, admission needs votes from half of them
 * - Each airline pays its fund once
 */
class AirlineRegistryTest {

    private static final AccountId AIRLINE2 = account("airline2");
    private static final AccountId AIRLINE3 = account("airline3");
    private static final AccountId AIRLINE4 = account("airline4");
    private static final AccountId AIRLINE5 = account("airline5");

    private SuretyFixture fixture;
    private AirlineRegistry registry;

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    @BeforeEach
    void setUp() {
        fixture = new SuretyFixture();
        registry = fixture.airlineRegistry;
    }

    private void registerFourFundedAirlines() {
        fixture.fund(FIRST_AIRLINE);
        fixture.admitAndFund(AIRLINE2);
        fixture.admitAndFund(AIRLINE3);
        fixture.admitAndFund(AIRLINE4);
    }

    @Test
    @DisplayName("First airline is registered but unfunded at startup")
    void firstAirlineIsBootstrapped() {
        assertTrue(registry.isRegistered(FIRST_AIRLINE));
        assertFalse(registry.hasPaidFund(FIRST_AIRLINE));
        assertEquals(1, registry.getRegisteredAirlineCount());
        assertEquals(1, fixture.outboxService.getEventsOfType(AirlineAdmittedEvent.EVENT_TYPE).size());
    }

    @Test
    @DisplayName("Unfunded airline cannot register another airline")
    void unfundedAirlineCannotRegister() {
        SuretyException e = assertThrows(SuretyException.class,
            () -> registry.registerAirline(as(FIRST_AIRLINE), AIRLINE2));

        assertEquals(SuretyError.NOT_AUTHORIZED_AIRLINE, e.getError());
        assertFalse(registry.isRegistered(AIRLINE2));
        assertEquals(1, registry.getRegisteredAirlineCount());
    }

    @Test
    @DisplayName("Below the threshold, airlines are admitted without votes")
    void directAdmissionBelowThreshold() {
        fixture.fund(FIRST_AIRLINE);

        AdmissionResult result = registry.registerAirline(as(FIRST_AIRLINE), AIRLINE2);

        assertTrue(result.isAdmitted());
        assertEquals(0, result.getVotes());
        assertTrue(registry.isRegistered(AIRLINE2));
        assertFalse(registry.hasPaidFund(AIRLINE2));
        assertEquals(2, registry.getRegisteredAirlineCount());
    }

    @Test
    @DisplayName("Fifth airline needs two distinct votes")
    void fifthAirlineNeedsConsensus() {
        printTestHeader("Fifth airline needs two distinct votes");
        registerFourFundedAirlines();
        assertEquals(4, registry.getRegisteredAirlineCount());

        AdmissionResult first = registry.registerAirline(as(FIRST_AIRLINE), AIRLINE5);
        printOutput("First vote", first);
        assertFalse(first.isAdmitted());
        assertEquals(1, first.getVotes());
        assertTrue(registry.isPending(AIRLINE5));
        assertFalse(registry.isRegistered(AIRLINE5));

        SuretyException duplicate = assertThrows(SuretyException.class,
            () -> registry.registerAirline(as(FIRST_AIRLINE), AIRLINE5));
        assertEquals(SuretyError.DUPLICATE_VOTE, duplicate.getError());
        assertEquals(1, registry.getVoteCount(AIRLINE5));

        AdmissionResult second = registry.registerAirline(as(AIRLINE2), AIRLINE5);
        printOutput("Second vote", second);
        assertTrue(second.isAdmitted());
        assertEquals(2, second.getVotes());
        assertTrue(registry.isRegistered(AIRLINE5));
        assertFalse(registry.isPending(AIRLINE5));
        assertEquals(5, registry.getRegisteredAirlineCount());
    }

    @Test
    @DisplayName("Registering an already registered airline is rejected")
    void alreadyRegisteredIsRejected() {
        fixture.fund(FIRST_AIRLINE);
        registry.registerAirline(as(FIRST_AIRLINE), AIRLINE2);

        SuretyException e = assertThrows(SuretyException.class,
            () -> registry.registerAirline(as(FIRST_AIRLINE), AIRLINE2));

        assertEquals(SuretyError.ALREADY_REGISTERED, e.getError());
        assertEquals(2, registry.getRegisteredAirlineCount());
    }

    @Test
    @DisplayName("Admission outcome does not depend on vote order")
    void voteOrderDoesNotMatter() {
        SuretyFixture other = new SuretyFixture();
        registerFourFundedAirlines();
        other.fund(FIRST_AIRLINE);
        other.admitAndFund(AIRLINE2);
        other.admitAndFund(AIRLINE3);
        other.admitAndFund(AIRLINE4);

        registry.registerAirline(as(AIRLINE3), AIRLINE5);
        registry.registerAirline(as(AIRLINE4), AIRLINE5);
        other.airlineRegistry.registerAirline(as(AIRLINE4), AIRLINE5);
        other.airlineRegistry.registerAirline(as(AIRLINE3), AIRLINE5);

        assertTrue(registry.isRegistered(AIRLINE5));
        assertTrue(other.airlineRegistry.isRegistered(AIRLINE5));
        assertEquals(registry.getRegisteredAirlineCount(), other.airlineRegistry.getRegisteredAirlineCount());
    }

    @Test
    @DisplayName("Concurrent votes admit the airline exactly once")
    void concurrentVotesAdmitOnce() throws InterruptedException {
        printTestHeader("Concurrent votes admit the airline exactly once");
        registerFourFundedAirlines();
        List<AccountId> voters = List.of(FIRST_AIRLINE, AIRLINE2, AIRLINE3, AIRLINE4);

        ExecutorService executor = Executors.newFixedThreadPool(voters.size());
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(voters.size());
        AtomicInteger admitted = new AtomicInteger();
        AtomicInteger pending = new AtomicInteger();
        AtomicInteger alreadyRegistered = new AtomicInteger();

        for (AccountId voter : voters) {
            executor.submit(() -> {
                try {
                    start.await();
                    AdmissionResult result = registry.registerAirline(as(voter), AIRLINE5);
                    (result.isAdmitted() ? admitted : pending).incrementAndGet();
                } catch (SuretyException e) {
                    if (e.getError() == SuretyError.ALREADY_REGISTERED) {
                        alreadyRegistered.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(10, TimeUnit.SECONDS));
        executor.shutdown();

        printOutput("Admitted / pending / already registered",
            admitted.get() + " / " + pending.get() + " / " + alreadyRegistered.get());
        assertEquals(1, admitted.get());
        assertEquals(1, pending.get());
        assertEquals(2, alreadyRegistered.get());
        assertEquals(5, registry.getRegisteredAirlineCount());
    }

    @Test
    @DisplayName("Membership fund is escrowed once and short payments are rejected")
    void membershipFund() {
        long joinFee = fixture.properties.getJoinFee();

        SuretyException shortPayment = assertThrows(SuretyException.class,
            () -> registry.payMembershipFund(as(FIRST_AIRLINE), joinFee - 1));
        assertEquals(SuretyError.INSUFFICIENT_PAYMENT, shortPayment.getError());
        assertFalse(registry.hasPaidFund(FIRST_AIRLINE));

        registry.payMembershipFund(as(FIRST_AIRLINE), joinFee);
        assertTrue(registry.hasPaidFund(FIRST_AIRLINE));
        assertEquals(10 * UNIT, fixture.ledger.airlineEscrowTotal());

        SuretyException again = assertThrows(SuretyException.class,
            () -> registry.payMembershipFund(as(FIRST_AIRLINE), joinFee));
        assertEquals(SuretyError.ALREADY_FUNDED, again.getError());
        assertEquals(10 * UNIT, fixture.ledger.airlineEscrowTotal());
    }

    @Test
    @DisplayName("Unregistered account cannot pay a membership fund")
    void unregisteredCannotFund() {
        SuretyException e = assertThrows(SuretyException.class, () -> fixture.fund(AIRLINE2));

        assertEquals(SuretyError.NOT_AUTHORIZED_AIRLINE, e.getError());
        assertEquals(0, fixture.ledger.airlineEscrowTotal());
    }

    @Test
    @DisplayName("Overpayment is returned to the airline")
    void overpaymentIsRefunded() {
        registry.payMembershipFund(as(FIRST_AIRLINE), 12 * UNIT);

        assertEquals(10 * UNIT, fixture.ledger.airlineEscrowTotal());
        assertEquals(2 * UNIT, fixture.payoutGateway.receivedBy(FIRST_AIRLINE));
        assertEquals(10 * UNIT, fixture.ledger.netValueReceived());
    }

    @Test
    @DisplayName("Failed refund is kept as withdrawable credit")
    void failedRefundBecomesCredit() {
        fixture.payoutGateway.setFailing(true);

        registry.payMembershipFund(as(FIRST_AIRLINE), 12 * UNIT);

        assertTrue(registry.hasPaidFund(FIRST_AIRLINE));
        assertEquals(2 * UNIT, fixture.ledger.creditOf(FIRST_AIRLINE));
        assertEquals(12 * UNIT, fixture.ledger.netValueReceived());
        assertTrue(fixture.ledger.isConserved());
    }
}
