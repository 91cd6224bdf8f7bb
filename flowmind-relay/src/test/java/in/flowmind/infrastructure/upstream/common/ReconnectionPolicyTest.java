package in.flowmind.infrastructure.upstream.common;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ReconnectionPolicy.
 *
 * Tests:
 * - Nominal backoff sequence and cap
 * - Jitter bounds
 * - Exhaustion after max attempts
 * - Builder validation
 */
class ReconnectionPolicyTest {

    private static ReconnectionPolicy noJitter() {
        return ReconnectionPolicy.builder()
            .baseDelay(Duration.ofSeconds(5))
            .maxDelay(Duration.ofSeconds(60))
            .maxAttempts(5)
            .jitter(0.0)
            .build();
    }

    @Test
    void testInitialState() {
        ReconnectionPolicy policy = noJitter();

        assertFalse(policy.isExhausted(), "Not exhausted initially");
        assertEquals(0, policy.getAttemptCount(), "Initial attempt count should be 0");
    }

    @Test
    void testNominalBackoffSequence() {
        ReconnectionPolicy policy = noJitter();

        long[] expected = {5, 10, 20, 40, 60, 60};
        for (int attempt = 1; attempt <= expected.length; attempt++) {
            assertEquals(Duration.ofSeconds(expected[attempt - 1]), policy.nominalDelay(attempt),
                "Nominal delay for attempt " + attempt);
        }
    }

    @Test
    void testNoJitterDelayEqualsNominal() {
        ReconnectionPolicy policy = noJitter();

        assertEquals(Duration.ofSeconds(20), policy.delayFor(3));
    }

    @Test
    void testJitterStaysWithinTenPercent() {
        ReconnectionPolicy low = ReconnectionPolicy.builder().random(() -> 0.0).build();
        ReconnectionPolicy high = ReconnectionPolicy.builder().random(() -> 0.999999).build();
        ReconnectionPolicy mid = ReconnectionPolicy.builder().random(() -> 0.5).build();

        assertEquals(Duration.ofMillis(9000), low.delayFor(2), "Lower bound is -10%");
        assertEquals(Duration.ofMillis(11000), high.delayFor(2), "Upper bound is +10%");
        assertEquals(Duration.ofMillis(10000), mid.delayFor(2), "Midpoint is nominal");

        ReconnectionPolicy random = ReconnectionPolicy.forProvider();
        for (int i = 0; i < 200; i++) {
            long ms = random.delayFor(6).toMillis();
            assertTrue(ms >= 54_000 && ms <= 66_000, "Capped delay with jitter out of range: " + ms);
        }
    }

    @Test
    void testExhaustedAfterMaxAttempts() {
        ReconnectionPolicy policy = noJitter();

        for (int i = 1; i <= 5; i++) {
            assertEquals(i, policy.recordFailure());
            assertFalse(policy.isExhausted(), "Attempt " + i + " is still allowed");
        }

        assertEquals(6, policy.recordFailure());
        assertTrue(policy.isExhausted(), "Sixth failure exceeds max attempts");
    }

    @Test
    void testSuccessResetsCounter() {
        ReconnectionPolicy policy = noJitter();
        for (int i = 0; i < 6; i++) {
            policy.recordFailure();
        }
        assertTrue(policy.isExhausted());

        policy.recordSuccess();

        assertFalse(policy.isExhausted());
        assertEquals(0, policy.getAttemptCount());
        assertEquals(1, policy.recordFailure(), "Counting restarts at attempt 1");
    }

    @Test
    void testResetAfterExhaustion() {
        ReconnectionPolicy policy = noJitter();
        for (int i = 0; i < 6; i++) {
            policy.recordFailure();
        }

        policy.reset();

        assertFalse(policy.isExhausted());
        assertEquals(1, policy.recordFailure());
    }

    @Test
    void testAttemptZeroRejected() {
        ReconnectionPolicy policy = noJitter();

        assertThrows(IllegalArgumentException.class, () -> policy.nominalDelay(0));
    }

    @Test
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class,
            () -> ReconnectionPolicy.builder().baseDelay(Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
            () -> ReconnectionPolicy.builder().maxDelay(Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class,
            () -> ReconnectionPolicy.builder().multiplier(1.0));
        assertThrows(IllegalArgumentException.class,
            () -> ReconnectionPolicy.builder().maxAttempts(0));
        assertThrows(IllegalArgumentException.class,
            () -> ReconnectionPolicy.builder().jitter(1.0));
        assertThrows(IllegalArgumentException.class,
            () -> ReconnectionPolicy.builder()
                .baseDelay(Duration.ofSeconds(90))
                .maxDelay(Duration.ofSeconds(60))
                .build());
    }
}
