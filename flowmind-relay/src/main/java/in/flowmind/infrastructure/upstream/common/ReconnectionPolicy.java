package in.flowmind.infrastructure.upstream.common;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Reconnection policy with exponential backoff and jitter for the provider connection.
 *
 * The nominal delay before attempt {@code n} is
 * {@code baseDelay * multiplier^(n-1)}, capped at {@code maxDelay}. The
 * delay actually waited is the nominal delay scaled by a random factor in
 * {@code [1 - jitter, 1 + jitter]}.
 *
 * Once more than {@code maxAttempts} consecutive failures have been
 * recorded the policy is exhausted and stays so until
 * {@link #recordSuccess()} or {@link #reset()}.
 *
 * Usage:
 * <pre>
 * ReconnectionPolicy policy = ReconnectionPolicy.forProvider();
 *
 * while (true) {
 *     int attempt = policy.recordFailure();
 *     if (policy.isExhausted()) {
 *         break;  // terminal
 *     }
 *     sleep(policy.delayFor(attempt));
 *     try {
 *         connect();
 *         policy.recordSuccess();
 *         break;
 *     } catch (UpstreamConnectException e) {
 *         // next round
 *     }
 * }
 * </pre>
 */
public class ReconnectionPolicy {

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;
    private final double jitter;
    private final DoubleSupplier random;

    private int attemptCount = 0;
    private boolean exhausted = false;

    private ReconnectionPolicy(Builder b) {
        this.baseDelay = b.baseDelay;
        this.maxDelay = b.maxDelay;
        this.multiplier = b.multiplier;
        this.maxAttempts = b.maxAttempts;
        this.jitter = b.jitter;
        this.random = b.random;
    }

    /**
     * Record a failed (or lost) connection and advance to the next attempt.
     *
     * @return the attempt number the caller is now about to make (1-based)
     */
    public synchronized int recordFailure() {
        attemptCount++;
        if (attemptCount > maxAttempts) {
            exhausted = true;
        }
        return attemptCount;
    }

    /**
     * Record a successful connection.
     * Resets the attempt counter and clears exhaustion.
     */
    public synchronized void recordSuccess() {
        attemptCount = 0;
        exhausted = false;
    }

    /**
     * Reset the policy to initial state.
     * Used when an operator forces a reconnect after terminal failure.
     */
    public synchronized void reset() {
        recordSuccess();
    }

    /**
     * @return true once more than maxAttempts consecutive failures were recorded
     */
    public synchronized boolean isExhausted() {
        return exhausted;
    }

    /**
     * Nominal (un-jittered) delay before the given attempt.
     */
    public Duration nominalDelay(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempt numbers start at 1: " + attempt);
        }
        double millis = baseDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        long capped = (long) Math.min(millis, (double) maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }

    /**
     * Delay to wait before the given attempt, jitter applied.
     */
    public Duration delayFor(int attempt) {
        long nominal = nominalDelay(attempt).toMillis();
        if (jitter == 0.0) {
            return Duration.ofMillis(nominal);
        }
        double factor = 1.0 + jitter * (2.0 * random.getAsDouble() - 1.0);
        return Duration.ofMillis(Math.max(0L, Math.round(nominal * factor)));
    }

    /**
     * @return number of failures since last success
     */
    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Provider defaults: 5s base, 60s cap, doubling, 5 attempts, 10% jitter.
     */
    public static ReconnectionPolicy forProvider() {
        return builder().build();
    }

    public static class Builder {
        private Duration baseDelay = Duration.ofSeconds(5);
        private Duration maxDelay = Duration.ofSeconds(60);
        private double multiplier = 2.0;
        private int maxAttempts = 5;
        private double jitter = 0.10;
        private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();

        public Builder baseDelay(Duration baseDelay) {
            if (baseDelay.isNegative() || baseDelay.isZero()) {
                throw new IllegalArgumentException("Base delay must be positive");
            }
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier <= 1.0) {
                throw new IllegalArgumentException("Multiplier must be greater than 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * @param jitter fraction of the nominal delay, 0.0 disables jitter
         */
        public Builder jitter(double jitter) {
            if (jitter < 0.0 || jitter >= 1.0) {
                throw new IllegalArgumentException("Jitter must be in [0, 1)");
            }
            this.jitter = jitter;
            return this;
        }

        /**
         * Source of uniform values in [0, 1) used for jitter.
         */
        public Builder random(DoubleSupplier random) {
            this.random = random;
            return this;
        }

        public ReconnectionPolicy build() {
            if (baseDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Base delay cannot exceed max delay");
            }
            return new ReconnectionPolicy(this);
        }
    }
}
