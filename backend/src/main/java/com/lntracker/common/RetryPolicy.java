package com.lntracker.common;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Bounded retry with a fixed delay and a tolerance window.
 * <p>
 * An attempt that fails after running longer than the tolerance window refills the retry
 * budget: a connection that works for a while and then drops is treated differently from
 * one that never comes up. Waits go through the {@link CancellationToken}; a cancel during
 * the wait ends the loop with an empty result instead of an exception.
 */
@Slf4j
public final class RetryPolicy {

    public static final int DEFAULT_MAX_RETRIES = 5;
    public static final Duration DEFAULT_DELAY = Duration.ofMinutes(5);
    public static final Duration DEFAULT_TOLERANCE_WINDOW = Duration.ofMinutes(15);

    private final Set<Class<? extends RuntimeException>> retryOn;
    private final Set<Class<? extends RuntimeException>> abortOn;
    private final int maxRetries;
    private final Duration delay;
    private final Duration toleranceWindow;
    private final CancellationToken cancellationToken;
    private final Clock clock;

    private RetryPolicy(Builder builder) {
        this.retryOn = Set.copyOf(builder.retryOn);
        this.abortOn = Set.copyOf(builder.abortOn);
        this.maxRetries = builder.maxRetries;
        this.delay = builder.delay;
        this.toleranceWindow = builder.toleranceWindow;
        this.cancellationToken = builder.cancellationToken;
        this.clock = builder.clock;
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (cancellationToken == null) {
            throw new IllegalArgumentException("cancellationToken is required");
        }
    }

    public static Builder builder(CancellationToken cancellationToken) {
        return new Builder(cancellationToken);
    }

    /**
     * Retries every {@link RuntimeException}: 5 retries, 5 minutes apart, budget refilled after 15 minutes.
     */
    public static RetryPolicy defaultPolicy(CancellationToken cancellationToken) {
        return builder(cancellationToken).build();
    }

    /**
     * Runs {@code operation} until it succeeds, the budget is exhausted, or the token fires.
     *
     * @return the result, or empty when cancelled while waiting for the next attempt
     */
    public <T> Optional<T> call(String operationName, Supplier<T> operation) {
        int retriesLeft = maxRetries;
        while (true) {
            Instant toleranceDeadline = toleranceWindow != null ? clock.instant().plus(toleranceWindow) : null;
            try {
                return Optional.ofNullable(operation.get());
            } catch (RuntimeException e) {
                if (matches(abortOn, e) || !matches(retryOn, e)) {
                    throw e;
                }
                log.error("{} failed: {}; retries left {}", operationName, e.getMessage(), retriesLeft);
                if (toleranceDeadline != null && clock.instant().isAfter(toleranceDeadline)) {
                    retriesLeft = maxRetries;
                }
                if (retriesLeft == 0) {
                    log.error("{} failed after {} retries, giving up", operationName, maxRetries, e);
                    throw e;
                }
                retriesLeft--;
                if (!delay.isZero() && !delay.isNegative()) {
                    log.debug("{}: waiting {} before retrying", operationName, delay);
                    if (cancellationToken.await(delay)) {
                        log.debug("{}: cancelled while waiting for retry", operationName);
                        return Optional.empty();
                    }
                }
            }
        }
    }

    /**
     * Void variant of {@link #call(String, Supplier)}.
     *
     * @return false if the loop ended because of cancellation
     */
    public boolean run(String operationName, Runnable operation) {
        return call(operationName, () -> {
            operation.run();
            return Boolean.TRUE;
        }).isPresent();
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getDelay() {
        return delay;
    }

    public Duration getToleranceWindow() {
        return toleranceWindow;
    }

    private static boolean matches(Set<Class<? extends RuntimeException>> types, RuntimeException e) {
        for (Class<? extends RuntimeException> type : types) {
            if (type.isInstance(e)) {
                return true;
            }
        }
        return false;
    }

    public static final class Builder {

        private final CancellationToken cancellationToken;
        private Set<Class<? extends RuntimeException>> retryOn = Set.of(RuntimeException.class);
        private Set<Class<? extends RuntimeException>> abortOn = Set.of();
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration delay = DEFAULT_DELAY;
        private Duration toleranceWindow = DEFAULT_TOLERANCE_WINDOW;
        private Clock clock = Clock.systemUTC();

        private Builder(CancellationToken cancellationToken) {
            this.cancellationToken = cancellationToken;
        }

        public Builder retryOn(Set<Class<? extends RuntimeException>> retryOn) {
            this.retryOn = retryOn;
            return this;
        }

        public Builder abortOn(Set<Class<? extends RuntimeException>> abortOn) {
            this.abortOn = abortOn;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder delay(Duration delay) {
            this.delay = delay != null ? delay : Duration.ZERO;
            return this;
        }

        /** Null disables the budget refill. */
        public Builder toleranceWindow(Duration toleranceWindow) {
            this.toleranceWindow = toleranceWindow;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
