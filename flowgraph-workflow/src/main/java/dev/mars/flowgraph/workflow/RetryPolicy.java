/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.flowgraph.workflow;

import dev.mars.flowgraph.config.FlowgraphConfiguration;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry rules of a single node. {@code maxAttempts} counts every attempt including the first,
 * so a policy of 1 never retries.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class RetryPolicy {

    private static final RetryPolicy NO_RETRY = new RetryPolicy(1, BackoffShape.NONE, Duration.ZERO, Duration.ZERO, 1.0);

    private final int maxAttempts;
    private final BackoffShape backoff;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;

    public RetryPolicy(int maxAttempts, BackoffShape backoff, Duration initialDelay, Duration maxDelay, double multiplier) {
        this.maxAttempts = maxAttempts;
        this.backoff = Objects.requireNonNull(backoff, "Backoff shape cannot be null");
        this.initialDelay = Objects.requireNonNull(initialDelay, "Initial delay cannot be null");
        this.maxDelay = Objects.requireNonNull(maxDelay, "Max delay cannot be null");
        this.multiplier = multiplier;
    }

    public static RetryPolicy noRetry() {
        return NO_RETRY;
    }

    /**
     * Policy applied to nodes that declare none.
     */
    public static RetryPolicy fromConfiguration(FlowgraphConfiguration configuration) {
        return new RetryPolicy(configuration.getDefaultMaxAttempts(),
                BackoffShape.EXPONENTIAL,
                Duration.ofMillis(configuration.getDefaultRetryInitialDelayMs()),
                Duration.ofMillis(configuration.getDefaultRetryMaxDelayMs()),
                2.0);
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public BackoffShape getBackoff() {
        return backoff;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public double getMultiplier() {
        return multiplier;
    }

    /**
     * Delay to wait before the next attempt once attempt {@code failedAttempt} (1-based) has failed.
     */
    public Duration getDelayAfterAttempt(int failedAttempt) {
        int n = Math.max(1, failedAttempt);
        long initialMs = initialDelay.toMillis();
        double delayMs;
        switch (backoff) {
            case FIXED:
                delayMs = initialMs;
                break;
            case LINEAR:
                delayMs = (double) initialMs * n;
                break;
            case EXPONENTIAL:
                delayMs = initialMs * Math.pow(multiplier, n - 1);
                break;
            case NONE:
            default:
                return Duration.ZERO;
        }
        long capMs = maxDelay.toMillis();
        if (capMs > 0 && delayMs > capMs) {
            delayMs = capMs;
        }
        return Duration.ofMillis((long) delayMs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RetryPolicy that = (RetryPolicy) o;
        return maxAttempts == that.maxAttempts &&
               Double.compare(that.multiplier, multiplier) == 0 &&
               backoff == that.backoff &&
               Objects.equals(initialDelay, that.initialDelay) &&
               Objects.equals(maxDelay, that.maxDelay);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxAttempts, backoff, initialDelay, maxDelay, multiplier);
    }

    @Override
    public String toString() {
        return "RetryPolicy{" +
               "maxAttempts=" + maxAttempts +
               ", backoff=" + backoff +
               ", initialDelay=" + initialDelay +
               ", maxDelay=" + maxDelay +
               ", multiplier=" + multiplier +
               '}';
    }

    /**
     * Builder for RetryPolicy.
     */
    public static class Builder {
        private int maxAttempts = 1;
        private BackoffShape backoff = BackoffShape.FIXED;
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(5);
        private double multiplier = 2.0;

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder backoff(BackoffShape backoff) {
            this.backoff = backoff;
            return this;
        }

        public Builder initialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            this.multiplier = multiplier;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(maxAttempts, backoff, initialDelay, maxDelay, multiplier);
        }
    }
}
