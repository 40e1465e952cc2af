package com.realtime.admission.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Circuit breaker and retry configuration for one operation domain.
 * Instances are immutable; {@link Builder#build()} rejects non-positive values
 * and a base delay larger than the maximum delay.
 */
public class CircuitBreakerConfig {
    
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final int successThreshold;
    private final int maxRetryAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final Duration timeout;
    
    private CircuitBreakerConfig(Builder builder) {
        this.failureThreshold = builder.failureThreshold;
        this.recoveryTimeout = builder.recoveryTimeout;
        this.successThreshold = builder.successThreshold;
        this.maxRetryAttempts = builder.maxRetryAttempts;
        this.baseDelay = builder.baseDelay;
        this.maxDelay = builder.maxDelay;
        this.timeout = builder.timeout;
    }
    
    /**
     * Failures (after retries are exhausted) that open a closed circuit.
     */
    public int getFailureThreshold() {
        return failureThreshold;
    }
    
    /**
     * Time an open circuit waits after the last failure before admitting probe calls.
     */
    public Duration getRecoveryTimeout() {
        return recoveryTimeout;
    }
    
    /**
     * Successes needed in half-open state to close the circuit.
     */
    public int getSuccessThreshold() {
        return successThreshold;
    }
    
    public int getMaxRetryAttempts() {
        return maxRetryAttempts;
    }
    
    public Duration getBaseDelay() {
        return baseDelay;
    }
    
    public Duration getMaxDelay() {
        return maxDelay;
    }
    
    /**
     * Upper bound for a single attempt.
     */
    public Duration getTimeout() {
        return timeout;
    }
    
    public Builder toBuilder() {
        return builder()
            .failureThreshold(failureThreshold)
            .recoveryTimeout(recoveryTimeout)
            .successThreshold(successThreshold)
            .maxRetryAttempts(maxRetryAttempts)
            .baseDelay(baseDelay)
            .maxDelay(maxDelay)
            .timeout(timeout);
    }
    
    public static CircuitBreakerConfig defaultConfig() {
        return builder().build();
    }
    
    /**
     * Preset tuned for the given deployment environment.
     */
    public static CircuitBreakerConfig forEnvironment(DeploymentEnvironment environment) {
        Objects.requireNonNull(environment, "environment must not be null");
        return switch (environment) {
            case STAGING -> builder()
                .failureThreshold(3)
                .recoveryTimeout(Duration.ofSeconds(15))
                .maxRetryAttempts(5)
                .baseDelay(Duration.ofMillis(500))
                .maxDelay(Duration.ofSeconds(30))
                .timeout(Duration.ofSeconds(10))
                .build();
            case PRODUCTION -> builder()
                .failureThreshold(5)
                .recoveryTimeout(Duration.ofSeconds(60))
                .maxRetryAttempts(3)
                .baseDelay(Duration.ofSeconds(2))
                .maxDelay(Duration.ofSeconds(120))
                .timeout(Duration.ofSeconds(15))
                .build();
            case DEVELOPMENT -> builder()
                .failureThreshold(10)
                .recoveryTimeout(Duration.ofSeconds(5))
                .maxRetryAttempts(3)
                .baseDelay(Duration.ofMillis(100))
                .maxDelay(Duration.ofSeconds(5))
                .timeout(Duration.ofSeconds(5))
                .build();
        };
    }
    
    /**
     * Preset for an environment tag such as {@code "staging"} or {@code "prod"}.
     * Unknown or blank tags resolve to the development preset.
     */
    public static CircuitBreakerConfig forEnvironment(String environmentTag) {
        return forEnvironment(DeploymentEnvironment.fromTag(environmentTag));
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CircuitBreakerConfig that = (CircuitBreakerConfig) o;
        return failureThreshold == that.failureThreshold
            && successThreshold == that.successThreshold
            && maxRetryAttempts == that.maxRetryAttempts
            && recoveryTimeout.equals(that.recoveryTimeout)
            && baseDelay.equals(that.baseDelay)
            && maxDelay.equals(that.maxDelay)
            && timeout.equals(that.timeout);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(failureThreshold, recoveryTimeout, successThreshold, maxRetryAttempts,
                            baseDelay, maxDelay, timeout);
    }
    
    @Override
    public String toString() {
        return String.format("CircuitBreakerConfig{failureThreshold=%d, recoveryTimeout=%s, successThreshold=%d, " +
                           "maxRetryAttempts=%d, baseDelay=%s, maxDelay=%s, timeout=%s}",
            failureThreshold, recoveryTimeout, successThreshold, maxRetryAttempts, baseDelay, maxDelay, timeout);
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private int failureThreshold = 5;
        private Duration recoveryTimeout = Duration.ofSeconds(30);
        private int successThreshold = 2;
        private int maxRetryAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private Duration timeout = Duration.ofSeconds(10);
        
        public Builder failureThreshold(int threshold) {
            this.failureThreshold = threshold;
            return this;
        }
        
        public Builder recoveryTimeout(Duration timeout) {
            this.recoveryTimeout = timeout;
            return this;
        }
        
        public Builder successThreshold(int threshold) {
            this.successThreshold = threshold;
            return this;
        }
        
        public Builder maxRetryAttempts(int attempts) {
            this.maxRetryAttempts = attempts;
            return this;
        }
        
        public Builder baseDelay(Duration delay) {
            this.baseDelay = delay;
            return this;
        }
        
        public Builder maxDelay(Duration delay) {
            this.maxDelay = delay;
            return this;
        }
        
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }
        
        public CircuitBreakerConfig build() {
            requirePositive("failureThreshold", failureThreshold);
            requirePositive("successThreshold", successThreshold);
            requirePositive("maxRetryAttempts", maxRetryAttempts);
            requirePositive("recoveryTimeout", recoveryTimeout);
            requireWholeMillis("baseDelay", baseDelay);
            requireWholeMillis("maxDelay", maxDelay);
            requirePositive("timeout", timeout);
            if (baseDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException(
                    String.format("baseDelay (%s) must not exceed maxDelay (%s)", baseDelay, maxDelay));
            }
            return new CircuitBreakerConfig(this);
        }
        
        private static void requirePositive(String name, int value) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive, got " + value);
            }
        }
        
        // Backoff intervals are computed in milliseconds.
        private static void requireWholeMillis(String name, Duration value) {
            requirePositive(name, value);
            if (value.toMillis() < 1) {
                throw new IllegalArgumentException(name + " must be at least 1ms, got " + value);
            }
        }
        
        private static void requirePositive(String name, Duration value) {
            Objects.requireNonNull(value, name + " must not be null");
            if (value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive, got " + value);
            }
        }
    }
}
