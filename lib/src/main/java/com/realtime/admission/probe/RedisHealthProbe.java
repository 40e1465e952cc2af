package com.realtime.admission.probe;

import com.realtime.admission.availability.ProbeException;
import com.realtime.admission.availability.ServiceHealthProbe;
import com.realtime.admission.model.ProbeResult;
import com.realtime.admission.model.ServiceType;
import io.lettuce.core.api.StatefulRedisConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * Health probe that sends {@code PING} over a Lettuce connection.
 *
 * <p>{@code PONG} within {@code degradedLatency} is HEALTHY. A slower {@code PONG} or any other
 * reply is DEGRADED. A connection or command error completes the probe exceptionally with
 * {@link ProbeException}.</p>
 */
public class RedisHealthProbe implements ServiceHealthProbe {

    private static final Logger logger = LoggerFactory.getLogger(RedisHealthProbe.class);

    public static final Duration DEFAULT_DEGRADED_LATENCY = Duration.ofMillis(500);

    private final StatefulRedisConnection<String, String> connection;
    private final Duration degradedLatency;
    private final ServiceType serviceType;

    public RedisHealthProbe(StatefulRedisConnection<String, String> connection) {
        this(connection, DEFAULT_DEGRADED_LATENCY);
    }

    public RedisHealthProbe(StatefulRedisConnection<String, String> connection, Duration degradedLatency) {
        this(connection, degradedLatency, ServiceType.REDIS);
    }

    /**
     * @param serviceType service reported in errors, for Redis instances backing another service
     */
    public RedisHealthProbe(StatefulRedisConnection<String, String> connection, Duration degradedLatency,
                            ServiceType serviceType) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
        this.degradedLatency = Objects.requireNonNull(degradedLatency, "degradedLatency must not be null");
        this.serviceType = Objects.requireNonNull(serviceType, "serviceType must not be null");
        if (degradedLatency.isNegative() || degradedLatency.isZero()) {
            throw new IllegalArgumentException("degradedLatency must be positive");
        }
    }

    @Override
    public CompletionStage<ProbeResult> check() {
        long startTime = System.nanoTime();
        CompletableFuture<String> pingFuture;
        try {
            pingFuture = connection.async().ping().toCompletableFuture();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(pingFailure(e));
        }

        return pingFuture.handle((reply, error) -> {
            if (error != null) {
                throw pingFailure(error);
            }

            Duration latency = Duration.ofNanos(System.nanoTime() - startTime);
            logger.debug("PING for {}: reply={}, latency={}ms", serviceType, reply, latency.toMillis());

            if (!"PONG".equals(reply)) {
                return ProbeResult.degraded("Unexpected ping response: " + reply);
            }
            if (latency.compareTo(degradedLatency) > 0) {
                return ProbeResult.degraded(String.format("Slow ping response: %dms (limit %dms)",
                    latency.toMillis(), degradedLatency.toMillis()));
            }
            return ProbeResult.healthy();
        });
    }

    private ProbeException pingFailure(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        return new ProbeException(serviceType, "PING failed: " + cause.getMessage(), cause);
    }

    public Duration getDegradedLatency() {
        return degradedLatency;
    }
}
