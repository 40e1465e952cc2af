package com.realtime.admission.integration;

import com.realtime.admission.AdmissionControl;
import com.realtime.admission.config.AvailabilityConfig;
import com.realtime.admission.config.DeploymentEnvironment;
import com.realtime.admission.model.AdmissionDecision;
import com.realtime.admission.model.ProbeResult;
import com.realtime.admission.model.ServiceHealthInfo;
import com.realtime.admission.model.ServiceStatus;
import com.realtime.admission.model.ServiceType;
import com.realtime.admission.probe.RedisHealthProbe;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.api.StatefulRedisConnection;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the Redis probe and the admission flow against a real Redis server.
 */
@Testcontainers(disabledWithoutDocker = true)
@Tag("integration")
class RedisHealthProbeIntegrationTest {

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7.2.4"))
            .withExposedPorts(6379);

    private static RedisClient client;
    private static StatefulRedisConnection<String, String> connection;

    @BeforeAll
    static void setUpClass() {
        assertTrue(redis.isRunning(), "Redis container should be running");

        RedisURI uri = RedisURI.builder()
                .withHost(redis.getHost())
                .withPort(redis.getFirstMappedPort())
                .withTimeout(Duration.ofSeconds(5))
                .build();
        client = RedisClient.create(uri);
        connection = client.connect();
    }

    @AfterAll
    static void tearDownClass() {
        if (connection != null) {
            connection.close();
        }
        if (client != null) {
            client.shutdown();
        }
    }

    @Test
    void testPingReportsHealthy() throws Exception {
        RedisHealthProbe probe = new RedisHealthProbe(connection, Duration.ofSeconds(2));

        ProbeResult result = probe.check().toCompletableFuture().get(5, TimeUnit.SECONDS);

        assertEquals(ServiceStatus.HEALTHY, result.getStatus());
    }

    @Test
    void testAdmissionWithRedisAsCriticalDependency() {
        AvailabilityConfig config = AvailabilityConfig.builder()
                .probeTimeout(Duration.ofSeconds(3))
                .build();

        try (AdmissionControl admissionControl = AdmissionControl.builder()
                .environment(DeploymentEnvironment.DEVELOPMENT)
                .availabilityConfig(config)
                .probe(ServiceType.REDIS, new RedisHealthProbe(connection))
                .probe(ServiceType.AUTH_SERVICE, () -> CompletableFuture.completedFuture(ProbeResult.healthy()))
                .probe(ServiceType.DATABASE, () -> CompletableFuture.completedFuture(ProbeResult.healthy()))
                .build()) {

            AdmissionDecision decision = admissionControl.shouldAllowConnection().join();
            assertTrue(decision.isAllowed());

            ServiceHealthInfo redisHealth = admissionControl.availability()
                    .getServiceHealth(ServiceType.REDIS).orElseThrow();
            assertEquals(ServiceStatus.HEALTHY, redisHealth.getStatus());
            assertTrue(redisHealth.getResponseTime().isPresent());
        }
    }

    @Test
    void testClosedConnectionReportsFailed() {
        StatefulRedisConnection<String, String> closed = client.connect();
        closed.close();

        try (AdmissionControl admissionControl = AdmissionControl.builder()
                .environment(DeploymentEnvironment.DEVELOPMENT)
                .probe(ServiceType.REDIS, new RedisHealthProbe(closed))
                .build()) {

            admissionControl.availability().checkAllServices().join();

            ServiceHealthInfo redisHealth = admissionControl.availability()
                    .getServiceHealth(ServiceType.REDIS).orElseThrow();
            assertEquals(ServiceStatus.FAILED, redisHealth.getStatus());
            assertTrue(redisHealth.getErrorMessage().isPresent());
        }
    }
}
