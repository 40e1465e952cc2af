package com.realtime.admission.observability;

import com.realtime.admission.model.CircuitBreakerState;
import com.realtime.admission.model.ServiceStatus;
import com.realtime.admission.model.ServiceType;
import com.realtime.admission.observability.HealthEventPublisher.CircuitStateChangeEvent;
import com.realtime.admission.observability.HealthEventPublisher.ServiceHealthChangeEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

public class HealthEventPublisherTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private HealthEventPublisher publisher;

    @BeforeEach
    public void setUp() {
        publisher = new HealthEventPublisher();
    }

    @Test
    public void testHealthEventStream() {
        StepVerifier.create(publisher.getHealthEventStream().take(2))
            .then(() -> {
                publisher.publishHealthChange(ServiceType.REDIS, ServiceStatus.UNKNOWN, ServiceStatus.HEALTHY, false, null, NOW);
                publisher.publishHealthChange(ServiceType.REDIS, ServiceStatus.HEALTHY, ServiceStatus.FAILED, true, "reset", NOW);
            })
            .assertNext(event -> {
                assertEquals(ServiceType.REDIS, event.getService());
                assertEquals(ServiceStatus.HEALTHY, event.getNewStatus());
                assertFalse(event.isCircuitBreakerOpen());
            })
            .assertNext(event -> {
                assertEquals(ServiceStatus.FAILED, event.getNewStatus());
                assertTrue(event.isCircuitBreakerOpen());
                assertEquals("reset", event.getErrorMessage());
            })
            .expectComplete()
            .verify(Duration.ofSeconds(5));
    }

    @Test
    public void testCircuitEventStream() {
        StepVerifier.create(publisher.getCircuitEventStream().take(1))
            .then(() -> publisher.publishCircuitStateChange("websocket_connect",
                CircuitBreakerState.CLOSED, CircuitBreakerState.OPEN, NOW))
            .assertNext(event -> {
                assertEquals("websocket_connect", event.getCircuitName());
                assertEquals(CircuitBreakerState.CLOSED, event.getFromState());
                assertEquals(CircuitBreakerState.OPEN, event.getToState());
                assertEquals(NOW, event.getTimestamp());
            })
            .expectComplete()
            .verify(Duration.ofSeconds(5));
    }

    @Test
    public void testEventsWithoutSubscribersAreDropped() {
        publisher.publishHealthChange(ServiceType.DATABASE, ServiceStatus.UNKNOWN, ServiceStatus.FAILED, false, "down", NOW);

        List<ServiceHealthChangeEvent> events = new CopyOnWriteArrayList<>();
        Disposable subscription = publisher.subscribeToHealthChanges(events::add);
        publisher.publishHealthChange(ServiceType.DATABASE, ServiceStatus.FAILED, ServiceStatus.HEALTHY, false, null, NOW);
        subscription.dispose();

        assertEquals(1, events.size());
        assertEquals(ServiceStatus.HEALTHY, events.get(0).getNewStatus());
    }

    @Test
    public void testSubscriberTracking() {
        Disposable first = publisher.subscribeToHealthChanges(event -> { });
        Disposable second = publisher.subscribeToCircuitChanges(event -> { });
        assertEquals(2, publisher.getSubscriberCount());

        first.dispose();
        assertEquals(1, publisher.getSubscriberCount());

        second.dispose();
        assertEquals(0, publisher.getSubscriberCount());
    }

    @Test
    public void testFailingListenerDoesNotStopDelivery() {
        List<CircuitStateChangeEvent> received = new CopyOnWriteArrayList<>();
        Disposable subscription = publisher.subscribeToCircuitChanges(event -> {
            received.add(event);
            throw new IllegalStateException("listener bug");
        });

        publisher.publishCircuitStateChange("db", CircuitBreakerState.CLOSED, CircuitBreakerState.OPEN, NOW);
        publisher.publishCircuitStateChange("db", CircuitBreakerState.OPEN, CircuitBreakerState.HALF_OPEN, NOW);
        subscription.dispose();

        assertEquals(2, received.size());
    }

    @Test
    public void testNewSubscriberAfterDisposeStillReceives() {
        publisher.subscribeToHealthChanges(event -> { }).dispose();

        List<ServiceHealthChangeEvent> events = new CopyOnWriteArrayList<>();
        Disposable subscription = publisher.subscribeToHealthChanges(events::add);
        publisher.publishHealthChange(ServiceType.AUTH_SERVICE, ServiceStatus.UNKNOWN, ServiceStatus.HEALTHY, false, null, NOW);
        subscription.dispose();

        assertEquals(1, events.size());
    }

    @Test
    public void testCloseCompletesStreams() {
        StepVerifier.create(publisher.getHealthEventStream())
            .then(publisher::close)
            .expectComplete()
            .verify(Duration.ofSeconds(5));
    }
}
