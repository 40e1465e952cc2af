package com.realtime.admission.observability;

import com.realtime.admission.model.CircuitBreakerState;
import com.realtime.admission.model.ServiceStatus;
import com.realtime.admission.model.ServiceType;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Publishes service health transitions and circuit breaker state transitions as
 * reactive streams. Events emitted while nobody is subscribed are dropped.
 */
public class HealthEventPublisher {
    
    private static final Logger logger = LoggerFactory.getLogger(HealthEventPublisher.class);
    
    private final Sinks.Many<ServiceHealthChangeEvent> healthEventSink;
    private final Sinks.Many<CircuitStateChangeEvent> circuitEventSink;
    private final ConcurrentMap<String, Long> subscribers;
    private final AtomicLong subscriberSequence;
    
    public HealthEventPublisher() {
        this.healthEventSink = Sinks.many().multicast().onBackpressureBuffer(Queues.SMALL_BUFFER_SIZE, false);
        this.circuitEventSink = Sinks.many().multicast().onBackpressureBuffer(Queues.SMALL_BUFFER_SIZE, false);
        this.subscribers = new ConcurrentHashMap<>();
        this.subscriberSequence = new AtomicLong();
        
        logger.debug("HealthEventPublisher initialized");
    }
    
    /**
     * Publishes a change of a service's health status or breaker flag.
     *
     * @param timestamp when the change happened, on the caller's clock
     */
    public void publishHealthChange(ServiceType service, ServiceStatus previousStatus, ServiceStatus newStatus,
                                    boolean circuitBreakerOpen, String errorMessage, Instant timestamp) {
        ServiceHealthChangeEvent event = new ServiceHealthChangeEvent(
            service, previousStatus, newStatus, circuitBreakerOpen, errorMessage, timestamp);
        emit(healthEventSink, event, service.id());
    }
    
    /**
     * Publishes a circuit breaker state transition.
     */
    public void publishCircuitStateChange(String circuitName, CircuitBreakerState from, CircuitBreakerState to,
                                          Instant timestamp) {
        CircuitStateChangeEvent event = new CircuitStateChangeEvent(circuitName, from, to, timestamp);
        emit(circuitEventSink, event, circuitName);
    }
    
    private <E> void emit(Sinks.Many<E> sink, E event, String source) {
        if (sink.currentSubscriberCount() == 0) {
            logger.trace("No subscribers, dropping {}", event);
            return;
        }
        
        Sinks.EmitResult result;
        synchronized (sink) {
            result = sink.tryEmitNext(event);
        }
        if (result.isFailure()) {
            logger.warn("Failed to publish event for {}: {}", source, result);
        } else {
            logger.debug("Published {}", event);
        }
    }
    
    /**
     * Subscribes to service health change events.
     *
     * @param listener the callback for health change events
     * @return Disposable to unsubscribe
     */
    public Disposable subscribeToHealthChanges(Consumer<ServiceHealthChangeEvent> listener) {
        return subscribe("health", healthEventSink.asFlux(), listener);
    }
    
    /**
     * Subscribes to circuit breaker state transitions.
     *
     * @param listener the callback for state transitions
     * @return Disposable to unsubscribe
     */
    public Disposable subscribeToCircuitChanges(Consumer<CircuitStateChangeEvent> listener) {
        return subscribe("circuit", circuitEventSink.asFlux(), listener);
    }
    
    private <E> Disposable subscribe(String prefix, Flux<E> stream, Consumer<E> listener) {
        String subscriberId = prefix + "-" + subscriberSequence.incrementAndGet();
        subscribers.put(subscriberId, System.currentTimeMillis());
        
        logger.info("New {} event subscriber: {} (total subscribers: {})", prefix, subscriberId, subscribers.size());
        
        return stream
            .doOnCancel(() -> {
                subscribers.remove(subscriberId);
                logger.info("Subscription cancelled: {} (remaining: {})", subscriberId, subscribers.size());
            })
            .subscribe(
                event -> {
                    try {
                        listener.accept(event);
                    } catch (RuntimeException e) {
                        logger.error("Event listener {} failed on {}", subscriberId, event, e);
                    }
                },
                error -> logger.error("Event subscriber {} error", subscriberId, error)
            );
    }
    
    public int getSubscriberCount() {
        return subscribers.size();
    }
    
    public Flux<ServiceHealthChangeEvent> getHealthEventStream() {
        return healthEventSink.asFlux();
    }
    
    public Flux<CircuitStateChangeEvent> getCircuitEventStream() {
        return circuitEventSink.asFlux();
    }
    
    /**
     * Completes both streams.
     */
    public void close() {
        logger.info("Closing HealthEventPublisher with {} active subscribers", subscribers.size());
        
        synchronized (healthEventSink) {
            healthEventSink.tryEmitComplete();
        }
        synchronized (circuitEventSink) {
            circuitEventSink.tryEmitComplete();
        }
        subscribers.clear();
    }
    
    /**
     * A service's health status or breaker flag changed.
     */
    public static class ServiceHealthChangeEvent {
        private final ServiceType service;
        private final ServiceStatus previousStatus;
        private final ServiceStatus newStatus;
        private final boolean circuitBreakerOpen;
        private final String errorMessage;
        private final Instant timestamp;
        
        public ServiceHealthChangeEvent(ServiceType service, ServiceStatus previousStatus, ServiceStatus newStatus,
                                        boolean circuitBreakerOpen, String errorMessage, Instant timestamp) {
            this.service = service;
            this.previousStatus = previousStatus;
            this.newStatus = newStatus;
            this.circuitBreakerOpen = circuitBreakerOpen;
            this.errorMessage = errorMessage;
            this.timestamp = timestamp;
        }
        
        public ServiceType getService() {
            return service;
        }
        
        public ServiceStatus getPreviousStatus() {
            return previousStatus;
        }
        
        public ServiceStatus getNewStatus() {
            return newStatus;
        }
        
        public boolean isCircuitBreakerOpen() {
            return circuitBreakerOpen;
        }
        
        public String getErrorMessage() {
            return errorMessage;
        }
        
        public Instant getTimestamp() {
            return timestamp;
        }
        
        @Override
        public String toString() {
            return String.format("ServiceHealthChangeEvent{service=%s, %s -> %s, circuitBreakerOpen=%s}",
                service, previousStatus, newStatus, circuitBreakerOpen);
        }
    }
    
    /**
     * A circuit breaker moved between states.
     */
    public static class CircuitStateChangeEvent {
        private final String circuitName;
        private final CircuitBreakerState fromState;
        private final CircuitBreakerState toState;
        private final Instant timestamp;
        
        public CircuitStateChangeEvent(String circuitName, CircuitBreakerState fromState,
                                       CircuitBreakerState toState, Instant timestamp) {
            this.circuitName = circuitName;
            this.fromState = fromState;
            this.toState = toState;
            this.timestamp = timestamp;
        }
        
        public String getCircuitName() {
            return circuitName;
        }
        
        public CircuitBreakerState getFromState() {
            return fromState;
        }
        
        public CircuitBreakerState getToState() {
            return toState;
        }
        
        public Instant getTimestamp() {
            return timestamp;
        }
        
        @Override
        public String toString() {
            return String.format("CircuitStateChangeEvent{circuit='%s', %s -> %s}", circuitName, fromState, toState);
        }
    }
}
