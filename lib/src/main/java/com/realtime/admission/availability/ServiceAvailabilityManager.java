package com.realtime.admission.availability;

import com.realtime.admission.config.AvailabilityConfig;
import com.realtime.admission.config.ServiceDependencyMap;
import com.realtime.admission.model.AdmissionDecision;
import com.realtime.admission.model.HealthReport;
import com.realtime.admission.model.HealthReport.OverallStatus;
import com.realtime.admission.model.HealthReport.ServiceDetail;
import com.realtime.admission.model.ProbeResult;
import com.realtime.admission.model.ServiceHealthInfo;
import com.realtime.admission.model.ServiceStatus;
import com.realtime.admission.model.ServiceType;
import com.realtime.admission.observability.HealthEventPublisher;
import com.realtime.admission.observability.MetricsCollector;
import com.realtime.admission.scheduling.AsyncScheduler;
import io.micrometer.core.instrument.Gauge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Tracks the health of every {@link ServiceType} and decides whether new realtime
 * connections are admitted.
 *
 * <p>Health comes from probes registered per service. {@link #checkAllServices()} runs all
 * probes concurrently, each bounded by the probe timeout, and applies the results in one
 * step once every probe has finished. Probe failures never escape; they become FAILED
 * records. Each service carries a failure-streak breaker: after
 * {@code maxConsecutiveFailures} failed checks the service is treated as unavailable until
 * {@code circuitBreakerTimeout} has passed.</p>
 *
 * <p>Admission is denied while any critical service is unavailable, or while the number of
 * degraded services is at or above the configured threshold.</p>
 *
 * <p>Construct once at startup and share the instance. All reads and writes of the health
 * records are serialized by a single lock.</p>
 */
public class ServiceAvailabilityManager implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ServiceAvailabilityManager.class);

    private final AvailabilityConfig config;
    private final ServiceDependencyMap dependencyMap;
    private final AsyncScheduler scheduler;
    private final HealthEventPublisher eventPublisher;
    private final MetricsCollector metricsCollector;

    private final Map<ServiceType, ServiceHealthProbe> probes = new ConcurrentHashMap<>();
    private final Set<CompletableFuture<?>> inFlightChecks = ConcurrentHashMap.newKeySet();
    private final List<Gauge> availabilityGauges = new ArrayList<>();

    private final Object healthLock = new Object();
    private final Map<ServiceType, ServiceHealthInfo> health = new EnumMap<>(ServiceType.class);
    private Instant lastGlobalCheck;

    private final Object monitorLock = new Object();
    private ScheduledExecutorService monitorExecutor;
    private ScheduledFuture<?> monitoringTask;

    public ServiceAvailabilityManager(AvailabilityConfig config, AsyncScheduler scheduler) {
        this(config, scheduler, new HealthEventPublisher(), new MetricsCollector());
    }

    public ServiceAvailabilityManager(AvailabilityConfig config, AsyncScheduler scheduler,
                                      HealthEventPublisher eventPublisher, MetricsCollector metricsCollector) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.dependencyMap = config.getDependencyMap();
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.eventPublisher = Objects.requireNonNull(eventPublisher, "eventPublisher must not be null");
        this.metricsCollector = Objects.requireNonNull(metricsCollector, "metricsCollector must not be null");

        for (ServiceType type : ServiceType.values()) {
            health.put(type, ServiceHealthInfo.unknown(type));
            metricsCollector.registerServiceAvailability(type, () -> isServiceAvailable(type))
                .ifPresent(availabilityGauges::add);
        }

        logger.info("Service availability manager initialized: critical={}, optional={}",
                   dependencyMap.getCritical(), dependencyMap.getOptional());
    }

    /**
     * Registers the health probe for a service, replacing any earlier one.
     */
    public void registerProbe(ServiceType serviceType, ServiceHealthProbe probe) {
        Objects.requireNonNull(serviceType, "serviceType must not be null");
        Objects.requireNonNull(probe, "probe must not be null");

        if (probes.put(serviceType, probe) != null) {
            logger.info("Replaced health probe for {}", serviceType);
        } else {
            logger.debug("Registered health probe for {}", serviceType);
        }
    }

    public Set<ServiceType> getRegisteredServices() {
        return Collections.unmodifiableSet(probes.keySet());
    }

    /**
     * Runs every registered probe concurrently and applies the results together.
     * Services without a probe keep their current record.
     *
     * <p>The returned future never completes exceptionally because of a probe. Cancelling it
     * cancels the probes still running, and none of the results are applied.</p>
     *
     * @return snapshot of all health records after the check
     */
    public CompletableFuture<Map<ServiceType, ServiceHealthInfo>> checkAllServices() {
        Map<ServiceType, CompletableFuture<ProbeResult>> started = new EnumMap<>(ServiceType.class);
        Map<ServiceType, CompletableFuture<ProbeOutcome>> outcomes = new EnumMap<>(ServiceType.class);

        probes.forEach((type, probe) -> {
            Instant start = scheduler.now();
            CompletableFuture<ProbeResult> probeFuture = scheduler.runWithTimeout(probe::check, config.getProbeTimeout());
            started.put(type, probeFuture);
            outcomes.put(type, probeFuture.handle((result, error) -> toOutcome(type, result, error, start)));
        });

        logger.debug("Checking {} service(s): {}", started.size(), started.keySet());

        CompletableFuture<Map<ServiceType, ServiceHealthInfo>> check = CompletableFuture
            .allOf(outcomes.values().toArray(new CompletableFuture<?>[0]))
            .thenApply(ignored -> applyOutcomes(outcomes));

        inFlightChecks.add(check);
        check.whenComplete((result, error) -> {
            inFlightChecks.remove(check);
            if (error != null) {
                logger.warn("Service health check did not complete: {}", describe(error));
                started.values().forEach(future -> future.cancel(true));
            }
        });
        return check;
    }

    private ProbeOutcome toOutcome(ServiceType type, ProbeResult result, Throwable error, Instant start) {
        Duration responseTime = Duration.between(start, scheduler.now());
        if (error != null) {
            Throwable cause = unwrap(error);
            String message = cause instanceof TimeoutException
                ? String.format("Health check timed out after %dms", config.getProbeTimeout().toMillis())
                : "Health check failed: " + describe(cause);
            logger.debug("Probe for {} failed after {}ms: {}", type, responseTime.toMillis(), message);
            return new ProbeOutcome(ServiceStatus.FAILED, message, responseTime);
        }
        if (result == null) {
            return new ProbeOutcome(ServiceStatus.FAILED, "Health check returned no result", responseTime);
        }
        logger.debug("Probe for {}: {} in {}ms", type, result, responseTime.toMillis());
        return new ProbeOutcome(result.getStatus(), result.getMessage().orElse(null), responseTime);
    }

    private Map<ServiceType, ServiceHealthInfo> applyOutcomes(Map<ServiceType, CompletableFuture<ProbeOutcome>> outcomes) {
        List<HealthChange> changes = new ArrayList<>();
        Map<ServiceType, ServiceHealthInfo> snapshot;
        synchronized (healthLock) {
            Instant now = scheduler.now();
            outcomes.forEach((type, future) -> {
                ProbeOutcome outcome = future.join();
                metricsCollector.recordProbe(type, outcome.responseTime, outcome.status);
                applyUpdate(type, outcome.status, outcome.errorMessage, outcome.responseTime, now)
                    .ifPresent(changes::add);
            });
            lastGlobalCheck = now;
            snapshot = copyOfHealth();
        }
        changes.forEach(this::onHealthChange);
        return snapshot;
    }

    /**
     * Records the outcome of a health check for one service and updates its
     * failure-streak breaker.
     *
     * @param errorMessage error description, may be null
     * @param responseTime probe duration, may be null
     */
    public void updateServiceHealth(ServiceType serviceType, ServiceStatus status,
                                    String errorMessage, Duration responseTime) {
        Objects.requireNonNull(serviceType, "serviceType must not be null");
        Objects.requireNonNull(status, "status must not be null");

        Optional<HealthChange> change;
        synchronized (healthLock) {
            change = applyUpdate(serviceType, status, errorMessage, responseTime, scheduler.now());
        }
        change.ifPresent(this::onHealthChange);
    }

    public void updateServiceHealth(ServiceType serviceType, ServiceStatus status) {
        updateServiceHealth(serviceType, status, null, null);
    }

    // caller holds healthLock
    private Optional<HealthChange> applyUpdate(ServiceType type, ServiceStatus status, String errorMessage,
                                               Duration responseTime, Instant now) {
        ServiceHealthInfo current = health.get(type);

        int consecutiveFailures = status == ServiceStatus.FAILED ? current.getConsecutiveFailures() + 1 : 0;
        boolean breakerOpen = current.isCircuitBreakerOpen();
        Instant breakerUntil = current.getCircuitBreakerUntil().orElse(null);

        if (consecutiveFailures >= config.getMaxConsecutiveFailures()) {
            breakerOpen = true;
            breakerUntil = now.plus(config.getCircuitBreakerTimeout());
        }
        if (status == ServiceStatus.HEALTHY && current.isCircuitBreakerOpen()
                && breakerUntil != null && !now.isBefore(breakerUntil)) {
            breakerOpen = false;
            breakerUntil = null;
        }

        ServiceHealthInfo updated = current.toBuilder()
            .status(status)
            .lastCheck(now)
            .errorMessage(errorMessage)
            .responseTime(responseTime)
            .consecutiveFailures(consecutiveFailures)
            .circuitBreakerOpen(breakerOpen)
            .circuitBreakerUntil(breakerUntil)
            .build();
        health.put(type, updated);

        if (current.getStatus() != status || current.isCircuitBreakerOpen() != breakerOpen) {
            return Optional.of(new HealthChange(current, updated));
        }
        return Optional.empty();
    }

    private void onHealthChange(HealthChange change) {
        ServiceHealthInfo previous = change.previous;
        ServiceHealthInfo updated = change.updated;
        ServiceType type = updated.getServiceType();

        if (!previous.isCircuitBreakerOpen() && updated.isCircuitBreakerOpen()) {
            logger.warn("Service {} failed {} consecutive checks, suspended until {}",
                       type, updated.getConsecutiveFailures(), updated.getCircuitBreakerUntil().orElse(null));
        } else if (previous.isCircuitBreakerOpen() && !updated.isCircuitBreakerOpen()) {
            logger.info("Service {} recovered, failure breaker cleared", type);
        }

        if (previous.getStatus() != updated.getStatus()) {
            if (updated.getStatus() == ServiceStatus.FAILED && dependencyMap.isCritical(type)) {
                logger.warn("Critical service {} health changed: {} -> {} ({})", type,
                           previous.getStatus(), updated.getStatus(), updated.getErrorMessage().orElse("no detail"));
            } else {
                logger.info("Service {} health changed: {} -> {}", type, previous.getStatus(), updated.getStatus());
            }
        }

        eventPublisher.publishHealthChange(type, previous.getStatus(), updated.getStatus(),
                                           updated.isCircuitBreakerOpen(), updated.getErrorMessage().orElse(null),
                                           updated.getLastCheck().orElseGet(scheduler::now));
    }

    /**
     * Whether the service can currently be relied on. A service whose failure breaker is open
     * becomes available again, as a probe opportunity, once the breaker timeout has passed.
     */
    public boolean isServiceAvailable(ServiceType serviceType) {
        synchronized (healthLock) {
            ServiceHealthInfo info = health.get(serviceType);
            if (info == null) {
                return false;
            }
            if (info.isCircuitBreakerOpen()) {
                return info.getCircuitBreakerUntil()
                    .map(until -> !scheduler.now().isBefore(until))
                    .orElse(false);
            }
            return info.getStatus().isUsable();
        }
    }

    public boolean areCriticalServicesAvailable() {
        return unavailableCriticalServices().isEmpty();
    }

    public List<ServiceType> getDegradedServices() {
        return servicesWithStatus(ServiceStatus.DEGRADED);
    }

    public List<ServiceType> getFailedServices() {
        return servicesWithStatus(ServiceStatus.FAILED);
    }

    private List<ServiceType> servicesWithStatus(ServiceStatus status) {
        synchronized (healthLock) {
            return health.values().stream()
                .filter(info -> info.getStatus() == status)
                .map(ServiceHealthInfo::getServiceType)
                .collect(Collectors.toList());
        }
    }

    private List<ServiceType> unavailableCriticalServices() {
        synchronized (healthLock) {
            return dependencyMap.getCritical().stream()
                .filter(type -> !isServiceAvailable(type))
                .collect(Collectors.toList());
        }
    }

    /**
     * Admission decision from the current health records, without refreshing them.
     */
    public AdmissionDecision evaluateAdmission() {
        synchronized (healthLock) {
            List<ServiceType> unavailable = unavailableCriticalServices();
            if (!unavailable.isEmpty()) {
                return AdmissionDecision.deny("critical services unavailable: " + ids(unavailable));
            }

            List<ServiceType> degraded = getDegradedServices();
            if (degraded.size() >= config.getDegradedServiceThreshold()) {
                return AdmissionDecision.deny(String.format("too many degraded services (%d, limit %d): %s",
                    degraded.size(), config.getDegradedServiceThreshold(), ids(degraded)));
            }
            return AdmissionDecision.allow();
        }
    }

    /**
     * Decides whether a new connection is admitted, first refreshing health if the last
     * check is older than the health check interval. If that refresh is cancelled or fails,
     * the connection is denied rather than judged on stale records.
     */
    public CompletableFuture<AdmissionDecision> shouldAllowConnection() {
        CompletableFuture<?> refresh = refreshIfStale();
        CompletableFuture<AdmissionDecision> decision = refresh.handle((ignored, error) -> {
            AdmissionDecision result = error == null ? evaluateAdmission() : unknownHealthDecision(error);
            metricsCollector.recordAdmissionDecision(result.isAllowed());
            if (!result.isAllowed()) {
                logger.warn("Connection denied: {}", result.getReason().orElse(""));
            } else {
                logger.debug("Connection admitted");
            }
            return result;
        });
        propagateCancellation(decision, refresh);
        return decision;
    }

    /**
     * Health report, refreshed first if the last check is older than the health check interval.
     * Reports taken within the same interval show identical service statuses.
     */
    public CompletableFuture<HealthReport> getHealthReport() {
        CompletableFuture<?> refresh = refreshIfStale();
        CompletableFuture<HealthReport> report = refresh.handle((ignored, error) ->
            buildReport(error == null ? null : unknownHealthDecision(error)));
        propagateCancellation(report, refresh);
        return report;
    }

    private HealthReport buildReport(AdmissionDecision decisionOverride) {
        synchronized (healthLock) {
            AdmissionDecision decision = decisionOverride != null ? decisionOverride : evaluateAdmission();

            Map<ServiceType, ServiceDetail> critical = new LinkedHashMap<>();
            Map<ServiceType, ServiceDetail> optional = new LinkedHashMap<>();
            int healthy = 0;
            int unknown = 0;
            for (ServiceHealthInfo info : health.values()) {
                ServiceType type = info.getServiceType();
                ServiceDetail detail = new ServiceDetail(isServiceAvailable(type), info);
                if (dependencyMap.isCritical(type)) {
                    critical.put(type, detail);
                } else {
                    optional.put(type, detail);
                }
                if (info.getStatus() == ServiceStatus.HEALTHY) {
                    healthy++;
                } else if (info.getStatus() == ServiceStatus.UNKNOWN) {
                    unknown++;
                }
            }

            HealthReport.Summary summary = new HealthReport.Summary(
                health.size(), critical.size(), optional.size(), healthy, unknown,
                getDegradedServices(), getFailedServices());

            OverallStatus overall;
            if (!decision.isAllowed()) {
                overall = OverallStatus.UNHEALTHY;
            } else if (healthy == health.size()) {
                overall = OverallStatus.HEALTHY;
            } else {
                overall = OverallStatus.DEGRADED;
            }
            return new HealthReport(overall, decision, lastGlobalCheck, critical, optional, summary);
        }
    }

    private CompletableFuture<?> refreshIfStale() {
        if (isStale()) {
            logger.debug("Cached service health is stale, running health checks");
            return checkAllServices();
        }
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Whether no check has completed yet or the last one is older than the health check interval.
     */
    public boolean isStale() {
        synchronized (healthLock) {
            return lastGlobalCheck == null
                || !scheduler.now().isBefore(lastGlobalCheck.plus(config.getHealthCheckInterval()));
        }
    }

    private static void propagateCancellation(CompletableFuture<?> dependent, CompletableFuture<?> source) {
        dependent.whenComplete((ignored, error) -> {
            if (dependent.isCancelled()) {
                source.cancel(true);
            }
        });
    }

    private static AdmissionDecision unknownHealthDecision(Throwable error) {
        Throwable cause = unwrap(error);
        String detail = cause instanceof CancellationException ? "health check cancelled" : describe(cause);
        return AdmissionDecision.deny("service health unknown: " + detail);
    }

    public Optional<ServiceHealthInfo> getServiceHealth(ServiceType serviceType) {
        synchronized (healthLock) {
            return Optional.ofNullable(health.get(serviceType));
        }
    }

    public Map<ServiceType, ServiceHealthInfo> getAllServiceHealth() {
        synchronized (healthLock) {
            return copyOfHealth();
        }
    }

    public Optional<Instant> getLastCheck() {
        synchronized (healthLock) {
            return Optional.ofNullable(lastGlobalCheck);
        }
    }

    public AvailabilityConfig getConfig() {
        return config;
    }

    // caller holds healthLock
    private Map<ServiceType, ServiceHealthInfo> copyOfHealth() {
        return Collections.unmodifiableMap(new EnumMap<>(health));
    }

    /**
     * Starts refreshing health in the background every health check interval.
     */
    public void startMonitoring() {
        synchronized (monitorLock) {
            if (monitoringTask != null) {
                return;
            }

            monitorExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread thread = new Thread(r, "service-availability-monitor");
                thread.setDaemon(true);
                return thread;
            });
            Duration interval = config.getHealthCheckInterval();
            monitoringTask = monitorExecutor.scheduleWithFixedDelay(
                this::performScheduledCheck,
                0,
                interval.toMillis(),
                TimeUnit.MILLISECONDS
            );

            logger.info("Service availability monitoring started with interval: {}", interval);
        }
    }

    private void performScheduledCheck() {
        try {
            checkAllServices().join();
        } catch (CancellationException e) {
            logger.debug("Scheduled health check cancelled");
        } catch (Exception e) {
            logger.error("Error during scheduled health check", e);
        }
    }

    public boolean isMonitoring() {
        synchronized (monitorLock) {
            return monitoringTask != null;
        }
    }

    /**
     * Stops background monitoring and cancels health checks still in flight.
     */
    public void stop() {
        synchronized (monitorLock) {
            if (monitoringTask != null) {
                monitoringTask.cancel(false);
                monitoringTask = null;
            }
            // Releases a monitor run blocked on its check before waiting for the executor.
            cancelInFlightChecks();
            if (monitorExecutor != null) {
                monitorExecutor.shutdown();
                try {
                    if (!monitorExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                        monitorExecutor.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    monitorExecutor.shutdownNow();
                    Thread.currentThread().interrupt();
                }
                monitorExecutor = null;
                logger.info("Service availability monitoring stopped");
            }
        }
        cancelInFlightChecks();
    }

    private void cancelInFlightChecks() {
        new ArrayList<>(inFlightChecks).forEach(check -> check.cancel(true));
    }

    /**
     * Stops monitoring and removes this manager's availability gauges from the registry.
     */
    @Override
    public void close() {
        stop();
        synchronized (availabilityGauges) {
            availabilityGauges.forEach(metricsCollector::remove);
            availabilityGauges.clear();
        }
    }

    private static String ids(List<ServiceType> services) {
        return services.stream().map(ServiceType::id).collect(Collectors.joining(", "));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error) {
        Throwable cause = unwrap(error);
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static final class ProbeOutcome {
        private final ServiceStatus status;
        private final String errorMessage;
        private final Duration responseTime;

        ProbeOutcome(ServiceStatus status, String errorMessage, Duration responseTime) {
            this.status = status;
            this.errorMessage = errorMessage;
            this.responseTime = responseTime;
        }
    }

    private static final class HealthChange {
        private final ServiceHealthInfo previous;
        private final ServiceHealthInfo updated;

        HealthChange(ServiceHealthInfo previous, ServiceHealthInfo updated) {
            this.previous = previous;
            this.updated = updated;
        }
    }
}
