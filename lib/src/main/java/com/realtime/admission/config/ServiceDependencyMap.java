package com.realtime.admission.config;

import com.realtime.admission.model.ServiceType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Splits every {@link ServiceType} into critical and optional dependencies.
 * A critical service that is unavailable blocks all new connections; an optional
 * one only degrades the experience.
 */
public final class ServiceDependencyMap {
    
    private final Set<ServiceType> critical;
    private final Set<ServiceType> optional;
    
    private ServiceDependencyMap(Set<ServiceType> critical) {
        this.critical = Collections.unmodifiableSet(EnumSet.copyOf(critical));
        this.optional = Collections.unmodifiableSet(EnumSet.complementOf(EnumSet.copyOf(critical)));
    }
    
    /**
     * Creates a map in which the given services are critical and every other service is optional.
     *
     * @throws IllegalArgumentException if no critical service is given
     */
    public static ServiceDependencyMap withCritical(Set<ServiceType> critical) {
        Objects.requireNonNull(critical, "critical must not be null");
        if (critical.isEmpty()) {
            throw new IllegalArgumentException("At least one service must be critical");
        }
        return new ServiceDependencyMap(critical);
    }
    
    /**
     * Creates a map from explicit critical and optional sets, which must be disjoint
     * and together cover every service type.
     */
    public static ServiceDependencyMap of(Set<ServiceType> critical, Set<ServiceType> optional) {
        Objects.requireNonNull(critical, "critical must not be null");
        Objects.requireNonNull(optional, "optional must not be null");
        
        Set<ServiceType> overlap = critical.isEmpty() ? EnumSet.noneOf(ServiceType.class) : EnumSet.copyOf(critical);
        overlap.retainAll(optional);
        if (!overlap.isEmpty()) {
            throw new IllegalArgumentException("Services cannot be both critical and optional: " + overlap);
        }
        
        Set<ServiceType> missing = EnumSet.allOf(ServiceType.class);
        missing.removeAll(critical);
        missing.removeAll(optional);
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Services not classified as critical or optional: " + missing);
        }
        return withCritical(critical);
    }
    
    /**
     * Authentication and the primary datastore are critical; everything else is optional.
     */
    public static ServiceDependencyMap defaultMap() {
        return new ServiceDependencyMap(EnumSet.of(ServiceType.AUTH_SERVICE, ServiceType.DATABASE));
    }
    
    public Set<ServiceType> getCritical() {
        return critical;
    }
    
    public Set<ServiceType> getOptional() {
        return optional;
    }
    
    public boolean isCritical(ServiceType serviceType) {
        return critical.contains(serviceType);
    }
    
    @Override
    public String toString() {
        return "ServiceDependencyMap{critical=" + critical + ", optional=" + optional + "}";
    }
}
