package com.realtime.admission.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Dependencies whose health decides whether realtime connections are admitted.
 */
public enum ServiceType {
    
    AUTH_SERVICE("auth_service"),
    DATABASE("database"),
    REDIS("redis"),
    WEBSOCKET_BRIDGE("websocket_bridge"),
    AGENT_SUPERVISOR("agent_supervisor"),
    TOOL_DISPATCHER("tool_dispatcher"),
    THREAD_SERVICE("thread_service");
    
    private final String id;
    
    ServiceType(String id) {
        this.id = id;
    }
    
    /**
     * Stable identifier used in denial reasons, reports and metric tags.
     */
    public String id() {
        return id;
    }
    
    public static Optional<ServiceType> fromId(String id) {
        return Arrays.stream(values())
            .filter(type -> type.id.equalsIgnoreCase(id))
            .findFirst();
    }
    
    @Override
    public String toString() {
        return id;
    }
}
