package com.realtime.admission.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Deployment environments with their own resilience presets.
 */
public enum DeploymentEnvironment {
    
    DEVELOPMENT,
    STAGING,
    PRODUCTION;
    
    /**
     * System property, then environment variable, consulted by {@link #current()}.
     */
    public static final String ENVIRONMENT_KEY = "ENVIRONMENT";
    
    private static final Logger logger = LoggerFactory.getLogger(DeploymentEnvironment.class);
    
    /**
     * Resolves an environment tag. Matching is case-insensitive and accepts the usual
     * short forms; blank or unrecognised tags fall back to {@link #DEVELOPMENT}.
     */
    public static DeploymentEnvironment fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return DEVELOPMENT;
        }
        
        switch (tag.trim().toLowerCase(Locale.ROOT)) {
            case "production":
            case "prod":
                return PRODUCTION;
            case "staging":
            case "stage":
                return STAGING;
            case "development":
            case "dev":
            case "local":
            case "test":
                return DEVELOPMENT;
            default:
                logger.warn("Unknown environment '{}', using development resilience settings", tag);
                return DEVELOPMENT;
        }
    }
    
    /**
     * Environment of the running process.
     */
    public static DeploymentEnvironment current() {
        String tag = System.getProperty(ENVIRONMENT_KEY);
        if (tag == null || tag.isBlank()) {
            tag = System.getenv(ENVIRONMENT_KEY);
        }
        return fromTag(tag);
    }
}
