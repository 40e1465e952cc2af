package com.realtime.admission.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class DeploymentEnvironmentTest {

    @AfterEach
    public void clearProperty() {
        System.clearProperty(DeploymentEnvironment.ENVIRONMENT_KEY);
    }

    @ParameterizedTest
    @CsvSource({
        "production, PRODUCTION",
        "PROD, PRODUCTION",
        "staging, STAGING",
        "Stage, STAGING",
        "development, DEVELOPMENT",
        "dev, DEVELOPMENT",
        "local, DEVELOPMENT",
        "test, DEVELOPMENT",
        "' production ', PRODUCTION"
    })
    public void testFromTag(String tag, DeploymentEnvironment expected) {
        assertEquals(expected, DeploymentEnvironment.fromTag(tag));
    }

    @Test
    public void testBlankOrUnknownTagFallsBackToDevelopment() {
        assertEquals(DeploymentEnvironment.DEVELOPMENT, DeploymentEnvironment.fromTag(null));
        assertEquals(DeploymentEnvironment.DEVELOPMENT, DeploymentEnvironment.fromTag("   "));
        assertEquals(DeploymentEnvironment.DEVELOPMENT, DeploymentEnvironment.fromTag("perf-lab"));
    }

    @Test
    public void testCurrentReadsSystemProperty() {
        System.setProperty(DeploymentEnvironment.ENVIRONMENT_KEY, "staging");

        assertEquals(DeploymentEnvironment.STAGING, DeploymentEnvironment.current());
    }
}
