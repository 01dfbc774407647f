/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.stratus.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for StratusConfiguration.
 * Validates default values, layering of supplied properties and type conversion fallbacks.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
class StratusConfigurationTest {

    private StratusConfiguration config;

    @BeforeEach
    void setUp() {
        config = new StratusConfiguration(new Properties());
    }

    @AfterEach
    void tearDown() {
        System.clearProperty(StratusConfiguration.MAX_CONCURRENCY);
        System.clearProperty(StratusConfiguration.INTERVENTION_MAX);
    }

    // ========== Default Configuration Tests ==========

    @Test
    void testDefaultMaxConcurrency() {
        assertEquals(4, config.getMaxConcurrency());
    }

    @Test
    void testDefaultWorkflowTimeoutIsDisabled() {
        assertEquals(0, config.getWorkflowTimeoutMs());
    }

    @Test
    void testDefaultCheckpointDirectory() {
        assertEquals(Path.of(".stratus/checkpoints"), config.getCheckpointDirectory());
    }

    @Test
    void testDefaultRetrySettings() {
        assertEquals(1, config.getRetryMaxAttempts());
        assertEquals(1000, config.getRetryDelayMs());
        assertEquals(30000, config.getRetryMaxDelayMs());
    }

    @Test
    void testDefaultInterventionSettings() {
        assertEquals(3, config.getMaxManualInterventions());
        assertEquals(300000, config.getInterventionTimeoutMs());
    }

    @Test
    void testDefaultMetricsEnabled() {
        assertTrue(config.isMetricsEnabled());
    }

    // ========== Custom Properties Tests ==========

    @Test
    void testSuppliedPropertiesOverrideDefaults() {
        Properties props = new Properties();
        props.setProperty(StratusConfiguration.MAX_CONCURRENCY, "8");
        props.setProperty(StratusConfiguration.CHECKPOINT_DIR, "/var/lib/stratus");
        props.setProperty(StratusConfiguration.METRICS_ENABLED, "false");

        StratusConfiguration custom = new StratusConfiguration(props);

        assertEquals(8, custom.getMaxConcurrency());
        assertEquals(Path.of("/var/lib/stratus"), custom.getCheckpointDirectory());
        assertFalse(custom.isMetricsEnabled());
    }

    @Test
    void testSystemPropertyOverride() {
        System.setProperty(StratusConfiguration.INTERVENTION_MAX, "7");

        StratusConfiguration fromSystem = new StratusConfiguration();

        assertEquals(7, fromSystem.getMaxManualInterventions());
    }

    // ========== Type Conversion Tests ==========

    @Test
    void testInvalidIntegerFallsBackToDefault() {
        config.setProperty(StratusConfiguration.INTERVENTION_MAX, "lots");
        assertEquals(3, config.getMaxManualInterventions());
    }

    @Test
    void testInvalidLongFallsBackToDefault() {
        config.setProperty(StratusConfiguration.RETRY_DELAY_MS, "soon");
        assertEquals(1000, config.getRetryDelayMs());
    }

    @Test
    void testNonPositiveConcurrencyFallsBackToDefault() {
        config.setProperty(StratusConfiguration.MAX_CONCURRENCY, "0");
        assertEquals(4, config.getMaxConcurrency());
    }

    @Test
    void testRetryAttemptsNeverBelowOne() {
        config.setProperty(StratusConfiguration.RETRY_MAX_ATTEMPTS, "-2");
        assertEquals(1, config.getRetryMaxAttempts());
    }

    @Test
    void testGenericPropertyAccess() {
        assertNull(config.getProperty("stratus.unknown"));
        assertEquals("fallback", config.getProperty("stratus.unknown", "fallback"));
        config.setProperty("stratus.custom", "value");
        assertEquals("value", config.getProperty("stratus.custom"));
    }

    @Test
    void testToStringContainsKeySettings() {
        String text = config.toString();
        assertTrue(text.contains("maxConcurrency=4"));
        assertTrue(text.contains("metricsEnabled=true"));
    }
}
